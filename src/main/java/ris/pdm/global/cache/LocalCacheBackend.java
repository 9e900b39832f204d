package ris.pdm.global.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * 프로세스 로컬 fallback 백엔드 (Caffeine)
 *
 * <p>엔트리마다 TTL이 다르므로 {@link Expiry}로 쓰기 시점의 TTL을 그대로 적용합니다. 읽기는 만료 시간을 연장하지 않습니다.
 */
public class LocalCacheBackend implements CacheBackend {

    private final Cache<String, LocalEntry> cache;

    public LocalCacheBackend(long maximumSize) {
        this(maximumSize, Ticker.systemTicker());
    }

    public LocalCacheBackend(long maximumSize, Ticker ticker) {
        this.cache =
                Caffeine.newBuilder()
                        .maximumSize(maximumSize)
                        .expireAfter(new PerEntryExpiry())
                        .ticker(ticker)
                        .executor(Runnable::run)
                        .build();
    }

    @Override
    public String name() {
        return "local";
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(cache.getIfPresent(key)).map(LocalEntry::json);
    }

    @Override
    public void set(String key, String json, long ttlSeconds) {
        cache.put(key, new LocalEntry(json, ttlSeconds));
    }

    /** 이미 유효한 엔트리가 있으면 덮어쓰지 않습니다 (읽기 경로 백필용). */
    public void setIfAbsent(String key, String json, long ttlSeconds) {
        cache.asMap().putIfAbsent(key, new LocalEntry(json, ttlSeconds));
    }

    @Override
    public OptionalLong remainingTtlSeconds(String key) {
        OptionalLong remaining =
                cache.policy().expireVariably()
                        .map(policy -> policy.getExpiresAfter(key, TimeUnit.SECONDS))
                        .orElseGet(OptionalLong::empty);
        return remaining.isPresent() && remaining.getAsLong() > 0 ? remaining : OptionalLong.empty();
    }

    @Override
    public boolean delete(String key) {
        return cache.asMap().remove(key) != null;
    }

    @Override
    public long deleteMatching(String globPattern) {
        Pattern pattern = GlobPattern.compile(globPattern);
        long before = cache.estimatedSize();
        cache.asMap().keySet().removeIf(key -> pattern.matcher(key).matches());
        cache.cleanUp();
        return Math.max(0L, before - cache.estimatedSize());
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public void clear() {
        cache.invalidateAll();
    }

    private record LocalEntry(String json, long ttlSeconds) {}

    private static final class PerEntryExpiry implements Expiry<String, LocalEntry> {

        @Override
        public long expireAfterCreate(String key, LocalEntry value, long currentTime) {
            return TimeUnit.SECONDS.toNanos(value.ttlSeconds());
        }

        @Override
        public long expireAfterUpdate(String key, LocalEntry value, long currentTime, long currentDuration) {
            return TimeUnit.SECONDS.toNanos(value.ttlSeconds());
        }

        @Override
        public long expireAfterRead(String key, LocalEntry value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
