package ris.pdm.global.cache;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * 공유/내구성 1차 백엔드 (Redis)
 *
 * <p>TTL은 {@code SET key value EX ttl}로 Redis가 직접 만료시킵니다.
 */
@RequiredArgsConstructor
public class RedisCacheBackend implements CacheBackend {

    private static final String PONG = "PONG";
    static final long SCAN_COUNT = 1000;
    static final int DELETE_CHUNK_SIZE = 500;

    private final StringRedisTemplate redisTemplate;

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redisTemplate.opsForValue().get(key));
    }

    @Override
    public void set(String key, String json, long ttlSeconds) {
        redisTemplate.opsForValue().set(key, json, Duration.ofSeconds(ttlSeconds));
    }

    @Override
    public OptionalLong remainingTtlSeconds(String key) {
        Long ttl = redisTemplate.getExpire(key, TimeUnit.SECONDS);
        return ttl != null && ttl > 0 ? OptionalLong.of(ttl) : OptionalLong.empty();
    }

    @Override
    public boolean delete(String key) {
        return Boolean.TRUE.equals(redisTemplate.delete(key));
    }

    /** KEYS 대신 SCAN(COUNT {@value #SCAN_COUNT})으로 조회하고 {@value #DELETE_CHUNK_SIZE}개 단위로 삭제합니다. */
    @Override
    public long deleteMatching(String globPattern) {
        List<String> keys = scanKeys(globPattern);
        long deleted = 0L;
        for (int from = 0; from < keys.size(); from += DELETE_CHUNK_SIZE) {
            List<String> chunk = keys.subList(from, Math.min(from + DELETE_CHUNK_SIZE, keys.size()));
            Long removed = redisTemplate.delete(chunk);
            deleted += removed == null ? 0L : removed;
        }
        return deleted;
    }

    private List<String> scanKeys(String pattern) {
        List<String> keys = new ArrayList<>();
        redisTemplate.execute(
                (RedisCallback<Void>)
                        connection -> {
                            ScanOptions options = ScanOptions.scanOptions().match(pattern).count(SCAN_COUNT).build();
                            try (Cursor<byte[]> cursor = connection.keyCommands().scan(options)) {
                                while (cursor.hasNext()) {
                                    keys.add(new String(cursor.next(), StandardCharsets.UTF_8));
                                }
                            }
                            return null;
                        });
        return keys;
    }

    @Override
    public boolean isAvailable() {
        String reply = redisTemplate.execute((RedisCallback<String>) connection -> connection.ping());
        return PONG.equalsIgnoreCase(reply);
    }
}
