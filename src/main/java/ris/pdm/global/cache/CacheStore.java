package ris.pdm.global.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.LongAdder;
import lombok.extern.slf4j.Slf4j;
import ris.pdm.global.executor.LogicExecutor;
import ris.pdm.global.executor.TaskContext;

/**
 * 2계층 캐시 저장소 (Primary: Redis, Fallback: 로컬 Caffeine)
 *
 * <h4>읽기</h4>
 *
 * <ol>
 *   <li>Primary 조회. 히트 시 로컬에 사본이 없으면 primary의 남은 TTL({@code localTtlCap} 상한)로 백필
 *   <li>Primary가 미스로 응답하면 확정 미스. 로컬 사본도 제거
 *   <li>Primary 장애 시에만 로컬 조회
 * </ol>
 *
 * <h4>쓰기</h4>
 *
 * <p>Primary 쓰기 성공 시 로컬에도 {@code min(ttl, cap)}으로 기록합니다. Primary 장애 시 로컬에만 기록하고 {@code true}를
 * 반환합니다. 직렬화 실패 또는 두 백엔드 모두 실패한 경우에만 {@code false}.
 *
 * <h4>계약</h4>
 *
 * <ul>
 *   <li>어떤 메서드도 예외를 던지지 않음. 결과는 {@link Optional} / {@code boolean} / 삭제 건수로만 표현
 *   <li>모든 백엔드 장애는 WARN 로그 + {@code cache.error} 카운터로 기록
 *   <li>health 상태는 관측용이며 get/set 경로를 막지 않음
 * </ul>
 */
@Slf4j
public class CacheStore {

    private static final String COMPONENT = "CacheStore";

    private final CacheBackend primary;
    private final LocalCacheBackend local;
    private final ObjectMapper objectMapper;
    private final LogicExecutor executor;
    private final long localTtlCapSeconds;

    private final AtomicBoolean primaryHealthy = new AtomicBoolean(false);

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder primaryHits = new LongAdder();
    private final LongAdder localHits = new LongAdder();
    private final LongAdder sets = new LongAdder();
    private final LongAdder deletes = new LongAdder();
    private final LongAdder errors = new LongAdder();

    private final Counter primaryHitCounter;
    private final Counter localHitCounter;
    private final Counter missCounter;
    private final Counter setCounter;
    private final Counter errorCounter;

    /**
     * @param primary 1차 백엔드. {@code null}이면 로컬 전용 모드
     */
    public CacheStore(
            CacheBackend primary,
            LocalCacheBackend local,
            ObjectMapper objectMapper,
            LogicExecutor executor,
            MeterRegistry meterRegistry,
            long localTtlCapSeconds) {
        this.primary = primary;
        this.local = local;
        this.objectMapper = objectMapper;
        this.executor = executor;
        this.localTtlCapSeconds = localTtlCapSeconds;

        this.primaryHitCounter = Counter.builder("cache.hit").tag("layer", "primary").register(meterRegistry);
        this.localHitCounter = Counter.builder("cache.hit").tag("layer", "local").register(meterRegistry);
        this.missCounter = Counter.builder("cache.miss").register(meterRegistry);
        this.setCounter = Counter.builder("cache.set").register(meterRegistry);
        this.errorCounter = Counter.builder("cache.error").register(meterRegistry);
    }

    // ==================== Lifecycle ====================

    /** 기동 시 primary 연결 확인 */
    public void init() {
        boolean healthy = checkPrimary();
        if (healthy) {
            log.info("[CacheStore] 초기화 완료: primary={}, localTtlCap={}s", primary.name(), localTtlCapSeconds);
        } else {
            log.warn("[CacheStore] primary 미연결, 로컬 캐시로 동작합니다 (degraded)");
        }
    }

    /** 종료 시 최종 통계 기록 후 로컬 캐시 정리 */
    public void shutdown() {
        log.info("[CacheStore] 종료: stats={}", stats());
        local.clear();
    }

    // ==================== Read ====================

    public <T> Optional<T> get(String key, Class<T> type) {
        return get(key, objectMapper.constructType(type));
    }

    public <T> Optional<T> get(String key, TypeReference<T> type) {
        return get(key, objectMapper.getTypeFactory().constructType(type));
    }

    private <T> Optional<T> get(String key, JavaType type) {
        Optional<String> json = lookup(key);
        if (json.isEmpty()) {
            misses.increment();
            missCounter.increment();
            log.debug("[CacheStore] miss: key={}", key);
            return Optional.empty();
        }
        Optional<T> value = deserialize(key, json.get(), type);
        if (value.isPresent()) {
            hits.increment();
        } else {
            misses.increment();
            missCounter.increment();
        }
        return value;
    }

    private Optional<String> lookup(String key) {
        if (primary != null) {
            PrimaryRead read =
                    executor.executeOrCatch(
                            () -> PrimaryRead.of(primary.get(key)),
                            e -> onPrimaryFailure(PrimaryRead.FAILED),
                            TaskContext.of(COMPONENT, "primaryGet", key));
            if (read.answered()) {
                markPrimaryHealthy();
                return read.value().isPresent() ? onPrimaryHit(key, read.value().get()) : onPrimaryMiss(key);
            }
        }
        Optional<String> fromLocal = local.get(key);
        if (fromLocal.isPresent()) {
            localHits.increment();
            localHitCounter.increment();
        }
        return fromLocal;
    }

    private Optional<String> onPrimaryHit(String key, String json) {
        primaryHits.increment();
        primaryHitCounter.increment();
        OptionalLong remaining =
                executor.executeOrCatch(
                        () -> primary.remainingTtlSeconds(key),
                        e -> onPrimaryFailure(OptionalLong.empty()),
                        TaskContext.of(COMPONENT, "primaryTtl", key));
        if (remaining.isPresent()) {
            local.setIfAbsent(key, json, Math.min(remaining.getAsLong(), localTtlCapSeconds));
        }
        return Optional.of(json);
    }

    /** primary가 응답한 미스는 확정 미스. 로컬 사본도 버립니다. */
    private Optional<String> onPrimaryMiss(String key) {
        local.delete(key);
        return Optional.empty();
    }

    /** primary 조회 결과. {@code answered == false}는 장애 */
    private record PrimaryRead(boolean answered, Optional<String> value) {

        static final PrimaryRead FAILED = new PrimaryRead(false, Optional.empty());

        static PrimaryRead of(Optional<String> value) {
            return new PrimaryRead(true, value);
        }
    }

    private <T> Optional<T> deserialize(String key, String json, JavaType type) {
        return executor.executeOrCatch(
                () -> Optional.<T>ofNullable(objectMapper.readValue(json, type)),
                e -> {
                    recordError();
                    return Optional.empty();
                },
                TaskContext.of(COMPONENT, "deserialize", key));
    }

    // ==================== Write ====================

    /**
     * 값 저장
     *
     * @param ttlSeconds 명시적 TTL (초). 0 이하이면 저장하지 않고 {@code false}
     * @return primary 또는 로컬 중 하나라도 저장되었으면 {@code true}
     */
    public boolean set(String key, Object value, long ttlSeconds) {
        if (ttlSeconds <= 0) {
            log.warn("[CacheStore] TTL은 양수여야 합니다: key={}, ttl={}", key, ttlSeconds);
            return false;
        }
        Optional<String> json = serialize(key, value);
        if (json.isEmpty()) {
            return false;
        }
        long localTtl = Math.min(ttlSeconds, localTtlCapSeconds);

        boolean primaryWritten = primary != null && writePrimary(key, json.get(), ttlSeconds);
        boolean localWritten =
                executor.executeOrCatch(
                        () -> {
                            local.set(key, json.get(), localTtl);
                            return true;
                        },
                        e -> {
                            recordError();
                            return false;
                        },
                        TaskContext.of(COMPONENT, "localSet", key));

        boolean stored = primaryWritten || localWritten;
        if (stored) {
            sets.increment();
            setCounter.increment();
        }
        return stored;
    }

    private boolean writePrimary(String key, String json, long ttlSeconds) {
        boolean written =
                executor.executeOrCatch(
                        () -> {
                            primary.set(key, json, ttlSeconds);
                            return true;
                        },
                        e -> onPrimaryFailure(false),
                        TaskContext.of(COMPONENT, "primarySet", key));
        if (written) {
            markPrimaryHealthy();
        }
        return written;
    }

    private Optional<String> serialize(String key, Object value) {
        return executor.executeOrCatch(
                () -> Optional.of(objectMapper.writeValueAsString(value)),
                e -> {
                    recordError();
                    return Optional.empty();
                },
                TaskContext.of(COMPONENT, "serialize", key));
    }

    // ==================== Delete ====================

    public boolean delete(String key) {
        boolean primaryRemoved =
                primary != null
                        && executor.executeOrCatch(
                                () -> primary.delete(key),
                                e -> onPrimaryFailure(false),
                                TaskContext.of(COMPONENT, "primaryDelete", key));
        boolean localRemoved = local.delete(key);
        boolean removed = primaryRemoved || localRemoved;
        if (removed) {
            deletes.increment();
        }
        return removed;
    }

    /**
     * glob 패턴 삭제 (양쪽 백엔드)
     *
     * @return primary가 응답했으면 primary 삭제 건수, 아니면 로컬 삭제 건수
     */
    public long deleteMatching(String globPattern) {
        long primaryRemoved =
                primary == null
                        ? -1L
                        : executor.executeOrCatch(
                                () -> primary.deleteMatching(globPattern),
                                e -> onPrimaryFailure(-1L),
                                TaskContext.of(COMPONENT, "primaryDeleteMatching", globPattern));
        long localRemoved = local.deleteMatching(globPattern);
        long removed = primaryRemoved >= 0 ? Math.max(primaryRemoved, localRemoved) : localRemoved;
        deletes.add(removed);
        log.info("[CacheStore] 패턴 삭제: pattern={}, removed={}", globPattern, removed);
        return removed;
    }

    // ==================== Health / Stats ====================

    /** 마지막 primary 작업(또는 상태 확인) 기준 연결 상태 */
    public boolean isHealthy() {
        return primaryHealthy.get();
    }

    /** primary에 ping을 보내 상태를 갱신합니다. */
    public boolean checkPrimary() {
        if (primary == null) {
            primaryHealthy.set(false);
            return false;
        }
        boolean available =
                executor.executeOrCatch(
                        primary::isAvailable, e -> onPrimaryFailure(false), TaskContext.of(COMPONENT, "healthCheck"));
        primaryHealthy.set(available);
        return available;
    }

    public CacheStats stats() {
        long hitCount = hits.sum();
        long missCount = misses.sum();
        return new CacheStats(
                hitCount,
                missCount,
                primaryHits.sum(),
                localHits.sum(),
                sets.sum(),
                deletes.sum(),
                errors.sum(),
                CacheStats.hitRate(hitCount, missCount),
                primaryHealthy.get() ? "healthy" : "degraded",
                primary != null ? primary.name() : "none",
                local.size());
    }

    // ==================== Internal ====================

    private <T> T onPrimaryFailure(T fallback) {
        if (primaryHealthy.compareAndSet(true, false)) {
            log.warn("[CacheStore] primary 장애 감지, 로컬 캐시로 전환");
        }
        recordError();
        return fallback;
    }

    private void markPrimaryHealthy() {
        if (primaryHealthy.compareAndSet(false, true)) {
            log.info("[CacheStore] primary 연결 복구");
        }
    }

    private void recordError() {
        errors.increment();
        errorCounter.increment();
    }
}
