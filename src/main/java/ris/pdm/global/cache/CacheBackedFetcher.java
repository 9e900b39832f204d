package ris.pdm.global.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import ris.pdm.global.common.function.ThrowingSupplier;
import ris.pdm.global.executor.LogicExecutor;
import ris.pdm.global.executor.TaskContext;

/**
 * Cache-aside 조회기
 *
 * <p>(namespace, identifier, params)로 키를 만들고, 히트면 {@code fetchFn}을 호출하지 않습니다. 미스면 {@code fetchFn}
 * 결과를 같은 키/TTL로 저장한 뒤 반환합니다.
 *
 * <ul>
 *   <li>{@code null} 결과는 반환하되 캐시하지 않음
 *   <li>{@code fetchFn} 예외는 그대로 전파 (BaseException 그대로, checked 예외는 InternalSystemException)
 *   <li>동일 키 동시 미스는 각각 {@code fetchFn}을 호출 (single-flight 없음)
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CacheBackedFetcher {

    private final CacheStore cacheStore;
    private final CacheKeyGenerator keyGenerator;
    private final LogicExecutor executor;

    public <T> T fetchWithCache(
            String namespace,
            String identifier,
            Map<String, ?> params,
            long ttlSeconds,
            Class<T> type,
            ThrowingSupplier<T> fetchFn) {
        String key = keyGenerator.generateKey(namespace, identifier, params);
        return fetch(key, ttlSeconds, k -> cacheStore.get(k, type), fetchFn);
    }

    public <T> T fetchWithCache(
            String namespace,
            String identifier,
            Map<String, ?> params,
            long ttlSeconds,
            TypeReference<T> type,
            ThrowingSupplier<T> fetchFn) {
        String key = keyGenerator.generateKey(namespace, identifier, params);
        return fetch(key, ttlSeconds, k -> cacheStore.get(k, type), fetchFn);
    }

    /** 네임스페이스 기본 TTL 사용 */
    public <T> T fetchWithCache(
            CacheNamespace namespace,
            String identifier,
            Map<String, ?> params,
            Class<T> type,
            ThrowingSupplier<T> fetchFn) {
        return fetchWithCache(
                namespace.getName(), identifier, params, namespace.getTtlSeconds(), type, fetchFn);
    }

    /** 네임스페이스 기본 TTL 사용 (제네릭 타입) */
    public <T> T fetchWithCache(
            CacheNamespace namespace,
            String identifier,
            Map<String, ?> params,
            TypeReference<T> type,
            ThrowingSupplier<T> fetchFn) {
        return fetchWithCache(
                namespace.getName(), identifier, params, namespace.getTtlSeconds(), type, fetchFn);
    }

    private <T> T fetch(
            String key, long ttlSeconds, Function<String, Optional<T>> reader, ThrowingSupplier<T> fetchFn) {
        Optional<T> cached = reader.apply(key);
        if (cached.isPresent()) {
            log.debug("[CacheFetcher] hit: key={}", key);
            return cached.get();
        }

        T fresh = executor.execute(fetchFn, TaskContext.of("CacheFetcher", "fetch", key));
        if (fresh != null) {
            cacheStore.set(key, fresh, ttlSeconds);
        }
        return fresh;
    }
}
