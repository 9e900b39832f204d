package ris.pdm.service.cache;

import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ris.pdm.config.CacheProperties;
import ris.pdm.global.cache.CacheKeyGenerator;
import ris.pdm.global.cache.CacheNamespace;
import ris.pdm.global.cache.CacheStats;
import ris.pdm.global.cache.CacheStore;
import ris.pdm.global.error.exception.UnknownCacheNamespaceException;

/**
 * 캐시 운영 기능 (무효화, 통계, 워밍업)
 *
 * <p>네임스페이스 무효화는 {@code <prefix>:<namespace>:*} 패턴 삭제이며 primary/로컬 양쪽에 적용됩니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CacheAdminService {

    private final CacheStore cacheStore;
    private final CacheKeyGenerator keyGenerator;
    private final CacheProperties properties;

    /**
     * @param namespace 네임스페이스 이름 (예: {@code workItems})
     * @return 삭제된 엔트리 수
     * @throws UnknownCacheNamespaceException 등록되지 않은 네임스페이스
     */
    public long invalidateNamespace(String namespace) {
        CacheNamespace target =
                CacheNamespace.fromName(namespace).orElseThrow(() -> new UnknownCacheNamespaceException(namespace));
        long removed = cacheStore.deleteMatching(keyGenerator.namespacePattern(target.getName()));
        log.info("[CacheAdmin] 네임스페이스 무효화: namespace={}, removed={}", target, removed);
        return removed;
    }

    /** 전체 캐시 삭제 */
    public long clearAll() {
        long removed = cacheStore.deleteMatching(keyGenerator.allKeysPattern());
        log.info("[CacheAdmin] 전체 캐시 삭제: removed={}", removed);
        return removed;
    }

    public CacheStats getCacheStats() {
        return cacheStore.stats();
    }

    /** 미리 계산된 값을 워밍업 TTL로 적재 */
    public boolean warmup(CacheNamespace namespace, String identifier, Map<String, ?> params, Object value) {
        String key = keyGenerator.generateKey(namespace.getName(), identifier, params);
        boolean stored = cacheStore.set(key, value, properties.getWarmupTtlSeconds());
        log.info("[CacheAdmin] 워밍업: key={}, stored={}", key, stored);
        return stored;
    }
}
