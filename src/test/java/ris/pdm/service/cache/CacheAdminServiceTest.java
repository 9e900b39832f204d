package ris.pdm.service.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import ris.pdm.config.CacheProperties;
import ris.pdm.global.cache.CacheKeyGenerator;
import ris.pdm.global.cache.CacheNamespace;
import ris.pdm.global.cache.CacheStore;
import ris.pdm.global.cache.LocalCacheBackend;
import ris.pdm.global.error.exception.UnknownCacheNamespaceException;
import ris.pdm.global.executor.DefaultLogicExecutor;
import ris.pdm.global.executor.LogicExecutor;

@Tag("unit")
class CacheAdminServiceTest {

    private CacheStore store;
    private CacheKeyGenerator keyGenerator;
    private CacheAdminService service;

    @BeforeEach
    void setUp() {
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        LogicExecutor executor = new DefaultLogicExecutor(meterRegistry);
        CacheProperties properties = new CacheProperties();
        store = new CacheStore(null, new LocalCacheBackend(1_000), new ObjectMapper(), executor, meterRegistry, 300);
        keyGenerator = new CacheKeyGenerator(properties, executor);
        service = new CacheAdminService(store, keyGenerator, properties);
    }

    private String put(CacheNamespace namespace, String identifier) {
        String key = keyGenerator.generateKey(namespace.getName(), identifier, Map.of("v", identifier));
        store.set(key, identifier, 60);
        return key;
    }

    @Test
    @DisplayName("네임스페이스 무효화는 해당 네임스페이스 키만 삭제")
    void shouldInvalidateOnlyTargetNamespace() {
        String query = put(CacheNamespace.WORK_ITEMS, "query");
        put(CacheNamespace.WORK_ITEMS, "other");
        String metrics = put(CacheNamespace.METRICS, "distribution");

        long removed = service.invalidateNamespace("workItems");

        assertThat(removed).isEqualTo(2);
        assertThat(store.get(query, String.class)).isEmpty();
        assertThat(store.get(metrics, String.class)).contains("distribution");
    }

    @Test
    @DisplayName("등록되지 않은 네임스페이스는 UnknownCacheNamespaceException")
    void shouldRejectUnknownNamespace() {
        assertThatThrownBy(() -> service.invalidateNamespace("sessions"))
                .isInstanceOf(UnknownCacheNamespaceException.class);
    }

    @Test
    @DisplayName("전체 삭제 + 통계")
    void shouldClearAllAndReportStats() {
        put(CacheNamespace.WORK_ITEMS, "a");
        put(CacheNamespace.TEAM_MEMBERS, "b");

        assertThat(service.clearAll()).isEqualTo(2);
        assertThat(service.getCacheStats().sets()).isEqualTo(2);
        assertThat(service.getCacheStats().status()).isEqualTo("degraded");
    }

    @Test
    @DisplayName("워밍업은 워밍업 TTL로 적재되어 바로 조회 가능")
    void shouldWarmup() {
        boolean stored = service.warmup(CacheNamespace.TEAM_MEMBERS, "all", Map.of(), "[\"p1\"]");

        assertThat(stored).isTrue();
        String key = keyGenerator.generateKey("teamMembers", "all", Map.of());
        assertThat(store.get(key, String.class)).contains("[\"p1\"]");
    }
}
