package ris.pdm.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import ris.pdm.global.cache.CacheBackend;
import ris.pdm.global.cache.CacheStore;
import ris.pdm.global.cache.LocalCacheBackend;
import ris.pdm.global.cache.RedisCacheBackend;
import ris.pdm.global.executor.LogicExecutor;

/**
 * 2계층 캐시 구성 (Redis primary + Caffeine local)
 *
 * <p>{@code cache.primary-enabled=false}이면 Redis 없이 로컬 전용으로 기동합니다.
 */
@Slf4j
@Configuration
public class CacheConfig {

    @Bean
    public LocalCacheBackend localCacheBackend(CacheProperties properties) {
        return new LocalCacheBackend(properties.getLocalMaxSize());
    }

    @Bean(initMethod = "init", destroyMethod = "shutdown")
    public CacheStore cacheStore(
            CacheProperties properties,
            ObjectProvider<StringRedisTemplate> redisTemplate,
            LocalCacheBackend localCacheBackend,
            ObjectMapper objectMapper,
            LogicExecutor executor,
            MeterRegistry meterRegistry) {
        CacheBackend primary = null;
        if (properties.isPrimaryEnabled()) {
            StringRedisTemplate template = redisTemplate.getIfAvailable();
            if (template != null) {
                primary = new RedisCacheBackend(template);
            } else {
                log.warn("[CacheConfig] StringRedisTemplate 없음, 로컬 캐시 전용으로 기동합니다.");
            }
        }
        return new CacheStore(
                primary,
                localCacheBackend,
                objectMapper,
                executor,
                meterRegistry,
                properties.getLocalTtlCapSeconds());
    }
}
