package ris.pdm.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * CacheStore 외부 설정 프로퍼티
 *
 * <h4>설계 의도</h4>
 *
 * <ul>
 *   <li>keyPrefix: Redis 키 공간 분리 ({@code <prefix>:<namespace>:...})
 *   <li>localTtlCapSeconds: 로컬(Caffeine) 백엔드는 짧게 유지하여 재기동된 Redis와의 괴리를 제한
 *   <li>primaryEnabled: Redis 없이 기동하는 개발 환경용 스위치
 * </ul>
 *
 * @see CacheConfig
 */
@Validated
@ConfigurationProperties(prefix = "cache")
public class CacheProperties {

    @NotBlank private String keyPrefix = "ris:cache";

    /** 로컬 백엔드 TTL 상한 (초). 로컬 쓰기/백필 TTL = min(ttl, cap) */
    @Min(1)
    @Max(86400)
    private int localTtlCapSeconds = 300;

    @Min(100)
    @Max(1_000_000)
    private int localMaxSize = 10_000;

    private boolean primaryEnabled = true;

    /** 워밍업 적재 TTL (초) */
    @Min(1)
    @Max(86400)
    private int warmupTtlSeconds = 1800;

    public String getKeyPrefix() {
        return keyPrefix;
    }

    public void setKeyPrefix(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    public int getLocalTtlCapSeconds() {
        return localTtlCapSeconds;
    }

    public void setLocalTtlCapSeconds(int localTtlCapSeconds) {
        this.localTtlCapSeconds = localTtlCapSeconds;
    }

    public int getLocalMaxSize() {
        return localMaxSize;
    }

    public void setLocalMaxSize(int localMaxSize) {
        this.localMaxSize = localMaxSize;
    }

    public boolean isPrimaryEnabled() {
        return primaryEnabled;
    }

    public void setPrimaryEnabled(boolean primaryEnabled) {
        this.primaryEnabled = primaryEnabled;
    }

    public int getWarmupTtlSeconds() {
        return warmupTtlSeconds;
    }

    public void setWarmupTtlSeconds(int warmupTtlSeconds) {
        this.warmupTtlSeconds = warmupTtlSeconds;
    }
}
