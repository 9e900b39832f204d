package ris.pdm.global.cache;

import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * 캐시 네임스페이스와 기본 TTL
 *
 * <p>네임스페이스는 저장 키의 두 번째 구성 요소입니다 ({@code <prefix>:<namespace>:...}).
 */
public enum CacheNamespace {
    /** WIQL 조회 결과 */
    WORK_ITEMS("workItems", Duration.ofMinutes(5)),

    /** 배치 상세 조회 결과 */
    WORK_ITEM_DETAILS("workItemDetails", Duration.ofMinutes(15)),

    /** 이터레이션 목록, 해석된 이터레이션 경로 */
    ITERATIONS("iterations", Duration.ofMinutes(30)),

    METRICS("metrics", Duration.ofMinutes(5)),

    TEAM_MEMBERS("teamMembers", Duration.ofMinutes(30)),

    /** 버그 분류 PRIMARY 응답 */
    BUG_CLASSIFICATION("bugClassification", Duration.ofMinutes(10));

    private final String name;
    private final Duration ttl;

    CacheNamespace(String name, Duration ttl) {
        this.name = Objects.requireNonNull(name);
        this.ttl = Objects.requireNonNull(ttl);
    }

    public String getName() {
        return name;
    }

    public Duration getTtl() {
        return ttl;
    }

    public long getTtlSeconds() {
        return ttl.toSeconds();
    }

    public static Optional<CacheNamespace> fromName(String name) {
        return Arrays.stream(values()).filter(ns -> ns.name.equals(name)).findFirst();
    }

    @Override
    public String toString() {
        return name;
    }
}
