package ris.pdm.service.classification;

/** 응답을 만든 데이터 경로 */
public enum FallbackTier {
    /** 실시간 버그 조회 + 분포 계산 */
    PRIMARY,
    /** 현재 이터레이션 작업 분포의 버그 요약 */
    FALLBACK,
    /** 0으로 채운 고정 형태 응답 */
    LAST_RESORT
}
