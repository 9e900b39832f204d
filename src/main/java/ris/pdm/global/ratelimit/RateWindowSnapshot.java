package ris.pdm.global.ratelimit;

/**
 * 현재 윈도우 상태 (관측용 스냅샷)
 *
 * @param requestsInWindow 최근 윈도우 내 허용된 호출 수
 * @param budget 윈도우당 허용 호출 수
 * @param windowMillis 윈도우 길이 (ms)
 */
public record RateWindowSnapshot(int requestsInWindow, int budget, long windowMillis) {}
