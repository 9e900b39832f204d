package ris.pdm.global.ratelimit;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ConcurrentLinkedDeque;
import lombok.extern.slf4j.Slf4j;

/**
 * 아웃바운드 트래커 API 호출 예산을 지키는 슬라이딩 윈도우(log) 리미터
 *
 * <h4>알고리즘</h4>
 *
 * <ol>
 *   <li>윈도우보다 오래된 타임스탬프를 먼저 제거 (lazy purge)
 *   <li>윈도우 내 호출 수가 예산 이상이면 {@code window - (now - oldest)} 만큼 대기 후 재확인
 *   <li>예산 내이면 {@code now}를 기록하고 즉시 반환
 * </ol>
 *
 * <h4>동시성</h4>
 *
 * <p>락 없이 {@link ConcurrentLinkedDeque}만 사용합니다. 경합 시 예산을 소폭 초과 허용할 수 있으며, 이는 허용된 트레이드오프입니다.
 *
 * <h4>실패 없음</h4>
 *
 * <p>예산 소진은 에러가 아니라 지연으로만 해소됩니다. 대기 중 인터럽트되면 인터럽트 플래그를 복원하고 그대로 허용합니다.
 */
@Slf4j
public class SlidingWindowRateLimiter {

    private final int budget;
    private final long windowMillis;
    private final Clock clock;
    private final Sleeper sleeper;
    private final ConcurrentLinkedDeque<Long> timestamps = new ConcurrentLinkedDeque<>();

    private final Counter admittedCounter;
    private final Counter delayedCounter;
    private final Timer waitTimer;

    public SlidingWindowRateLimiter(
            int budget, Duration window, Clock clock, Sleeper sleeper, MeterRegistry meterRegistry) {
        if (budget <= 0) {
            throw new IllegalArgumentException("budget must be positive: " + budget);
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive: " + window);
        }
        this.budget = budget;
        this.windowMillis = window.toMillis();
        this.clock = clock;
        this.sleeper = sleeper;
        this.admittedCounter = Counter.builder("tracker.ratelimit.admitted").register(meterRegistry);
        this.delayedCounter = Counter.builder("tracker.ratelimit.delayed").register(meterRegistry);
        this.waitTimer = Timer.builder("tracker.ratelimit.wait").register(meterRegistry);
    }

    /** 호출이 허용될 때까지 대기한 뒤 호출을 기록합니다. */
    public void admit() {
        boolean delayed = false;
        while (true) {
            long now = clock.millis();
            purgeExpired(now);

            if (timestamps.size() < budget) {
                timestamps.addLast(now);
                admittedCounter.increment();
                return;
            }

            Long oldest = timestamps.peekFirst();
            if (oldest == null) {
                continue;
            }
            long waitMillis = windowMillis - (now - oldest);
            if (waitMillis <= 0) {
                continue;
            }

            if (!delayed) {
                delayedCounter.increment();
                delayed = true;
            }
            log.debug("[RateLimiter] 예산 소진, 대기: waitMs={}, budget={}", waitMillis, budget);
            if (!pause(waitMillis)) {
                timestamps.addLast(clock.millis());
                admittedCounter.increment();
                return;
            }
        }
    }

    /** 현재 윈도우 상태 조회 (purge 포함) */
    public RateWindowSnapshot snapshot() {
        purgeExpired(clock.millis());
        return new RateWindowSnapshot(timestamps.size(), budget, windowMillis);
    }

    public int getBudget() {
        return budget;
    }

    private void purgeExpired(long now) {
        long cutoff = now - windowMillis;
        Long head;
        while ((head = timestamps.peekFirst()) != null && head <= cutoff) {
            timestamps.removeFirstOccurrence(head);
        }
    }

    /**
     * @return 정상적으로 대기를 마쳤으면 true, 인터럽트되었으면 false
     */
    private boolean pause(long waitMillis) {
        Duration wait = Duration.ofMillis(waitMillis);
        try {
            sleeper.sleep(wait);
            waitTimer.record(wait);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[RateLimiter] 대기 중 인터럽트, 대기 없이 허용합니다.");
            return false;
        }
    }
}
