package ris.pdm.global.ratelimit;

import java.time.Duration;

/**
 * 호출 스레드를 일정 시간 정지시키는 전략
 *
 * <p>테스트에서는 가상 시계를 전진시키는 구현으로 교체합니다.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
