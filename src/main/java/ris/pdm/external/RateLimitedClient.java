package ris.pdm.external;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import ris.pdm.global.common.function.ThrowingSupplier;
import ris.pdm.global.executor.LogicExecutor;
import ris.pdm.global.executor.TaskContext;
import ris.pdm.global.executor.strategy.ExceptionTranslator;
import ris.pdm.global.ratelimit.SlidingWindowRateLimiter;

/**
 * 모든 아웃바운드 트래커 호출의 단일 관문
 *
 * <ol>
 *   <li>{@link SlidingWindowRateLimiter#admit()}로 호출 예산 확보 (필요 시 대기)
 *   <li>호출 실행 후 모든 전송 계층 예외를 {@link ris.pdm.global.error.exception.UpstreamUnavailableException}으로 변환
 * </ol>
 *
 * <p>재시도는 하지 않습니다. 실패 처리는 상위(IterationResolver 후보 순회, Fallback tier)의 몫입니다.
 */
@Component
@RequiredArgsConstructor
public class RateLimitedClient {

    private final SlidingWindowRateLimiter rateLimiter;
    private final LogicExecutor executor;

    /**
     * @param context {@code operation}이 예외 메시지의 업스트림 작업 이름으로 사용됩니다.
     */
    public <T> T call(TaskContext context, ThrowingSupplier<T> request) {
        rateLimiter.admit();
        return executor.executeWithTranslation(
                request, ExceptionTranslator.forUpstream(context.operation()), context);
    }
}
