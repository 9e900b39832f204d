package ris.pdm.global.executor;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.Objects;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import ris.pdm.global.common.function.ThrowingSupplier;
import ris.pdm.global.executor.strategy.ExceptionTranslator;
import org.springframework.stereotype.Component;

/**
 * LogicExecutor 기본 구현체
 *
 * <ul>
 *   <li>Checked Exception → Runtime Exception 자동 변환</li>
 *   <li>Micrometer 타이머 자동 수집 ({@code logic.executor})</li>
 *   <li><b>Error 격리</b> - Error(OOM 등)는 절대 캐치하지 않고 상위로 전파</li>
 *   <li><b>메트릭 카디널리티 통제</b> - dynamicValue는 로그에만 기록, 태그는 component/operation만 사용</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DefaultLogicExecutor implements LogicExecutor {

    private final MeterRegistry meterRegistry;

    @Override
    public <T> T execute(ThrowingSupplier<T> task, TaskContext context) {
        return executeWithTranslation(task, ExceptionTranslator.defaultTranslator(), context);
    }

    @Override
    public <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context) {
        return executeOrCatch(task, e -> defaultValue, context);
    }

    @Override
    public <T> T executeOrCatch(
        ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context) {
        Objects.requireNonNull(recovery, "recovery");
        try {
            return runTimed(task, context);
        } catch (Error e) {
            throw e;
        } catch (Throwable t) {
            log.warn("[{}] 예외 발생, 복구 경로 실행: {}", context.toTaskName(), t.toString());
            return recovery.apply(t);
        }
    }

    @Override
    public <T> T executeWithTranslation(
        ThrowingSupplier<T> task, ExceptionTranslator translator, TaskContext context) {
        Objects.requireNonNull(translator, "translator");
        try {
            return runTimed(task, context);
        } catch (Error e) {
            throw e;
        } catch (Throwable t) {
            log.error("[{}] 실행 중 예외 발생: {}", context.toTaskName(), t.toString());
            throw translator.translate(t);
        }
    }

    /**
     * 작업 실행 + 타이머 기록
     *
     * <p>성공/실패 모두 {@code logic.executor} 타이머에 기록되며, 예외는 원본 그대로 던집니다.
     */
    private <T> T runTimed(ThrowingSupplier<T> task, TaskContext context) throws Throwable {
        Objects.requireNonNull(task, "task");
        Objects.requireNonNull(context, "context");
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            T result = task.get();
            record(sample, context, "success", "none");
            return result;
        } catch (Throwable t) {
            record(sample, context, "failure", t.getClass().getSimpleName());
            throw t;
        }
    }

    private void record(Timer.Sample sample, TaskContext context, String result, String exception) {
        sample.stop(Timer.builder("logic.executor")
            .tag("component", context.component())
            .tag("operation", context.operation())
            .tag("result", result)
            .tag("exception", exception)
            .register(meterRegistry));
    }
}
