package ris.pdm.global.executor;

import java.util.function.Function;
import ris.pdm.global.common.function.ThrowingSupplier;
import ris.pdm.global.executor.strategy.ExceptionTranslator;

/**
 * 예외 처리 패턴을 추상화한 실행기
 *
 * <p>비즈니스 로직은 별도 메서드로 분리하고 메서드 참조({@code this::method})를 활용하세요.
 *
 * <h3>지원 패턴</h3>
 * <ol>
 *   <li><b>try-catch-throw</b> (예외 변환 후 재전파) - {@link #execute}</li>
 *   <li><b>try-catch-return</b> (기본값 반환) - {@link #executeOrDefault}</li>
 *   <li><b>try-catch-recover</b> (복구 로직 실행) - {@link #executeOrCatch}</li>
 *   <li><b>다중 catch</b> (ExceptionTranslator 사용) - {@link #executeWithTranslation}</li>
 * </ol>
 *
 * <h3>공통 규칙</h3>
 * <ul>
 *   <li>{@link Error}는 절대 캐치하지 않고 그대로 전파</li>
 *   <li>{@link ris.pdm.global.error.exception.base.BaseException}은 변환 없이 통과</li>
 *   <li>그 외 예외는 {@link ris.pdm.global.error.exception.InternalSystemException}으로 규격화</li>
 * </ul>
 *
 * @see TaskContext
 * @see ExceptionTranslator
 */
public interface LogicExecutor {

    /**
     * 작업 실행 후 예외를 RuntimeException으로 변환하여 전파
     *
     * @param task 실행할 작업
     * @param context 작업 컨텍스트 (로깅/메트릭용)
     * @return 작업 결과
     */
    <T> T execute(ThrowingSupplier<T> task, TaskContext context);

    /**
     * 예외 발생 시 기본값 반환
     *
     * <p>예외는 WARN 로그로 남기고 기본값을 반환합니다.
     */
    <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context);

    /**
     * 예외 발생 시 복구 함수 실행
     *
     * <p>복구 함수에는 원본 예외가 전달됩니다 (변환 전).
     */
    <T> T executeOrCatch(ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context);

    /**
     * 지정한 변환기로 예외를 도메인 예외로 변환
     *
     * <h4>사용 예시</h4>
     * <pre>{@code
     * List<Iteration> iterations = executor.executeWithTranslation(
     *     () -> source.getIterations(project, team, "all"),
     *     ExceptionTranslator.forUpstream("iterations"),
     *     TaskContext.of("Tracker", "iterations", project)
     * );
     * }</pre>
     */
    <T> T executeWithTranslation(
        ThrowingSupplier<T> task, ExceptionTranslator translator, TaskContext context);
}
