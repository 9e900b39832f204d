package ris.pdm.global.executor.strategy;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.IOException;
import reactor.core.Exceptions;
import ris.pdm.global.error.exception.CacheSerializationException;
import ris.pdm.global.error.exception.InternalSystemException;
import ris.pdm.global.error.exception.UpstreamUnavailableException;
import ris.pdm.global.error.exception.base.BaseException;
import ris.pdm.global.error.exception.base.ClientBaseException;

/**
 * 특정 예외를 도메인 예외로 변환하는 전략
 *
 * <p>다중 catch 블록을 if-else 체인으로 대체하여 코드 평탄화를 달성합니다.
 *
 * <h3>Error 격리</h3>
 * <ul>
 *   <li>{@link Error}(OOM, StackOverflow 등)는 절대 변환하지 않고 그대로 throw</li>
 *   <li>원본 예외를 cause로 보존하여 스택 트레이스 유지</li>
 * </ul>
 */
@FunctionalInterface
public interface ExceptionTranslator {

    /**
     * 예외를 변환하여 반환
     *
     * @param e 원본 예외
     * @return 변환된 RuntimeException
     * @throws Error Error 타입은 변환하지 않고 그대로 throw
     */
    RuntimeException translate(Throwable e);

    /**
     * 업스트림 호출 예외 변환기
     *
     * <ul>
     *   <li>{@link UpstreamUnavailableException} → 그대로 재전파</li>
     *   <li>{@link ClientBaseException} → 그대로 재전파 (호출자 입력 오류)</li>
     *   <li>기타 모든 예외 (WebClient, 타임아웃, I/O, non-2xx) → {@link UpstreamUnavailableException}</li>
     * </ul>
     *
     * @param operation 업스트림 작업 이름 (예: "wiql", "iterations")
     */
    static ExceptionTranslator forUpstream(String operation) {
        return e -> {
            if (e instanceof Error error) {
                throw error;
            }
            if (e instanceof UpstreamUnavailableException upstream) {
                return upstream;
            }
            if (e instanceof ClientBaseException client) {
                return client;
            }
            return new UpstreamUnavailableException(operation, unwrap(e));
        };
    }

    /**
     * JSON 처리 예외 변환기
     *
     * <ul>
     *   <li>{@link JsonProcessingException}, {@link IOException} → {@link CacheSerializationException}</li>
     *   <li>{@link BaseException} → 그대로 재전파</li>
     *   <li>기타 → {@link InternalSystemException}</li>
     * </ul>
     *
     * @param key 직렬화 대상 캐시 키
     */
    static ExceptionTranslator forJson(String key) {
        return e -> {
            if (e instanceof Error error) {
                throw error;
            }
            if (e instanceof IOException) {
                return new CacheSerializationException(key, e);
            }
            if (e instanceof BaseException base) {
                return base;
            }
            return new InternalSystemException("json-processing:" + key, e);
        };
    }

    /**
     * 기본 예외 변환기
     *
     * <ul>
     *   <li>{@link BaseException} → 그대로 전파 (비즈니스 예외 보존)</li>
     *   <li>기타 예외 → {@link InternalSystemException}으로 규격화</li>
     * </ul>
     */
    static ExceptionTranslator defaultTranslator() {
        return e -> {
            if (e instanceof Error error) {
                throw error;
            }
            if (e instanceof BaseException base) {
                return base;
            }
            return new InternalSystemException("default-task", e);
        };
    }

    /**
     * Reactor의 {@code block()}이 checked 예외를 감싼 래퍼를 벗겨 원인을 드러냅니다.
     */
    private static Throwable unwrap(Throwable e) {
        Throwable unwrapped = Exceptions.unwrap(e);
        return unwrapped != null ? unwrapped : e;
    }
}
