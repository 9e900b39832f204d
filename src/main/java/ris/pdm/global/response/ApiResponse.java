package ris.pdm.global.response;

/**
 * API 공통 성공 응답 포맷
 *
 * <p>실패 응답은 {@link ris.pdm.global.error.GlobalExceptionHandler}가 {@code ErrorResponse}로 반환합니다.
 *
 * @param success 성공 여부
 * @param data 응답 데이터
 * @param <T> 응답 데이터 타입
 */
public record ApiResponse<T>(boolean success, T data) {

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(true, data);
    }
}
