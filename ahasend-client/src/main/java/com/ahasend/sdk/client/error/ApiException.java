package com.ahasend.sdk.client.error;

/**
 * API가 non-2xx 응답을 반환했음을 알리는 예외.
 *
 * <p>{@link com.ahasend.sdk.client.ApiClient#executeOrThrow}가 던집니다.
 * 상세 정보는 {@link #getError()}로 조회합니다.</p>
 *
 * @author AhaSend SDK Team
 * @since 1.0.0
 */
public final class ApiException extends Exception {

    private static final long serialVersionUID = 1L;

    private final transient ApiError error;

    public ApiException(ApiError error) {
        super(requireError(error).describe());
        this.error = error;
    }

    public ApiError getError() {
        return error;
    }

    public ApiErrorType getType() {
        return error.type();
    }

    public int getStatusCode() {
        return error.statusCode();
    }

    public boolean isRetryable() {
        return error.isRetryable();
    }

    private static ApiError requireError(ApiError error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        return error;
    }
}
