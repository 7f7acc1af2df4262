package com.ahasend.sdk.client.error;

/**
 * API 오류 분류.
 *
 * <p>HTTP 상태 코드로 결정되며, 호출자는 이 값으로 재시도 여부나 사용자 안내를 분기합니다.</p>
 *
 * @author AhaSend SDK Team
 * @since 1.0.0
 */
public enum ApiErrorType {

    /** 400 */
    VALIDATION("validation"),

    /** 401 */
    AUTHENTICATION("authentication"),

    /** 403 */
    PERMISSION("permission"),

    /** 404 */
    NOT_FOUND("not_found"),

    /** 409 */
    CONFLICT("conflict"),

    /** 412: 멱등성 키 재사용 등 */
    IDEMPOTENCY("idempotency"),

    /** 429 */
    RATE_LIMIT("rate_limit"),

    /** 5xx */
    SERVER("server"),

    /** 응답을 받지 못한 전송 실패 */
    NETWORK("network"),

    /** 그 외 */
    UNKNOWN("unknown");

    private final String key;

    ApiErrorType(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /**
     * 상태 코드로 분류.
     *
     * @param statusCode HTTP 상태 코드
     * @return 오류 분류 (매핑되지 않는 4xx와 그 외는 UNKNOWN)
     */
    public static ApiErrorType fromStatusCode(int statusCode) {
        return switch (statusCode) {
            case 400 -> VALIDATION;
            case 401 -> AUTHENTICATION;
            case 403 -> PERMISSION;
            case 404 -> NOT_FOUND;
            case 409 -> CONFLICT;
            case 412 -> IDEMPOTENCY;
            case 429 -> RATE_LIMIT;
            default -> statusCode >= 500 ? SERVER : UNKNOWN;
        };
    }
}
