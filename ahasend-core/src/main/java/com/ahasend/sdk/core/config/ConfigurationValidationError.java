package com.ahasend.sdk.core.config;

/**
 * 설정 검증 오류 (불변 record).
 *
 * @param field 오류가 발생한 필드 경로 (예: customerRateLimits.general.burstCapacity)
 * @param value 거부된 값 (null 가능)
 * @param message 오류 설명
 * @author AhaSend SDK Team
 * @since 1.0.0
 */
public record ConfigurationValidationError(String field, Object value, String message) {

    /**
     * Compact constructor.
     *
     * @throws IllegalArgumentException field 또는 message가 비어있는 경우
     */
    public ConfigurationValidationError {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("field cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    /**
     * 사람이 읽을 수 있는 오류 메시지.
     *
     * @return "configuration validation error for {field} ({value}): {message}"
     */
    public String describe() {
        return "configuration validation error for " + field + " (" + value + "): " + message;
    }
}
