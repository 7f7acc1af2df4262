package com.ahasend.sdk.core.idempotency;

/**
 * 멱등성 키 설정 (불변 record).
 *
 * @param autoGenerate 키가 지정되지 않은 POST 요청에 UUID 키 자동 생성 여부
 * @param keyPrefix 생성되는 키의 접두사 (빈 문자열이면 접두사 없음)
 * @author AhaSend SDK Team
 * @since 1.0.0
 */
public record IdempotencyConfig(boolean autoGenerate, String keyPrefix) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: autoGenerate=true, keyPrefix=""</p>
     */
    public IdempotencyConfig() {
        this(true, "");
    }

    /**
     * Compact constructor. null 접두사는 빈 문자열로 정규화합니다.
     */
    public IdempotencyConfig {
        if (keyPrefix == null) {
            keyPrefix = "";
        }
    }

    public IdempotencyConfig withAutoGenerate(boolean autoGenerate) {
        return new IdempotencyConfig(autoGenerate, keyPrefix);
    }

    public IdempotencyConfig withKeyPrefix(String keyPrefix) {
        return new IdempotencyConfig(autoGenerate, keyPrefix);
    }
}
