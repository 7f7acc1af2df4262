package com.ahasend.sdk.core.idempotency;

import java.util.UUID;

/**
 * 멱등성 키 생성 유틸리티.
 *
 * <p>{@code Idempotency-Key} 헤더로 전송되어, 같은 키로 재전송된 요청이
 * 서버에서 한 번만 처리되도록 합니다.</p>
 *
 * @author AhaSend SDK Team
 * @since 1.0.0
 */
public final class IdempotencyKeys {

    private IdempotencyKeys() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * UUID 기반 키 생성.
     *
     * @return 새 키 (예: 550e8400-e29b-41d4-a716-446655440000)
     */
    public static String generate() {
        return UUID.randomUUID().toString();
    }

    /**
     * 접두사가 붙은 키 생성.
     *
     * @param prefix 접두사 (null 또는 빈 문자열이면 접두사 없음)
     * @return "{prefix}-{uuid}"
     */
    public static String generate(String prefix) {
        if (prefix == null || prefix.isEmpty()) {
            return generate();
        }
        return prefix + "-" + generate();
    }
}
