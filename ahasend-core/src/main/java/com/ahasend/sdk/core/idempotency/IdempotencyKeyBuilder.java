package com.ahasend.sdk.core.idempotency;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 연관된 여러 작업에 쓸 멱등성 키 생성기.
 *
 * <p>첫 {@link #next()}는 기준 키를 그대로 반환하고, 이후 호출은
 * {@code {base}-{8자리 hex}} 형태의 새 키를 반환합니다.</p>
 *
 * <pre>{@code
 * IdempotencyKeyBuilder keys = new IdempotencyKeyBuilder("order-42");
 * keys.next();                 // "order-42"
 * keys.withSuffix("receipt");  // "order-42-receipt"
 * }</pre>
 *
 * @author AhaSend SDK Team
 * @since 1.0.0
 */
public final class IdempotencyKeyBuilder {

    private final String baseKey;
    private final AtomicInteger counter = new AtomicInteger();

    /**
     * @param baseKey 기준 키 (null 또는 빈 문자열이면 UUID 생성)
     */
    public IdempotencyKeyBuilder(String baseKey) {
        this.baseKey = baseKey == null || baseKey.isEmpty() ? IdempotencyKeys.generate() : baseKey;
    }

    public String getBaseKey() {
        return baseKey;
    }

    public String next() {
        if (counter.incrementAndGet() == 1) {
            return baseKey;
        }
        return baseKey + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    public String withSuffix(String suffix) {
        return baseKey + "-" + suffix;
    }
}
