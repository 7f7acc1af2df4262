package com.ahasend.sdk.core.idempotency;

/**
 * 설정에 따라 멱등성 키를 생성/보장하는 헬퍼.
 *
 * @author AhaSend SDK Team
 * @since 1.0.0
 */
public final class IdempotencyHelper {

    private final IdempotencyConfig config;

    public IdempotencyHelper(IdempotencyConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    public IdempotencyConfig getConfig() {
        return config;
    }

    /**
     * 설정된 접두사로 새 키 생성.
     */
    public String generateKey() {
        return IdempotencyKeys.generate(config.keyPrefix());
    }

    /**
     * 키 보장.
     *
     * @param key 호출자가 지정한 키 (null 가능)
     * @return 지정된 키, 없으면 autoGenerate일 때 새 키, 아니면 빈 문자열
     */
    public String ensureKey(String key) {
        if (key != null && !key.isEmpty()) {
            return key;
        }
        if (config.autoGenerate()) {
            return generateKey();
        }
        return "";
    }
}
