package com.ahasend.sdk.core.ratelimit;

/**
 * Rate Limit 적용 단위가 되는 엔드포인트 카테고리.
 *
 * <p>카테고리마다 독립된 {@link TokenBucket}이 할당됩니다.</p>
 *
 * <table>
 *   <caption>기본 한도</caption>
 *   <tr><th>카테고리</th><th>requestsPerSecond</th><th>burstCapacity</th></tr>
 *   <tr><td>GENERAL</td><td>100</td><td>200</td></tr>
 *   <tr><td>STATISTICS</td><td>1</td><td>1</td></tr>
 *   <tr><td>SEND_MESSAGE</td><td>100</td><td>200</td></tr>
 * </table>
 *
 * @author AhaSend SDK Team
 * @since 1.0.0
 */
public enum EndpointType {

    /** 일반 API (도메인, 웹훅, API 키 등) */
    GENERAL("general", 100, 200),

    /** 통계 API ({@code /statistics/...}) */
    STATISTICS("statistics", 1, 1),

    /** 메시지 발송 API ({@code POST .../messages}) */
    SEND_MESSAGE("send_message", 100, 200);

    private final String key;
    private final int defaultRequestsPerSecond;
    private final int defaultBurstCapacity;

    EndpointType(String key, int defaultRequestsPerSecond, int defaultBurstCapacity) {
        this.key = key;
        this.defaultRequestsPerSecond = defaultRequestsPerSecond;
        this.defaultBurstCapacity = defaultBurstCapacity;
    }

    /**
     * 설정/로그에 사용하는 소문자 키.
     *
     * @return 키 (예: "send_message")
     */
    public String getKey() {
        return key;
    }

    /**
     * 카테고리 기본 설정.
     *
     * @return 활성화된 기본 RateLimitConfig
     */
    public RateLimitConfig defaultConfig() {
        return RateLimitConfig.of(defaultRequestsPerSecond, defaultBurstCapacity);
    }

    /**
     * 키로 카테고리 조회.
     *
     * @param key 소문자 키 (대소문자 무시)
     * @return EndpointType
     * @throws IllegalArgumentException 알 수 없는 키인 경우
     */
    public static EndpointType fromKey(String key) {
        for (EndpointType type : values()) {
            if (type.key.equalsIgnoreCase(key)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown endpoint type: " + key);
    }

    @Override
    public String toString() {
        return key;
    }
}
