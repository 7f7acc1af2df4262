package com.ahasend.sdk.client.config;

import com.ahasend.sdk.core.idempotency.IdempotencyConfig;
import com.ahasend.sdk.core.ratelimit.CustomerRateLimitConfig;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * API 클라이언트 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>baseUrl: API 서버 주소 (기본 https://api.ahasend.com)</li>
 *   <li>apiKey: Bearer 인증 키 (기본 없음)</li>
 *   <li>userAgent: User-Agent 헤더 (기본 AhaSend-Java-SDK/1.0)</li>
 *   <li>timeout: 요청 타임아웃 (기본 30초)</li>
 *   <li>enableRateLimit: 클라이언트 측 Rate Limiting 전역 스위치 (기본 true)</li>
 *   <li>customerRateLimits: 카테고리별 한도 재정의 (기본 없음 = 카테고리 기본값)</li>
 *   <li>idempotencyConfig: 멱등성 키 설정 (기본 자동 생성)</li>
 *   <li>defaultHeaders: 모든 요청에 추가되는 헤더</li>
 * </ul>
 *
 * <p>값의 유효성은 {@link ClientConfigurationValidator}가 검증합니다.</p>
 *
 * @author AhaSend SDK Team
 * @since 1.0.0
 * @param baseUrl API 서버 주소
 * @param apiKey API 키 (null 가능)
 * @param userAgent User-Agent
 * @param timeout 요청 타임아웃
 * @param enableRateLimit Rate Limiting 전역 활성화 여부
 * @param customerRateLimits 카테고리별 한도 (null 가능)
 * @param idempotencyConfig 멱등성 설정
 * @param defaultHeaders 기본 헤더
 */
public record ClientConfiguration(
    String baseUrl,
    String apiKey,
    String userAgent,
    Duration timeout,
    boolean enableRateLimit,
    CustomerRateLimitConfig customerRateLimits,
    IdempotencyConfig idempotencyConfig,
    Map<String, String> defaultHeaders
) {

    public static final String DEFAULT_BASE_URL = "https://api.ahasend.com";
    public static final String DEFAULT_USER_AGENT = "AhaSend-Java-SDK/1.0";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    /**
     * 기본 설정 생성자.
     */
    public ClientConfiguration() {
        this(DEFAULT_BASE_URL, null, DEFAULT_USER_AGENT, DEFAULT_TIMEOUT, true, null,
            new IdempotencyConfig(), Map.of());
    }

    /**
     * Compact constructor. null 컬렉션/설정은 기본값으로 정규화합니다.
     */
    public ClientConfiguration {
        if (idempotencyConfig == null) {
            idempotencyConfig = new IdempotencyConfig();
        }
        defaultHeaders = defaultHeaders == null ? Map.of() : Map.copyOf(defaultHeaders);
    }

    public ClientConfiguration withBaseUrl(String baseUrl) {
        return new ClientConfiguration(baseUrl, apiKey, userAgent, timeout, enableRateLimit,
            customerRateLimits, idempotencyConfig, defaultHeaders);
    }

    public ClientConfiguration withApiKey(String apiKey) {
        return new ClientConfiguration(baseUrl, apiKey, userAgent, timeout, enableRateLimit,
            customerRateLimits, idempotencyConfig, defaultHeaders);
    }

    public ClientConfiguration withUserAgent(String userAgent) {
        return new ClientConfiguration(baseUrl, apiKey, userAgent, timeout, enableRateLimit,
            customerRateLimits, idempotencyConfig, defaultHeaders);
    }

    public ClientConfiguration withTimeout(Duration timeout) {
        return new ClientConfiguration(baseUrl, apiKey, userAgent, timeout, enableRateLimit,
            customerRateLimits, idempotencyConfig, defaultHeaders);
    }

    public ClientConfiguration withEnableRateLimit(boolean enableRateLimit) {
        return new ClientConfiguration(baseUrl, apiKey, userAgent, timeout, enableRateLimit,
            customerRateLimits, idempotencyConfig, defaultHeaders);
    }

    public ClientConfiguration withCustomerRateLimits(CustomerRateLimitConfig customerRateLimits) {
        return new ClientConfiguration(baseUrl, apiKey, userAgent, timeout, enableRateLimit,
            customerRateLimits, idempotencyConfig, defaultHeaders);
    }

    public ClientConfiguration withIdempotencyConfig(IdempotencyConfig idempotencyConfig) {
        return new ClientConfiguration(baseUrl, apiKey, userAgent, timeout, enableRateLimit,
            customerRateLimits, idempotencyConfig, defaultHeaders);
    }

    /**
     * 기본 헤더 하나를 추가(또는 교체)한 새 인스턴스 생성.
     */
    public ClientConfiguration withDefaultHeader(String name, String value) {
        Map<String, String> headers = new LinkedHashMap<>(defaultHeaders);
        headers.put(name, value);
        return new ClientConfiguration(baseUrl, apiKey, userAgent, timeout, enableRateLimit,
            customerRateLimits, idempotencyConfig, headers);
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String toString() {
        return "ClientConfiguration{baseUrl=" + baseUrl
            + ", apiKey=" + (hasApiKey() ? "***" : "none")
            + ", userAgent=" + userAgent
            + ", timeout=" + timeout
            + ", enableRateLimit=" + enableRateLimit
            + ", customerRateLimits=" + customerRateLimits
            + ", idempotencyConfig=" + idempotencyConfig + '}';
    }
}
