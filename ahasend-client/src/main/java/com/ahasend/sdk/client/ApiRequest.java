package com.ahasend.sdk.client;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * API 요청 명세 (불변 record).
 *
 * <p>경로는 {@code {name}} 형태의 placeholder를 포함하는 템플릿이며,
 * 실행 시 {@link PathTemplates#expand(String, Map)}로 확장됩니다.</p>
 *
 * <pre>{@code
 * ApiRequest request = ApiRequest.post("/v2/accounts/{account_id}/messages")
 *     .withPathParam("account_id", accountId)
 *     .withJsonBody(json)
 *     .withIdempotencyKey("order-42");
 * }</pre>
 *
 * @param method HTTP method (대문자로 정규화)
 * @param pathTemplate 경로 템플릿
 * @param pathParams 경로 파라미터
 * @param queryParams 쿼리 파라미터 (삽입 순서 유지)
 * @param headers 요청별 헤더 (설정의 기본 헤더보다 우선)
 * @param body 요청 본문 (없으면 null)
 * @param skipRateLimit true이면 클라이언트 측 Rate Limit 승인을 건너뜀
 * @param timeout 요청별 타임아웃 (null이면 클라이언트 설정 사용)
 * @author AhaSend SDK Team
 * @since 1.0.0
 */
public record ApiRequest(
    String method,
    String pathTemplate,
    Map<String, String> pathParams,
    Map<String, String> queryParams,
    Map<String, String> headers,
    byte[] body,
    boolean skipRateLimit,
    Duration timeout
) {

    /**
     * Compact constructor.
     *
     * @throws IllegalArgumentException method 또는 pathTemplate이 비어있거나 timeout이 0 이하인 경우
     */
    public ApiRequest {
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("method cannot be null or blank");
        }
        if (pathTemplate == null || pathTemplate.isBlank()) {
            throw new IllegalArgumentException("pathTemplate cannot be null or blank");
        }
        if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        method = method.toUpperCase(Locale.ROOT);
        pathParams = copy(pathParams);
        queryParams = copy(queryParams);
        headers = copy(headers);
    }

    public static ApiRequest of(String method, String pathTemplate) {
        return new ApiRequest(method, pathTemplate, null, null, null, null, false, null);
    }

    public static ApiRequest get(String pathTemplate) {
        return of("GET", pathTemplate);
    }

    public static ApiRequest post(String pathTemplate) {
        return of("POST", pathTemplate);
    }

    public static ApiRequest put(String pathTemplate) {
        return of("PUT", pathTemplate);
    }

    public static ApiRequest patch(String pathTemplate) {
        return of("PATCH", pathTemplate);
    }

    public static ApiRequest delete(String pathTemplate) {
        return of("DELETE", pathTemplate);
    }

    public ApiRequest withPathParam(String name, String value) {
        return new ApiRequest(method, pathTemplate, put(pathParams, name, value), queryParams, headers,
            body, skipRateLimit, timeout);
    }

    public ApiRequest withQueryParam(String name, String value) {
        return new ApiRequest(method, pathTemplate, pathParams, put(queryParams, name, value), headers,
            body, skipRateLimit, timeout);
    }

    public ApiRequest withHeader(String name, String value) {
        return new ApiRequest(method, pathTemplate, pathParams, queryParams, put(headers, name, value),
            body, skipRateLimit, timeout);
    }

    public ApiRequest withBody(byte[] body) {
        return new ApiRequest(method, pathTemplate, pathParams, queryParams, headers,
            body, skipRateLimit, timeout);
    }

    /**
     * UTF-8 JSON 본문 설정.
     */
    public ApiRequest withJsonBody(String json) {
        return withBody(json == null ? null : json.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * 멱등성 키 지정. 같은 키로 재전송된 요청은 서버에서 한 번만 처리됩니다.
     */
    public ApiRequest withIdempotencyKey(String key) {
        return withHeader(ApiClient.IDEMPOTENCY_KEY_HEADER, key);
    }

    /**
     * 클라이언트 측 Rate Limit 승인을 건너뛰는 요청.
     */
    public ApiRequest withoutRateLimit() {
        return new ApiRequest(method, pathTemplate, pathParams, queryParams, headers,
            body, true, timeout);
    }

    public ApiRequest withTimeout(Duration timeout) {
        return new ApiRequest(method, pathTemplate, pathParams, queryParams, headers,
            body, skipRateLimit, timeout);
    }

    public boolean hasBody() {
        return body != null;
    }

    private static Map<String, String> put(Map<String, String> source, String name, String value) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        Map<String, String> copy = new LinkedHashMap<>(source);
        copy.put(name, value);
        return copy;
    }

    private static Map<String, String> copy(Map<String, String> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
