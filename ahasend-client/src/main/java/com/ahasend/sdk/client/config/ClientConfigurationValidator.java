package com.ahasend.sdk.client.config;

import com.ahasend.sdk.core.config.ValidationResult;
import com.ahasend.sdk.core.ratelimit.CustomerRateLimitConfig;
import com.ahasend.sdk.core.ratelimit.EndpointType;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * {@link ClientConfiguration} 검증기.
 *
 * <p>오류(errors)는 클라이언트 생성을 막고, 경고(warnings)는 로그로만 남깁니다.</p>
 *
 * <p><strong>검증 항목:</strong></p>
 * <ul>
 *   <li>baseUrl: http/https scheme, 유효한 host (오류)</li>
 *   <li>apiKey: 비어있음 (경고)</li>
 *   <li>userAgent: 비어있음, 200자 초과 (경고)</li>
 *   <li>timeout: null 또는 0 이하 (오류), 1초 미만 / 5분 초과 (경고)</li>
 *   <li>defaultHeaders: 빈 이름, CR/LF 포함 (오류)</li>
 *   <li>customerRateLimits: 카테고리별 {@link com.ahasend.sdk.core.ratelimit.RateLimitConfig#validate}</li>
 *   <li>idempotency 접두사: 허용 문자 (오류), 50자 초과 (경고)</li>
 * </ul>
 *
 * @author AhaSend SDK Team
 * @since 1.0.0
 */
public final class ClientConfigurationValidator {

    private static final Pattern HOST = Pattern.compile("^[a-zA-Z0-9.-]+$");
    private static final Pattern KEY_PREFIX = Pattern.compile("^[a-zA-Z0-9_-]+$");
    private static final int MAX_USER_AGENT_LENGTH = 200;
    private static final int MAX_KEY_PREFIX_LENGTH = 50;
    private static final Duration SHORT_TIMEOUT = Duration.ofSeconds(1);
    private static final Duration LONG_TIMEOUT = Duration.ofMinutes(5);

    private ClientConfigurationValidator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 설정 검증.
     *
     * @param configuration 검증 대상
     * @return 오류와 경고 목록
     * @throws IllegalArgumentException configuration이 null인 경우
     */
    public static ValidationResult validate(ClientConfiguration configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("configuration cannot be null");
        }
        ValidationResult.Builder result = ValidationResult.builder();
        validateBaseUrl(configuration.baseUrl(), result);
        validateClient(configuration, result);
        validateTimeout(configuration.timeout(), result);
        validateRateLimits(configuration.customerRateLimits(), result);
        validateIdempotency(configuration.idempotencyConfig().keyPrefix(), result);
        return result.build();
    }

    /**
     * 운영 환경 권장 사항 점검.
     *
     * <p>검증과 달리 설정을 거부하지 않으며, 개선이 권장되는 항목만 반환합니다.</p>
     *
     * @param configuration 점검 대상
     * @return 권장 사항 목록 (비어있으면 운영 준비 완료)
     */
    public static List<String> productionIssues(ClientConfiguration configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("configuration cannot be null");
        }
        List<String> issues = new ArrayList<>();
        if (!configuration.enableRateLimit()) {
            issues.add("Rate limiting is disabled - should be enabled in production");
        }
        if (ClientConfiguration.DEFAULT_USER_AGENT.equals(configuration.userAgent())
                || configuration.userAgent() == null || configuration.userAgent().isBlank()) {
            issues.add("Using default UserAgent - consider setting a more specific one for production");
        }
        if (configuration.baseUrl() == null || !configuration.baseUrl().startsWith("https://")) {
            issues.add("Using non-HTTPS scheme - should use HTTPS in production");
        }
        return List.copyOf(issues);
    }

    private static void validateBaseUrl(String baseUrl, ValidationResult.Builder result) {
        if (baseUrl == null || baseUrl.isBlank()) {
            result.error("baseUrl", baseUrl, "cannot be empty");
            return;
        }
        URI uri;
        try {
            uri = new URI(baseUrl);
        } catch (URISyntaxException e) {
            result.error("baseUrl", baseUrl, "invalid URL: " + e.getReason());
            return;
        }
        String scheme = uri.getScheme();
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
            result.error("baseUrl", baseUrl, "scheme must be 'http' or 'https'");
        }
        String host = uri.getHost();
        if (host == null || host.isEmpty()) {
            result.error("baseUrl", baseUrl, "must include a host");
        } else if (!HOST.matcher(host).matches()) {
            result.error("baseUrl", baseUrl, "contains invalid characters for hostname");
        }
        if (uri.getQuery() != null || uri.getFragment() != null) {
            result.error("baseUrl", baseUrl, "cannot include a query or fragment");
        }
    }

    private static void validateClient(ClientConfiguration configuration, ValidationResult.Builder result) {
        if (!configuration.hasApiKey()) {
            result.warning("apiKey is empty, requests without an Authorization header will be rejected");
        }

        String userAgent = configuration.userAgent();
        if (userAgent == null || userAgent.isBlank()) {
            result.warning("userAgent is empty, no User-Agent header will be sent");
        } else if (userAgent.length() > MAX_USER_AGENT_LENGTH) {
            result.warning("userAgent is very long (>" + MAX_USER_AGENT_LENGTH + " characters)");
        }

        for (Map.Entry<String, String> header : configuration.defaultHeaders().entrySet()) {
            String name = header.getKey();
            if (name.isBlank()) {
                result.error("defaultHeaders", name, "header name cannot be empty");
            }
            if (containsLineBreak(name)) {
                result.error("defaultHeaders", name, "header name cannot contain newline characters");
            }
            if (containsLineBreak(header.getValue())) {
                result.error("defaultHeaders", name + ": " + header.getValue(),
                    "header value cannot contain newline characters");
            }
        }
    }

    private static void validateTimeout(Duration timeout, ValidationResult.Builder result) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            result.error("timeout", timeout, "must be positive");
        } else if (timeout.compareTo(SHORT_TIMEOUT) < 0) {
            result.warning("timeout is very short (<1 second)");
        } else if (timeout.compareTo(LONG_TIMEOUT) > 0) {
            result.warning("timeout is very long (>5 minutes)");
        }
    }

    private static void validateRateLimits(CustomerRateLimitConfig limits, ValidationResult.Builder result) {
        if (limits == null) {
            return;
        }
        for (EndpointType type : EndpointType.values()) {
            limits.forType(type).ifPresent(config ->
                config.validate("customerRateLimits." + fieldName(type), result));
        }
    }

    private static void validateIdempotency(String keyPrefix, ValidationResult.Builder result) {
        if (keyPrefix.isEmpty()) {
            return;
        }
        if (keyPrefix.length() > MAX_KEY_PREFIX_LENGTH) {
            result.warning("idempotencyConfig.keyPrefix is very long (>" + MAX_KEY_PREFIX_LENGTH + " characters)");
        }
        if (!KEY_PREFIX.matcher(keyPrefix).matches()) {
            result.error("idempotencyConfig.keyPrefix", keyPrefix,
                "can only contain letters, numbers, hyphens, and underscores");
        }
    }

    private static String fieldName(EndpointType type) {
        return switch (type) {
            case GENERAL -> "general";
            case STATISTICS -> "statistics";
            case SEND_MESSAGE -> "sendMessage";
        };
    }

    private static boolean containsLineBreak(String value) {
        return value != null && (value.indexOf('\r') >= 0 || value.indexOf('\n') >= 0);
    }
}
