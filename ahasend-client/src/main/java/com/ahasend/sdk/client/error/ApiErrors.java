package com.ahasend.sdk.client.error;

import com.ahasend.sdk.core.context.ContextDoneException;
import com.ahasend.sdk.core.spi.TransportResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 오류 응답 해석 유틸리티.
 *
 * <p><strong>해석 규칙:</strong></p>
 * <pre>
 * 1. type       = ApiErrorType.fromStatusCode(status)
 * 2. requestId  = X-Request-Id 헤더
 * 3. retryAfter = Retry-After 헤더 (초, RATE_LIMIT일 때만)
 * 4. message    = JSON 본문의 "message" → 1000자 미만 원문 → 상태 설명
 * 5. field/resource 추출, 해결 안내 생성
 * </pre>
 *
 * @author AhaSend SDK Team
 * @since 1.0.0
 */
public final class ApiErrors {

    private static final Logger log = LoggerFactory.getLogger(ApiErrors.class);

    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String RETRY_AFTER_HEADER = "Retry-After";

    private static final int MAX_RAW_MESSAGE_LENGTH = 1000;
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private ApiErrors() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * non-2xx 응답을 구조화된 오류로 변환.
     *
     * @param response 응답
     * @param method 요청 HTTP method (null 허용)
     * @param endpoint 요청 경로 (null 허용)
     * @return 오류 정보
     * @throws IllegalArgumentException response가 null인 경우
     */
    public static ApiError fromResponse(TransportResponse response, String method, String endpoint) {
        if (response == null) {
            throw new IllegalArgumentException("response cannot be null");
        }
        int status = response.statusCode();
        ApiErrorType type = ApiErrorType.fromStatusCode(status);

        // 1. 헤더
        String requestId = blankToNull(response.header(REQUEST_ID_HEADER));
        Duration retryAfter = type == ApiErrorType.RATE_LIMIT
            ? parseRetryAfter(response.header(RETRY_AFTER_HEADER))
            : null;

        // 2. 본문
        String message = parseMessage(response);

        // 3. 메시지 문맥
        String field = type == ApiErrorType.VALIDATION ? extractField(message) : null;
        String resource = type == ApiErrorType.NOT_FOUND ? extractResource(message) : null;

        ApiError draft = new ApiError(type, status, message, requestId, retryAfter,
            method, endpoint, field, resource, List.of(), response.body());
        return new ApiError(type, status, message, requestId, retryAfter,
            method, endpoint, field, resource, suggestionsFor(draft), response.body());
    }

    /**
     * 임의의 실패가 재시도로 해결될 수 있는지.
     *
     * <ul>
     *   <li>{@link ApiException}: {@link ApiError#isRetryable()}</li>
     *   <li>{@link ContextDoneException}: false (호출자 측 중단)</li>
     *   <li>그 외 {@link IOException}: true (네트워크 오류)</li>
     * </ul>
     */
    public static boolean isRetryable(Throwable failure) {
        if (failure instanceof ApiException api) {
            return api.isRetryable();
        }
        return typeOf(failure) == ApiErrorType.NETWORK;
    }

    /**
     * 실패 분류.
     *
     * @return ApiException이면 해당 분류, IOException이면 NETWORK, 그 외 UNKNOWN
     *         ({@link ContextDoneException}은 IOException이 아니므로 UNKNOWN)
     */
    public static ApiErrorType typeOf(Throwable failure) {
        if (failure instanceof ApiException api) {
            return api.getType();
        }
        if (failure instanceof IOException) {
            return ApiErrorType.NETWORK;
        }
        return ApiErrorType.UNKNOWN;
    }

    private static String parseMessage(TransportResponse response) {
        String body = response.bodyAsString();
        if (!body.isBlank()) {
            try {
                JsonNode node = OBJECT_MAPPER.readTree(body);
                JsonNode message = node == null ? null : node.get("message");
                if (message != null && message.isTextual() && !message.asText().isBlank()) {
                    return message.asText();
                }
                return reasonPhrase(response.statusCode());
            } catch (JsonProcessingException e) {
                log.debug("Error response body is not JSON (status {}): {}", response.statusCode(), e.getOriginalMessage());
            }
            if (body.length() < MAX_RAW_MESSAGE_LENGTH) {
                return body.trim();
            }
        }
        return reasonPhrase(response.statusCode());
    }

    private static Duration parseRetryAfter(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            long seconds = Long.parseLong(raw.trim());
            return seconds >= 0 ? Duration.ofSeconds(seconds) : null;
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric Retry-After: {}", raw);
            return null;
        }
    }

    /**
     * "missing field: subject" → subject, "invalid email address" → email
     */
    static String extractField(String message) {
        String lower = message.toLowerCase(Locale.ROOT);
        if (!lower.contains("invalid") && !lower.contains("missing")) {
            return null;
        }
        int colon = message.indexOf(':');
        if (colon >= 0) {
            String after = message.substring(colon + 1);
            int next = after.indexOf(':');
            String field = (next >= 0 ? after.substring(0, next) : after).trim();
            return field.isEmpty() ? null : field;
        }
        int idx = lower.indexOf("invalid ");
        if (idx >= 0) {
            String after = lower.substring(idx + "invalid ".length()).trim();
            int space = after.indexOf(' ');
            String field = space > 0 ? after.substring(0, space) : after;
            return field.isEmpty() ? null : field;
        }
        return null;
    }

    static String extractResource(String message) {
        String lower = message.toLowerCase(Locale.ROOT);
        if (lower.contains("domain")) {
            return "domain";
        }
        if (lower.contains("message")) {
            return "message";
        }
        if (lower.contains("api key") || lower.contains("api_key")) {
            return "api_key";
        }
        if (lower.contains("webhook")) {
            return "webhook";
        }
        if (lower.contains("route")) {
            return "route";
        }
        if (lower.contains("account")) {
            return "account";
        }
        return null;
    }

    private static List<String> suggestionsFor(ApiError error) {
        List<String> suggestions = new ArrayList<>();
        switch (error.type()) {
            case AUTHENTICATION -> {
                suggestions.add("Check that your API key is valid and properly formatted");
                suggestions.add("Ensure the API key starts with 'aha-sk-'");
                suggestions.add("Verify the Authorization header is set: 'Bearer <your-api-key>'");
            }
            case PERMISSION -> {
                suggestions.add("Check that your API key has the required scopes for this operation");
                suggestions.add("Review the API documentation for required permissions");
                error.requiredScope().ifPresent(scope -> suggestions.add("Required scope: " + scope));
            }
            case VALIDATION -> {
                if (error.field() != null) {
                    suggestions.add("Check the '" + error.field() + "' field in your request");
                    suggestions.add("Review the API documentation for field requirements");
                    switch (error.field()) {
                        case "sender", "from" -> {
                            suggestions.add("Ensure the sender email is from a domain you own");
                            suggestions.add("Example: noreply@yourdomain.com");
                        }
                        case "to", "recipient" -> {
                            suggestions.add("Verify the recipient email address format");
                            suggestions.add("Example: user@example.com");
                        }
                        default -> { }
                    }
                } else {
                    suggestions.add("Review your request parameters for missing or invalid values");
                    suggestions.add("Check the API documentation for required fields");
                }
                if (error.endpoint() != null && error.endpoint().contains("/messages")) {
                    if ("POST".equals(error.method())) {
                        suggestions.add("Ensure either 'text_content' or 'html_content' is provided");
                    } else if ("GET".equals(error.method())) {
                        suggestions.add("Check your query parameters (sender, recipient, status, etc.)");
                    }
                }
            }
            case NOT_FOUND -> {
                if (error.resource() != null) {
                    suggestions.add("Verify the " + error.resource() + " ID is correct");
                    suggestions.add("Check that the " + error.resource() + " exists and you have access to it");
                    if ("domain".equals(error.resource())) {
                        suggestions.add("Ensure the domain is properly configured with DNS records");
                    }
                } else {
                    suggestions.add("Double-check the resource ID or identifier");
                    suggestions.add("Ensure the resource exists and you have access to it");
                }
            }
            case RATE_LIMIT -> {
                suggestions.add("Reduce the frequency of your API requests");
                suggestions.add("Implement exponential backoff in your retry logic");
                suggestions.add("Consider upgrading your plan for higher rate limits");
                if (error.retryAfter() != null && !error.retryAfter().isZero()) {
                    suggestions.add("Wait " + error.retryAfter().getSeconds() + " seconds before retrying");
                }
            }
            case SERVER -> {
                suggestions.add("This is a temporary server issue - try again in a few moments");
                suggestions.add("If the issue persists, contact AhaSend support");
                if (error.requestId() != null) {
                    suggestions.add("Include this request ID when contacting support: " + error.requestId());
                }
            }
            case CONFLICT -> {
                suggestions.add("The resource may already exist or be in a conflicting state");
                suggestions.add("Try using a different identifier or check existing resources");
            }
            case IDEMPOTENCY -> {
                suggestions.add("Use a unique idempotency key for each logical request");
                suggestions.add("Don't reuse idempotency keys across different operations");
                suggestions.add("Idempotency keys expire after 24 hours");
            }
            default -> { }
        }
        return suggestions;
    }

    private static String reasonPhrase(int statusCode) {
        return switch (statusCode) {
            case 400 -> "Bad Request";
            case 401 -> "Unauthorized";
            case 403 -> "Forbidden";
            case 404 -> "Not Found";
            case 409 -> "Conflict";
            case 412 -> "Precondition Failed";
            case 422 -> "Unprocessable Entity";
            case 429 -> "Too Many Requests";
            case 500 -> "Internal Server Error";
            case 502 -> "Bad Gateway";
            case 503 -> "Service Unavailable";
            case 504 -> "Gateway Timeout";
            default -> "HTTP " + statusCode;
        };
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
