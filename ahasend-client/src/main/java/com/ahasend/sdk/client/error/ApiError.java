package com.ahasend.sdk.client.error;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * non-2xx 응답에서 추출한 구조화된 오류 정보 (불변 record).
 *
 * <p>{@link ApiErrors#fromResponse}로 생성합니다.</p>
 *
 * @param type 상태 코드 기반 분류
 * @param statusCode HTTP 상태 코드
 * @param message 서버 메시지 (없으면 상태 설명)
 * @param requestId {@code X-Request-Id} 헤더 값 (없으면 null)
 * @param retryAfter {@code Retry-After} 헤더 값, RATE_LIMIT일 때만 (없으면 null)
 * @param method 요청 HTTP method (없으면 null)
 * @param endpoint 요청 경로 (없으면 null)
 * @param field 검증 오류의 대상 필드 (없으면 null)
 * @param resource 찾지 못한 리소스 종류 (없으면 null)
 * @param suggestions 해결 안내 문구
 * @param rawBody 원본 응답 본문
 * @author AhaSend SDK Team
 * @since 1.0.0
 */
public record ApiError(
    ApiErrorType type,
    int statusCode,
    String message,
    String requestId,
    Duration retryAfter,
    String method,
    String endpoint,
    String field,
    String resource,
    List<String> suggestions,
    byte[] rawBody
) {

    /**
     * Compact constructor.
     *
     * @throws IllegalArgumentException type 또는 message가 null인 경우
     */
    public ApiError {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        rawBody = rawBody == null ? new byte[0] : rawBody;
    }

    /**
     * 재시도로 해결될 수 있는 오류인지.
     *
     * <p>RATE_LIMIT, SERVER, NETWORK는 재시도 가능합니다. CONFLICT는 멱등 요청이 아직
     * 처리 중이라는 메시지("in progress", "processing")일 때만 재시도 가능합니다.</p>
     */
    public boolean isRetryable() {
        return switch (type) {
            case RATE_LIMIT, SERVER, NETWORK -> true;
            case CONFLICT -> {
                String lower = message.toLowerCase(Locale.ROOT);
                yield lower.contains("in progress") || lower.contains("processing");
            }
            default -> false;
        };
    }

    public boolean isAuthError() {
        return type == ApiErrorType.AUTHENTICATION;
    }

    public boolean isPermissionError() {
        return type == ApiErrorType.PERMISSION;
    }

    public boolean isValidationError() {
        return type == ApiErrorType.VALIDATION;
    }

    public boolean isNotFoundError() {
        return type == ApiErrorType.NOT_FOUND;
    }

    public boolean isRateLimitError() {
        return type == ApiErrorType.RATE_LIMIT;
    }

    public boolean isIdempotencyError() {
        return type == ApiErrorType.IDEMPOTENCY;
    }

    /**
     * 권한 오류 메시지에서 필요한 scope 추출.
     *
     * <p>"requires scope: messages:send:all", "missing permission: domains:write" 형태를 인식합니다.</p>
     *
     * @return scope (PERMISSION이 아니거나 추출할 수 없으면 empty)
     */
    public Optional<String> requiredScope() {
        if (type != ApiErrorType.PERMISSION) {
            return Optional.empty();
        }
        String lower = message.toLowerCase(Locale.ROOT);
        for (String marker : new String[] {"scope:", "permission:"}) {
            int idx = lower.indexOf(marker);
            if (idx >= 0) {
                String scope = message.substring(idx + marker.length()).trim();
                return scope.isEmpty() ? Optional.empty() : Optional.of(scope);
            }
        }
        return Optional.empty();
    }

    /**
     * 사람이 읽는 한 줄 설명.
     *
     * <p>예: {@code rate_limit error (HTTP 429): too many requests | POST /v2/accounts/1/messages}</p>
     */
    public String describe() {
        StringBuilder sb = new StringBuilder()
            .append(type.getKey()).append(" error (HTTP ").append(statusCode).append("): ").append(message);
        if (field != null) {
            sb.append(" | field: ").append(field);
        }
        if (resource != null) {
            sb.append(" | resource: ").append(resource);
        }
        if (method != null && endpoint != null) {
            sb.append(" | ").append(method).append(' ').append(endpoint);
        }
        return sb.toString();
    }
}
