package com.ahasend.sdk.core.ratelimit;

import com.ahasend.sdk.core.config.ValidationResult;

/**
 * 카테고리별 Rate Limit 설정 (불변 record).
 *
 * <p>{@link TokenBucket}의 생성 및 재설정에 사용됩니다.</p>
 *
 * <p><strong>값의 의미:</strong></p>
 * <ul>
 *   <li>requestsPerSecond: 초당 토큰 보충량. 0이면 보충 없음 (초기 버스트만 사용 가능)</li>
 *   <li>burstCapacity: 버킷 최대 토큰 수. 연속으로 즉시 통과 가능한 요청 수</li>
 *   <li>enabled: false이면 토큰 수와 무관하게 모든 요청 즉시 통과</li>
 * </ul>
 *
 * <p>음수 값은 record 생성 시점이 아니라 {@link #validate(String, ValidationResult.Builder)}
 * 단계에서 필드 단위로 보고됩니다. 잘못된 설정은 버킷에 도달하기 전에 거부됩니다.</p>
 *
 * @param requestsPerSecond 초당 허용 요청 수 (0 이상)
 * @param burstCapacity 버스트 허용량 (0 이상)
 * @param enabled 활성화 여부
 * @author AhaSend SDK Team
 * @since 1.0.0
 */
public record RateLimitConfig(int requestsPerSecond, int burstCapacity, boolean enabled) {

    /**
     * 활성화된 설정 생성.
     *
     * @param requestsPerSecond 초당 허용 요청 수
     * @param burstCapacity 버스트 허용량
     * @return RateLimitConfig (enabled=true)
     */
    public static RateLimitConfig of(int requestsPerSecond, int burstCapacity) {
        return new RateLimitConfig(requestsPerSecond, burstCapacity, true);
    }

    /**
     * 비활성 설정. 승인 검사를 모두 통과시킵니다.
     */
    public static RateLimitConfig disabled() {
        return new RateLimitConfig(0, 0, false);
    }

    /**
     * enabled만 변경한 새 인스턴스 생성.
     */
    public RateLimitConfig withEnabled(boolean enabled) {
        return new RateLimitConfig(requestsPerSecond, burstCapacity, enabled);
    }

    /**
     * requestsPerSecond만 변경한 새 인스턴스 생성.
     */
    public RateLimitConfig withRequestsPerSecond(int requestsPerSecond) {
        return new RateLimitConfig(requestsPerSecond, burstCapacity, enabled);
    }

    /**
     * burstCapacity만 변경한 새 인스턴스 생성.
     */
    public RateLimitConfig withBurstCapacity(int burstCapacity) {
        return new RateLimitConfig(requestsPerSecond, burstCapacity, enabled);
    }

    /**
     * 설정 검증 결과를 누적기에 기록.
     *
     * <p><strong>오류:</strong> 음수 requestsPerSecond, 음수 burstCapacity</p>
     * <p><strong>경고 (enabled인 경우만):</strong></p>
     * <ul>
     *   <li>burstCapacity == 0: 모든 요청이 무기한 대기</li>
     *   <li>requestsPerSecond == 0: 초기 버스트 소진 후 보충 없음</li>
     *   <li>burstCapacity &lt; requestsPerSecond: 버스트가 초당 처리량보다 작음</li>
     * </ul>
     *
     * @param field 필드 경로 접두사 (예: "customerRateLimits.general")
     * @param result 검증 결과 누적기
     */
    public void validate(String field, ValidationResult.Builder result) {
        if (requestsPerSecond < 0) {
            result.error(field + ".requestsPerSecond", requestsPerSecond, "cannot be negative");
        }
        if (burstCapacity < 0) {
            result.error(field + ".burstCapacity", burstCapacity, "cannot be negative");
        }
        if (!enabled || requestsPerSecond < 0 || burstCapacity < 0) {
            return;
        }
        if (burstCapacity == 0) {
            result.warning(field + ".burstCapacity is 0, every request will block until cancelled");
        } else if (requestsPerSecond == 0) {
            result.warning(field + ".requestsPerSecond is 0, tokens are never refilled after the initial burst");
        } else if (burstCapacity < requestsPerSecond) {
            result.warning(field + ".burstCapacity (" + burstCapacity
                + ") is less than requestsPerSecond (" + requestsPerSecond + ")");
        }
    }

    /**
     * 단독 검증.
     *
     * @param field 필드 경로 접두사
     * @return 검증 결과
     */
    public ValidationResult validate(String field) {
        ValidationResult.Builder result = ValidationResult.builder();
        validate(field, result);
        return result.build();
    }
}
