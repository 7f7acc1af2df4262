package com.ahasend.sdk.core.ratelimit;

import java.util.Optional;

/**
 * 세 카테고리의 한도를 한 번에 지정하는 설정 (불변 record).
 *
 * <p>엔터프라이즈 계정처럼 기본 한도가 다른 고객을 위한 일괄 설정입니다.
 * null 필드는 "현재 설정 유지"를 의미합니다.</p>
 *
 * @param general GENERAL 카테고리 설정 (null 가능)
 * @param statistics STATISTICS 카테고리 설정 (null 가능)
 * @param sendMessage SEND_MESSAGE 카테고리 설정 (null 가능)
 * @author AhaSend SDK Team
 * @since 1.0.0
 */
public record CustomerRateLimitConfig(
    RateLimitConfig general,
    RateLimitConfig statistics,
    RateLimitConfig sendMessage
) {

    /**
     * 모든 카테고리 미지정.
     *
     * @return 빈 설정
     */
    public static CustomerRateLimitConfig empty() {
        return new CustomerRateLimitConfig(null, null, null);
    }

    /**
     * 카테고리별 설정 조회.
     *
     * @param type 엔드포인트 카테고리
     * @return 지정된 설정 (없으면 empty)
     */
    public Optional<RateLimitConfig> forType(EndpointType type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        return switch (type) {
            case GENERAL -> Optional.ofNullable(general);
            case STATISTICS -> Optional.ofNullable(statistics);
            case SEND_MESSAGE -> Optional.ofNullable(sendMessage);
        };
    }

    /**
     * 한 카테고리만 변경한 새 인스턴스 생성.
     *
     * @param type 엔드포인트 카테고리
     * @param config 설정 (null이면 미지정으로 되돌림)
     * @return 새 인스턴스
     */
    public CustomerRateLimitConfig with(EndpointType type, RateLimitConfig config) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        return switch (type) {
            case GENERAL -> new CustomerRateLimitConfig(config, statistics, sendMessage);
            case STATISTICS -> new CustomerRateLimitConfig(general, config, sendMessage);
            case SEND_MESSAGE -> new CustomerRateLimitConfig(general, statistics, config);
        };
    }
}
