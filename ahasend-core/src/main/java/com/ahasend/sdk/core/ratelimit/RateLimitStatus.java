package com.ahasend.sdk.core.ratelimit;

import java.time.Duration;
import java.util.Optional;

/**
 * 카테고리의 현재 설정과 토큰 상태 스냅샷 (불변 record).
 *
 * <p>조회 시점의 지연 보충(lazy refill) 결과가 반영된 값이며,
 * 스냅샷을 읽는 것은 버킷 상태에 영향을 주지 않습니다.</p>
 *
 * @param endpointType 엔드포인트 카테고리
 * @param enabled 카테고리 활성화 여부 (전역 스위치와 별개)
 * @param requestsPerSecond 초당 허용 요청 수
 * @param burstCapacity 버스트 허용량
 * @param tokens 현재 토큰 수 (0 ~ burstCapacity)
 * @author AhaSend SDK Team
 * @since 1.0.0
 */
public record RateLimitStatus(
    EndpointType endpointType,
    boolean enabled,
    int requestsPerSecond,
    int burstCapacity,
    double tokens
) {

    /**
     * 즉시 사용 가능한 토큰 수 (소수점 이하 버림).
     *
     * @return 사용 가능한 토큰 수
     */
    public int tokensAvailable() {
        return (int) Math.floor(tokens);
    }

    public boolean isFull() {
        return tokens >= burstCapacity;
    }

    /**
     * 버킷이 가득 찰 때까지 남은 시간.
     *
     * @return 남은 시간 (이미 가득 찼으면 ZERO, 보충되지 않는 버킷이면 empty)
     */
    public Optional<Duration> timeUntilFull() {
        if (isFull()) {
            return Optional.of(Duration.ZERO);
        }
        if (requestsPerSecond <= 0) {
            return Optional.empty();
        }
        double seconds = (burstCapacity - tokens) / requestsPerSecond;
        return Optional.of(Duration.ofNanos((long) Math.ceil(seconds * 1_000_000_000d)));
    }
}
