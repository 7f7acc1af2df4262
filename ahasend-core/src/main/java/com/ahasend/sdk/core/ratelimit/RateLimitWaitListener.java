package com.ahasend.sdk.core.ratelimit;

import java.time.Duration;

/**
 * 토큰 부족으로 요청이 대기하게 될 때 호출되는 콜백.
 *
 * <p>모니터링/메트릭 연동용입니다. 리스너는 요청 스레드에서 대기 직전에 호출되므로
 * 빠르게 반환해야 하며, 던진 예외는 로그만 남기고 무시됩니다.</p>
 *
 * @author AhaSend SDK Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RateLimitWaitListener {

    /** 아무 동작도 하지 않는 리스너 */
    RateLimitWaitListener NONE = (endpointType, estimatedWait) -> { };

    /**
     * 대기 시작 알림.
     *
     * @param endpointType 대기하는 카테고리
     * @param estimatedWait 다음 토큰까지 예상 대기 시간 (보충되지 않는 버킷이면 매우 큰 값)
     */
    void onRateLimitWait(EndpointType endpointType, Duration estimatedWait);
}
