package com.ahasend.sdk.core.ratelimit;

import com.ahasend.sdk.core.context.ContextDoneException;
import com.ahasend.sdk.core.context.RequestContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 엔드포인트 카테고리별 클라이언트 측 Rate Limiter.
 *
 * <p>카테고리마다 하나의 {@link TokenBucket}을 소유하고, 요청의 (method, path)를
 * {@link EndpointClassifier}로 분류하여 해당 버킷에 승인을 위임합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. classify(method, path) → EndpointType
 * 2. 전역 스위치 off → 즉시 통과 (토큰 소비 없음)
 * 3. bucket.tryAcquire() 성공 → 즉시 통과
 * 4. 실패 → waitListener 알림 → bucket.waitForToken(context) 대기
 * </pre>
 *
 * <p><strong>수명:</strong> 클라이언트당 하나 생성되어 클라이언트가 소유합니다 (프로세스 전역 싱글턴 아님).
 * 버킷 집합은 생성 시 고정되며, 설정 변경은 버킷을 교체하지 않고 제자리에서 갱신합니다.
 * 대기 중인 호출자는 다음 재검사 시점({@link TokenBucket#MAX_POLL_MILLIS}ms 이내)에
 * 새 한도, 카테고리 활성화 여부, 전역 스위치를 반영합니다.</p>
 *
 * <p><strong>실패 의미:</strong> 한도 초과는 거부가 아니라 대기로 처리됩니다 (throttle).
 * 대기 중 발생하는 {@link ContextDoneException}은 재시도 없이 호출자에게 그대로 전달됩니다.</p>
 *
 * <p><strong>Thread-safety:</strong> 모든 메서드는 여러 요청 스레드에서 동시에 호출할 수 있습니다.</p>
 *
 * @author AhaSend SDK Team
 * @since 1.0.0
 */
public final class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final Map<EndpointType, TokenBucket> buckets;
    private final AtomicBoolean globalEnabled = new AtomicBoolean(true);
    private volatile RateLimitWaitListener waitListener = RateLimitWaitListener.NONE;

    /**
     * 카테고리별 기본 한도로 생성.
     */
    public RateLimiter() {
        this(NanoClock.SYSTEM);
    }

    /**
     * 시간원을 지정하여 기본 한도로 생성.
     *
     * @param clock 시간원
     * @throws IllegalArgumentException clock이 null인 경우
     */
    public RateLimiter(NanoClock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        Map<EndpointType, TokenBucket> map = new EnumMap<>(EndpointType.class);
        for (EndpointType type : EndpointType.values()) {
            map.put(type, new TokenBucket(type.defaultConfig(), clock, globalEnabled::get));
        }
        this.buckets = Collections.unmodifiableMap(map);
    }

    /**
     * 요청 분류.
     *
     * @see EndpointClassifier#classify(String, String)
     */
    public EndpointType classify(String method, String path) {
        return EndpointClassifier.classify(method, path);
    }

    /**
     * 카테고리 한도 변경 (활성화 상태로 설정).
     *
     * @param type 카테고리
     * @param requestsPerSecond 초당 허용 요청 수 (0 이상)
     * @param burstCapacity 버스트 허용량 (0 이상)
     * @throws IllegalArgumentException 값이 음수인 경우
     */
    public void setRateLimit(EndpointType type, int requestsPerSecond, int burstCapacity) {
        setRateLimit(type, RateLimitConfig.of(requestsPerSecond, burstCapacity));
    }

    /**
     * 카테고리 설정 변경.
     *
     * @param type 카테고리
     * @param config 새 설정
     * @throws IllegalArgumentException 설정이 유효하지 않은 경우
     */
    public void setRateLimit(EndpointType type, RateLimitConfig config) {
        bucket(type).reconfigure(config);
        log.info("Rate limit for {} set to {} req/s, burst {}, enabled={}",
            type, config.requestsPerSecond(), config.burstCapacity(), config.enabled());
    }

    /**
     * 카테고리 활성화/비활성화.
     */
    public void setEnabled(EndpointType type, boolean enabled) {
        bucket(type).setEnabled(enabled);
        log.info("Rate limit for {} {}", type, enabled ? "enabled" : "disabled");
    }

    /**
     * 전역 스위치 (kill switch).
     *
     * <p>false이면 카테고리 설정과 무관하게 모든 승인이 토큰 소비 없이 즉시 통과합니다.</p>
     *
     * @param enabled 전역 활성화 여부
     */
    public void setGlobalEnabled(boolean enabled) {
        if (globalEnabled.getAndSet(enabled) != enabled) {
            log.info("Rate limiting globally {}", enabled ? "enabled" : "disabled");
        }
    }

    public boolean isGlobalEnabled() {
        return globalEnabled.get();
    }

    /**
     * 고객 설정 일괄 적용.
     *
     * <p>지정되지 않은(null) 카테고리는 현재 설정을 유지합니다.</p>
     *
     * @param config 고객 설정
     * @throws IllegalArgumentException config가 null이거나 유효하지 않은 값을 포함하는 경우
     */
    public void configure(CustomerRateLimitConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        for (EndpointType type : EndpointType.values()) {
            config.forType(type).ifPresent(c -> setRateLimit(type, c));
        }
    }

    public void setWaitListener(RateLimitWaitListener listener) {
        this.waitListener = listener == null ? RateLimitWaitListener.NONE : listener;
    }

    /**
     * 토큰 획득 시도 (비블로킹).
     *
     * @param method HTTP method
     * @param path 요청 경로
     * @return 통과하면 true
     */
    public boolean tryAcquire(String method, String path) {
        if (!globalEnabled.get()) {
            return true;
        }
        return bucket(classify(method, path)).tryAcquire();
    }

    /**
     * 요청이 속한 카테고리의 토큰을 얻을 때까지 대기.
     *
     * @param method HTTP method
     * @param path 요청 경로
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public void waitForToken(String method, String path) throws InterruptedException {
        EndpointType type = classify(method, path);
        if (!globalEnabled.get()) {
            return;
        }
        TokenBucket bucket = bucket(type);
        if (bucket.tryAcquire()) {
            return;
        }
        notifyWait(type, bucket);
        bucket.waitForToken();
    }

    /**
     * 요청이 속한 카테고리의 토큰을 얻거나 컨텍스트가 종료될 때까지 대기.
     *
     * @param context 취소/데드라인 신호
     * @param method HTTP method
     * @param path 요청 경로
     * @throws ContextDoneException 토큰보다 취소/데드라인이 먼저 도달한 경우
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public void waitForToken(RequestContext context, String method, String path)
            throws ContextDoneException, InterruptedException {
        waitForToken(context, classify(method, path));
    }

    /**
     * 지정 카테고리의 토큰을 얻거나 컨텍스트가 종료될 때까지 대기.
     *
     * @param context 취소/데드라인 신호
     * @param type 카테고리
     * @throws ContextDoneException 토큰보다 취소/데드라인이 먼저 도달한 경우
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public void waitForToken(RequestContext context, EndpointType type)
            throws ContextDoneException, InterruptedException {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (!globalEnabled.get()) {
            return;
        }
        TokenBucket bucket = bucket(type);
        if (bucket.tryAcquire()) {
            return;
        }
        notifyWait(type, bucket);
        try {
            bucket.waitForToken(context);
        } catch (ContextDoneException e) {
            log.debug("Gave up waiting for {} rate limit token: {}", type, e.getMessage());
            throw e;
        }
    }

    /**
     * 카테고리 상태 스냅샷 (블로킹/상태 변경 없음).
     *
     * @param type 카테고리
     * @return 불변 스냅샷
     */
    public RateLimitStatus getRateLimitStatus(EndpointType type) {
        return bucket(type).status(type);
    }

    /**
     * 전체 카테고리 상태 스냅샷.
     *
     * @return 카테고리 → 스냅샷 (불변, 선언 순서)
     */
    public Map<EndpointType, RateLimitStatus> getAllStatuses() {
        Map<EndpointType, RateLimitStatus> statuses = new EnumMap<>(EndpointType.class);
        buckets.forEach((type, bucket) -> statuses.put(type, bucket.status(type)));
        return Collections.unmodifiableMap(statuses);
    }

    private TokenBucket bucket(EndpointType type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        return buckets.get(type);
    }

    private void notifyWait(EndpointType type, TokenBucket bucket) {
        Duration estimated = Duration.ofNanos(bucket.nanosUntilAvailable());
        log.debug("Throttling {} request, next token in ~{}ms", type, estimated.toMillis());
        try {
            waitListener.onRateLimitWait(type, estimated);
        } catch (RuntimeException e) {
            log.warn("Rate limit wait listener failed for {}", type, e);
        }
    }
}
