package com.ahasend.sdk.core.ratelimit;

import com.ahasend.sdk.core.config.ValidationResult;
import com.ahasend.sdk.core.context.ContextDoneException;
import com.ahasend.sdk.core.context.RequestContext;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * 토큰 버킷 기반 승인 제어(admission control) 기본 단위.
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * elapsed = now - lastRefill
 * tokens  = min(capacity, tokens + elapsed * requestsPerSecond)
 * lastRefill = now
 * tokens >= 1 이면 1 소비 후 통과, 아니면 대기
 * </pre>
 *
 * <p><strong>지연 보충 (lazy refill):</strong> 백그라운드 타이머 없이 승인 검사 시점마다
 * 경과 시간으로 보충량을 계산합니다. 따라서 관찰 가능한 상태는 항상 일관적이며,
 * 스케줄링 인프라가 필요 없습니다.</p>
 *
 * <p><strong>대기 방식:</strong> 토큰이 없으면 다음 토큰 예상 시각, 데드라인,
 * 폴링 상한({@value #MAX_POLL_MILLIS}ms) 중 가장 이른 시점까지 스레드를 park 한 뒤 재검사합니다.
 * busy-wait 하지 않으며, 취소 신호는 즉시 대기를 깨웁니다.</p>
 *
 * <p><strong>Thread-safety:</strong> 보충과 소비는 버킷 모니터 안에서 하나의 단위로 수행됩니다.
 * 하나의 토큰으로 두 호출자가 동시에 통과하는 일은 없습니다.
 * 대기자 간 공정성(FIFO)은 보장하지 않습니다. 먼저 재검사한 대기자가 토큰을 가져갑니다.</p>
 *
 * <p><strong>재설정:</strong> {@link #reconfigure(RateLimitConfig)}는 인스턴스를 교체하지 않고
 * 제자리에서 갱신합니다. 이미 대기 중인 호출자도 다음 재검사 시점에 새 설정을 적용받습니다.</p>
 *
 * @author AhaSend SDK Team
 * @since 1.0.0
 */
public final class TokenBucket {

    /** 대기 중 재검사 최대 간격 (밀리초) */
    public static final long MAX_POLL_MILLIS = 50L;

    private static final long MAX_POLL_NANOS = TimeUnit.MILLISECONDS.toNanos(MAX_POLL_MILLIS);
    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    /** 다음 토큰을 기대할 수 없음 (보충 없음 또는 용량 0) */
    static final long NEVER = Long.MAX_VALUE;

    private final NanoClock clock;
    private final BooleanSupplier globallyEnabled;

    private RateLimitConfig config;
    private double tokens;
    private long lastRefillNanos;

    /**
     * 시스템 시간원으로 생성.
     *
     * @param config 설정
     * @throws IllegalArgumentException 설정이 유효하지 않은 경우
     */
    public TokenBucket(RateLimitConfig config) {
        this(config, NanoClock.SYSTEM);
    }

    /**
     * 시간원을 지정하여 생성.
     *
     * <p>버킷은 가득 찬 상태(tokens = burstCapacity)로 시작합니다.</p>
     *
     * @param config 설정
     * @param clock 시간원
     * @throws IllegalArgumentException 설정이 유효하지 않거나 의존성이 null인 경우
     */
    public TokenBucket(RateLimitConfig config, NanoClock clock) {
        this(config, clock, () -> true);
    }

    /**
     * RateLimiter 전용 생성자.
     *
     * @param globallyEnabled 전역 스위치. false를 반환하는 동안 모든 승인 즉시 통과
     */
    TokenBucket(RateLimitConfig config, NanoClock clock, BooleanSupplier globallyEnabled) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (globallyEnabled == null) {
            throw new IllegalArgumentException("globallyEnabled cannot be null");
        }
        requireValid(config);
        this.clock = clock;
        this.globallyEnabled = globallyEnabled;
        this.config = config;
        this.tokens = config.burstCapacity();
        this.lastRefillNanos = clock.nanoTime();
    }

    /**
     * 토큰 획득 시도 (비블로킹).
     *
     * @return 통과하면 true (비활성 버킷은 토큰을 소비하지 않고 true)
     */
    public boolean tryAcquire() {
        return reserve() == 0L;
    }

    /**
     * 토큰을 얻을 때까지 대기.
     *
     * <p>비활성 버킷이면 토큰을 소비하지 않고 즉시 반환합니다.
     * 보충되지 않는 빈 버킷에서는 인터럽트될 때까지 대기합니다.</p>
     *
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public void waitForToken() throws InterruptedException {
        long delay;
        while ((delay = reserve()) > 0L) {
            TimeUnit.NANOSECONDS.sleep(Math.min(delay, MAX_POLL_NANOS));
        }
    }

    /**
     * 토큰을 얻거나 컨텍스트가 종료될 때까지 대기.
     *
     * <p>즉시 사용 가능한 토큰이 있으면 컨텍스트가 이미 종료되었더라도 성공합니다.
     * 컨텍스트는 토큰이 없을 때만 검사합니다.</p>
     *
     * @param context 취소/데드라인 신호
     * @throws com.ahasend.sdk.core.context.RequestCanceledException 취소가 먼저 발생한 경우
     * @throws com.ahasend.sdk.core.context.DeadlineExceededException 데드라인이 먼저 경과한 경우
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public void waitForToken(RequestContext context) throws ContextDoneException, InterruptedException {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        long delay;
        while ((delay = reserve()) > 0L) {
            context.throwIfDone();
            context.awaitDone(Math.min(delay, MAX_POLL_NANOS));
        }
    }

    /**
     * 설정 변경 (제자리 갱신).
     *
     * <p>기존 보충률로 경과분을 먼저 반영한 뒤 새 설정을 적용하며,
     * 새 용량보다 많은 토큰은 잘라냅니다.</p>
     *
     * @param newConfig 새 설정
     * @throws IllegalArgumentException 설정이 유효하지 않은 경우
     */
    public synchronized void reconfigure(RateLimitConfig newConfig) {
        requireValid(newConfig);
        refill();
        this.config = newConfig;
        this.tokens = Math.min(tokens, newConfig.burstCapacity());
    }

    public synchronized void setEnabled(boolean enabled) {
        reconfigure(config.withEnabled(enabled));
    }

    public synchronized RateLimitConfig getConfig() {
        return config;
    }

    /**
     * 현재 상태 스냅샷.
     *
     * <p>보충량을 계산만 하고 버킷 상태는 변경하지 않습니다.</p>
     *
     * @param endpointType 스냅샷에 기록할 카테고리
     * @return 불변 스냅샷
     */
    public synchronized RateLimitStatus status(EndpointType endpointType) {
        return new RateLimitStatus(
            endpointType,
            config.enabled(),
            config.requestsPerSecond(),
            config.burstCapacity(),
            projectedTokens(clock.nanoTime())
        );
    }

    /**
     * 다음 토큰까지 예상 대기 시간 (상태 변경 없음).
     *
     * @return 즉시 가능하면 {@link Duration#ZERO}, 보충을 기대할 수 없으면 empty
     */
    public Optional<Duration> estimateWait() {
        long nanos = nanosUntilAvailable();
        return nanos == NEVER ? Optional.empty() : Optional.of(Duration.ofNanos(nanos));
    }

    /**
     * @return 나노초 (즉시 가능하면 0, 기대할 수 없으면 {@link Long#MAX_VALUE})
     */
    synchronized long nanosUntilAvailable() {
        if (!config.enabled() || !globallyEnabled.getAsBoolean()) {
            return 0L;
        }
        return nanosUntilToken(projectedTokens(clock.nanoTime()));
    }

    /**
     * 보충 후 토큰 1개 소비 시도.
     *
     * @return 통과하면 0, 아니면 다음 토큰까지 예상 대기 시간 (나노초)
     */
    private synchronized long reserve() {
        if (!config.enabled() || !globallyEnabled.getAsBoolean()) {
            return 0L;
        }
        refill();
        if (tokens >= 1.0) {
            tokens -= 1.0;
            return 0L;
        }
        return nanosUntilToken(tokens);
    }

    private void refill() {
        long now = clock.nanoTime();
        tokens = projectedTokens(now);
        lastRefillNanos = Math.max(lastRefillNanos, now);
    }

    private double projectedTokens(long now) {
        long elapsed = now - lastRefillNanos;
        if (elapsed <= 0L) {
            return tokens;
        }
        double added = elapsed / NANOS_PER_SECOND * config.requestsPerSecond();
        return Math.min(config.burstCapacity(), tokens + added);
    }

    private long nanosUntilToken(double current) {
        if (current >= 1.0) {
            return 0L;
        }
        if (config.requestsPerSecond() == 0 || config.burstCapacity() < 1) {
            return NEVER;
        }
        double missing = 1.0 - current;
        long nanos = (long) Math.ceil(missing / config.requestsPerSecond() * NANOS_PER_SECOND);
        return Math.max(1L, nanos);
    }

    private static void requireValid(RateLimitConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        ValidationResult result = config.validate("rateLimit");
        if (result.hasErrors()) {
            throw new IllegalArgumentException(result.errorMessage());
        }
    }

    @Override
    public synchronized String toString() {
        return "TokenBucket{tokens=" + tokens + ", config=" + config + '}';
    }
}
