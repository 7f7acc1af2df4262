package com.ahasend.sdk.core.context;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * 요청 단위 취소/데드라인 신호.
 *
 * <p>블로킹 호출(예: Rate Limiter 토큰 대기)에 전달되어, 호출자가 대기를 중단할 수 있게 합니다.
 * 두 가지 종료 조건을 구분합니다:</p>
 * <ul>
 *   <li><strong>취소:</strong> {@link #cancel()} 호출 → {@link RequestCanceledException}</li>
 *   <li><strong>데드라인:</strong> 지정 시각 경과 → {@link DeadlineExceededException}</li>
 * </ul>
 * <p>두 조건이 모두 성립하면 취소를 우선 보고합니다.</p>
 *
 * <p><strong>파생 규칙:</strong></p>
 * <ul>
 *   <li>파생 컨텍스트는 부모의 데드라인을 상속하며, 더 이른 데드라인이 적용됩니다.</li>
 *   <li>부모가 취소되면 모든 파생 컨텍스트도 취소됩니다. 반대 방향은 전파되지 않습니다.</li>
 *   <li>{@link #background()}는 취소/데드라인이 없는 루트 컨텍스트입니다.</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * RequestContext ctx = RequestContext.timeout(Duration.ofMillis(500));
 * try {
 *     rateLimiter.waitForToken(ctx, "POST", "/v2/accounts/123/messages");
 * } catch (DeadlineExceededException e) {
 *     // 500ms 안에 토큰을 얻지 못함
 * }
 * }</pre>
 *
 * <p>데드라인은 {@link System#nanoTime()} 기준의 단조 시각입니다.</p>
 *
 * <p><strong>수명:</strong> 파생 컨텍스트는 부모의 취소 리스너로 등록됩니다.
 * 데드라인 경과가 관찰되면 부모에서 자동으로 분리되지만, 장수명 부모에서 파생한 컨텍스트는
 * 작업이 끝나면 {@link #cancel()}을 호출해 즉시 해제하는 것이 좋습니다.</p>
 *
 * @author AhaSend SDK Team
 * @since 1.0.0
 */
public final class RequestContext {

    // 약 73년. nanoTime 덧셈 overflow 방지용 상한
    private static final long MAX_TIMEOUT_NANOS = Long.MAX_VALUE >> 2;

    private static final RequestContext BACKGROUND = new RequestContext(null, false, 0L);

    private final CancellationSignal signal;
    private final boolean hasDeadline;
    private final long deadlineNanos;

    private RequestContext(CancellationSignal signal, boolean hasDeadline, long deadlineNanos) {
        this.signal = signal;
        this.hasDeadline = hasDeadline;
        this.deadlineNanos = deadlineNanos;
    }

    /**
     * 취소되지 않고 데드라인도 없는 루트 컨텍스트.
     *
     * @return background 컨텍스트 (싱글턴)
     */
    public static RequestContext background() {
        return BACKGROUND;
    }

    /**
     * 취소 가능한 루트 컨텍스트 생성.
     *
     * @return 새 컨텍스트
     */
    public static RequestContext cancellable() {
        return BACKGROUND.withCancellation();
    }

    /**
     * 현재 시각 + timeout 을 데드라인으로 갖는 루트 컨텍스트 생성.
     *
     * @param timeout 타임아웃 (null 불가, 음수 불가)
     * @return 새 컨텍스트
     * @throws IllegalArgumentException timeout이 null이거나 음수인 경우
     */
    public static RequestContext timeout(Duration timeout) {
        return BACKGROUND.withTimeout(timeout);
    }

    /**
     * 취소 가능한 파생 컨텍스트 생성.
     *
     * <p>데드라인은 그대로 상속합니다.</p>
     *
     * @return 파생 컨텍스트
     */
    public RequestContext withCancellation() {
        return new RequestContext(childSignal(), hasDeadline, deadlineNanos);
    }

    /**
     * 타임아웃이 적용된 파생 컨텍스트 생성.
     *
     * @param timeout 타임아웃 (null 불가, 음수 불가)
     * @return 파생 컨텍스트
     * @throws IllegalArgumentException timeout이 null이거나 음수인 경우
     */
    public RequestContext withTimeout(Duration timeout) {
        if (timeout == null) {
            throw new IllegalArgumentException("timeout cannot be null");
        }
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout cannot be negative (current: " + timeout + ")");
        }
        long timeoutNanos = timeout.compareTo(Duration.ofNanos(MAX_TIMEOUT_NANOS)) > 0
            ? MAX_TIMEOUT_NANOS
            : timeout.toNanos();
        return withDeadline(System.nanoTime() + timeoutNanos);
    }

    /**
     * 데드라인이 적용된 파생 컨텍스트 생성.
     *
     * <p>부모 데드라인이 더 이르면 부모 데드라인이 유지됩니다.</p>
     *
     * @param deadlineNanoTime {@link System#nanoTime()} 기준 데드라인
     * @return 파생 컨텍스트
     */
    public RequestContext withDeadline(long deadlineNanoTime) {
        long effective = deadlineNanoTime;
        if (hasDeadline && deadlineNanos - deadlineNanoTime < 0) {
            effective = deadlineNanos;
        }
        return new RequestContext(childSignal(), true, effective);
    }

    /**
     * 컨텍스트 취소.
     *
     * <p>멱등합니다. 대기 중인 모든 스레드가 즉시 깨어납니다.</p>
     *
     * @throws IllegalStateException background 컨텍스트를 취소하려는 경우
     */
    public void cancel() {
        if (signal == null) {
            throw new IllegalStateException("background context cannot be cancelled");
        }
        signal.cancel();
    }

    public boolean isCancelled() {
        return signal != null && signal.isCancelled();
    }

    /**
     * 데드라인 경과 여부.
     *
     * <p>경과가 처음 관찰되면 부모 취소 신호와의 연결을 끊습니다. 이후 부모가 취소되어도
     * 이 컨텍스트는 데드라인 경과 상태로 남습니다.</p>
     */
    public boolean isDeadlineExceeded() {
        if (!hasDeadline || deadlineNanos - System.nanoTime() > 0) {
            return false;
        }
        if (signal != null) {
            signal.detach();
        }
        return true;
    }

    public boolean isDone() {
        return isCancelled() || isDeadlineExceeded();
    }

    public boolean hasDeadline() {
        return hasDeadline;
    }

    /**
     * 데드라인까지 남은 시간.
     *
     * @return 남은 시간 (데드라인이 없으면 empty, 경과했으면 {@link Duration#ZERO})
     */
    public Optional<Duration> remaining() {
        if (!hasDeadline) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofNanos(Math.max(0L, deadlineNanos - System.nanoTime())));
    }

    /**
     * 종료 상태이면 해당 예외를 던짐.
     *
     * @throws RequestCanceledException 취소된 경우
     * @throws DeadlineExceededException 데드라인이 경과한 경우
     */
    public void throwIfDone() throws ContextDoneException {
        if (isCancelled()) {
            throw new RequestCanceledException();
        }
        if (isDeadlineExceeded()) {
            throw new DeadlineExceededException();
        }
    }

    /**
     * 종료 상태이면 원인을 연결한 해당 예외를 던짐.
     *
     * <p>전송 계층의 {@link java.io.IOException}이 컨텍스트 종료 때문인지 판별할 때 사용합니다.</p>
     *
     * @param cause 관찰된 실패
     * @throws RequestCanceledException 취소된 경우
     * @throws DeadlineExceededException 데드라인이 경과한 경우
     */
    public void throwIfDone(Throwable cause) throws ContextDoneException {
        if (isCancelled()) {
            throw new RequestCanceledException(cause);
        }
        if (isDeadlineExceeded()) {
            throw new DeadlineExceededException(cause);
        }
    }

    /**
     * 취소 리스너 등록.
     *
     * <p>이미 취소된 경우 즉시 실행됩니다. background 컨텍스트에서는 아무것도 등록하지 않습니다.
     * 데드라인 경과는 리스너를 호출하지 않습니다.</p>
     *
     * @param listener 취소 시 실행할 작업
     * @return 등록 해제 핸들
     */
    public Runnable onCancel(Runnable listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        if (signal == null) {
            return () -> { };
        }
        return signal.onCancel(listener);
    }

    /**
     * 취소, 데드라인, 또는 지정 시간 경과 중 가장 빠른 시점까지 대기.
     *
     * <p>busy-wait 없이 스레드를 park 합니다.</p>
     *
     * @param maxWaitNanos 최대 대기 시간 (나노초)
     * @return 대기 종료 시점에 컨텍스트가 종료 상태이면 true
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public boolean awaitDone(long maxWaitNanos) throws InterruptedException {
        long waitNanos = maxWaitNanos;
        if (hasDeadline) {
            waitNanos = Math.min(waitNanos, deadlineNanos - System.nanoTime());
        }
        if (waitNanos > 0) {
            if (signal != null) {
                signal.await(waitNanos);
            } else {
                TimeUnit.NANOSECONDS.sleep(waitNanos);
            }
        }
        return isDone();
    }

    int cancelListenerCount() {
        return signal == null ? 0 : signal.listenerCount();
    }

    private CancellationSignal childSignal() {
        return signal == null ? new CancellationSignal() : signal.newChild();
    }

    @Override
    public String toString() {
        if (this == BACKGROUND) {
            return "RequestContext{background}";
        }
        return "RequestContext{cancelled=" + isCancelled()
            + ", remaining=" + remaining().map(Duration::toString).orElse("none") + '}';
    }
}
