package com.ahasend.sdk.core.context;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 취소 신호 (내부 구현).
 *
 * <p>한 번만 발화하며, 발화 시 대기 중인 스레드를 깨우고 등록된 리스너를 정확히 한 번 실행합니다.
 * 자식 신호는 부모 신호 발화 시 함께 발화합니다.</p>
 */
final class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CountDownLatch latch = new CountDownLatch(1);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
    private volatile Runnable detachFromParent = () -> { };

    /**
     * 부모에 연결된 자식 신호 생성.
     *
     * <p>자식이 먼저 취소되거나 {@link #detach()}되면 부모의 리스너 목록에서 스스로 제거됩니다.</p>
     *
     * @return 자식 신호
     */
    CancellationSignal newChild() {
        CancellationSignal child = new CancellationSignal();
        child.detachFromParent = onCancel(child::cancel);
        return child;
    }

    void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        latch.countDown();
        detachFromParent.run();
        for (Runnable listener : listeners) {
            if (listeners.remove(listener)) {
                listener.run();
            }
        }
    }

    /**
     * 부모와의 연결 해제. 이후 부모 취소는 이 신호에 전파되지 않습니다.
     */
    void detach() {
        Runnable detach = detachFromParent;
        detachFromParent = () -> { };
        detach.run();
    }

    int listenerCount() {
        return listeners.size();
    }

    boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * 취소 리스너 등록.
     *
     * <p>이미 취소된 상태라면 호출 스레드에서 즉시 실행합니다.</p>
     *
     * @param listener 취소 시 실행할 작업
     * @return 등록 해제 핸들
     */
    Runnable onCancel(Runnable listener) {
        listeners.add(listener);
        if (cancelled.get() && listeners.remove(listener)) {
            listener.run();
        }
        return () -> listeners.remove(listener);
    }

    /**
     * 취소 또는 타임아웃까지 대기.
     *
     * @param nanos 최대 대기 시간 (나노초)
     * @return 취소되었으면 true
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    boolean await(long nanos) throws InterruptedException {
        return latch.await(nanos, TimeUnit.NANOSECONDS);
    }
}
