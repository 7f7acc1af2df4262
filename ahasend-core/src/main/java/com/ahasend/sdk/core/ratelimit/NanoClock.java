package com.ahasend.sdk.core.ratelimit;

/**
 * 단조 증가 시간원.
 *
 * <p>토큰 보충 계산에 사용됩니다. 테스트에서는 수동으로 전진하는 구현을 주입해
 * 보충 결과를 결정적으로 검증할 수 있습니다.</p>
 *
 * @author AhaSend SDK Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface NanoClock {

    /** {@link System#nanoTime()} 기반 시간원 */
    NanoClock SYSTEM = System::nanoTime;

    long nanoTime();
}
