package com.ahasend.sdk.core.context;

/**
 * {@link RequestContext}가 종료되어 대기를 포기했음을 알리는 예외.
 *
 * <p>Rate Limiter 대기 중 호출자의 취소 신호 또는 데드라인이 먼저 도달했을 때 던져집니다.
 * 송신 중 전송 계층이 취소로 호출을 중단한 경우에도 원인을 연결하여 이 예외로 변환됩니다.
 * 서버 장애가 아니라 호출자 측 중단을 의미하므로, 전송 계층은 이 예외를
 * 재시도하지 않고 그대로 상위로 전달해야 합니다.</p>
 *
 * <ul>
 *   <li>{@link RequestCanceledException}: 취소 신호가 먼저 발생</li>
 *   <li>{@link DeadlineExceededException}: 데드라인이 먼저 경과</li>
 * </ul>
 *
 * @author AhaSend SDK Team
 * @since 1.0.0
 */
public abstract class ContextDoneException extends Exception {

    private static final long serialVersionUID = 1L;

    protected ContextDoneException(String message) {
        super(message);
    }

    protected ContextDoneException(String message, Throwable cause) {
        super(message, cause);
    }
}
