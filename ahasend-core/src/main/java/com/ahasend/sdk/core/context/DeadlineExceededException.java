package com.ahasend.sdk.core.context;

/**
 * {@link RequestContext}에 설정된 데드라인이 경과한 경우.
 *
 * @author AhaSend SDK Team
 * @since 1.0.0
 */
public final class DeadlineExceededException extends ContextDoneException {

    private static final long serialVersionUID = 1L;

    public DeadlineExceededException() {
        super("context deadline exceeded");
    }

    public DeadlineExceededException(String message) {
        super(message);
    }

    /**
     * 전송 계층에서 관찰된 중단을 컨텍스트 종료로 변환할 때 사용.
     *
     * @param cause 원인 (예: 취소된 HTTP 호출의 IOException)
     */
    public DeadlineExceededException(Throwable cause) {
        super("context deadline exceeded", cause);
    }
}
