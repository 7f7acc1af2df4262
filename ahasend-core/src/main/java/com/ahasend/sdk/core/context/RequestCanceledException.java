package com.ahasend.sdk.core.context;

/**
 * 호출자가 {@link RequestContext#cancel()}로 요청을 취소한 경우.
 *
 * @author AhaSend SDK Team
 * @since 1.0.0
 */
public final class RequestCanceledException extends ContextDoneException {

    private static final long serialVersionUID = 1L;

    public RequestCanceledException() {
        super("context canceled");
    }

    public RequestCanceledException(String message) {
        super(message);
    }

    /**
     * 전송 계층에서 관찰된 중단을 컨텍스트 종료로 변환할 때 사용.
     *
     * @param cause 원인 (예: 취소된 HTTP 호출의 IOException)
     */
    public RequestCanceledException(Throwable cause) {
        super("context canceled", cause);
    }
}
