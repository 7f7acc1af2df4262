package com.ahasend.sdk.core.spi;

import com.ahasend.sdk.core.context.RequestContext;

import java.io.IOException;

/**
 * HTTP 전송 SPI (Service Provider Interface).
 *
 * <p>API 클라이언트는 Rate Limit 승인을 받은 요청만 이 인터페이스로 전달합니다.
 * 구현체는 요청 하나를 한 번 송신하고 응답을 반환합니다.</p>
 *
 * <p><strong>구현 책임:</strong></p>
 * <ul>
 *   <li>{@link TransportRequest#timeout()}과 컨텍스트 잔여 시간 중 짧은 쪽을 호출 타임아웃으로 적용</li>
 *   <li>컨텍스트 취소 시 진행 중인 호출 중단</li>
 *   <li>non-2xx 응답도 예외가 아닌 {@link TransportResponse}로 반환</li>
 * </ul>
 *
 * <p><strong>구현 예시:</strong></p>
 * <ul>
 *   <li>OkHttp 어댑터 (adapter-okhttp 모듈)</li>
 *   <li>InMemoryTransport (testkit 모듈, 테스트용)</li>
 * </ul>
 *
 * @author AhaSend SDK Team
 * @since 1.0.0
 */
public interface HttpTransport {

    /**
     * 요청 송신.
     *
     * @param request 완성된 요청
     * @param context 취소/데드라인 신호
     * @return HTTP 응답
     * @throws IOException 네트워크 오류, 타임아웃, 취소로 호출이 중단된 경우
     */
    TransportResponse execute(TransportRequest request, RequestContext context) throws IOException;
}
