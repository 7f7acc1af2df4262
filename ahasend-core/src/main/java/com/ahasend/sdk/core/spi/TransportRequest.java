package com.ahasend.sdk.core.spi;

import java.time.Duration;
import java.util.Map;

/**
 * 전송 계층에 전달되는 완성된 HTTP 요청 (불변 record).
 *
 * <p>URL, 헤더, 본문이 모두 확정된 상태이며, 전송 구현체는 이를 그대로 송신합니다.</p>
 *
 * @param method HTTP method (GET, POST, PUT, PATCH, DELETE)
 * @param url 전체 URL (쿼리 포함)
 * @param headers 요청 헤더 (불변 복사본)
 * @param body 요청 본문 (없으면 null)
 * @param timeout 호출 타임아웃 (null이면 전송 구현체 기본값)
 * @author AhaSend SDK Team
 * @since 1.0.0
 */
public record TransportRequest(
    String method,
    String url,
    Map<String, String> headers,
    byte[] body,
    Duration timeout
) {

    /**
     * Compact constructor.
     *
     * @throws IllegalArgumentException method 또는 url이 비어있는 경우
     */
    public TransportRequest {
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("method cannot be null or blank");
        }
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url cannot be null or blank");
        }
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public boolean hasBody() {
        return body != null;
    }

    /**
     * 헤더 조회 (이름 대소문자 무시).
     *
     * @param name 헤더 이름
     * @return 헤더 값 (없으면 null)
     */
    public String header(String name) {
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }
}
