package com.ahasend.sdk.core.spi;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * 전송 계층이 반환하는 HTTP 응답 (불변 record).
 *
 * @param statusCode HTTP 상태 코드
 * @param headers 응답 헤더
 * @param body 응답 본문 (없으면 빈 배열)
 * @author AhaSend SDK Team
 * @since 1.0.0
 */
public record TransportResponse(int statusCode, Map<String, String> headers, byte[] body) {

    public TransportResponse {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        body = body == null ? new byte[0] : body;
    }

    /**
     * 2xx 여부.
     */
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
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

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }
}
