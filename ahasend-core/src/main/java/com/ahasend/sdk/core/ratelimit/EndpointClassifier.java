package com.ahasend.sdk.core.ratelimit;

import java.util.Arrays;

/**
 * HTTP method + path → {@link EndpointType} 분류기.
 *
 * <p>모든 (method, path) 쌍은 정확히 하나의 카테고리로 매핑되며, 버킷 상태와 무관한 순수 함수입니다.</p>
 *
 * <p><strong>분류 규칙 (위에서부터 우선):</strong></p>
 * <ol>
 *   <li>POST 이고 마지막 경로 세그먼트가 {@code messages} → SEND_MESSAGE
 *       (예: {@code POST /v2/accounts/{id}/messages})</li>
 *   <li>경로에 {@code statistics} 세그먼트 포함 → STATISTICS
 *       (예: {@code GET /v2/accounts/{id}/statistics/transactional/bounce})</li>
 *   <li>그 외 → GENERAL</li>
 * </ol>
 *
 * <p>쿼리 문자열과 끝의 슬래시는 무시하며, method는 대소문자를 구분하지 않습니다.
 * null 입력은 GENERAL로 분류합니다.</p>
 *
 * @author AhaSend SDK Team
 * @since 1.0.0
 */
public final class EndpointClassifier {

    private static final String SEND_MESSAGE_SEGMENT = "messages";
    private static final String STATISTICS_SEGMENT = "statistics";

    private EndpointClassifier() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 요청 분류.
     *
     * @param method HTTP method (null 가능)
     * @param path 요청 경로 (null 가능, 쿼리 포함 가능)
     * @return 엔드포인트 카테고리 (null 아님)
     */
    public static EndpointType classify(String method, String path) {
        if (path == null || path.isEmpty()) {
            return EndpointType.GENERAL;
        }

        String[] segments = segments(path);
        if (segments.length == 0) {
            return EndpointType.GENERAL;
        }

        if ("POST".equalsIgnoreCase(method) && SEND_MESSAGE_SEGMENT.equals(segments[segments.length - 1])) {
            return EndpointType.SEND_MESSAGE;
        }

        for (String segment : segments) {
            if (STATISTICS_SEGMENT.equals(segment)) {
                return EndpointType.STATISTICS;
            }
        }

        return EndpointType.GENERAL;
    }

    private static String[] segments(String path) {
        int end = path.length();
        int query = path.indexOf('?');
        if (query >= 0) {
            end = query;
        }
        int fragment = path.indexOf('#');
        if (fragment >= 0 && fragment < end) {
            end = fragment;
        }
        return Arrays.stream(path.substring(0, end).split("/"))
            .filter(segment -> !segment.isEmpty())
            .toArray(String[]::new);
    }
}
