/**
 * AhaSend API 클라이언트 패키지.
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ahasend.sdk.client.ApiClient}: 요청 실행 진입점 (Rate Limit, 인증, 멱등성)</li>
 *   <li>{@link com.ahasend.sdk.client.ApiRequest}: 불변 요청 명세</li>
 *   <li>{@link com.ahasend.sdk.client.PathTemplates}: 경로 템플릿 확장 및 보안 검증</li>
 * </ul>
 *
 * <h2>사용 예시</h2>
 * <pre>{@code
 * ApiClient client = new ApiClient(
 *     new ClientConfiguration().withApiKey("aha-sk-..."),
 *     new OkHttpTransport());
 *
 * RequestContext ctx = RequestContext.timeout(Duration.ofSeconds(5));
 * TransportResponse response = client.execute(ctx,
 *     ApiRequest.post("/v2/accounts/{account_id}/messages")
 *         .withPathParam("account_id", accountId)
 *         .withJsonBody(json));
 * }</pre>
 *
 * @author AhaSend SDK Team
 * @since 1.0.0
 */
package com.ahasend.sdk.client;
