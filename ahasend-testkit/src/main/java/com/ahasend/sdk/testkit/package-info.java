/**
 * AhaSend SDK 테스트 지원 패키지.
 *
 * <p>{@link com.ahasend.sdk.testkit.InMemoryTransport}로 네트워크 없이
 * API 클라이언트의 요청 조립과 Rate Limit 동작을 검증할 수 있습니다.</p>
 *
 * <pre>{@code
 * InMemoryTransport transport = new InMemoryTransport().enqueueJson(202, "{}");
 * ApiClient client = new ApiClient(configuration, transport);
 * client.execute(ApiRequest.post("/v2/accounts/{account_id}/messages") ...);
 * TransportRequest sent = transport.takeRequest();
 * }</pre>
 *
 * @author AhaSend SDK Team
 * @since 1.0.0
 */
package com.ahasend.sdk.testkit;
