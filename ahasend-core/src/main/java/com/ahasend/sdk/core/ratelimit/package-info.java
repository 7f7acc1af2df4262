/**
 * 클라이언트 측 Rate Limiting 패키지.
 *
 * <p>API 호출 전에 엔드포인트 카테고리별 토큰 버킷으로 송신 속도를 조절합니다.
 * 한도를 넘는 요청은 거부되지 않고, 토큰이 생길 때까지 (또는 호출자 컨텍스트가 종료될 때까지) 대기합니다.</p>
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ahasend.sdk.core.ratelimit.TokenBucket} - 지연 보충 토큰 버킷 (승인 기본 단위)</li>
 *   <li>{@link com.ahasend.sdk.core.ratelimit.RateLimiter} - 카테고리별 버킷 소유, 분류 및 위임</li>
 *   <li>{@link com.ahasend.sdk.core.ratelimit.EndpointClassifier} - (method, path) → 카테고리</li>
 *   <li>{@link com.ahasend.sdk.core.ratelimit.RateLimitConfig},
 *       {@link com.ahasend.sdk.core.ratelimit.RateLimitStatus} - 입력 설정 / 출력 스냅샷</li>
 * </ul>
 *
 * <h2>사용 예시</h2>
 * <pre>{@code
 * RateLimiter limiter = new RateLimiter();
 * limiter.setRateLimit(EndpointType.SEND_MESSAGE, 50, 100);
 *
 * RequestContext ctx = RequestContext.timeout(Duration.ofSeconds(2));
 * limiter.waitForToken(ctx, "POST", "/v2/accounts/123/messages");
 * // 토큰 획득 → HTTP 요청 진행
 * }</pre>
 *
 * <h2>공정성</h2>
 *
 * <p>같은 버킷의 대기자 간 FIFO 순서는 보장하지 않습니다. 먼저 재검사한 대기자가 토큰을 가져갑니다.</p>
 *
 * @author AhaSend SDK Team
 * @since 1.0.0
 */
package com.ahasend.sdk.core.ratelimit;
