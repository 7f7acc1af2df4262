/**
 * API 오류 패키지.
 *
 * <p>non-2xx 응답은 {@link com.ahasend.sdk.client.error.ApiErrors#fromResponse}로
 * {@link com.ahasend.sdk.client.error.ApiError}가 되며,
 * {@link com.ahasend.sdk.client.ApiClient#executeOrThrow}는 이를
 * {@link com.ahasend.sdk.client.error.ApiException}으로 던집니다.</p>
 *
 * <pre>{@code
 * try {
 *     client.executeOrThrow(ctx, request);
 * } catch (ApiException e) {
 *     if (e.getError().isRateLimitError() && e.getError().retryAfter() != null) {
 *         // Retry-After 만큼 대기 후 재시도
 *     }
 * }
 * }</pre>
 *
 * @author AhaSend SDK Team
 * @since 1.0.0
 */
package com.ahasend.sdk.client.error;
