/**
 * 전송 계층 SPI 패키지.
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * client (ApiClient)
 *   ↓ RateLimiter 승인 후 호출
 * core/spi (HttpTransport)
 *   ↑ implements
 * adapter-okhttp (OkHttpTransport), testkit (InMemoryTransport)
 * </pre>
 *
 * @author AhaSend SDK Team
 * @since 1.0.0
 */
package com.ahasend.sdk.core.spi;
