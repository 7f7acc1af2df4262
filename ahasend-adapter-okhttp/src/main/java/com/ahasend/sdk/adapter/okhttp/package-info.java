/**
 * OkHttp 전송 어댑터 패키지.
 *
 * <p>{@link com.ahasend.sdk.core.spi.HttpTransport} SPI를 OkHttp로 구현합니다.</p>
 *
 * @author AhaSend SDK Team
 * @since 1.0.0
 */
package com.ahasend.sdk.adapter.okhttp;
