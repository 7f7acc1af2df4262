/**
 * 멱등성 키 생성 패키지.
 *
 * @author AhaSend SDK Team
 * @since 1.0.0
 */
package com.ahasend.sdk.core.idempotency;
