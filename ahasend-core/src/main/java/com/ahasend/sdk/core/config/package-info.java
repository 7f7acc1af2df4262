/**
 * 설정 검증 결과 타입.
 *
 * @author AhaSend SDK Team
 * @since 1.0.0
 */
package com.ahasend.sdk.core.config;
