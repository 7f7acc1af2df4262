/**
 * API 클라이언트 설정 패키지.
 *
 * <p>{@link com.ahasend.sdk.client.config.ClientConfiguration}은 불변 record이며,
 * {@link com.ahasend.sdk.client.config.EnvironmentConfigurationLoader}로 환경 변수를 덮어쓰고
 * {@link com.ahasend.sdk.client.config.ClientConfigurationValidator}로 검증합니다.</p>
 *
 * <pre>{@code
 * ClientConfiguration config = new EnvironmentConfigurationLoader()
 *     .overlay(new ClientConfiguration().withApiKey("aha-sk-..."));
 * }</pre>
 *
 * @author AhaSend SDK Team
 * @since 1.0.0
 */
package com.ahasend.sdk.client.config;
