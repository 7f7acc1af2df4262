package com.ahasend.sdk.client.config;

import com.ahasend.sdk.core.ratelimit.CustomerRateLimitConfig;
import com.ahasend.sdk.core.ratelimit.EndpointType;
import com.ahasend.sdk.core.ratelimit.RateLimitConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * EnvironmentConfigurationLoader 테스트.
 *
 * @author AhaSend SDK Team
 * @since 1.0.0
 */
@DisplayName("EnvironmentConfigurationLoader 테스트")
class EnvironmentConfigurationLoaderTest {

    @Test
    void 변수가_없으면_기본_설정() {
        ClientConfiguration config = new EnvironmentConfigurationLoader(Map.of()).load();

        assertThat(config).isEqualTo(new ClientConfiguration());
    }

    @Test
    void 모든_변수를_적용한다() {
        // given
        Map<String, String> env = Map.of(
            "AHASEND_API_KEY", "aha-sk-env",
            "AHASEND_BASE_URL", "https://sandbox.ahasend.com",
            "AHASEND_USER_AGENT", "billing/1.0",
            "AHASEND_TIMEOUT", "10",
            "AHASEND_ENABLE_RATE_LIMIT", "off",
            "AHASEND_IDEMPOTENCY_AUTO_GENERATE", "no",
            "AHASEND_IDEMPOTENCY_PREFIX", "billing",
            "AHASEND_RATE_LIMIT_SEND_MESSAGE_RPS", "20",
            "AHASEND_RATE_LIMIT_STATISTICS_BURST", "3"
        );

        // when
        ClientConfiguration config = new EnvironmentConfigurationLoader(env).load();

        // then
        assertThat(config.apiKey()).isEqualTo("aha-sk-env");
        assertThat(config.baseUrl()).isEqualTo("https://sandbox.ahasend.com");
        assertThat(config.userAgent()).isEqualTo("billing/1.0");
        assertThat(config.timeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(config.enableRateLimit()).isFalse();
        assertThat(config.idempotencyConfig().autoGenerate()).isFalse();
        assertThat(config.idempotencyConfig().keyPrefix()).isEqualTo("billing");
        assertThat(config.customerRateLimits().forType(EndpointType.SEND_MESSAGE))
            .contains(RateLimitConfig.of(20, 200));
        assertThat(config.customerRateLimits().forType(EndpointType.STATISTICS))
            .contains(RateLimitConfig.of(1, 3));
        assertThat(config.customerRateLimits().forType(EndpointType.GENERAL)).isEmpty();
    }

    @Test
    void TOKEN은_API_KEY가_없을_때만_사용된다() {
        assertThat(new EnvironmentConfigurationLoader(Map.of("AHASEND_TOKEN", "t")).load().apiKey())
            .isEqualTo("t");
        assertThat(new EnvironmentConfigurationLoader(Map.of("AHASEND_TOKEN", "t", "AHASEND_API_KEY", "k"))
            .load().apiKey()).isEqualTo("k");
    }

    @ParameterizedTest
    @CsvSource({"true, true", "1, true", "YES, true", "On, true", "false, false", "0, false", "no, false", "OFF, false"})
    void boolean_표기를_해석한다(String raw, boolean expected) {
        ClientConfiguration base = new ClientConfiguration().withEnableRateLimit(!expected);

        ClientConfiguration config = new EnvironmentConfigurationLoader(Map.of("AHASEND_ENABLE_RATE_LIMIT", raw))
            .overlay(base);

        assertThat(config.enableRateLimit()).isEqualTo(expected);
    }

    @Test
    void 해석할_수_없는_값은_무시된다() {
        // given
        Map<String, String> env = Map.of(
            "AHASEND_TIMEOUT", "soon",
            "AHASEND_ENABLE_RATE_LIMIT", "maybe",
            "AHASEND_RATE_LIMIT_GENERAL_RPS", "-3",
            "AHASEND_BASE_URL", "   "
        );

        // when
        ClientConfiguration config = new EnvironmentConfigurationLoader(env).load();

        // then
        assertThat(config).isEqualTo(new ClientConfiguration());
    }

    @Test
    void 타임아웃_0은_무시되어_클라이언트_생성을_막지_않는다() {
        // given
        ClientConfiguration base = new ClientConfiguration().withTimeout(Duration.ofSeconds(5));

        // when
        ClientConfiguration config = new EnvironmentConfigurationLoader(Map.of("AHASEND_TIMEOUT", "0")).overlay(base);

        // then
        assertThat(config.timeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(ClientConfigurationValidator.validate(config).hasErrors()).isFalse();
    }

    @Test
    void overlay는_기존_고객_한도_위에_적용된다() {
        // given
        ClientConfiguration base = new ClientConfiguration().withCustomerRateLimits(
            CustomerRateLimitConfig.empty().with(EndpointType.GENERAL, new RateLimitConfig(5, 10, false)));

        // when
        ClientConfiguration config = new EnvironmentConfigurationLoader(
            Map.of("AHASEND_RATE_LIMIT_GENERAL_BURST", "50")).overlay(base);

        // then
        assertThat(config.customerRateLimits().forType(EndpointType.GENERAL))
            .contains(new RateLimitConfig(5, 50, false));
    }
}
