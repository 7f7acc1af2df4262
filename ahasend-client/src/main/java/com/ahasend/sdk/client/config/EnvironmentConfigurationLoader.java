package com.ahasend.sdk.client.config;

import com.ahasend.sdk.core.idempotency.IdempotencyConfig;
import com.ahasend.sdk.core.ratelimit.CustomerRateLimitConfig;
import com.ahasend.sdk.core.ratelimit.EndpointType;
import com.ahasend.sdk.core.ratelimit.RateLimitConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 환경 변수 기반 설정 로더.
 *
 * <p><strong>지원 변수:</strong></p>
 * <ul>
 *   <li>{@code AHASEND_API_KEY} (없으면 {@code AHASEND_TOKEN})</li>
 *   <li>{@code AHASEND_BASE_URL}, {@code AHASEND_USER_AGENT}</li>
 *   <li>{@code AHASEND_TIMEOUT}: 초 단위 양의 정수</li>
 *   <li>{@code AHASEND_ENABLE_RATE_LIMIT}: boolean</li>
 *   <li>{@code AHASEND_IDEMPOTENCY_AUTO_GENERATE}: boolean, {@code AHASEND_IDEMPOTENCY_PREFIX}</li>
 *   <li>{@code AHASEND_RATE_LIMIT_{GENERAL|STATISTICS|SEND_MESSAGE}_{RPS|BURST}}: 0 이상 정수</li>
 * </ul>
 *
 * <p>boolean 값은 true/false, 1/0, yes/no, on/off (대소문자 무시)를 허용합니다.
 * 해석할 수 없는 값은 경고 로그를 남기고 무시하며, 기존 설정 값이 유지됩니다.</p>
 *
 * @author AhaSend SDK Team
 * @since 1.0.0
 */
public final class EnvironmentConfigurationLoader {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentConfigurationLoader.class);

    public static final String API_KEY = "AHASEND_API_KEY";
    public static final String TOKEN = "AHASEND_TOKEN";
    public static final String BASE_URL = "AHASEND_BASE_URL";
    public static final String USER_AGENT = "AHASEND_USER_AGENT";
    public static final String TIMEOUT = "AHASEND_TIMEOUT";
    public static final String ENABLE_RATE_LIMIT = "AHASEND_ENABLE_RATE_LIMIT";
    public static final String IDEMPOTENCY_AUTO_GENERATE = "AHASEND_IDEMPOTENCY_AUTO_GENERATE";
    public static final String IDEMPOTENCY_PREFIX = "AHASEND_IDEMPOTENCY_PREFIX";

    private static final String RATE_LIMIT_PREFIX = "AHASEND_RATE_LIMIT_";

    private final Map<String, String> environment;

    /**
     * 프로세스 환경 변수를 읽는 로더.
     */
    public EnvironmentConfigurationLoader() {
        this(System.getenv());
    }

    /**
     * 지정한 변수 맵을 읽는 로더.
     *
     * @param environment 변수 맵
     */
    public EnvironmentConfigurationLoader(Map<String, String> environment) {
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }
        this.environment = Map.copyOf(environment);
    }

    /**
     * 기본 설정 위에 환경 변수를 적용.
     */
    public ClientConfiguration load() {
        return overlay(new ClientConfiguration());
    }

    /**
     * 주어진 설정 위에 환경 변수를 적용.
     *
     * <p>설정되지 않은 변수는 base 값을 그대로 유지합니다.</p>
     *
     * @param base 기준 설정
     * @return 환경 변수가 적용된 새 설정
     */
    public ClientConfiguration overlay(ClientConfiguration base) {
        if (base == null) {
            throw new IllegalArgumentException("base cannot be null");
        }
        ClientConfiguration result = base;

        Optional<String> apiKey = value(API_KEY).or(() -> value(TOKEN));
        if (apiKey.isPresent()) {
            result = result.withApiKey(apiKey.get());
        }
        Optional<String> baseUrl = value(BASE_URL);
        if (baseUrl.isPresent()) {
            result = result.withBaseUrl(baseUrl.get());
        }
        Optional<String> userAgent = value(USER_AGENT);
        if (userAgent.isPresent()) {
            result = result.withUserAgent(userAgent.get());
        }
        Optional<Integer> timeoutSeconds = positiveIntValue(TIMEOUT);
        if (timeoutSeconds.isPresent()) {
            result = result.withTimeout(Duration.ofSeconds(timeoutSeconds.get()));
        }
        Optional<Boolean> enableRateLimit = booleanValue(ENABLE_RATE_LIMIT);
        if (enableRateLimit.isPresent()) {
            result = result.withEnableRateLimit(enableRateLimit.get());
        }

        result = result.withIdempotencyConfig(idempotency(result.idempotencyConfig()));
        result = result.withCustomerRateLimits(rateLimits(result.customerRateLimits()));
        return result;
    }

    private IdempotencyConfig idempotency(IdempotencyConfig base) {
        IdempotencyConfig config = base;
        Optional<Boolean> autoGenerate = booleanValue(IDEMPOTENCY_AUTO_GENERATE);
        if (autoGenerate.isPresent()) {
            config = config.withAutoGenerate(autoGenerate.get());
        }
        Optional<String> prefix = value(IDEMPOTENCY_PREFIX);
        if (prefix.isPresent()) {
            config = config.withKeyPrefix(prefix.get());
        }
        return config;
    }

    private CustomerRateLimitConfig rateLimits(CustomerRateLimitConfig base) {
        CustomerRateLimitConfig limits = base;
        for (EndpointType type : EndpointType.values()) {
            String name = RATE_LIMIT_PREFIX + type.name();
            Optional<Integer> rps = intValue(name + "_RPS");
            Optional<Integer> burst = intValue(name + "_BURST");
            if (rps.isEmpty() && burst.isEmpty()) {
                continue;
            }
            CustomerRateLimitConfig current = limits == null ? CustomerRateLimitConfig.empty() : limits;
            RateLimitConfig config = current.forType(type).orElseGet(type::defaultConfig);
            if (rps.isPresent()) {
                config = config.withRequestsPerSecond(rps.get());
            }
            if (burst.isPresent()) {
                config = config.withBurstCapacity(burst.get());
            }
            limits = current.with(type, config);
        }
        return limits;
    }

    private Optional<String> value(String name) {
        String raw = environment.get(name);
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(raw.trim());
    }

    private Optional<Integer> intValue(String name) {
        Optional<String> raw = value(name);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            int parsed = Integer.parseInt(raw.get());
            if (parsed < 0) {
                log.warn("Ignoring {}={}: must not be negative", name, raw.get());
                return Optional.empty();
            }
            return Optional.of(parsed);
        } catch (NumberFormatException e) {
            log.warn("Ignoring {}={}: not an integer", name, raw.get());
            return Optional.empty();
        }
    }

    private Optional<Integer> positiveIntValue(String name) {
        Optional<Integer> parsed = intValue(name);
        if (parsed.isPresent() && parsed.get() == 0) {
            log.warn("Ignoring {}=0: must be positive", name);
            return Optional.empty();
        }
        return parsed;
    }

    private Optional<Boolean> booleanValue(String name) {
        Optional<String> raw = value(name);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        return switch (raw.get().toLowerCase(Locale.ROOT)) {
            case "true", "1", "yes", "on" -> Optional.of(Boolean.TRUE);
            case "false", "0", "no", "off" -> Optional.of(Boolean.FALSE);
            default -> {
                log.warn("Ignoring {}={}: not a boolean", name, raw.get());
                yield Optional.empty();
            }
        };
    }
}
