package com.ahasend.sdk.client;

import com.ahasend.sdk.client.config.ClientConfiguration;
import com.ahasend.sdk.client.config.ClientConfigurationValidator;
import com.ahasend.sdk.client.error.ApiError;
import com.ahasend.sdk.client.error.ApiErrors;
import com.ahasend.sdk.client.error.ApiException;
import com.ahasend.sdk.core.config.ValidationResult;
import com.ahasend.sdk.core.context.ContextDoneException;
import com.ahasend.sdk.core.context.RequestContext;
import com.ahasend.sdk.core.idempotency.IdempotencyConfig;
import com.ahasend.sdk.core.idempotency.IdempotencyHelper;
import com.ahasend.sdk.core.idempotency.IdempotencyKeyBuilder;
import com.ahasend.sdk.core.ratelimit.CustomerRateLimitConfig;
import com.ahasend.sdk.core.ratelimit.EndpointType;
import com.ahasend.sdk.core.ratelimit.RateLimitStatus;
import com.ahasend.sdk.core.ratelimit.RateLimitWaitListener;
import com.ahasend.sdk.core.ratelimit.RateLimiter;
import com.ahasend.sdk.core.spi.HttpTransport;
import com.ahasend.sdk.core.spi.TransportRequest;
import com.ahasend.sdk.core.spi.TransportResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;

/**
 * AhaSend API 클라이언트.
 *
 * <p>요청 조립, 클라이언트 측 Rate Limiting, 멱등성 키 부여를 담당하며,
 * 실제 송신은 {@link HttpTransport} 구현체에 위임합니다.</p>
 *
 * <p><strong>실행 흐름:</strong></p>
 * <ol>
 *   <li>경로 템플릿 확장 및 파라미터 검증</li>
 *   <li>엔드포인트 분류 (GENERAL / STATISTICS / SEND_MESSAGE)</li>
 *   <li>URL 및 헤더 조립 (인증, User-Agent, 멱등성 키)</li>
 *   <li>Rate Limit 승인 대기 (skipRateLimit이 아닌 경우)</li>
 *   <li>Transport 호출</li>
 * </ol>
 *
 * <p><strong>오류 처리:</strong> 컨텍스트 취소/데드라인은 대기 중이든 송신 중이든
 * {@link ContextDoneException}으로 재시도 없이 전달됩니다. 전송 계층이 취소로 중단한 호출도
 * {@link IOException}이 아닌 {@link ContextDoneException}(원인 연결)으로 변환됩니다.
 * {@link #execute}는 non-2xx 응답을 {@link TransportResponse}로 반환하고,
 * {@link #executeOrThrow}는 이를 {@link ApiException}으로 변환합니다.</p>
 *
 * <p><strong>Thread-safety:</strong> 하나의 인스턴스를 여러 스레드에서 공유할 수 있으며,
 * 모든 요청은 같은 {@link RateLimiter}를 거칩니다.</p>
 *
 * @author AhaSend SDK Team
 * @since 1.0.0
 */
public final class ApiClient {

    private static final Logger log = LoggerFactory.getLogger(ApiClient.class);

    public static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private static final String AUTHORIZATION = "Authorization";
    private static final String CONTENT_TYPE = "Content-Type";
    private static final String JSON = "application/json";

    private final ClientConfiguration configuration;
    private final HttpTransport transport;
    private final RateLimiter rateLimiter;
    private volatile IdempotencyHelper idempotencyHelper;

    /**
     * 새 {@link RateLimiter}를 소유하는 클라이언트 생성.
     *
     * @param configuration 클라이언트 설정
     * @param transport HTTP 전송 구현체
     * @throws IllegalArgumentException 설정이 유효하지 않은 경우
     */
    public ApiClient(ClientConfiguration configuration, HttpTransport transport) {
        this(configuration, transport, new RateLimiter());
    }

    /**
     * Rate Limiter를 주입하는 생성자.
     *
     * @param configuration 클라이언트 설정
     * @param transport HTTP 전송 구현체
     * @param rateLimiter 이 클라이언트가 사용할 Rate Limiter
     * @throws IllegalArgumentException 인자가 null이거나 설정이 유효하지 않은 경우
     */
    public ApiClient(ClientConfiguration configuration, HttpTransport transport, RateLimiter rateLimiter) {
        if (configuration == null) {
            throw new IllegalArgumentException("configuration cannot be null");
        }
        if (transport == null) {
            throw new IllegalArgumentException("transport cannot be null");
        }
        if (rateLimiter == null) {
            throw new IllegalArgumentException("rateLimiter cannot be null");
        }

        ValidationResult validation = ClientConfigurationValidator.validate(configuration);
        if (validation.hasErrors()) {
            throw new IllegalArgumentException(validation.errorMessage());
        }
        validation.getWarnings().forEach(warning -> log.warn("Client configuration: {}", warning));

        this.configuration = configuration;
        this.transport = transport;
        this.rateLimiter = rateLimiter;
        this.idempotencyHelper = new IdempotencyHelper(configuration.idempotencyConfig());

        rateLimiter.setGlobalEnabled(configuration.enableRateLimit());
        if (configuration.customerRateLimits() != null) {
            rateLimiter.configure(configuration.customerRateLimits());
        }
        log.debug("Created {}", configuration);
    }

    /**
     * 취소/데드라인 없이 요청 실행.
     *
     * @see #execute(RequestContext, ApiRequest)
     */
    public TransportResponse execute(ApiRequest request)
            throws IOException, ContextDoneException, InterruptedException {
        return execute(RequestContext.background(), request);
    }

    /**
     * 요청 실행.
     *
     * @param context 취소/데드라인 신호 (Rate Limit 대기와 Transport 호출에 모두 적용)
     * @param request 요청 명세
     * @return HTTP 응답 (non-2xx 포함)
     * @throws IllegalArgumentException 경로 파라미터가 누락되었거나 안전하지 않은 경우
     * @throws IllegalStateException API 키가 없고 요청에 Authorization 헤더도 없는 경우
     * @throws ContextDoneException Rate Limit 대기 또는 송신 중 취소/데드라인 경과
     * @throws IOException 전송 실패
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public TransportResponse execute(RequestContext context, ApiRequest request)
            throws IOException, ContextDoneException, InterruptedException {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }

        // 1. 경로 확장 (보안 검증 포함)
        String path = PathTemplates.expand(request.pathTemplate(), request.pathParams());

        // 2. 엔드포인트 분류
        EndpointType endpointType = rateLimiter.classify(request.method(), path);

        // 3. URL 및 헤더 조립
        String url = buildUrl(path, request.queryParams());
        Map<String, String> headers = buildHeaders(request);

        // 4. Rate Limit 승인
        if (!request.skipRateLimit()) {
            rateLimiter.waitForToken(context, endpointType);
        }

        // 5. 송신 (즉시 토큰을 얻었더라도 종료된 컨텍스트로는 보내지 않음)
        context.throwIfDone();
        TransportRequest transportRequest = new TransportRequest(
            request.method(),
            url,
            headers,
            request.body(),
            request.timeout() != null ? request.timeout() : configuration.timeout()
        );
        log.debug("{} {} [{}]", request.method(), path, endpointType);
        TransportResponse response;
        try {
            response = transport.execute(transportRequest, context);
        } catch (IOException e) {
            // 컨텍스트 종료로 중단된 호출은 네트워크 오류가 아님
            context.throwIfDone(e);
            throw e;
        }
        if (!response.isSuccessful()) {
            log.debug("{} {} returned {}", request.method(), path, response.statusCode());
        }
        return response;
    }

    /**
     * 취소/데드라인 없이 요청 실행, non-2xx는 예외로 변환.
     *
     * @see #executeOrThrow(RequestContext, ApiRequest)
     */
    public TransportResponse executeOrThrow(ApiRequest request)
            throws ApiException, IOException, ContextDoneException, InterruptedException {
        return executeOrThrow(RequestContext.background(), request);
    }

    /**
     * 요청 실행, non-2xx 응답은 {@link ApiException}으로 변환.
     *
     * @param context 취소/데드라인 신호
     * @param request 요청 명세
     * @return 2xx 응답
     * @throws ApiException 서버가 non-2xx를 반환한 경우 (상태 코드 분류, Retry-After, 요청 ID 포함)
     * @throws ContextDoneException 대기 또는 송신 중 취소/데드라인
     * @throws IOException 전송 실패
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     * @see #execute(RequestContext, ApiRequest)
     */
    public TransportResponse executeOrThrow(RequestContext context, ApiRequest request)
            throws ApiException, IOException, ContextDoneException, InterruptedException {
        TransportResponse response = execute(context, request);
        if (response.isSuccessful()) {
            return response;
        }
        String path = PathTemplates.expand(request.pathTemplate(), request.pathParams());
        ApiError error = ApiErrors.fromResponse(response, request.method(), path);
        log.debug("API error: {} (requestId={})", error.describe(), error.requestId());
        throw new ApiException(error);
    }

    // ===== Rate Limit 관리 =====

    public void setGeneralRateLimit(int requestsPerSecond, int burstCapacity) {
        rateLimiter.setRateLimit(EndpointType.GENERAL, requestsPerSecond, burstCapacity);
    }

    public void setStatisticsRateLimit(int requestsPerSecond, int burstCapacity) {
        rateLimiter.setRateLimit(EndpointType.STATISTICS, requestsPerSecond, burstCapacity);
    }

    public void setSendMessageRateLimit(int requestsPerSecond, int burstCapacity) {
        rateLimiter.setRateLimit(EndpointType.SEND_MESSAGE, requestsPerSecond, burstCapacity);
    }

    public void setRateLimit(EndpointType endpointType, int requestsPerSecond, int burstCapacity) {
        rateLimiter.setRateLimit(endpointType, requestsPerSecond, burstCapacity);
    }

    public void enableRateLimit(EndpointType endpointType, boolean enabled) {
        rateLimiter.setEnabled(endpointType, enabled);
    }

    /**
     * 클라이언트 측 Rate Limiting 전역 스위치.
     */
    public void setGlobalRateLimit(boolean enabled) {
        rateLimiter.setGlobalEnabled(enabled);
    }

    public void configureCustomerRateLimits(CustomerRateLimitConfig config) {
        rateLimiter.configure(config);
    }

    public RateLimitStatus getRateLimitStatus(EndpointType endpointType) {
        return rateLimiter.getRateLimitStatus(endpointType);
    }

    /**
     * 요청이 Rate Limit 때문에 대기해야 할 때 호출될 리스너 등록 (모니터링용).
     */
    public void setRateLimitWaitListener(RateLimitWaitListener listener) {
        rateLimiter.setWaitListener(listener);
    }

    public RateLimiter getRateLimiter() {
        return rateLimiter;
    }

    // ===== 멱등성 =====

    public String generateIdempotencyKey() {
        return idempotencyHelper.generateKey();
    }

    public IdempotencyKeyBuilder newIdempotencyKeyBuilder() {
        return new IdempotencyKeyBuilder(idempotencyHelper.generateKey());
    }

    public IdempotencyKeyBuilder newIdempotencyKeyBuilder(String baseKey) {
        return new IdempotencyKeyBuilder(baseKey);
    }

    /**
     * 멱등성 설정 교체. 이후 요청부터 적용됩니다.
     */
    public void setIdempotencyConfig(IdempotencyConfig config) {
        this.idempotencyHelper = new IdempotencyHelper(config);
    }

    public IdempotencyConfig getIdempotencyConfig() {
        return idempotencyHelper.getConfig();
    }

    public ClientConfiguration getConfiguration() {
        return configuration;
    }

    private String buildUrl(String path, Map<String, String> queryParams) {
        String baseUrl = configuration.baseUrl();
        if (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        StringBuilder url = new StringBuilder(baseUrl);
        if (!path.startsWith("/")) {
            url.append('/');
        }
        url.append(path);

        char separator = '?';
        for (Map.Entry<String, String> param : queryParams.entrySet()) {
            url.append(separator)
                .append(URLEncoder.encode(param.getKey(), StandardCharsets.UTF_8))
                .append('=')
                .append(URLEncoder.encode(param.getValue(), StandardCharsets.UTF_8));
            separator = '&';
        }
        return url.toString();
    }

    /**
     * 헤더 조립.
     *
     * <p>우선순위 (뒤가 앞을 덮어씀): 기본 헤더 → 인증/멱등성 → 설정의 defaultHeaders → 요청 헤더.
     * Authorization은 요청 헤더에 있으면 그것을, 없으면 설정의 API 키를 사용합니다.</p>
     */
    private Map<String, String> buildHeaders(ApiRequest request) {
        Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headers.put("Accept", JSON);
        if (request.hasBody()) {
            headers.put(CONTENT_TYPE, JSON);
        }
        if (configuration.userAgent() != null && !configuration.userAgent().isBlank()) {
            headers.put("User-Agent", configuration.userAgent());
        }

        Map<String, String> requestHeaders = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        requestHeaders.putAll(request.headers());

        if (requestHeaders.containsKey(AUTHORIZATION)) {
            headers.put(AUTHORIZATION, requestHeaders.get(AUTHORIZATION));
        } else if (configuration.hasApiKey()) {
            headers.put(AUTHORIZATION, "Bearer " + configuration.apiKey());
        } else {
            throw new IllegalStateException(
                "No API key provided. Set it via client configuration or an Authorization request header");
        }

        if ("POST".equals(request.method()) && !requestHeaders.containsKey(IDEMPOTENCY_KEY_HEADER)) {
            String key = idempotencyHelper.ensureKey(null);
            if (!key.isEmpty()) {
                headers.put(IDEMPOTENCY_KEY_HEADER, key);
            }
        }

        headers.putAll(configuration.defaultHeaders());
        headers.putAll(requestHeaders);
        return headers;
    }
}
