package com.ahasend.sdk.adapter.okhttp;

import com.ahasend.sdk.client.ApiClient;
import com.ahasend.sdk.client.ApiRequest;
import com.ahasend.sdk.client.config.ClientConfiguration;
import com.ahasend.sdk.client.error.ApiErrorType;
import com.ahasend.sdk.client.error.ApiException;
import com.ahasend.sdk.core.context.RequestCanceledException;
import com.ahasend.sdk.core.context.RequestContext;
import com.ahasend.sdk.core.spi.TransportRequest;
import com.ahasend.sdk.core.spi.TransportResponse;
import okhttp3.Headers;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * OkHttpTransport 테스트.
 *
 * <p>{@link OkHttpMockEngine} interceptor로 네트워크 없이 요청/응답 매핑을 검증합니다.</p>
 *
 * @author AhaSend SDK Team
 * @since 1.0.0
 */
@DisplayName("OkHttpTransport 테스트")
class OkHttpTransportTest {

    private static final String URL = "https://api.ahasend.com/v2/accounts/acc-1/messages";

    private OkHttpMockEngine engine;
    private OkHttpTransport transport;

    @BeforeEach
    void setUp() {
        engine = new OkHttpMockEngine();
        OkHttpClient client = OkHttpTransport.defaultClient().newBuilder()
            .addInterceptor(engine)
            .build();
        transport = new OkHttpTransport(client);
    }

    // ============================================================
    // 1. 요청/응답 매핑
    // ============================================================

    @Test
    void 요청_헤더와_본문을_그대로_송신한다() throws Exception {
        // given
        engine.enqueueJson(202, "{\"data\":[]}");
        TransportRequest request = new TransportRequest("POST", URL,
            Map.of("Authorization", "Bearer k", "Content-Type", "application/json", "Idempotency-Key", "order-1"),
            "{\"subject\":\"hi\"}".getBytes(StandardCharsets.UTF_8),
            Duration.ofSeconds(5));

        // when
        TransportResponse response = transport.execute(request, RequestContext.background());

        // then
        OkHttpMockEngine.CapturedRequest sent = engine.takeRequest();
        assertThat(sent.method()).isEqualTo("POST");
        assertThat(sent.url()).isEqualTo(URL);
        assertThat(sent.header("Authorization")).isEqualTo("Bearer k");
        assertThat(sent.header("Idempotency-Key")).isEqualTo("order-1");
        assertThat(sent.contentType()).hasToString("application/json");
        assertThat(sent.body()).isEqualTo("{\"subject\":\"hi\"}");

        assertThat(response.statusCode()).isEqualTo(202);
        assertThat(response.bodyAsString()).isEqualTo("{\"data\":[]}");
        assertThat(response.headers()).containsEntry("Content-Type", "application/json");
    }

    @Test
    void 본문_없는_POST는_빈_본문으로_송신한다() throws Exception {
        engine.enqueueJson(200, "{}");

        transport.execute(new TransportRequest("POST", URL, null, null, null), RequestContext.background());

        assertThat(engine.takeRequest().body()).isEmpty();
    }

    @Test
    void non_2xx_응답은_예외가_아니다() throws Exception {
        // given
        engine.enqueue(429, "{\"message\":\"slow down\"}", Headers.of("Retry-After", "1", "X-Trace", "a", "X-Trace", "b"));

        // when
        TransportResponse response = transport.execute(
            new TransportRequest("GET", URL, null, null, null), RequestContext.background());

        // then
        assertThat(response.isSuccessful()).isFalse();
        assertThat(response.statusCode()).isEqualTo(429);
        assertThat(response.headers()).containsEntry("Retry-After", "1").containsEntry("X-Trace", "a, b");
    }

    @Test
    void 전송_실패는_그대로_전달되고_재시도하지_않는다() {
        // given
        engine.enqueueFailure(new SocketTimeoutException("read timed out"));
        engine.enqueueJson(200, "{}");

        // when & then
        assertThatThrownBy(() -> transport.execute(
                new TransportRequest("GET", URL, null, null, null), RequestContext.background()))
            .isInstanceOf(SocketTimeoutException.class);
        assertThat(engine.requestCount()).isEqualTo(1);
    }

    // ============================================================
    // 2. 타임아웃 / 취소
    // ============================================================

    @Test
    @DisplayName("호출 타임아웃은 요청 타임아웃과 컨텍스트 잔여 시간 중 짧은 쪽")
    void 호출_타임아웃_적용() throws Exception {
        // given
        engine.enqueueJson(200, "{}");
        engine.enqueueJson(200, "{}");
        TransportRequest request = new TransportRequest("GET", URL, null, null, Duration.ofSeconds(30));

        // when
        transport.execute(request, RequestContext.background());
        transport.execute(request, RequestContext.timeout(Duration.ofSeconds(2)));

        // then
        assertThat(engine.takeRequest().timeoutNanos()).isEqualTo(TimeUnit.SECONDS.toNanos(30));
        assertThat(engine.takeRequest().timeoutNanos())
            .isPositive()
            .isLessThanOrEqualTo(TimeUnit.SECONDS.toNanos(2));
    }

    @Test
    void callTimeout_계산() {
        assertThat(OkHttpTransport.callTimeout(null, RequestContext.background())).isEmpty();
        assertThat(OkHttpTransport.callTimeout(Duration.ofSeconds(1), RequestContext.background()))
            .contains(Duration.ofSeconds(1));
        assertThat(OkHttpTransport.callTimeout(Duration.ofSeconds(1), RequestContext.timeout(Duration.ofMinutes(1))))
            .contains(Duration.ofSeconds(1));
        assertThat(OkHttpTransport.callTimeout(null, RequestContext.timeout(Duration.ofMinutes(1))))
            .hasValueSatisfying(d -> assertThat(d).isLessThanOrEqualTo(Duration.ofMinutes(1)));
    }

    @Test
    void 종료된_컨텍스트로는_송신하지_않는다() {
        // given
        RequestContext cancelled = RequestContext.cancellable();
        cancelled.cancel();
        RequestContext expired = RequestContext.timeout(Duration.ZERO);
        TransportRequest request = new TransportRequest("GET", URL, null, null, null);

        // when & then
        assertThatThrownBy(() -> transport.execute(request, cancelled))
            .isInstanceOf(IOException.class)
            .hasMessage("Canceled");
        assertThatThrownBy(() -> transport.execute(request, expired))
            .isInstanceOf(InterruptedIOException.class);
        assertThat(engine.requestCount()).isZero();
    }

    @Test
    void 컨텍스트_취소는_진행_중인_호출을_중단한다() throws Exception {
        // given
        engine.enqueueHang();
        RequestContext ctx = RequestContext.cancellable();
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<TransportResponse> inFlight = executor.submit(() ->
                transport.execute(new TransportRequest("GET", URL, null, null, null), ctx));
            engine.awaitHanging();

            // when
            ctx.cancel();

            // then
            assertThatThrownBy(() -> inFlight.get(2, TimeUnit.SECONDS))
                .hasCauseInstanceOf(IOException.class);
        } finally {
            executor.shutdownNow();
        }
    }

    // ============================================================
    // 3. ApiClient 연동
    // ============================================================

    @Test
    void ApiClient와_함께_메시지를_전송한다() throws Exception {
        // given
        engine.enqueueJson(202, "{\"object\":\"list\"}");
        ApiClient client = new ApiClient(new ClientConfiguration().withApiKey("aha-sk-test"), transport);

        // when
        TransportResponse response = client.execute(RequestContext.timeout(Duration.ofSeconds(5)),
            ApiRequest.post("/v2/accounts/{account_id}/messages")
                .withPathParam("account_id", "acc-1")
                .withJsonBody("{\"subject\":\"hi\"}"));

        // then
        assertThat(response.statusCode()).isEqualTo(202);
        OkHttpMockEngine.CapturedRequest sent = engine.takeRequest();
        assertThat(sent.url()).isEqualTo(URL);
        assertThat(sent.header("Authorization")).isEqualTo("Bearer aha-sk-test");
        assertThat(sent.header("Idempotency-Key")).isNotBlank();
        assertThat(sent.header("User-Agent")).isEqualTo("AhaSend-Java-SDK/1.0");
    }

    @Test
    void ApiClient_송신_중_취소는_RequestCanceledException으로_전달된다() throws Exception {
        // given
        engine.enqueueHang();
        ApiClient client = new ApiClient(new ClientConfiguration().withApiKey("aha-sk-test"), transport);
        RequestContext ctx = RequestContext.cancellable();
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<TransportResponse> inFlight = executor.submit(() ->
                client.execute(ctx, ApiRequest.get("/v2/accounts/{account_id}/domains")
                    .withPathParam("account_id", "acc-1")));
            engine.awaitHanging();

            // when
            ctx.cancel();

            // then
            assertThatThrownBy(() -> inFlight.get(2, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .cause()
                .isInstanceOf(RequestCanceledException.class)
                .hasCauseInstanceOf(IOException.class);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void ApiClient_executeOrThrow는_429를_ApiException으로_변환한다() {
        // given
        engine.enqueue(429, "{\"message\":\"slow down\"}",
            Headers.of("Retry-After", "7", "X-Request-Id", "req-429"));
        ApiClient client = new ApiClient(new ClientConfiguration().withApiKey("aha-sk-test"), transport);

        // when & then
        assertThatThrownBy(() -> client.executeOrThrow(ApiRequest.get("/v2/ping")))
            .isInstanceOfSatisfying(ApiException.class, e -> {
                assertThat(e.getType()).isEqualTo(ApiErrorType.RATE_LIMIT);
                assertThat(e.getError().retryAfter()).isEqualTo(Duration.ofSeconds(7));
                assertThat(e.getError().requestId()).isEqualTo("req-429");
                assertThat(e.getError().message()).isEqualTo("slow down");
            });
    }

    @Test
    void null_인자는_거부된다() {
        assertThatThrownBy(() -> new OkHttpTransport(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> transport.execute(null, RequestContext.background()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
