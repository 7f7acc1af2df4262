package com.ahasend.sdk.adapter.okhttp;

import com.ahasend.sdk.core.context.RequestContext;
import com.ahasend.sdk.core.spi.HttpTransport;
import com.ahasend.sdk.core.spi.TransportRequest;
import com.ahasend.sdk.core.spi.TransportResponse;
import okhttp3.Call;
import okhttp3.Headers;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * OkHttp 기반 {@link HttpTransport} 구현체.
 *
 * <p><strong>동작:</strong></p>
 * <ul>
 *   <li>호출 타임아웃: 요청 타임아웃과 컨텍스트 잔여 시간 중 짧은 쪽을 {@link Call#timeout()}에 적용</li>
 *   <li>취소: 컨텍스트가 취소되면 진행 중인 {@link Call}을 cancel</li>
 *   <li>이미 종료된 컨텍스트로는 송신하지 않음</li>
 *   <li>non-2xx 응답도 {@link TransportResponse}로 반환</li>
 * </ul>
 *
 * <p>기본 클라이언트는 연결 실패 시 자동 재시도를 끕니다. 요청은 정확히 한 번 송신됩니다.</p>
 *
 * @author AhaSend SDK Team
 * @since 1.0.0
 */
public final class OkHttpTransport implements HttpTransport {

    private static final Logger log = LoggerFactory.getLogger(OkHttpTransport.class);

    private static final Set<String> BODY_METHODS = Set.of("POST", "PUT", "PATCH");
    private static final MediaType DEFAULT_MEDIA_TYPE = MediaType.parse("application/json");

    private final OkHttpClient client;

    /**
     * 기본 설정의 OkHttpClient로 생성.
     */
    public OkHttpTransport() {
        this(defaultClient());
    }

    /**
     * 공유 OkHttpClient로 생성.
     *
     * @param client OkHttp 클라이언트 (connection pool 공유 가능)
     * @throws IllegalArgumentException client가 null인 경우
     */
    public OkHttpTransport(OkHttpClient client) {
        if (client == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
        this.client = client;
    }

    /**
     * 기본 OkHttpClient.
     *
     * <p>connect 10초, read/write 30초, 연결 실패 재시도 없음.</p>
     */
    public static OkHttpClient defaultClient() {
        return new OkHttpClient.Builder()
            .connectTimeout(10, TimeUnit.SECONDS)
            .readTimeout(30, TimeUnit.SECONDS)
            .writeTimeout(30, TimeUnit.SECONDS)
            .retryOnConnectionFailure(false)
            .build();
    }

    @Override
    public TransportResponse execute(TransportRequest request, RequestContext context) throws IOException {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (context.isCancelled()) {
            throw new IOException("Canceled");
        }
        if (context.isDeadlineExceeded()) {
            throw new InterruptedIOException("timeout");
        }

        Call call = client.newCall(toOkHttpRequest(request));
        callTimeout(request.timeout(), context)
            .ifPresent(timeout -> call.timeout().timeout(Math.max(1L, timeout.toNanos()), TimeUnit.NANOSECONDS));

        Runnable unsubscribe = context.onCancel(call::cancel);
        try (Response response = call.execute()) {
            return toTransportResponse(response);
        } catch (IOException e) {
            log.debug("{} {} failed (canceled={}): {}",
                request.method(), request.url(), call.isCanceled(), e.getMessage());
            throw e;
        } finally {
            unsubscribe.run();
        }
    }

    /**
     * 요청 타임아웃과 컨텍스트 잔여 시간 중 짧은 쪽.
     */
    static Optional<Duration> callTimeout(Duration requestTimeout, RequestContext context) {
        Optional<Duration> remaining = context.remaining();
        if (requestTimeout == null) {
            return remaining;
        }
        if (remaining.isPresent() && remaining.get().compareTo(requestTimeout) < 0) {
            return remaining;
        }
        return Optional.of(requestTimeout);
    }

    private static Request toOkHttpRequest(TransportRequest request) {
        Request.Builder builder = new Request.Builder().url(request.url());
        request.headers().forEach(builder::header);

        RequestBody body = null;
        if (request.hasBody()) {
            String contentType = request.header("Content-Type");
            MediaType mediaType = contentType != null ? MediaType.parse(contentType) : DEFAULT_MEDIA_TYPE;
            body = RequestBody.create(request.body(), mediaType);
        } else if (BODY_METHODS.contains(request.method())) {
            body = RequestBody.create(new byte[0], null);
        }
        return builder.method(request.method(), body).build();
    }

    private static TransportResponse toTransportResponse(Response response) throws IOException {
        Map<String, String> headers = new LinkedHashMap<>();
        Headers source = response.headers();
        for (String name : source.names()) {
            headers.put(name, String.join(", ", source.values(name)));
        }
        ResponseBody body = response.body();
        byte[] bytes = body != null ? body.bytes() : new byte[0];
        return new TransportResponse(response.code(), headers, bytes);
    }
}
