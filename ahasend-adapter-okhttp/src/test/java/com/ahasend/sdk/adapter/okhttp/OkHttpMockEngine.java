package com.ahasend.sdk.adapter.okhttp;

import okhttp3.Headers;
import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;

/**
 * 네트워크 I/O 없이 응답을 돌려주는 OkHttp interceptor.
 *
 * <p>응답(또는 실패)을 적재하고, 모든 요청은 호출 타임아웃과 함께 기록됩니다.
 * {@link #enqueueHang()}로 적재한 결과는 호출이 취소될 때까지 응답하지 않습니다.</p>
 */
final class OkHttpMockEngine implements Interceptor {

    private final ConcurrentLinkedQueue<Planned> planned = new ConcurrentLinkedQueue<>();
    private final ConcurrentLinkedQueue<CapturedRequest> captured = new ConcurrentLinkedQueue<>();
    private final CountDownLatch hanging = new CountDownLatch(1);

    void enqueue(int code, String body, Headers headers) {
        planned.add(new Planned(code, body, headers, null, false));
    }

    void enqueueJson(int code, String body) {
        enqueue(code, body, Headers.of("Content-Type", "application/json"));
    }

    void enqueueFailure(IOException failure) {
        planned.add(new Planned(0, null, null, failure, false));
    }

    void enqueueHang() {
        planned.add(new Planned(0, null, null, null, true));
    }

    void awaitHanging() throws InterruptedException {
        hanging.await();
    }

    CapturedRequest takeRequest() {
        return captured.poll();
    }

    int requestCount() {
        return captured.size();
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        captured.add(new CapturedRequest(request, readBody(request.body()), chain.call().timeout().timeoutNanos()));

        Planned result = planned.poll();
        if (result == null) {
            throw new IOException("No planned response for request: " + request.method() + " " + request.url());
        }
        if (result.failure() != null) {
            throw result.failure();
        }
        if (result.hang()) {
            hanging.countDown();
            while (!chain.call().isCanceled()) {
                try {
                    Thread.sleep(5);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IOException("interrupted", e);
                }
            }
            throw new IOException("Canceled");
        }

        return new Response.Builder()
            .request(request)
            .protocol(Protocol.HTTP_1_1)
            .code(result.code())
            .message("mock")
            .headers(result.headers())
            .body(ResponseBody.create(result.body(), MediaType.parse("application/json")))
            .build();
    }

    private static String readBody(RequestBody body) throws IOException {
        if (body == null) {
            return null;
        }
        Buffer buffer = new Buffer();
        body.writeTo(buffer);
        return buffer.readString(StandardCharsets.UTF_8);
    }

    private record Planned(int code, String body, Headers headers, IOException failure, boolean hang) {
    }

    record CapturedRequest(Request request, String body, long timeoutNanos) {

        String method() {
            return request.method();
        }

        String url() {
            return request.url().toString();
        }

        String header(String name) {
            return request.header(name);
        }

        MediaType contentType() {
            return request.body() == null ? null : request.body().contentType();
        }
    }
}
