package com.ahasend.sdk.testkit;

import com.ahasend.sdk.core.context.RequestContext;
import com.ahasend.sdk.core.spi.HttpTransport;
import com.ahasend.sdk.core.spi.TransportRequest;
import com.ahasend.sdk.core.spi.TransportResponse;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 테스트용 In-memory {@link HttpTransport} 구현체.
 *
 * <p>네트워크 I/O를 수행하지 않습니다. 테스트는 응답(또는 실패)을 미리 적재하고,
 * 송신된 모든 요청은 검증을 위해 기록됩니다.</p>
 *
 * <p><strong>동작:</strong></p>
 * <ul>
 *   <li>적재된 결과를 FIFO 순서로 하나씩 반환</li>
 *   <li>적재된 결과가 없으면 {@link IOException}</li>
 *   <li>이미 취소된 컨텍스트로 호출하면 {@code IOException("Canceled")} (요청은 기록됨)</li>
 * </ul>
 *
 * <p><strong>제약사항:</strong></p>
 * <ul>
 *   <li>타임아웃을 시뮬레이션하지 않음</li>
 *   <li>프로덕션 용도가 아님</li>
 * </ul>
 *
 * @author AhaSend SDK Team
 * @since 1.0.0
 */
public final class InMemoryTransport implements HttpTransport {

    private static final Map<String, String> JSON_HEADERS = Map.of("Content-Type", "application/json");

    private final ConcurrentLinkedQueue<PlannedResult> plannedResults = new ConcurrentLinkedQueue<>();
    private final ConcurrentLinkedQueue<TransportRequest> capturedRequests = new ConcurrentLinkedQueue<>();
    private final AtomicInteger requestCount = new AtomicInteger();

    /**
     * JSON 응답 적재.
     *
     * @param statusCode HTTP 상태 코드
     * @param body JSON 본문 (null이면 빈 본문)
     * @return this (체이닝용)
     */
    public InMemoryTransport enqueueJson(int statusCode, String body) {
        byte[] bytes = body == null ? new byte[0] : body.getBytes(StandardCharsets.UTF_8);
        return enqueue(new TransportResponse(statusCode, JSON_HEADERS, bytes));
    }

    public InMemoryTransport enqueue(TransportResponse response) {
        if (response == null) {
            throw new IllegalArgumentException("response cannot be null");
        }
        plannedResults.add(new PlannedResult(response, null));
        return this;
    }

    /**
     * 전송 실패 적재. 다음 호출에서 그대로 던집니다.
     */
    public InMemoryTransport enqueueFailure(IOException failure) {
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
        plannedResults.add(new PlannedResult(null, failure));
        return this;
    }

    @Override
    public TransportResponse execute(TransportRequest request, RequestContext context) throws IOException {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        capturedRequests.add(request);
        requestCount.incrementAndGet();

        if (context.isCancelled()) {
            throw new IOException("Canceled");
        }
        PlannedResult planned = plannedResults.poll();
        if (planned == null) {
            throw new IOException("No planned response for request: " + request.method() + " " + request.url());
        }
        if (planned.failure() != null) {
            throw planned.failure();
        }
        return planned.response();
    }

    /**
     * 가장 오래된 기록 요청을 꺼냄.
     *
     * @return 요청 (없으면 null)
     */
    public TransportRequest takeRequest() {
        return capturedRequests.poll();
    }

    /**
     * 아직 꺼내지 않은 기록 요청 목록 (스냅샷).
     */
    public List<TransportRequest> getRequests() {
        return new ArrayList<>(capturedRequests);
    }

    public int getRequestCount() {
        return requestCount.get();
    }

    public int pendingResults() {
        return plannedResults.size();
    }

    /**
     * 적재된 결과와 기록을 모두 초기화.
     */
    public void reset() {
        plannedResults.clear();
        capturedRequests.clear();
        requestCount.set(0);
    }

    private record PlannedResult(TransportResponse response, IOException failure) {
    }
}
