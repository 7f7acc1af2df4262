package com.ahasend.sdk.testkit;

import com.ahasend.sdk.core.context.RequestContext;
import com.ahasend.sdk.core.spi.TransportRequest;
import com.ahasend.sdk.core.spi.TransportResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketTimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryTransport 테스트.
 *
 * @author AhaSend SDK Team
 * @since 1.0.0
 */
@DisplayName("InMemoryTransport 테스트")
class InMemoryTransportTest {

    private InMemoryTransport transport;

    @BeforeEach
    void setUp() {
        transport = new InMemoryTransport();
    }

    @Test
    void 적재된_응답을_순서대로_반환하고_요청을_기록한다() throws Exception {
        // given
        transport.enqueueJson(200, "{\"a\":1}").enqueueJson(404, null);

        // when
        TransportResponse first = transport.execute(get("/one"), RequestContext.background());
        TransportResponse second = transport.execute(get("/two"), RequestContext.background());

        // then
        assertThat(first.statusCode()).isEqualTo(200);
        assertThat(first.bodyAsString()).isEqualTo("{\"a\":1}");
        assertThat(second.statusCode()).isEqualTo(404);
        assertThat(transport.getRequestCount()).isEqualTo(2);
        assertThat(transport.takeRequest().url()).endsWith("/one");
        assertThat(transport.takeRequest().url()).endsWith("/two");
        assertThat(transport.takeRequest()).isNull();
    }

    @Test
    void 적재된_실패를_던진다() {
        transport.enqueueFailure(new SocketTimeoutException("timeout"));

        assertThatThrownBy(() -> transport.execute(get("/x"), RequestContext.background()))
            .isInstanceOf(SocketTimeoutException.class)
            .hasMessage("timeout");
    }

    @Test
    void 적재된_결과가_없으면_IOException() {
        assertThatThrownBy(() -> transport.execute(get("/x"), RequestContext.background()))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("No planned response for request: GET");
    }

    @Test
    void 취소된_컨텍스트는_응답을_소비하지_않는다() {
        // given
        transport.enqueueJson(200, "{}");
        RequestContext ctx = RequestContext.cancellable();
        ctx.cancel();

        // when & then
        assertThatThrownBy(() -> transport.execute(get("/x"), ctx))
            .isInstanceOf(IOException.class)
            .hasMessage("Canceled");
        assertThat(transport.pendingResults()).isEqualTo(1);
        assertThat(transport.getRequests()).hasSize(1);
    }

    @Test
    void reset은_모든_상태를_지운다() throws Exception {
        transport.enqueueJson(200, "{}").enqueueJson(200, "{}");
        transport.execute(get("/x"), RequestContext.background());

        transport.reset();

        assertThat(transport.getRequestCount()).isZero();
        assertThat(transport.pendingResults()).isZero();
        assertThat(transport.getRequests()).isEmpty();
    }

    private static TransportRequest get(String path) {
        return new TransportRequest("GET", "https://api.ahasend.com" + path, null, null, null);
    }
}
