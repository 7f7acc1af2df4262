package com.ahasend.sdk.core.ratelimit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * EndpointClassifier 유닛 테스트.
 *
 * @author AhaSend SDK Team
 * @since 1.0.0
 */
@DisplayName("EndpointClassifier 테스트")
class EndpointClassifierTest {

    @ParameterizedTest(name = "{0} {1} → {2}")
    @CsvSource({
        "POST,   /v2/accounts/acc-1/messages,                         SEND_MESSAGE",
        "post,   /v2/accounts/acc-1/messages/,                        SEND_MESSAGE",
        "POST,   /v2/accounts/acc-1/messages?dry_run=true,            SEND_MESSAGE",
        "GET,    /v2/accounts/acc-1/messages,                         GENERAL",
        "POST,   /v2/accounts/acc-1/messages/msg-1/cancel,            GENERAL",
        "GET,    /v2/accounts/acc-1/statistics/transactional,         STATISTICS",
        "GET,    /v2/accounts/acc-1/statistics/bounces?from=2024-01,  STATISTICS",
        "GET,    /v2/accounts/acc-1/domains,                          GENERAL",
        "DELETE, /v2/accounts/acc-1/webhooks/wh-1,                    GENERAL",
        "GET,    /v2/accounts/acc-1/statisticsreport,                 GENERAL"
    })
    void 요청을_카테고리로_분류한다(String method, String path, EndpointType expected) {
        assertThat(EndpointClassifier.classify(method, path)).isEqualTo(expected);
    }

    @Test
    void 빈_경로는_GENERAL() {
        assertThat(EndpointClassifier.classify("GET", null)).isEqualTo(EndpointType.GENERAL);
        assertThat(EndpointClassifier.classify("POST", "")).isEqualTo(EndpointType.GENERAL);
        assertThat(EndpointClassifier.classify("POST", "/")).isEqualTo(EndpointType.GENERAL);
        assertThat(EndpointClassifier.classify(null, "/v2/accounts/acc-1/messages")).isEqualTo(EndpointType.GENERAL);
    }

    @Test
    void 인스턴스화할_수_없다() throws Exception {
        var constructor = EndpointClassifier.class.getDeclaredConstructor();
        constructor.setAccessible(true);

        assertThatThrownBy(constructor::newInstance)
            .hasCauseInstanceOf(UnsupportedOperationException.class);
    }
}
