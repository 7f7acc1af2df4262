package com.ahasend.sdk.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ValidationResult 유닛 테스트.
 *
 * @author AhaSend SDK Team
 * @since 1.0.0
 */
@DisplayName("ValidationResult 테스트")
class ValidationResultTest {

    @Test
    void 비어있는_결과는_유효하다() {
        ValidationResult result = ValidationResult.builder().build();

        assertThat(result.isValid()).isTrue();
        assertThat(result.hasErrors()).isFalse();
        assertThat(result.hasWarnings()).isFalse();
        assertThat(result.errorMessage()).isEmpty();
    }

    @Test
    void 오류_메시지는_모든_오류를_연결한다() {
        // given
        ValidationResult result = ValidationResult.builder()
            .error("baseUrl", "ftp://x", "scheme must be http or https")
            .error("timeout", "PT0S", "must be positive")
            .warning("apiKey is empty")
            .build();

        // when
        String message = result.errorMessage();

        // then
        assertThat(result.isValid()).isFalse();
        assertThat(result.getWarnings()).containsExactly("apiKey is empty");
        assertThat(message).isEqualTo("configuration validation failed: "
            + "configuration validation error for baseUrl (ftp://x): scheme must be http or https; "
            + "configuration validation error for timeout (PT0S): must be positive");
    }

    @Test
    void merge는_오류와_경고를_합친다() {
        ValidationResult first = ValidationResult.builder().error("a", 1, "bad").build();
        ValidationResult second = ValidationResult.builder().warning("careful").build();

        ValidationResult merged = ValidationResult.builder().merge(first).merge(second).build();

        assertThat(merged.getErrors()).hasSize(1);
        assertThat(merged.getWarnings()).containsExactly("careful");
    }

    @Test
    void 결과_목록은_변경할_수_없다() {
        ValidationResult result = ValidationResult.builder().warning("w").build();

        assertThatThrownBy(() -> result.getWarnings().add("x"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void 오류_필드와_메시지는_비어있을_수_없다() {
        assertThatThrownBy(() -> new ConfigurationValidationError(" ", 1, "msg"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ConfigurationValidationError("field", 1, null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
