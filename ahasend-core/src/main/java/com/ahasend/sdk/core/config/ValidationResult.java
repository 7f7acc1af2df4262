package com.ahasend.sdk.core.config;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 설정 검증 결과.
 *
 * <p>오류(errors)는 설정을 사용할 수 없음을, 경고(warnings)는 동작은 하지만
 * 의도와 다를 수 있음을 의미합니다. 검증은 대상 설정을 변경하지 않습니다.</p>
 *
 * @author AhaSend SDK Team
 * @since 1.0.0
 */
public final class ValidationResult {

    private final List<ConfigurationValidationError> errors;
    private final List<String> warnings;

    private ValidationResult(List<ConfigurationValidationError> errors, List<String> warnings) {
        this.errors = List.copyOf(errors);
        this.warnings = List.copyOf(warnings);
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public List<ConfigurationValidationError> getErrors() {
        return errors;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    /**
     * 모든 오류를 하나의 메시지로 결합.
     *
     * @return 오류 메시지 (오류가 없으면 빈 문자열)
     */
    public String errorMessage() {
        if (errors.isEmpty()) {
            return "";
        }
        return errors.stream()
            .map(ConfigurationValidationError::describe)
            .collect(Collectors.joining("; ", "configuration validation failed: ", ""));
    }

    @Override
    public String toString() {
        return "ValidationResult{errors=" + errors.size() + ", warnings=" + warnings.size() + '}';
    }

    /**
     * 검증 결과 누적기.
     */
    public static final class Builder {

        private final List<ConfigurationValidationError> errors = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();

        private Builder() {
        }

        public Builder error(String field, Object value, String message) {
            errors.add(new ConfigurationValidationError(field, value, message));
            return this;
        }

        public Builder warning(String warning) {
            warnings.add(warning);
            return this;
        }

        public Builder merge(ValidationResult other) {
            errors.addAll(other.errors);
            warnings.addAll(other.warnings);
            return this;
        }

        public ValidationResult build() {
            return new ValidationResult(errors, warnings);
        }
    }
}
