package com.alerthub.model;

import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.List;

/**
 * 配置校验结果
 */
@Getter
@ToString
public final class ValidationResult {

    private final boolean valid;

    private final List<ValidationError> errors;

    /** 被校验的组件 */
    private final String component;

    private final Instant validatedAt;

    private ValidationResult(boolean valid, List<ValidationError> errors, String component, Instant validatedAt) {
        this.valid = valid;
        this.errors = List.copyOf(errors);
        this.component = component;
        this.validatedAt = validatedAt;
    }

    public static ValidationResult success(String component, Instant at) {
        return new ValidationResult(true, List.of(), component, at);
    }

    public static ValidationResult failure(List<ValidationError> errors, String component, Instant at) {
        return new ValidationResult(false, errors, component, at);
    }

    /** 是否包含指定错误码 */
    public boolean hasError(String code) {
        return errors.stream().anyMatch(e -> e.getCode().equals(code));
    }
}
