package com.alerthub.model;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public final class ValidationError {

    public static final String NO_CHANNELS = "NO_CHANNELS";
    public static final String CHANNEL_UNHEALTHY = "CHANNEL_UNHEALTHY";
    public static final String NO_FILTERS = "NO_FILTERS";
    public static final String VALIDATION_FAILED = "VALIDATION_FAILED";

    private final String code;

    private final String message;

    public ValidationError(String code, String message) {
        this.code = code;
        this.message = message;
    }
}
