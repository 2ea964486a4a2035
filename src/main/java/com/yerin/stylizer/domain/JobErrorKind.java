package com.yerin.stylizer.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum JobErrorKind {
    GENERATOR_ERROR,
    RESOURCE_EXHAUSTED,
    TIMEOUT,
    ORPHANED,
    INTERNAL;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
