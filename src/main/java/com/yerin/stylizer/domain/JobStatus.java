package com.yerin.stylizer.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum JobStatus {
    QUEUED,
    PROCESSING,
    COMPLETED,
    FAILED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /** queued → processing → {completed | failed}, 그 외 전이는 없다. */
    public boolean canTransitionTo(JobStatus next) {
        return switch (this) {
            case QUEUED -> next == PROCESSING;
            case PROCESSING -> next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }
}
