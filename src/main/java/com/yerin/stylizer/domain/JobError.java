package com.yerin.stylizer.domain;

import java.time.Duration;
import java.util.Objects;

public record JobError(JobErrorKind kind, String message) {

    public JobError {
        Objects.requireNonNull(kind, "kind");
        if (message == null || message.isBlank()) {
            message = "An unknown error occurred.";
        }
    }

    public static JobError generator(String message) {
        return new JobError(JobErrorKind.GENERATOR_ERROR, message);
    }

    public static JobError resourceExhausted(String message) {
        return new JobError(JobErrorKind.RESOURCE_EXHAUSTED, message);
    }

    public static JobError timeout(Duration limit) {
        return new JobError(JobErrorKind.TIMEOUT,
                "Job exceeded the time limit of " + limit.toSeconds() + " seconds.");
    }

    public static JobError orphaned() {
        return new JobError(JobErrorKind.ORPHANED,
                "Worker lease expired before the job reached a terminal state.");
    }

    public static JobError internal(String message) {
        return new JobError(JobErrorKind.INTERNAL, message);
    }
}
