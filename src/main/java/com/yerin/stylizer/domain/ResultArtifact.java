package com.yerin.stylizer.domain;

import java.time.Instant;
import java.util.Objects;

public record ResultArtifact(String jobId, byte[] payload, Instant createdAt) {

    public static final String MEDIA_TYPE = "image/png";

    public ResultArtifact {
        Objects.requireNonNull(jobId, "jobId");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(createdAt, "createdAt");
        payload = payload.clone();
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    public int size() {
        return payload.length;
    }
}
