package com.yerin.stylizer.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.yerin.stylizer.domain.Job;
import com.yerin.stylizer.domain.JobError;
import com.yerin.stylizer.domain.JobStatus;

import java.time.Instant;
import java.util.OptionalInt;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatusResponse(
        String jobId,
        JobStatus status,
        Integer queuePosition,
        String resultRef,
        JobError error,
        Instant submitTime,
        Instant startTime,
        Instant finishTime
) {
    public static JobStatusResponse from(Job j, OptionalInt queuePosition) {
        return new JobStatusResponse(
                j.getId(),
                j.getStatus(),
                queuePosition.isPresent() ? queuePosition.getAsInt() : null,
                j.getResultRef(),
                j.getError(),
                j.getSubmitTime(),
                j.getStartTime(),
                j.getFinishTime()
        );
    }
}
