package com.yerin.stylizer.dto.response;

public record JobSubmissionResponse(
        String message,
        String jobId,
        String statusUrl,
        String resultUrl
) {
    public static JobSubmissionResponse accepted(String jobId) {
        return new JobSubmissionResponse(
                "Request accepted and queued.",
                jobId,
                "/status/" + jobId,
                "/result/" + jobId
        );
    }
}
