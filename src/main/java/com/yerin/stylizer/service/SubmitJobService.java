package com.yerin.stylizer.service;

import com.yerin.stylizer.domain.GenerationParameters;
import com.yerin.stylizer.domain.JobqMetrics;
import com.yerin.stylizer.global.exception.AppException;
import com.yerin.stylizer.global.exception.code.JobErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class SubmitJobService {
    private final AdmissionGate admissionGate;
    private final JobqMetrics metrics;

    public String submit(GenerationParameters parameters) {
        String jobId = UUID.randomUUID().toString();

        AdmissionResult result = admissionGate.submit(jobId, parameters);
        if (!result.accepted()) {
            metrics.incRejected();
            throw new AppException(JobErrorCode.QUEUE_FULL);
        }

        metrics.incSubmitted();
        log.info("Job {} accepted and queued. params={}", jobId, parameters.toLogMap());
        return jobId;
    }
}
