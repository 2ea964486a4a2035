package com.yerin.stylizer.service;

import com.yerin.stylizer.config.JobqProperties;
import com.yerin.stylizer.domain.Job;
import com.yerin.stylizer.domain.JobStatus;
import com.yerin.stylizer.domain.ResultArtifact;
import com.yerin.stylizer.dto.response.JobStatusResponse;
import com.yerin.stylizer.global.exception.AppException;
import com.yerin.stylizer.global.exception.code.JobErrorCode;
import com.yerin.stylizer.repository.JobRegistry;
import com.yerin.stylizer.storage.ResultStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalInt;

@Slf4j
@Service
@RequiredArgsConstructor
public class JobQueryService {
    private final JobRegistry registry;
    private final ResultStore resultStore;
    private final QueuePositionEstimator positionEstimator;
    private final JobqProperties properties;
    private final Clock clock;

    public JobStatusResponse getStatus(String jobId) {
        Job job = find(jobId);
        OptionalInt position = job.getStatus() == JobStatus.QUEUED
                ? positionEstimator.position(jobId)
                : OptionalInt.empty();
        return JobStatusResponse.from(job, position);
    }

    /**
     * 완료된 작업의 결과를 돌려준다. 아직 진행 중이면 empty 와 함께 현재 상태를 담는다.
     *
     * @throws AppException 작업이 없거나(404), 실패했거나(500), 완료됐는데 결과가 없을 때(500)
     */
    public ResultLookup getResult(String jobId) {
        Job job = find(jobId);

        switch (job.getStatus()) {
            case COMPLETED -> {
                Optional<ResultArtifact> artifact = resultStore.get(jobId);
                if (artifact.isEmpty()) {
                    logMissingResult(job);
                    throw new AppException(JobErrorCode.RESULT_MISSING);
                }
                return new ResultLookup(job.getStatus(), artifact);
            }
            case FAILED -> throw new AppException(JobErrorCode.JOB_FAILED.withDetail(job.getError().message()));
            default -> {
                return new ResultLookup(job.getStatus(), Optional.empty());
            }
        }
    }

    // TTL 로 정리된 결과는 정상 만료, 그 전에 사라진 결과는 저장소 문제다
    private void logMissingResult(Job job) {
        Duration ttl = properties.getResult().getTtl();
        Instant expiresAt = job.getFinishTime().plus(ttl);
        if (!clock.instant().isBefore(expiresAt)) {
            log.warn("[Result] result for job {} expired (finishTime={}, ttl={})",
                    job.getId(), job.getFinishTime(), ttl);
        } else {
            log.error("[Integrity] result file for completed job {} not found (resultRef={})",
                    job.getId(), job.getResultRef());
        }
    }

    private Job find(String jobId) {
        return registry.findById(jobId)
                .orElseThrow(() -> new AppException(JobErrorCode.JOB_NOT_FOUND));
    }

    public record ResultLookup(JobStatus status, Optional<ResultArtifact> artifact) {}
}
