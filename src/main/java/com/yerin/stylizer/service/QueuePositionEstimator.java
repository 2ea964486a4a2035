package com.yerin.stylizer.service;

import com.yerin.stylizer.domain.JobStatus;
import com.yerin.stylizer.repository.JobRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.OptionalInt;

/**
 * QUEUED 작업의 1부터 시작하는 대기 순위.
 *
 * <p>큐는 앞에서만 빠지므로 순위는 {@code sequence - dequeuedTotal} 이다. 조회 직후 다른 작업이
 * 꺼내지거나 들어올 수 있으므로 참고값으로만 쓴다.
 */
@Component
@RequiredArgsConstructor
public class QueuePositionEstimator {

    private final JobRegistry registry;
    private final AdmissionGate admissionGate;

    public OptionalInt position(String jobId) {
        return registry.findById(jobId)
                .filter(job -> job.getStatus() == JobStatus.QUEUED)
                .map(job -> job.getSequence() - admissionGate.dequeuedTotal())
                .filter(rank -> rank > 0)
                .map(rank -> OptionalInt.of(Math.toIntExact(rank)))
                .orElse(OptionalInt.empty());
    }
}
