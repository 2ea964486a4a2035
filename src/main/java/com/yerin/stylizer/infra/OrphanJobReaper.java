package com.yerin.stylizer.infra;

import com.yerin.stylizer.domain.Job;
import com.yerin.stylizer.domain.JobError;
import com.yerin.stylizer.domain.JobStatus;
import com.yerin.stylizer.domain.JobqMetrics;
import com.yerin.stylizer.repository.JobRegistry;
import com.yerin.stylizer.service.AdmissionGate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * lease 가 만료된 PROCESSING 작업을 FAILED(orphaned) 로 정리한다.
 * 살아 있는 슬롯은 timeout 안에 끝나므로 여기 걸리는 작업은 슬롯이 죽었거나 멈춘 경우다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrphanJobReaper {

    private final JobRegistry registry;
    private final AdmissionGate admissionGate;
    private final JobqMetrics metrics;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${jobq.reaper.interval:PT10S}")
    public int reap() {
        Instant now = clock.instant();

        List<Job> expired = registry.findAllByStatus(JobStatus.PROCESSING).stream()
                .filter(j -> j.isLeaseExpired(now))
                .toList();

        if (expired.isEmpty()) return 0;

        int handled = 0;
        for (Job j : expired) {
            boolean reaped = registry.updateIf(j.getId(), JobStatus.PROCESSING,
                    cur -> cur.isLeaseExpired(now) ? cur.toFailed(now, JobError.orphaned()) : cur)
                    .filter(updated -> updated.getStatus() == JobStatus.FAILED)
                    .isPresent();
            if (reaped) {
                admissionGate.release(j.getId());
                metrics.incFailed();
                handled++;
                log.warn("[Reaper] orphaned jobId={}, startTime={}, leaseUntil={}",
                        j.getId(), j.getStartTime(), j.getLeaseUntil());
            }
        }
        log.info("[Reaper] reaped={} (PROCESSING→FAILED)", handled);
        return handled;
    }
}
