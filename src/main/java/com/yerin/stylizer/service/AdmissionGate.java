package com.yerin.stylizer.service;

import com.yerin.stylizer.config.JobqProperties;
import com.yerin.stylizer.domain.GenerationParameters;
import com.yerin.stylizer.domain.Job;
import com.yerin.stylizer.domain.JobQueuePort;
import com.yerin.stylizer.domain.JobStatus;
import com.yerin.stylizer.domain.JobqMetrics;
import com.yerin.stylizer.repository.JobRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 제출 승인과 FIFO 배분을 담당한다.
 *
 * <p>용량 검사, 레코드 생성, 큐 적재는 하나의 락 안에서 일어나므로 자리가 하나 남았을 때
 * 동시에 들어온 두 제출이 모두 승인되는 일은 없다. 큐에서 꺼내는 것과 PROCESSING 전이도
 * 같은 락 안에서 일어나므로 레지스트리의 QUEUED 작업은 항상 큐 안에 있다.
 *
 * <p>active(queued + processing) 카운트는 종료 전이에 성공한 쪽이 {@link #release(String)} 로 줄인다.
 */
@Slf4j
@Component
public class AdmissionGate {

    private final JobRegistry registry;
    private final JobQueuePort queue;
    private final Clock clock;
    private final int maxQueueSize;
    private final Duration lease;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition jobAvailable = lock.newCondition();
    private int active;

    public AdmissionGate(JobRegistry registry,
                         JobQueuePort queue,
                         Clock clock,
                         JobqProperties properties,
                         JobqMetrics metrics) {
        this.registry = registry;
        this.queue = queue;
        this.clock = clock;
        this.maxQueueSize = properties.getQueue().getMaxSize();
        this.lease = properties.leaseDuration();

        metrics.gauge("jobq_queue_depth", "jobs waiting in the queue", this::queuedCount);
        metrics.gauge("jobq_jobs_processing", "jobs occupying a worker slot", this::processingCount);
    }

    public AdmissionResult submit(String jobId, GenerationParameters parameters) {
        lock.lock();
        try {
            if (active >= maxQueueSize) {
                log.warn("[Admission] rejected jobId={}, reason=capacity_exceeded, active={}/{}",
                        jobId, active, maxQueueSize);
                return AdmissionResult.rejected(AdmissionResult.RejectReason.CAPACITY_EXCEEDED);
            }
            if (registry.findById(jobId).isPresent()) {
                log.warn("[Admission] rejected jobId={}, reason=duplicate_job_id", jobId);
                return AdmissionResult.rejected(AdmissionResult.RejectReason.DUPLICATE_JOB_ID);
            }

            long sequence = queue.enqueuedTotal() + 1;
            Job job = registry.save(Job.queued(jobId, sequence, parameters, clock.instant()));
            queue.enqueue(jobId);
            active++;
            jobAvailable.signal();

            log.info("[Admission] accepted jobId={}, seq={}, active={}/{}", jobId, sequence, active, maxQueueSize);
            return AdmissionResult.accepted(job);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 다음 작업을 꺼내 PROCESSING 으로 전이한다. 큐가 비어 있으면 최대 {@code maxWait} 동안 기다린다.
     */
    public Optional<Job> takeNext(Duration maxWait) throws InterruptedException {
        long nanos = maxWait.toNanos();
        lock.lockInterruptibly();
        try {
            while (true) {
                Optional<String> next = queue.poll();
                if (next.isEmpty()) {
                    if (nanos <= 0L) {
                        return Optional.empty();
                    }
                    nanos = jobAvailable.awaitNanos(nanos);
                    continue;
                }

                String jobId = next.get();
                Instant now = clock.instant();
                Optional<Job> started = registry.updateIf(jobId, JobStatus.QUEUED,
                        job -> job.toProcessing(now, now.plus(lease)));
                if (started.isPresent()) {
                    return started;
                }
                log.error("[Admission] dequeued jobId={} is not QUEUED in registry, skipped", jobId);
            }
        } finally {
            lock.unlock();
        }
    }

    /** 종료 전이에 성공한 작업의 자리를 반납한다. */
    public void release(String jobId) {
        lock.lock();
        try {
            if (active > 0) {
                active--;
            } else {
                log.error("[Admission] release without active job jobId={}", jobId);
            }
        } finally {
            lock.unlock();
        }
    }

    public long dequeuedTotal() {
        return queue.dequeuedTotal();
    }

    public long admittedTotal() {
        return queue.enqueuedTotal();
    }

    public List<String> queueSnapshot() {
        return queue.snapshot();
    }

    public int queuedCount() {
        return queue.size();
    }

    public int activeCount() {
        lock.lock();
        try {
            return active;
        } finally {
            lock.unlock();
        }
    }

    public int processingCount() {
        lock.lock();
        try {
            return active - queue.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return maxQueueSize;
    }
}
