package com.yerin.stylizer.infra;

import com.yerin.stylizer.config.JobqProperties;
import com.yerin.stylizer.domain.Job;
import com.yerin.stylizer.domain.JobError;
import com.yerin.stylizer.domain.JobStatus;
import com.yerin.stylizer.domain.JobqMetrics;
import com.yerin.stylizer.generator.Generator;
import com.yerin.stylizer.generator.GeneratorException;
import com.yerin.stylizer.repository.JobRegistry;
import com.yerin.stylizer.service.AdmissionGate;
import com.yerin.stylizer.storage.ResultStore;
import com.yerin.stylizer.storage.ResultStoreException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.UnaryOperator;

/**
 * 고정 개수의 실행 슬롯. 각 슬롯은 {@link AdmissionGate} 에서 작업을 하나씩 꺼내
 * Generator 를 호출하고 종료 상태를 기록한다.
 *
 * <p>Generator 는 별도 executor 에서 돌고 슬롯은 최대 timeout 만큼만 기다린다.
 * 실패한 작업은 재시도하지 않는다.
 */
@Slf4j
@Component
public class WorkerPool {

    private final AdmissionGate admissionGate;
    private final JobRegistry registry;
    private final ResultStore resultStore;
    private final Generator generator;
    private final JobqMetrics metrics;
    private final Clock clock;

    private final int concurrency;
    private final Duration timeout;
    private final Duration pollInterval;

    private ExecutorService slots;
    private ExecutorService generations;
    private volatile boolean running;

    public WorkerPool(AdmissionGate admissionGate,
                      JobRegistry registry,
                      ResultStore resultStore,
                      Generator generator,
                      JobqMetrics metrics,
                      Clock clock,
                      JobqProperties properties) {
        this.admissionGate = admissionGate;
        this.registry = registry;
        this.resultStore = resultStore;
        this.generator = generator;
        this.metrics = metrics;
        this.clock = clock;
        this.concurrency = properties.getWorker().getConcurrency();
        this.timeout = properties.getWorker().getTimeout();
        this.pollInterval = properties.getWorker().getPollInterval();
    }

    @PostConstruct
    public void start() {
        running = true;
        generations = Executors.newCachedThreadPool(new CustomizableThreadFactory("jobq-generator-"));
        slots = Executors.newFixedThreadPool(concurrency, new CustomizableThreadFactory("jobq-slot-"));
        for (int i = 0; i < concurrency; i++) {
            final String slot = WorkerId.slotName(i);
            slots.submit(() -> runSlot(slot));
        }
        log.info("[Worker] started {} slots, timeout={}", concurrency, timeout);
    }

    @PreDestroy
    public void stop() {
        running = false;
        if (slots != null) {
            slots.shutdownNow();
        }
        if (generations != null) {
            generations.shutdownNow();
        }
        log.info("[Worker] stopped");
    }

    private void runSlot(String slot) {
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                admissionGate.takeNext(pollInterval).ifPresent(job -> execute(slot, job));
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            } catch (Throwable t) {
                // 슬롯 스레드는 어떤 오류에도 살아 있어야 한다
                log.error("[Worker] slot={} loop error", slot, t);
            }
        }
    }

    void execute(String slot, Job job) {
        final String jobId = job.getId();
        log.info("[Worker] slot={} started jobId={}, params={}", slot, jobId, job.getParameters().toLogMap());
        long start = System.nanoTime();

        JobError error;
        try {
            byte[] image = invokeGenerator(job);
            String resultRef = resultStore.put(jobId, image);
            record(start, "completed");
            if (finish(jobId, j -> j.toCompleted(clock.instant(), resultRef))) {
                metrics.incCompleted();
                log.info("[Worker] slot={} completed jobId={} in {} ms", slot, jobId, elapsedMillis(start));
            } else {
                // 리퍼가 먼저 종료시킨 작업의 결과는 남기지 않는다
                resultStore.delete(jobId);
                log.warn("[Worker] slot={} lost race on completion jobId={}, result discarded", slot, jobId);
            }
            return;
        } catch (TimeoutException e) {
            metrics.incTimedOut();
            record(start, "timeout");
            error = JobError.timeout(timeout);
        } catch (GeneratorException e) {
            record(start, "failed");
            error = e.isResourceExhausted()
                    ? JobError.resourceExhausted(e.getMessage())
                    : JobError.generator(e.getMessage());
        } catch (ResultStoreException e) {
            log.error("[Worker] slot={} failed to store result jobId={}", slot, jobId, e);
            record(start, "failed");
            error = JobError.internal("Failed to store the generated image.");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            error = JobError.internal("Worker was interrupted before the job finished.");
        } catch (RuntimeException | Error e) {
            log.error("[Worker] slot={} unexpected error jobId={}", slot, jobId, e);
            record(start, "failed");
            error = JobError.internal("An unexpected server error occurred.");
        }

        final JobError failure = error;
        if (finish(jobId, j -> j.toFailed(clock.instant(), failure))) {
            metrics.incFailed();
            log.warn("[Worker] slot={} failed jobId={}, kind={}, err={}", slot, jobId, failure.kind(), failure.message());
        } else {
            log.warn("[Worker] slot={} lost race on failure jobId={}", slot, jobId);
        }
    }

    private byte[] invokeGenerator(Job job) throws TimeoutException, InterruptedException {
        Future<byte[]> future = generations.submit(() -> generator.generate(job.getParameters()));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof GeneratorException ge) {
                throw ge;
            }
            if (cause instanceof OutOfMemoryError) {
                throw GeneratorException.resourceExhausted("Processing failed due to insufficient memory.", cause);
            }
            throw new GeneratorException(rootMessage(cause), cause);
        } catch (TimeoutException | InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    private boolean finish(String jobId, UnaryOperator<Job> transition) {
        boolean done = registry.updateIf(jobId, JobStatus.PROCESSING, transition).isPresent();
        if (done) {
            admissionGate.release(jobId);
        }
        return done;
    }

    private void record(long startNanos, String outcome) {
        metrics.generationTimer(outcome).record(Duration.ofNanos(System.nanoTime() - startNanos));
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static String rootMessage(Throwable t) {
        Throwable cur = t;
        while (cur.getCause() != null) cur = cur.getCause();
        String msg = cur.getMessage();
        return (msg == null || msg.isBlank()) ? cur.getClass().getSimpleName() : msg;
    }
}
