package com.yerin.stylizer.domain;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

@Component
public class JobqMetrics {

    private final MeterRegistry registry;

    private final Counter jobSubmitted;
    private final Counter jobRejected;
    private final Counter jobCompleted;
    private final Counter jobFailed;
    private final Counter jobTimedOut;
    private final Counter resultSwept;

    public JobqMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.jobSubmitted = Counter.builder("jobq_jobs_submitted_total")
                .description("jobs accepted by admission").register(registry);
        this.jobRejected  = Counter.builder("jobq_jobs_rejected_total")
                .description("jobs rejected because the queue was full").register(registry);
        this.jobCompleted = Counter.builder("jobq_jobs_completed_total")
                .description("jobs completed").register(registry);
        this.jobFailed    = Counter.builder("jobq_jobs_failed_total")
                .description("jobs failed (generator error, timeout, orphaned)").register(registry);
        this.jobTimedOut  = Counter.builder("jobq_jobs_timed_out_total")
                .description("jobs failed by timeout").register(registry);
        this.resultSwept  = Counter.builder("jobq_results_swept_total")
                .description("result artifacts evicted by ttl").register(registry);
    }

    public void incSubmitted() { jobSubmitted.increment(); }
    public void incRejected()  { jobRejected.increment(); }
    public void incCompleted() { jobCompleted.increment(); }
    public void incFailed()    { jobFailed.increment(); }
    public void incTimedOut()  { jobTimedOut.increment(); }
    public void incSwept(int count) { resultSwept.increment(count); }

    // outcome 태그가 붙은 타이머 제공
    public Timer generationTimer(String outcome) {
        return Timer.builder("jobq_generation_duration_seconds")
                .description("generator duration by outcome")
                .tag("outcome", outcome)
                .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                .register(registry);
    }

    public void gauge(String name, String description, Supplier<Number> value) {
        Gauge.builder(name, value)
                .description(description)
                .register(registry);
    }
}
