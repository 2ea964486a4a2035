package com.yerin.stylizer.infra;

import com.yerin.stylizer.config.JobqProperties;
import com.yerin.stylizer.domain.Job;
import com.yerin.stylizer.domain.JobError;
import com.yerin.stylizer.domain.JobErrorKind;
import com.yerin.stylizer.domain.JobStatus;
import com.yerin.stylizer.domain.JobqMetrics;
import com.yerin.stylizer.domain.ResultArtifact;
import com.yerin.stylizer.generator.Generator;
import com.yerin.stylizer.generator.GeneratorException;
import com.yerin.stylizer.repository.InMemoryJobRegistry;
import com.yerin.stylizer.service.AdmissionGate;
import com.yerin.stylizer.storage.FileSystemResultStore;
import com.yerin.stylizer.storage.ResultStore;
import com.yerin.stylizer.support.TestImages;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.UnaryOperator;

import static org.assertj.core.api.Assertions.*;

@DisplayName("WorkerPool 실행/실패/타임아웃 테스트")
class WorkerPoolTest {

    @TempDir
    Path dir;

    Clock clock = Clock.systemUTC();
    InMemoryJobRegistry registry;
    AdmissionGate gate;
    FileSystemResultStore store;
    SimpleMeterRegistry meters;
    WorkerPool pool;

    @AfterEach
    void tearDown() {
        if (pool != null) pool.stop();
    }

    private void start(int concurrency, int maxQueue, Duration timeout, Generator generator) {
        start(concurrency, maxQueue, timeout, generator, UnaryOperator.identity());
    }

    private void start(int concurrency, int maxQueue, Duration timeout, Generator generator,
                       UnaryOperator<ResultStore> storeDecorator) {
        JobqProperties props = new JobqProperties();
        props.getWorker().setConcurrency(concurrency);
        props.getWorker().setTimeout(timeout);
        props.getWorker().setPollInterval(Duration.ofMillis(20));
        props.getQueue().setMaxSize(maxQueue);

        meters = new SimpleMeterRegistry();
        JobqMetrics metrics = new JobqMetrics(meters);
        registry = new InMemoryJobRegistry();
        gate = new AdmissionGate(registry, new InMemoryQueueAdapter(), clock, props, metrics);
        store = new FileSystemResultStore(dir, Duration.ofMinutes(15), clock);
        pool = new WorkerPool(gate, registry, storeDecorator.apply(store), generator, metrics, clock, props);
        pool.start();
    }

    private Job awaitTerminal(String jobId) {
        Awaitility.await()
                .atMost(Duration.ofSeconds(5))
                .pollInterval(Duration.ofMillis(20))
                .until(() -> registry.findById(jobId).map(j -> j.getStatus().isTerminal()).orElse(false));
        return registry.findById(jobId).orElseThrow();
    }

    @Test
    @DisplayName("성공하면 결과가 저장되고 COMPLETED 로 끝난다")
    void completes_and_stores_result() {
        start(1, 10, Duration.ofSeconds(5), p -> TestImages.png(p.width(), p.height()));

        gate.submit("ok", TestImages.params("p"));
        Job done = awaitTerminal("ok");

        assertThat(done.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(done.getResultRef()).endsWith("ok.png");
        assertThat(done.getStartTime()).isNotNull();
        assertThat(done.getFinishTime()).isAfterOrEqualTo(done.getStartTime());
        assertThat(store.get("ok")).isPresent();
        assertThat(gate.activeCount()).isZero();
        assertThat(meters.find("jobq_jobs_completed_total").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Generator 오류는 FAILED(generator_error) 이고 결과 파일이 없다")
    void generator_failure() {
        start(1, 10, Duration.ofSeconds(5), p -> {
            throw new GeneratorException("model exploded");
        });

        gate.submit("bad", TestImages.params("p"));
        Job done = awaitTerminal("bad");

        assertThat(done.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(done.getError().kind()).isEqualTo(JobErrorKind.GENERATOR_ERROR);
        assertThat(done.getError().message()).isEqualTo("model exploded");
        assertThat(done.getResultRef()).isNull();
        assertThat(store.get("bad")).isEmpty();
        assertThat(gate.activeCount()).isZero();
    }

    @Test
    @DisplayName("메모리 부족은 resource_exhausted 로 구분된다")
    void resource_exhausted() {
        start(1, 10, Duration.ofSeconds(5), p -> {
            throw new OutOfMemoryError("simulated");
        });

        gate.submit("oom", TestImages.params("p"));
        Job done = awaitTerminal("oom");

        assertThat(done.getError().kind()).isEqualTo(JobErrorKind.RESOURCE_EXHAUSTED);
    }

    @Test
    @DisplayName("예상치 못한 런타임 오류는 원인 메시지를 담은 generator_error")
    void unexpected_runtime_error() {
        start(1, 10, Duration.ofSeconds(5), p -> {
            throw new IllegalStateException("wrapper", new IllegalArgumentException("root cause"));
        });

        gate.submit("x", TestImages.params("p"));
        Job done = awaitTerminal("x");

        assertThat(done.getError().kind()).isEqualTo(JobErrorKind.GENERATOR_ERROR);
        assertThat(done.getError().message()).isEqualTo("root cause");
    }

    @Test
    @DisplayName("timeout 을 넘기면 FAILED(timeout) 이고 슬롯이 다음 작업을 받는다")
    void timeout_frees_slot() {
        CountDownLatch never = new CountDownLatch(1);
        start(1, 10, Duration.ofMillis(200), p -> {
            if (p.prompt().equals("slow")) {
                awaitQuietly(never, Duration.ofSeconds(30));
            }
            return TestImages.png(4, 4);
        });

        gate.submit("slow", TestImages.params("slow"));
        gate.submit("next", TestImages.params("fast"));

        Job slow = awaitTerminal("slow");
        Job next = awaitTerminal("next");

        assertThat(slow.getError().kind()).isEqualTo(JobErrorKind.TIMEOUT);
        assertThat(store.get("slow")).isEmpty();
        assertThat(next.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(meters.find("jobq_jobs_timed_out_total").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("동시성 1 에서는 제출 순서대로 시작한다")
    void fifo_with_single_slot() {
        List<String> started = Collections.synchronizedList(new ArrayList<>());
        start(1, 10, Duration.ofSeconds(5), p -> {
            started.add(p.prompt());
            return TestImages.png(4, 4);
        });

        for (int i = 0; i < 5; i++) {
            gate.submit("job-" + i, TestImages.params("p" + i));
        }
        awaitTerminal("job-4");

        assertThat(started).containsExactly("p0", "p1", "p2", "p3", "p4");
    }

    @Test
    @DisplayName("큐 10, 동시성 2 에서 12개 제출 시 10개 승인, 처리 중은 항상 2 이하")
    void capacity_and_concurrency_bound() {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);
        start(2, 10, Duration.ofSeconds(10), p -> {
            int now = running.incrementAndGet();
            maxRunning.accumulateAndGet(now, Math::max);
            try {
                awaitQuietly(release, Duration.ofSeconds(5));
                return TestImages.png(4, 4);
            } finally {
                running.decrementAndGet();
            }
        });

        int accepted = 0;
        for (int i = 0; i < 12; i++) {
            if (gate.submit("job-" + i, TestImages.params("p")).accepted()) accepted++;
        }

        assertThat(accepted).isEqualTo(10);
        Awaitility.await().atMost(Duration.ofSeconds(2)).until(() -> running.get() == 2);
        assertThat(registry.countByStatus(JobStatus.PROCESSING)).isEqualTo(2);
        assertThat(registry.countByStatus(JobStatus.QUEUED)).isEqualTo(8);

        release.countDown();
        Awaitility.await().atMost(Duration.ofSeconds(5))
                .until(() -> registry.countByStatus(JobStatus.COMPLETED) == 10);

        assertThat(maxRunning.get()).isLessThanOrEqualTo(2);
        assertThat(gate.activeCount()).isZero();
    }

    @Test
    @DisplayName("리퍼가 먼저 종료시킨 작업의 결과는 버려진다")
    void lost_race_discards_result() {
        start(1, 10, Duration.ofSeconds(5), p -> {
            // 생성 도중 lease 만료로 정리된 상황
            registry.updateIf("raced", JobStatus.PROCESSING,
                    j -> j.toFailed(clock.instant(), JobError.orphaned()));
            return TestImages.png(4, 4);
        });

        gate.submit("raced", TestImages.params("p"));
        Job done = awaitTerminal("raced");

        assertThat(done.getError().kind()).isEqualTo(JobErrorKind.ORPHANED);
        assertThat(store.get("raced")).isEmpty();
        assertThat(meters.find("jobq_jobs_completed_total").counter().count()).isZero();
    }

    @Test
    @DisplayName("결과 저장 중 Error 가 나도 작업은 FAILED(internal) 로 끝나고 슬롯은 다음 작업을 처리한다")
    void error_during_store_keeps_slot_alive() {
        AtomicBoolean thrown = new AtomicBoolean();
        start(1, 10, Duration.ofSeconds(5), p -> TestImages.png(4, 4),
                delegate -> new FailOnceResultStore(delegate, thrown));

        gate.submit("first", TestImages.params("p"));
        gate.submit("second", TestImages.params("p"));

        Job first = awaitTerminal("first");
        Job second = awaitTerminal("second");

        assertThat(first.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(first.getError().kind()).isEqualTo(JobErrorKind.INTERNAL);
        assertThat(second.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(gate.activeCount()).isZero();
    }

    /** 첫 put 에서만 StackOverflowError 를 던진다. */
    private static final class FailOnceResultStore implements ResultStore {
        private final ResultStore delegate;
        private final AtomicBoolean thrown;

        FailOnceResultStore(ResultStore delegate, AtomicBoolean thrown) {
            this.delegate = delegate;
            this.thrown = thrown;
        }

        @Override
        public String put(String jobId, byte[] payload) {
            if (thrown.compareAndSet(false, true)) {
                throw new StackOverflowError("simulated");
            }
            return delegate.put(jobId, payload);
        }

        @Override
        public Optional<ResultArtifact> get(String jobId) {
            return delegate.get(jobId);
        }

        @Override
        public boolean delete(String jobId) {
            return delegate.delete(jobId);
        }

        @Override
        public int sweep(Duration ttl) {
            return delegate.sweep(ttl);
        }
    }

    private static void awaitQuietly(CountDownLatch latch, Duration max) {
        try {
            latch.await(max.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GeneratorException("interrupted", e);
        }
    }
}
