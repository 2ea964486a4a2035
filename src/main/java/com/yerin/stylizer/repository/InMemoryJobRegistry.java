package com.yerin.stylizer.repository;

import com.yerin.stylizer.domain.Job;
import com.yerin.stylizer.domain.JobStatus;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * 프로세스 메모리에 작업 레코드를 보관한다. 재시작 시 유지되지 않는다.
 */
@Repository
public class InMemoryJobRegistry implements JobRegistry {

    private final Map<String, Job> jobs = new ConcurrentHashMap<>();

    @Override
    public Job save(Job job) {
        Job prev = jobs.putIfAbsent(job.getId(), job);
        if (prev != null) {
            throw new IllegalStateException("job already registered: " + job.getId());
        }
        return job;
    }

    @Override
    public Optional<Job> findById(String id) {
        return Optional.ofNullable(jobs.get(id));
    }

    @Override
    public Optional<Job> updateIf(String id, JobStatus expectedCurrent, UnaryOperator<Job> transition) {
        AtomicReference<Job> updated = new AtomicReference<>();
        jobs.computeIfPresent(id, (key, current) -> {
            if (current.getStatus() != expectedCurrent) {
                return current;
            }
            Job next = transition.apply(current);
            updated.set(next);
            return next;
        });
        return Optional.ofNullable(updated.get());
    }

    @Override
    public long countByStatus(JobStatus status) {
        return jobs.values().stream()
                .filter(j -> j.getStatus() == status)
                .count();
    }

    @Override
    public List<Job> findAllByStatus(JobStatus status) {
        return jobs.values().stream()
                .filter(j -> j.getStatus() == status)
                .sorted(Comparator.comparingLong(Job::getSequence))
                .toList();
    }

    @Override
    public int deleteFinishedBefore(Instant cutoff) {
        AtomicInteger removed = new AtomicInteger();
        for (String id : jobs.keySet()) {
            jobs.computeIfPresent(id, (key, job) -> {
                if (job.getStatus().isTerminal() && job.getFinishTime().isBefore(cutoff)) {
                    removed.incrementAndGet();
                    return null;
                }
                return job;
            });
        }
        return removed.get();
    }
}
