package com.yerin.stylizer.infra;

import com.yerin.stylizer.domain.JobQueuePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

@Slf4j
@Component
public class InMemoryQueueAdapter implements JobQueuePort {

    private final Deque<String> queue = new ArrayDeque<>();
    private long enqueued;
    private long dequeued;

    @Override
    public synchronized long enqueue(String jobId) {
        queue.addLast(jobId);
        enqueued++;
        log.debug("[InMemoryQueue] enqueue jobId={}, seq={}, size={}", jobId, enqueued, queue.size());
        return enqueued;
    }

    @Override
    public synchronized Optional<String> poll() {
        String jobId = queue.pollFirst();
        if (jobId != null) {
            dequeued++;
        }
        return Optional.ofNullable(jobId);
    }

    @Override
    public synchronized int size() {
        return queue.size();
    }

    @Override
    public synchronized long enqueuedTotal() {
        return enqueued;
    }

    @Override
    public synchronized long dequeuedTotal() {
        return dequeued;
    }

    @Override
    public synchronized List<String> snapshot() {
        return List.copyOf(queue);
    }
}
