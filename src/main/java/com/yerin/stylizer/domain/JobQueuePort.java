package com.yerin.stylizer.domain;

import java.util.List;
import java.util.Optional;

/**
 * 승인된 작업 ID 의 FIFO 큐.
 *
 * <p>enqueue 는 1부터 증가하는 순번을 돌려준다. 큐는 앞에서만 꺼내므로
 * 대기 중인 작업의 순위는 {@code sequence - dequeuedTotal()} 로 바로 계산된다.
 */
public interface JobQueuePort {

    long enqueue(String jobId);

    Optional<String> poll();

    int size();

    long enqueuedTotal();

    long dequeuedTotal();

    /** 현재 대기 중인 작업 ID 를 제출 순서대로. */
    List<String> snapshot();
}
