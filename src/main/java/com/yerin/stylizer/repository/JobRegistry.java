package com.yerin.stylizer.repository;

import com.yerin.stylizer.domain.Job;
import com.yerin.stylizer.domain.JobStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * 작업 상태 조회의 단일 출처.
 *
 * <p>같은 프로세스 안에서 read-your-writes 를 보장한다. 변경은 작업 ID 단위로 직렬화된다.
 */
public interface JobRegistry {

    /**
     * 새 작업을 등록한다.
     *
     * @throws IllegalStateException 같은 ID 가 이미 있는 경우
     */
    Job save(Job job);

    Optional<Job> findById(String id);

    /**
     * 현재 상태가 {@code expectedCurrent} 일 때만 {@code transition} 결과로 교체한다.
     *
     * @return 교체된 스냅샷. 상태가 달랐거나 작업이 없으면 empty
     */
    Optional<Job> updateIf(String id, JobStatus expectedCurrent, UnaryOperator<Job> transition);

    long countByStatus(JobStatus status);

    List<Job> findAllByStatus(JobStatus status);

    /** finishTime 이 cutoff 이전인 종료 작업을 삭제하고 삭제 건수를 돌려준다. */
    int deleteFinishedBefore(Instant cutoff);
}
