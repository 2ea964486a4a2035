package com.yerin.stylizer.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Objects;

/**
 * 작업 레코드의 불변 스냅샷.
 *
 * <p>상태 변경은 {@code toProcessing / toCompleted / toFailed} 로 새 스냅샷을 만들어
 * {@link com.yerin.stylizer.repository.JobRegistry} 에 교체하는 방식으로만 일어난다.
 * <ul>
 *     <li>startTime 은 QUEUED 일 때만 비어 있다.</li>
 *     <li>finishTime 은 COMPLETED / FAILED 일 때만 존재한다.</li>
 *     <li>resultRef 와 error 는 종료 시점에 둘 중 하나만 설정된다.</li>
 * </ul>
 */
@Getter
@ToString(exclude = "parameters")
@Builder(toBuilder = true, access = AccessLevel.PRIVATE)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class Job {

    private final String id;

    /** 승인 순번(1부터). FIFO 순서와 대기 순위 계산에 쓰인다. */
    private final long sequence;

    private final GenerationParameters parameters;
    private final JobStatus status;
    private final Instant submitTime;
    private final Instant startTime;
    private final Instant finishTime;
    private final Instant leaseUntil;
    private final String resultRef;
    private final JobError error;

    public static Job queued(String id, long sequence, GenerationParameters parameters, Instant submitTime) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(parameters, "parameters");
        Objects.requireNonNull(submitTime, "submitTime");
        return Job.builder()
                .id(id)
                .sequence(sequence)
                .parameters(parameters)
                .status(JobStatus.QUEUED)
                .submitTime(submitTime)
                .build();
    }

    public Job toProcessing(Instant now, Instant leaseUntil) {
        requireTransition(JobStatus.PROCESSING);
        return toBuilder()
                .status(JobStatus.PROCESSING)
                .startTime(now)
                .leaseUntil(leaseUntil)
                .build();
    }

    public Job toCompleted(Instant now, String resultRef) {
        requireTransition(JobStatus.COMPLETED);
        Objects.requireNonNull(resultRef, "resultRef");
        return toBuilder()
                .status(JobStatus.COMPLETED)
                .finishTime(now)
                .leaseUntil(null)
                .resultRef(resultRef)
                .build();
    }

    public Job toFailed(Instant now, JobError error) {
        requireTransition(JobStatus.FAILED);
        Objects.requireNonNull(error, "error");
        return toBuilder()
                .status(JobStatus.FAILED)
                .finishTime(now)
                .leaseUntil(null)
                .error(error)
                .build();
    }

    public boolean isLeaseExpired(Instant now) {
        return status == JobStatus.PROCESSING && leaseUntil != null && !leaseUntil.isAfter(now);
    }

    private void requireTransition(JobStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("illegal transition " + status + " -> " + next + " for job " + id);
        }
    }
}
