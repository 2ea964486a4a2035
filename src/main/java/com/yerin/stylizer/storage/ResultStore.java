package com.yerin.stylizer.storage;

import com.yerin.stylizer.domain.ResultArtifact;

import java.time.Duration;
import java.util.Optional;

/**
 * 작업 ID 별 생성 결과 저장소.
 *
 * <p>작업 상태에 대해서는 아무것도 보장하지 않는다. 호출자는 먼저
 * {@link com.yerin.stylizer.repository.JobRegistry} 에서 COMPLETED 여부를 확인해야 한다.
 * 만료는 생성 시각 기준이며 마지막 접근 시각은 보지 않는다.
 */
public interface ResultStore {

    /**
     * 결과를 저장한다. 같은 ID 로 다시 저장하면 덮어쓴다.
     *
     * @return 저장 위치 참조
     */
    String put(String jobId, byte[] payload);

    /** 없거나 ttl 이 지난 결과는 empty. */
    Optional<ResultArtifact> get(String jobId);

    boolean delete(String jobId);

    /**
     * 생성 후 {@code ttl} 보다 오래된 결과를 삭제한다.
     *
     * @return 삭제 건수
     */
    int sweep(Duration ttl);
}
