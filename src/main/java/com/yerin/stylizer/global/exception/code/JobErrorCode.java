package com.yerin.stylizer.global.exception.code;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum JobErrorCode implements ErrorCode {
    JOB_NOT_FOUND(HttpStatus.NOT_FOUND, "작업을 찾을 수 없습니다.", "JOB-001"),
    QUEUE_FULL(HttpStatus.SERVICE_UNAVAILABLE, "대기열이 가득 찼습니다. 잠시 후 다시 시도해 주세요.", "JOB-002"),
    JOB_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "작업이 실패했습니다.", "JOB-003"),
    RESULT_MISSING(HttpStatus.INTERNAL_SERVER_ERROR, "완료된 작업의 결과 파일이 없습니다.", "JOB-004"),
    INVALID_IMAGE(HttpStatus.BAD_REQUEST, "이미지 파일이 올바르지 않습니다.", "JOB-005"),
    PROFILES_NOT_FOUND(HttpStatus.NOT_FOUND, "프로필 파일을 찾을 수 없습니다.", "JOB-006");

    private final HttpStatus httpStatus;
    private final String message;
    private final String code;
}
