package com.yerin.stylizer.global.exception;

import com.yerin.stylizer.global.dto.ErrorResponse;
import com.yerin.stylizer.global.exception.code.CommonErrorCode;
import com.yerin.stylizer.global.exception.code.ErrorCode;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@Slf4j
@RestControllerAdvice
public class ExceptionController {

    @ExceptionHandler(AppException.class)
    public ResponseEntity<ErrorResponse> handleAppException(AppException e,
                                                            HttpServletRequest request) {
        ErrorCode errorCode = e.getErrorCode();
        if (errorCode.getHttpStatus().is5xxServerError()) {
            log.error("AppException: {}, path={} {}", errorCode.getMessage(),
                    request.getMethod(), request.getRequestURI());
        } else {
            log.warn("AppException: {}, path={} {}", errorCode.getMessage(),
                    request.getMethod(), request.getRequestURI());
        }
        return respond(errorCode, request);
    }

    // MethodArgumentNotValidException 도 BindException 하위 타입
    @ExceptionHandler(BindException.class)
    public ResponseEntity<ErrorResponse> handleValidation(BindException e,
                                                          HttpServletRequest request) {
        FieldError fieldError = e.getBindingResult().getFieldError();
        String msg = (fieldError != null)
                ? fieldError.getField() + ": " + fieldError.getDefaultMessage()
                : "입력값이 유효하지 않습니다.";

        log.warn("Validation failed: {}, path={} {}", msg,
                request.getMethod(), request.getRequestURI());
        return respond(CommonErrorCode.INVALID_PARAMETER.withDetail(msg), request);
    }

    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ErrorResponse> handleMissingPart(MissingServletRequestPartException e,
                                                           HttpServletRequest request) {
        log.warn("Missing part: {}, path={} {}", e.getRequestPartName(),
                request.getMethod(), request.getRequestURI());
        return respond(CommonErrorCode.BAD_REQUEST.withDetail("필수 파트가 없습니다: " + e.getRequestPartName()), request);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleUploadSize(MaxUploadSizeExceededException e,
                                                          HttpServletRequest request) {
        log.warn("Upload too large: max={}, path={} {}", e.getMaxUploadSize(),
                request.getMethod(), request.getRequestURI());
        return respond(CommonErrorCode.PAYLOAD_TOO_LARGE, request);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoResource(NoResourceFoundException e,
                                                          HttpServletRequest request) {
        return respond(CommonErrorCode.NOT_FOUND, request);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethod(HttpRequestMethodNotSupportedException e,
                                                      HttpServletRequest request) {
        return respond(CommonErrorCode.METHOD_NOT_ALLOWED, request);
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMediaType(HttpMediaTypeNotSupportedException e,
                                                         HttpServletRequest request) {
        return respond(CommonErrorCode.UNSUPPORTED_MEDIA_TYPE, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAll(Exception e,
                                                   HttpServletRequest request) {
        log.error("Unhandled exception: ", e);
        return respond(CommonErrorCode.INTERNAL_SERVER_ERROR, request);
    }

    private ResponseEntity<ErrorResponse> respond(ErrorCode errorCode, HttpServletRequest request) {
        ErrorResponse body = ErrorResponse.of(errorCode, request);
        return ResponseEntity.status(errorCode.getHttpStatus()).body(body);
    }
}
