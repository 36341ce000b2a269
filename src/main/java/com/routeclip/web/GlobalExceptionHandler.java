package com.routeclip.web;

import com.routeclip.common.ApiResponse;
import com.routeclip.common.BusinessException;
import com.routeclip.common.IngestException;
import com.routeclip.common.MissingUserIdentityException;
import com.routeclip.common.VideoNotFoundException;
import com.routeclip.common.VideoNotReadyException;
import com.routeclip.config.TraceIdFilter;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.validation.BindingResult;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.UUID;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(IngestException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public ApiResponse<Void> handleIngestException(IngestException e) {
        String traceId = getTraceId();
        log.error("Ingest failed: message={}, traceId={}", e.getMessage(), traceId, e.getCause());
        return ApiResponse.error(e.getCode(), e.getMessage(), traceId);
    }

    @ExceptionHandler(VideoNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public ApiResponse<Void> handleNotFound(VideoNotFoundException e) {
        return ApiResponse.error(e.getCode(), e.getMessage(), getTraceId());
    }

    @ExceptionHandler(VideoNotReadyException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public ApiResponse<Void> handleNotReady(VideoNotReadyException e) {
        return ApiResponse.error(e.getCode(), e.getMessage(), getTraceId());
    }

    @ExceptionHandler(MissingUserIdentityException.class)
    @ResponseStatus(HttpStatus.UNAUTHORIZED)
    public ApiResponse<Void> handleMissingIdentity(MissingUserIdentityException e) {
        return ApiResponse.error(e.getCode(), e.getMessage(), getTraceId());
    }

    @ExceptionHandler(BusinessException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ApiResponse<Void> handleBusinessException(BusinessException e) {
        String traceId = getTraceId();
        log.warn("Business exception: code={}, message={}, traceId={}", e.getCode(), e.getMessage(), traceId);
        return ApiResponse.error(e.getCode(), e.getMessage(), traceId);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ApiResponse<Void> handleValidationException(MethodArgumentNotValidException e) {
        String traceId = getTraceId();
        BindingResult bindingResult = e.getBindingResult();
        String message = bindingResult.getFieldErrors().stream()
                .map(fieldError -> fieldError.getField() + ": " + fieldError.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("Validation failed: {}, traceId={}", message, traceId);
        return ApiResponse.error("VALIDATION_ERROR", message, traceId);
    }

    @ExceptionHandler({ConstraintViolationException.class, MissingServletRequestPartException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ApiResponse<Void> handleBadRequest(Exception e) {
        String traceId = getTraceId();
        log.warn("Bad request: {}, traceId={}", e.getMessage(), traceId);
        return ApiResponse.error("VALIDATION_ERROR", e.getMessage(), traceId);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    @ResponseStatus(HttpStatus.PAYLOAD_TOO_LARGE)
    public ApiResponse<Void> handleTooLarge(MaxUploadSizeExceededException e) {
        return ApiResponse.error("UPLOAD_TOO_LARGE", "Upload exceeds the size limit", getTraceId());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public ApiResponse<Void> handleException(Exception e) {
        String traceId = getTraceId();
        log.error("Unhandled exception: traceId={}", traceId, e);
        return ApiResponse.error("INTERNAL_ERROR", "Internal server error", traceId);
    }

    private String getTraceId() {
        String traceId = MDC.get(TraceIdFilter.TRACE_ID_MDC_KEY);
        return traceId != null ? traceId : UUID.randomUUID().toString();
    }
}
