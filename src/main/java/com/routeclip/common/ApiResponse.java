package com.routeclip.common;

import com.routeclip.config.TraceIdFilter;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.slf4j.MDC;

/**
 * Envelope of every JSON answer. {@code traceId} is the id of the request that produced it, so a
 * client report can be matched to the server log.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ApiResponse<T> {

    public static final String OK = "OK";

    private String code;
    private String message;
    private T data;
    private String traceId;

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(OK, "Success", data, MDC.get(TraceIdFilter.TRACE_ID_MDC_KEY));
    }

    public static <T> ApiResponse<T> error(String code, String message, String traceId) {
        return new ApiResponse<>(code, message, null, traceId);
    }
}
