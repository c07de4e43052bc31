package com.tradejournal.api.dto.response;

import com.tradejournal.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Error body for every failed journal request. {@code details} holds per-field validation messages,
 * or the resource and identifier of a not-found error.
 */
@Getter
@Builder
public class ApiErrorResponse {

    @Builder.Default
    private final boolean success = false;

    private final int status;
    private final String code;
    private final String message;
    private final Map<String, Object> details;
    private final String path;
    private final Instant timestamp;

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return ApiErrorResponse.builder()
                .status(errorCode.getHttpStatus())
                .code(errorCode.getCode())
                .message(message)
                .details(details == null || details.isEmpty() ? null : details)
                .path(path)
                .timestamp(Instant.now())
                .build();
    }
}
