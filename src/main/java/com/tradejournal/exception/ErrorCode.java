package com.tradejournal.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Error codes returned in {@code ApiErrorResponse.code}, each with its HTTP status. */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    /** A broker export or YAML trade log could not be read or written. */
    TRADE_LOG_ERROR("TRADE_LOG_ERROR", 500),
    INTERNAL_ERROR("INTERNAL_ERROR", 500);

    private final String code;
    private final int httpStatus;
}
