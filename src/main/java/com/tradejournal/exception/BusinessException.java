package com.tradejournal.exception;

import java.util.Map;

/** A well-formed request the journal cannot serve, such as an incomplete or reversed date range. */
public class BusinessException extends BaseException {

    public BusinessException(String message) {
        super(ErrorCode.BAD_REQUEST, message);
    }

    public BusinessException(String message, Map<String, Object> details) {
        super(ErrorCode.BAD_REQUEST, message, details);
    }
}
