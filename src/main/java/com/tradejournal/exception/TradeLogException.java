package com.tradejournal.exception;

/**
 * Thrown when a broker export or a YAML trade log cannot be read or written.
 *
 * <p>Only raised at the I/O boundary; reconstruction itself never throws it.
 */
public class TradeLogException extends BaseException {

    public TradeLogException(String message, Throwable cause) {
        super(ErrorCode.TRADE_LOG_ERROR, message, cause);
    }
}
