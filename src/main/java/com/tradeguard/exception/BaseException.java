package com.tradeguard.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Root of every exception this core raises on purpose. Carries an {@link ErrorCode} for
 * the REST layer and a details map for structured logging.
 *
 * <p>Risk rejections are never exceptions; only invariant violations, venue failures and
 * bad requests end up here.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
        this.details = Map.of();
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(message);
        this.errorCode = errorCode;
        this.details = details != null ? details : Map.of();
    }

    protected BaseException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = Map.of();
    }
}
