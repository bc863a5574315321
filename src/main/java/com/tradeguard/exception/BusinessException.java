package com.tradeguard.exception;

import java.util.Map;

/**
 * A request that is well-formed but not acceptable in the current state, e.g. clearing
 * the kill switch without naming an operator.
 */
public class BusinessException extends BaseException {

    public BusinessException(String message) {
        super(ErrorCode.BAD_REQUEST, message);
    }

    public BusinessException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }
}
