package com.tripsync.common.exception;

import com.tripsync.common.result.ErrorCode;

import java.util.Collections;
import java.util.List;

/**
 * 校验类异常：一次性携带全部违规信息，而不是只报第一条。
 */
public class TripValidationException extends BaseException {

    private final List<String> violations;

    public TripValidationException(ErrorCode errorCode, String message) {
        this(errorCode, message, Collections.singletonList(message));
    }

    public TripValidationException(ErrorCode errorCode, String message, List<String> violations) {
        super(errorCode, message);
        this.violations = violations == null ? Collections.emptyList() : List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
