package com.tripsync.server.validation;

import com.tripsync.common.exception.TripValidationException;

/**
 * 关联校验未通过，携带完整的校验结果。
 */
public class LinkValidationException extends TripValidationException {

    private final LinkValidationResult result;

    public LinkValidationException(LinkValidationResult result) {
        super(result.getCode(), result.getError(), result.getMessages());
        this.result = result;
    }

    public LinkValidationResult getResult() {
        return result;
    }
}
