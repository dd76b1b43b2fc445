package com.tripsync.server.validation;

import com.tripsync.common.result.ErrorCode;
import lombok.Data;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 关联校验结果。失败时 code 为 CROSS_TRIP_EXPENSE（费用校验失败，优先）或 CROSS_TRIP_TRAVEL_ITEM，
 * violations 列出全部违规，不会只报第一条。
 */
@Data
public class LinkValidationResult {

    private static final LinkValidationResult OK = new LinkValidationResult(null, null, Collections.emptyList());

    private final ErrorCode code;

    private final String error;

    private final List<LinkViolation> violations;

    public static LinkValidationResult ok() {
        return OK;
    }

    public static LinkValidationResult of(List<LinkViolation> violations) {
        if (violations.isEmpty()) {
            return OK;
        }
        boolean expenseFailed = violations.stream().anyMatch(v -> v.getCode() == ErrorCode.EXPENSE_NOT_FOUND);
        if (expenseFailed) {
            return new LinkValidationResult(ErrorCode.CROSS_TRIP_EXPENSE,
                    "Expense does not belong to this trip", List.copyOf(violations));
        }
        return new LinkValidationResult(ErrorCode.CROSS_TRIP_TRAVEL_ITEM,
                "Travel item does not belong to this trip", List.copyOf(violations));
    }

    public boolean isValid() {
        return code == null;
    }

    public List<String> getMessages() {
        return violations.stream().map(LinkViolation::getMessage).collect(Collectors.toList());
    }
}
