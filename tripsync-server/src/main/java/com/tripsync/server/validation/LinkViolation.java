package com.tripsync.server.validation;

import com.tripsync.common.result.ErrorCode;
import com.tripsync.pojo.entity.TravelItemType;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 单条关联校验违规。code 为 EXPENSE_NOT_FOUND 或 TRAVEL_ITEM_NOT_FOUND。
 */
@Data
@AllArgsConstructor
public class LinkViolation {

    private final ErrorCode code;

    /**
     * 违规对象为费用时为 null
     */
    private final TravelItemType itemType;

    private final String id;

    private final String message;

    public static LinkViolation expenseNotFound(String expenseId, String tripId) {
        return new LinkViolation(ErrorCode.EXPENSE_NOT_FOUND, null, expenseId,
                "Expense " + expenseId + " not found in trip " + tripId);
    }

    public static LinkViolation travelItemNotFound(TravelItemType type, String itemId, String tripId) {
        return new LinkViolation(ErrorCode.TRAVEL_ITEM_NOT_FOUND, type, itemId,
                "Travel item " + itemId + " not found in trip " + tripId);
    }
}
