package com.tripsync.server.validation;

import com.tripsync.pojo.dto.TravelItemRef;
import com.tripsync.pojo.entity.CostTrackingLink;
import com.tripsync.pojo.entity.Expense;
import com.tripsync.pojo.entity.TravelReference;
import com.tripsync.pojo.entity.TripDocument;
import com.tripsync.server.document.LinkedItem;
import com.tripsync.server.document.TripDocuments;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 行程边界校验：费用只能关联同一行程文档里的地点 / 住宿 / 路线。
 * 只看传入的这一个文档，别的行程里的 ID 在这里一律视为“不存在”。
 */
@Component
@Slf4j
public class TripBoundaryValidator {

    /**
     * 校验一次关联（或解除关联）请求。
     *
     * @param doc       已加载、已迁移的行程文档
     * @param expenseId 费用 ID
     * @param ref       目标条目；为 null 表示解除关联，此时只校验费用存在
     */
    public LinkValidationResult validateLink(TripDocument doc, String expenseId, TravelItemRef ref) {
        String tripId = doc.getId();
        List<LinkViolation> violations = new ArrayList<>(2);

        if (expenseId == null || !TripDocuments.expensesById(doc).containsKey(expenseId)) {
            violations.add(LinkViolation.expenseNotFound(expenseId, tripId));
        }
        if (ref != null && TripDocuments.findItem(doc, ref.getType(), ref.getId()).isEmpty()) {
            violations.add(LinkViolation.travelItemNotFound(ref.getType(), ref.getId(), tripId));
        }

        LinkValidationResult result = LinkValidationResult.of(violations);
        if (!result.isValid()) {
            log.info("关联校验未通过 tripId={}, expenseId={}, code={}, violations={}",
                    tripId, expenseId, result.getCode(), result.getMessages());
        }
        return result;
    }

    /**
     * 全量巡检一个行程：条目上指向不存在费用的关联，以及费用上指向不存在条目的引用。
     */
    public List<LinkViolation> validateAllTripBoundaries(TripDocument doc) {
        String tripId = doc.getId();
        Map<String, Expense> expenses = TripDocuments.expensesById(doc);
        List<LinkedItem> items = TripDocuments.linkedItems(doc);
        List<LinkViolation> violations = new ArrayList<>();

        for (LinkedItem item : items) {
            for (CostTrackingLink link : item.getLinks()) {
                if (link != null && !expenses.containsKey(link.getExpenseId())) {
                    violations.add(LinkViolation.expenseNotFound(link.getExpenseId(), tripId));
                }
            }
        }
        for (Expense expense : expenses.values()) {
            TravelReference ref = expense.getTravelReference();
            if (ref == null) {
                continue;
            }
            boolean found = items.stream().anyMatch(item -> item.isReferencedBy(ref));
            if (!found) {
                violations.add(LinkViolation.travelItemNotFound(ref.resolveType(), ref.getItemId(), tripId));
            }
        }
        return violations;
    }
}
