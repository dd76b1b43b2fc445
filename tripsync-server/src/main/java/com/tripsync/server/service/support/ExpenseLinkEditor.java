package com.tripsync.server.service.support;

import com.tripsync.pojo.dto.TravelItemRef;
import com.tripsync.pojo.entity.Expense;
import com.tripsync.pojo.entity.TripDocument;
import com.tripsync.server.document.LinkedItem;
import com.tripsync.server.document.TripDocuments;
import org.springframework.stereotype.Component;

/**
 * 在已通过边界校验的文档上建立或解除一条双向关联。
 * 一个费用同一时间只关联一个条目：先从所有条目上摘掉旧关联，再挂到新条目。
 */
@Component
public class ExpenseLinkEditor {

    /**
     * @param ref         目标条目，null 表示只解除关联
     * @param description 条目一侧关联的描述，为空时用条目名称
     */
    public void apply(TripDocument doc, String expenseId, TravelItemRef ref, String description) {
        Expense expense = TripDocuments.expensesById(doc).get(expenseId);
        if (expense == null) {
            throw new IllegalStateException("Expense " + expenseId + " vanished after validation");
        }
        for (LinkedItem item : TripDocuments.linkedItems(doc)) {
            item.removeLink(expenseId);
        }
        if (ref == null) {
            expense.setTravelReference(null);
            return;
        }
        LinkedItem target = TripDocuments.findItem(doc, ref.getType(), ref.getId())
                .orElseThrow(() -> new IllegalStateException("Travel item " + ref.getId() + " vanished after validation"));
        String linkDescription = description == null || description.isBlank() ? target.getName() : description;
        target.addLink(expenseId, linkDescription);
        expense.setTravelReference(target.toReference());
    }
}
