package com.tripsync.server.migration.step;

import com.tripsync.pojo.entity.CostTrackingLink;
import com.tripsync.pojo.entity.Expense;
import com.tripsync.pojo.entity.TravelItemType;
import com.tripsync.pojo.entity.TravelReference;
import com.tripsync.pojo.entity.TripDocument;
import com.tripsync.server.document.LinkedItem;
import com.tripsync.server.document.TripDocuments;
import com.tripsync.server.migration.MigrationAction;
import com.tripsync.server.migration.MigrationContext;
import com.tripsync.server.migration.SchemaMigration;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * v4 → v5：补齐费用与行程条目之间的双向关联。
 * <p>
 * 第一轮：费用的 travelReference 指向存在的条目但条目上没有对应关联 → 在条目上补。
 * 第二轮：条目上的关联对应的费用没有 travelReference → 在费用上补；
 * 费用引用的是另一个存在的条目 → 以费用为准，删掉这条冲突关联；
 * 费用引用的住宿已不存在 → 同样以费用为准，住宿由 v6 → v7 补建；
 * 费用引用的地点或路线已不存在 → 改为引用当前条目。
 * 一轮执行后即为不动点。
 * </p>
 */
@Component
public class LinkSynchronizationMigration implements SchemaMigration {

    @Override
    public int fromVersion() {
        return 4;
    }

    @Override
    public String description() {
        return "synchronize bidirectional links";
    }

    @Override
    public void migrate(TripDocument doc, MigrationContext context) {
        List<LinkedItem> items = TripDocuments.linkedItems(doc);
        Map<String, Expense> expenses = TripDocuments.expensesById(doc);

        for (Expense expense : expenses.values()) {
            LinkedItem target = resolve(items, expense.getTravelReference());
            if (target != null && !target.hasLink(expense.getId())) {
                target.addLink(expense.getId(), expense.getDescription());
                context.record(MigrationAction.LINK_ADDED, target.getType().getValue(), target.getId(),
                        expense.getId(), "Added missing expense link " + expense.getId() + " to " + target.describe());
            }
        }

        for (LinkedItem item : items) {
            Iterator<CostTrackingLink> it = item.mutableLinks().iterator();
            while (it.hasNext()) {
                CostTrackingLink link = it.next();
                Expense expense = expenses.get(link.getExpenseId());
                if (expense == null) {
                    continue;
                }
                TravelReference ref = expense.getTravelReference();
                if (item.isReferencedBy(ref)) {
                    continue;
                }
                if (ref == null || ref.getItemId() == null) {
                    expense.setTravelReference(item.toReference());
                    context.record(MigrationAction.REFERENCE_ADDED, "expense", expense.getId(), item.getId(),
                            "Added travel reference to " + item.describe() + " on expense " + expense.getId());
                } else if (resolve(items, ref) != null || ref.resolveType() == TravelItemType.ACCOMMODATION) {
                    it.remove();
                    context.record(MigrationAction.CONFLICTING_LINK_REMOVED, item.getType().getValue(), item.getId(),
                            expense.getId(), "Removed conflicting expense link " + expense.getId() + " from "
                                    + item.describe() + ", expense references " + ref.resolveType().getValue()
                                    + " " + ref.getItemId());
                } else {
                    expense.setTravelReference(item.toReference());
                    context.record(MigrationAction.REFERENCE_REPLACED, "expense", expense.getId(), item.getId(),
                            "Replaced dangling travel reference " + ref.getItemId() + " on expense "
                                    + expense.getId() + " with " + item.describe());
                }
            }
        }
    }

    private LinkedItem resolve(List<LinkedItem> items, TravelReference ref) {
        if (ref == null || ref.getItemId() == null) {
            return null;
        }
        for (LinkedItem item : items) {
            if (item.isReferencedBy(ref)) {
                return item;
            }
        }
        return null;
    }
}
