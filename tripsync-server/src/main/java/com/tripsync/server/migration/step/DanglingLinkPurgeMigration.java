package com.tripsync.server.migration.step;

import com.tripsync.pojo.entity.CostTrackingLink;
import com.tripsync.pojo.entity.TripDocument;
import com.tripsync.server.document.LinkedItem;
import com.tripsync.server.document.TripDocuments;
import com.tripsync.server.migration.MigrationAction;
import com.tripsync.server.migration.MigrationContext;
import com.tripsync.server.migration.SchemaMigration;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.Set;

/**
 * v3 → v4：删除指向本行程中不存在的费用的关联。
 */
@Component
public class DanglingLinkPurgeMigration implements SchemaMigration {

    @Override
    public int fromVersion() {
        return 3;
    }

    @Override
    public String description() {
        return "purge dangling expense links";
    }

    @Override
    public void migrate(TripDocument doc, MigrationContext context) {
        Set<String> expenseIds = TripDocuments.expensesById(doc).keySet();
        for (LinkedItem item : TripDocuments.linkedItems(doc)) {
            Iterator<CostTrackingLink> it = item.mutableLinks().iterator();
            while (it.hasNext()) {
                CostTrackingLink link = it.next();
                String expenseId = link == null ? null : link.getExpenseId();
                if (expenseId != null && expenseIds.contains(expenseId)) {
                    continue;
                }
                it.remove();
                context.record(MigrationAction.DANGLING_LINK_REMOVED, item.getType().getValue(), item.getId(),
                        expenseId, "Removed invalid expense link " + expenseId + " from " + item.describe());
            }
        }
    }
}
