package com.tripsync.server.migration.step;

import com.tripsync.pojo.entity.CostTrackingLink;
import com.tripsync.pojo.entity.FinanceData;
import com.tripsync.pojo.entity.Location;
import com.tripsync.pojo.entity.TripDocument;
import com.tripsync.server.document.LinkedItem;
import com.tripsync.server.document.TripDocuments;
import com.tripsync.server.migration.MigrationAction;
import com.tripsync.server.migration.MigrationContext;
import com.tripsync.server.migration.SchemaMigration;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * v2 → v3：关联列表规范化。
 * null 列表补成空列表；expenseId 为空的关联删除；同一条目上重复关联同一费用的只保留第一条；
 * 地点的 accommodationIds 去重去空。
 */
@Component
public class LinkNormalizationMigration implements SchemaMigration {

    @Override
    public int fromVersion() {
        return 2;
    }

    @Override
    public String description() {
        return "normalize link lists";
    }

    @Override
    public void migrate(TripDocument doc, MigrationContext context) {
        TripDocuments.ensureAccommodations(doc);
        FinanceData finance = doc.getFinance();
        if (finance != null && finance.getExpenses() == null) {
            finance.setExpenses(new ArrayList<>());
        }

        for (LinkedItem item : TripDocuments.linkedItems(doc)) {
            List<CostTrackingLink> links = item.mutableLinks();
            List<CostTrackingLink> kept = new ArrayList<>(links.size());
            Set<String> seen = new HashSet<>();
            for (CostTrackingLink link : links) {
                if (link == null || link.getExpenseId() == null || link.getExpenseId().isBlank()) {
                    context.record(MigrationAction.LINK_NORMALIZED, item.getType().getValue(), item.getId(), null,
                            "Removed blank expense link from " + item.describe());
                    continue;
                }
                if (!seen.add(link.getExpenseId())) {
                    context.record(MigrationAction.LINK_NORMALIZED, item.getType().getValue(), item.getId(),
                            link.getExpenseId(), "Removed duplicate expense link " + link.getExpenseId()
                                    + " from " + item.describe());
                    continue;
                }
                kept.add(link);
            }
            if (kept.size() != links.size()) {
                item.replaceLinks(kept);
            }
        }

        for (Location location : TripDocuments.locations(doc)) {
            if (location == null) {
                continue;
            }
            List<String> ids = TripDocuments.ensureAccommodationIds(location);
            Set<String> distinct = new LinkedHashSet<>();
            for (String id : ids) {
                if (id != null && !id.isBlank()) {
                    distinct.add(id);
                }
            }
            if (distinct.size() != ids.size()) {
                location.setAccommodationIds(new ArrayList<>(distinct));
                context.record(MigrationAction.LINK_NORMALIZED, "location", location.getId(), null,
                        "Normalized accommodation ids of location " + location.getId());
            }
        }
    }
}
