package com.tripsync.server.migration.step;

import com.tripsync.pojo.entity.Accommodation;
import com.tripsync.pojo.entity.Expense;
import com.tripsync.pojo.entity.Location;
import com.tripsync.pojo.entity.TravelItemType;
import com.tripsync.pojo.entity.TravelReference;
import com.tripsync.pojo.entity.TripDocument;
import com.tripsync.server.document.LinkedItem;
import com.tripsync.server.document.TripDocuments;
import com.tripsync.server.migration.MigrationAction;
import com.tripsync.server.migration.MigrationContext;
import com.tripsync.server.migration.SchemaMigration;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * v6 → v7：补建被地点或费用引用、但已经丢失的住宿，并补回费用关联。
 * <p>
 * 补建的住宿标记 needsReview=true，交给人工确认。
 * 最后收口费用 → 条目方向：travelReference 指向不存在的地点/路线时清空。
 * </p>
 */
@Component
public class MissingAccommodationRepairMigration implements SchemaMigration {

    private static final String RECOVERED_NAME = "Recovered accommodation";

    @Override
    public int fromVersion() {
        return 6;
    }

    @Override
    public String description() {
        return "recreate missing accommodations";
    }

    @Override
    public void migrate(TripDocument doc, MigrationContext context) {
        Map<String, Accommodation> accommodations = TripDocuments.accommodationsById(doc);
        Collection<Expense> expenses = TripDocuments.expensesById(doc).values();

        for (Location location : TripDocuments.locations(doc)) {
            if (location == null || location.getAccommodationIds() == null) {
                continue;
            }
            for (String accommodationId : location.getAccommodationIds()) {
                if (accommodationId == null || accommodations.containsKey(accommodationId)) {
                    continue;
                }
                Accommodation placeholder = placeholder(accommodationId, location.getId(),
                        nameFor(accommodationId, expenses, location), context);
                TripDocuments.ensureAccommodations(doc).add(placeholder);
                accommodations.put(accommodationId, placeholder);
                context.record(MigrationAction.ACCOMMODATION_RECREATED, "accommodation", accommodationId,
                        location.getId(), "Recreated missing accommodation " + accommodationId
                                + " for location " + location.getId());
            }
        }

        for (Expense expense : expenses) {
            TravelReference ref = expense.getTravelReference();
            if (ref == null || ref.resolveType() != TravelItemType.ACCOMMODATION || ref.getItemId() == null) {
                continue;
            }
            String accommodationId = ref.getItemId();
            if (accommodations.containsKey(accommodationId)) {
                continue;
            }
            Accommodation placeholder = placeholder(accommodationId, null,
                    nameFor(accommodationId, expenses, null), context);
            TripDocuments.ensureAccommodations(doc).add(placeholder);
            accommodations.put(accommodationId, placeholder);
            context.warn(MigrationAction.ACCOMMODATION_RECREATED, "accommodation", accommodationId,
                    "Recreated missing accommodation " + accommodationId + " referenced by expense "
                            + expense.getId() + " without an owning location");
        }

        reattachLinks(doc, expenses, context);
        clearDanglingReferences(doc, expenses, context);
    }

    private void reattachLinks(TripDocument doc, Collection<Expense> expenses, MigrationContext context) {
        for (Expense expense : expenses) {
            TravelReference ref = expense.getTravelReference();
            if (ref == null || ref.resolveType() != TravelItemType.ACCOMMODATION) {
                continue;
            }
            TripDocuments.findItem(doc, TravelItemType.ACCOMMODATION, ref.getItemId()).ifPresent(item -> {
                if (!item.hasLink(expense.getId())) {
                    item.addLink(expense.getId(), expense.getDescription());
                    context.record(MigrationAction.LINK_REATTACHED, "accommodation", item.getId(), expense.getId(),
                            "Reattached expense link " + expense.getId() + " to accommodation " + item.getId());
                }
            });
        }
    }

    private void clearDanglingReferences(TripDocument doc, Collection<Expense> expenses, MigrationContext context) {
        List<LinkedItem> items = TripDocuments.linkedItems(doc);
        for (Expense expense : expenses) {
            TravelReference ref = expense.getTravelReference();
            if (ref == null) {
                continue;
            }
            boolean resolvable = ref.getItemId() != null
                    && items.stream().anyMatch(item -> item.isReferencedBy(ref));
            if (!resolvable) {
                expense.setTravelReference(null);
                context.record(MigrationAction.REFERENCE_CLEARED, "expense", expense.getId(), ref.getItemId(),
                        "Cleared travel reference of expense " + expense.getId() + " to missing "
                                + (ref.resolveType() == null ? "item" : ref.resolveType().getValue())
                                + " " + ref.getItemId());
            }
        }
    }

    private Accommodation placeholder(String id, String locationId, String name, MigrationContext context) {
        Accommodation accommodation = new Accommodation();
        accommodation.setId(id);
        accommodation.setName(name);
        accommodation.setLocationId(locationId);
        accommodation.setAccommodationData("");
        accommodation.setIsAccommodationPublic(false);
        accommodation.setCostTrackingLinks(new ArrayList<>());
        accommodation.setNeedsReview(true);
        accommodation.setCreatedAt(context.now());
        accommodation.setUpdatedAt(context.now());
        return accommodation;
    }

    /**
     * 优先用引用它的费用上的描述，其次按所属地点命名。
     */
    private String nameFor(String accommodationId, Collection<Expense> expenses, Location location) {
        for (Expense expense : expenses) {
            TravelReference ref = expense.getTravelReference();
            if (ref != null && ref.resolveType() == TravelItemType.ACCOMMODATION
                    && accommodationId.equals(ref.getItemId())
                    && ref.getDescription() != null && !ref.getDescription().isBlank()) {
                return ref.getDescription();
            }
        }
        if (location != null && location.getName() != null) {
            return "Accommodation in " + location.getName();
        }
        return RECOVERED_NAME;
    }
}
