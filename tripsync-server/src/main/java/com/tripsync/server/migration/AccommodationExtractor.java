package com.tripsync.server.migration;

import com.tripsync.pojo.entity.Accommodation;
import com.tripsync.pojo.entity.CostTrackingLink;
import com.tripsync.pojo.entity.Expense;
import com.tripsync.pojo.entity.Location;
import com.tripsync.pojo.entity.TravelItemType;
import com.tripsync.pojo.entity.TravelReference;
import com.tripsync.pojo.entity.TripDocument;
import com.tripsync.server.document.TripDocuments;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 把内嵌在 Location 上的住宿信息抽成独立的 Accommodation。
 * <p>
 * 同时识别早期抽取不完整留下的形态：
 * 1. 地点上仍残留 accommodationData，而同内容的住宿已经存在；
 * 2. 住宿类费用关联仍挂在地点上，而该地点只拥有唯一一个住宿。
 * 两种情况都收敛到同一个最终状态，重复执行不会再产生变化。
 * </p>
 */
@Component
public class AccommodationExtractor {

    private static final String ACCOMMODATION_ID_PREFIX = "acc-";
    private static final int MAX_NAME_LENGTH = 80;

    public void extract(TripDocument doc, MigrationContext context) {
        List<Location> locations = TripDocuments.locations(doc);
        if (locations.isEmpty()) {
            return;
        }
        Map<String, Expense> expenses = TripDocuments.expensesById(doc);
        for (Location location : locations) {
            if (location == null || location.getId() == null) {
                continue;
            }
            String embedded = location.getAccommodationData();
            if (embedded != null && !embedded.isBlank()) {
                Accommodation target = findExtracted(doc, location, embedded);
                if (target == null) {
                    target = createFromEmbedded(doc, location, embedded, context);
                }
                List<String> ids = TripDocuments.ensureAccommodationIds(location);
                if (!ids.contains(target.getId())) {
                    ids.add(target.getId());
                }
                location.setAccommodationData(null);
                location.setIsAccommodationPublic(null);
                moveAccommodationLinks(location, target, expenses, context);
            } else {
                Accommodation single = singleOwnedAccommodation(doc, location);
                if (single != null) {
                    moveAccommodationLinks(location, single, expenses, context);
                }
            }
        }
    }

    private Accommodation findExtracted(TripDocument doc, Location location, String embedded) {
        for (Accommodation accommodation : TripDocuments.accommodations(doc)) {
            if (accommodation != null
                    && location.getId().equals(accommodation.getLocationId())
                    && embedded.equals(accommodation.getAccommodationData())) {
                return accommodation;
            }
        }
        return null;
    }

    private Accommodation createFromEmbedded(TripDocument doc, Location location, String embedded,
                                             MigrationContext context) {
        Accommodation accommodation = new Accommodation();
        accommodation.setId(uniqueId(doc, ACCOMMODATION_ID_PREFIX + location.getId()));
        accommodation.setName(deriveName(embedded, location.getName()));
        accommodation.setLocationId(location.getId());
        accommodation.setAccommodationData(embedded);
        accommodation.setIsAccommodationPublic(Boolean.TRUE.equals(location.getIsAccommodationPublic()));
        accommodation.setCostTrackingLinks(new ArrayList<>());
        accommodation.setCreatedAt(context.now());
        TripDocuments.ensureAccommodations(doc).add(accommodation);
        context.record(MigrationAction.ACCOMMODATION_EXTRACTED, "accommodation", accommodation.getId(),
                location.getId(), "Extracted accommodation " + accommodation.getId()
                        + " from location " + location.getId());
        return accommodation;
    }

    private Accommodation singleOwnedAccommodation(TripDocument doc, Location location) {
        List<Accommodation> owned = TripDocuments.accommodations(doc).stream()
                .filter(a -> a != null && location.getId().equals(a.getLocationId()))
                .collect(Collectors.toList());
        return owned.size() == 1 ? owned.get(0) : null;
    }

    private void moveAccommodationLinks(Location location, Accommodation target, Map<String, Expense> expenses,
                                        MigrationContext context) {
        List<CostTrackingLink> links = location.getCostTrackingLinks();
        if (links == null || links.isEmpty()) {
            return;
        }
        if (target.getCostTrackingLinks() == null) {
            target.setCostTrackingLinks(new ArrayList<>());
        }
        Set<String> existing = target.getCostTrackingLinks().stream()
                .map(CostTrackingLink::getExpenseId)
                .collect(Collectors.toSet());
        Iterator<CostTrackingLink> it = links.iterator();
        while (it.hasNext()) {
            CostTrackingLink link = it.next();
            if (link == null) {
                continue;
            }
            Expense expense = expenses.get(link.getExpenseId());
            if (!isAccommodationExpense(expense, location)) {
                continue;
            }
            it.remove();
            if (existing.add(link.getExpenseId())) {
                target.getCostTrackingLinks().add(link);
            }
            TravelReference ref = expense.getTravelReference();
            if (ref == null || ref.resolveType() == TravelItemType.LOCATION) {
                expense.setTravelReference(TravelReference.of(TravelItemType.ACCOMMODATION, target.getId(),
                        ref != null && ref.getDescription() != null ? ref.getDescription() : target.getName()));
            }
            context.record(MigrationAction.LINK_MOVED, "accommodation", target.getId(), link.getExpenseId(),
                    "Moved expense link " + link.getExpenseId() + " from location " + location.getId()
                            + " to accommodation " + target.getId());
        }
    }

    /**
     * 住宿类费用：明确引用了住宿，或分类名看起来是住宿。
     * 已明确引用其他地点的费用不动。
     */
    static boolean isAccommodationExpense(Expense expense, Location location) {
        if (expense == null) {
            return false;
        }
        TravelReference ref = expense.getTravelReference();
        if (ref != null && ref.resolveType() == TravelItemType.ACCOMMODATION) {
            return true;
        }
        if (ref != null && ref.resolveType() == TravelItemType.LOCATION
                && ref.getItemId() != null && !ref.getItemId().equals(location.getId())) {
            return false;
        }
        if (ref != null && ref.resolveType() == TravelItemType.ROUTE) {
            return false;
        }
        String category = expense.getCategory();
        if (category == null) {
            return false;
        }
        String c = category.toLowerCase(Locale.ROOT);
        return c.contains("accommodation") || c.contains("lodging") || c.contains("hotel");
    }

    private static String uniqueId(TripDocument doc, String base) {
        Set<String> taken = TripDocuments.accommodationsById(doc).keySet();
        if (!taken.contains(base)) {
            return base;
        }
        int n = 2;
        while (taken.contains(base + "-" + n)) {
            n++;
        }
        return base + "-" + n;
    }

    /**
     * 名称取 YAML frontmatter 的 name 字段，否则取第一行非空文本。
     */
    static String deriveName(String embedded, String locationName) {
        String firstLine = null;
        for (String raw : embedded.split("\\R")) {
            String line = raw.trim();
            if (line.isEmpty() || "---".equals(line)) {
                continue;
            }
            if (line.toLowerCase(Locale.ROOT).startsWith("name:")) {
                String value = stripQuotes(line.substring("name:".length()).trim());
                if (!value.isEmpty()) {
                    return truncate(value);
                }
            }
            if (firstLine == null) {
                firstLine = line.replaceFirst("^#+\\s*", "");
            }
        }
        if (firstLine != null && !firstLine.isEmpty() && !firstLine.contains(":")) {
            return truncate(firstLine);
        }
        return locationName == null ? "Accommodation" : "Accommodation in " + locationName;
    }

    private static String stripQuotes(String value) {
        if (value.length() >= 2
                && (value.startsWith("\"") && value.endsWith("\"") || value.startsWith("'") && value.endsWith("'"))) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }

    private static String truncate(String value) {
        return value.length() > MAX_NAME_LENGTH ? value.substring(0, MAX_NAME_LENGTH) : value;
    }
}
