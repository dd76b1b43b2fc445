package com.tripsync.server.link;

import com.tripsync.common.constant.StorageConstants;
import com.tripsync.pojo.entity.Accommodation;
import com.tripsync.pojo.entity.CostTrackingLink;
import com.tripsync.pojo.entity.Location;
import com.tripsync.pojo.entity.Route;
import com.tripsync.pojo.entity.TravelItemType;
import com.tripsync.server.document.ItineraryView;
import com.tripsync.server.document.LinkedItem;
import com.tripsync.server.document.TripDocuments;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 单个行程内「费用 ↔ 行程条目」的双向索引。
 * <p>
 * 正向：expenseId → 声明了该关联的条目描述；反向：(类型, 条目 ID) → 按声明顺序的 expenseId 列表。
 * 一次遍历地点、住宿、路线（含子路线）完成构建；只读，不触碰存储。
 * 重复关联只记一次，空 expenseId 忽略，不存在的费用不做校验。
 * </p>
 * rebuild 之后整体替换内部快照，读操作不需要加锁。
 */
public class TripLinkIndex {

    private final String tripId;
    private volatile Snapshot snapshot;

    private TripLinkIndex(String tripId, Snapshot snapshot) {
        this.tripId = tripId;
        this.snapshot = snapshot;
    }

    public static TripLinkIndex build(String tripId, ItineraryView view) {
        return new TripLinkIndex(tripId, Snapshot.of(view));
    }

    public static TripLinkIndex empty(String tripId) {
        return new TripLinkIndex(tripId, Snapshot.EMPTY);
    }

    /**
     * 用重新加载后的行程数据替换索引内容。
     */
    public void rebuild(ItineraryView view) {
        this.snapshot = Snapshot.of(view);
    }

    public String getTripId() {
        return tripId;
    }

    /**
     * 同一费用被多个条目关联时返回第一个声明的。
     */
    public Optional<TravelDescriptor> lookup(String expenseId) {
        List<TravelDescriptor> all = snapshot.forward.get(expenseId);
        return all == null || all.isEmpty() ? Optional.empty() : Optional.of(all.get(0));
    }

    public List<TravelDescriptor> lookupAll(String expenseId) {
        List<TravelDescriptor> all = snapshot.forward.get(expenseId);
        return all == null ? Collections.emptyList() : Collections.unmodifiableList(all);
    }

    public List<String> reverseLookup(TravelItemType kind, String itemId) {
        List<String> ids = snapshot.reverse.get(key(kind, itemId));
        return ids == null ? Collections.emptyList() : Collections.unmodifiableList(ids);
    }

    public boolean has(String expenseId) {
        return snapshot.forward.containsKey(expenseId);
    }

    public int size() {
        return snapshot.forward.size();
    }

    public Set<String> expenseIds() {
        return Collections.unmodifiableSet(snapshot.forward.keySet());
    }

    private static String key(TravelItemType kind, String itemId) {
        return kind.getValue() + ":" + itemId;
    }

    private static final class Snapshot {

        private static final Snapshot EMPTY = new Snapshot(Collections.emptyMap(), Collections.emptyMap());

        private final Map<String, List<TravelDescriptor>> forward;
        private final Map<String, List<String>> reverse;

        private Snapshot(Map<String, List<TravelDescriptor>> forward, Map<String, List<String>> reverse) {
            this.forward = forward;
            this.reverse = reverse;
        }

        static Snapshot of(ItineraryView view) {
            Map<String, List<TravelDescriptor>> forward = new LinkedHashMap<>();
            Map<String, List<String>> reverse = new LinkedHashMap<>();
            Map<String, String> locationNames = new HashMap<>();
            for (Location location : view.getLocations()) {
                if (location != null && location.getId() != null) {
                    locationNames.putIfAbsent(location.getId(), location.getName());
                }
            }
            String title = view.getTripTitle();

            for (Location location : view.getLocations()) {
                if (location != null) {
                    index(forward, reverse, LinkedItem.of(location),
                            TravelDescriptor.location(location.getId(), location.getName(), title));
                }
            }
            for (Accommodation accommodation : view.getAccommodations()) {
                if (accommodation != null) {
                    String locationName = locationNames.getOrDefault(accommodation.getLocationId(),
                            StorageConstants.UNKNOWN_LOCATION_NAME);
                    index(forward, reverse, LinkedItem.of(accommodation), TravelDescriptor.accommodation(
                            accommodation.getId(), accommodation.getName(), locationName, title));
                }
            }
            for (Route route : TripDocuments.flattenRoutes(view.getRoutes())) {
                index(forward, reverse, LinkedItem.of(route),
                        TravelDescriptor.route(route.getId(), LinkedItem.routeName(route), title));
            }
            return new Snapshot(forward, reverse);
        }

        private static void index(Map<String, List<TravelDescriptor>> forward, Map<String, List<String>> reverse,
                                  LinkedItem item, TravelDescriptor descriptor) {
            Set<String> declared = new LinkedHashSet<>();
            for (CostTrackingLink link : item.getLinks()) {
                if (link == null || link.getExpenseId() == null || link.getExpenseId().isBlank()) {
                    continue;
                }
                if (declared.add(link.getExpenseId())) {
                    forward.computeIfAbsent(link.getExpenseId(), k -> new ArrayList<>()).add(descriptor);
                }
            }
            if (!declared.isEmpty()) {
                reverse.computeIfAbsent(key(item.getType(), item.getId()), k -> new ArrayList<>()).addAll(declared);
            }
        }
    }
}
