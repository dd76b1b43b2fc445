package com.tripsync.server.service.support;

import com.tripsync.pojo.entity.Location;
import com.tripsync.pojo.entity.Route;
import com.tripsync.pojo.entity.TripUpdate;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 根据行程安排的前后差异生成公开动态：新增地点、取消行程、改期、新增路线、新增帖子。
 */
@Component
public class TripUpdateBuilder {

    private static final DateTimeFormatter DAY_FORMAT = DateTimeFormatter.ofPattern("MMM d, yyyy", Locale.ENGLISH);

    /** 地点上的帖子列表字段，统一以 id 或 url 去重 */
    private static final Map<String, String> POST_FIELDS = new LinkedHashMap<>();

    static {
        POST_FIELDS.put("instagramPosts", "Instagram");
        POST_FIELDS.put("tikTokPosts", "TikTok");
        POST_FIELDS.put("blogPosts", "blog");
    }

    /**
     * @param previousLocations 修改前的地点，null 视为空
     * @param nextLocations     提交的地点，null 表示本次没有修改地点
     * @param previousRoutes    修改前的路线
     * @param nextRoutes        提交的路线，null 表示本次没有修改路线
     */
    public List<TripUpdate> build(List<Location> previousLocations, List<Location> nextLocations,
                                  List<Route> previousRoutes, List<Route> nextRoutes, Instant now) {
        List<TripUpdate> updates = new ArrayList<>();
        if (nextLocations != null) {
            Map<String, Location> before = byId(previousLocations);
            Set<String> after = new HashSet<>();
            for (Location location : nextLocations) {
                if (location != null) {
                    after.add(location.getId());
                }
            }
            for (Location location : nextLocations) {
                if (location != null && !before.containsKey(location.getId())) {
                    updates.add(update(now, "New trip location added: " + locationReference(location) + "."));
                }
            }
            for (Location old : before.values()) {
                if (!after.contains(old.getId())) {
                    String range = formatRange(old);
                    updates.add(update(now, range.isEmpty()
                            ? "Visit to " + old.getName() + " cancelled."
                            : "Visit to " + old.getName() + " on " + range + " cancelled."));
                }
            }
            for (Location location : nextLocations) {
                Location old = location == null ? null : before.get(location.getId());
                if (old == null) {
                    continue;
                }
                String oldRange = formatRange(old);
                String newRange = formatRange(location);
                if (!oldRange.isEmpty() && !newRange.isEmpty() && !oldRange.equals(newRange)) {
                    updates.add(update(now, "Visit to " + location.getName() + " on " + oldRange
                            + " rescheduled to " + newRange + "."));
                }
                for (Map.Entry<String, String> field : POST_FIELDS.entrySet()) {
                    int added = countNewPosts(old.getExtraProperties().get(field.getKey()),
                            location.getExtraProperties().get(field.getKey()));
                    if (added > 0) {
                        updates.add(update(now, "New " + field.getValue() + " " + (added == 1 ? "post" : "posts")
                                + " added to the " + visitReference(location) + "."));
                    }
                }
            }
        }
        if (nextRoutes != null) {
            Set<String> before = new HashSet<>();
            if (previousRoutes != null) {
                for (Route route : previousRoutes) {
                    if (route != null) {
                        before.add(route.getId());
                    }
                }
            }
            for (Route route : nextRoutes) {
                if (route == null || before.contains(route.getId()) || route.getFrom() == null || route.getTo() == null) {
                    continue;
                }
                String transport = route.getType() == null ? "travel" : route.getType().toLowerCase(Locale.ROOT);
                updates.add(update(now, "New " + transport + " route added between " + route.getFrom()
                        + " and " + route.getTo() + "."));
            }
        }
        return updates;
    }

    /**
     * 新动态插到最前面，超出上限的旧动态丢弃。
     */
    public List<TripUpdate> prepend(List<TripUpdate> existing, List<TripUpdate> fresh, int limit) {
        List<TripUpdate> merged = new ArrayList<>(fresh);
        if (existing != null) {
            merged.addAll(existing);
        }
        return merged.size() > limit ? new ArrayList<>(merged.subList(0, limit)) : merged;
    }

    private Map<String, Location> byId(List<Location> locations) {
        Map<String, Location> map = new LinkedHashMap<>();
        if (locations != null) {
            for (Location location : locations) {
                if (location != null) {
                    map.putIfAbsent(location.getId(), location);
                }
            }
        }
        return map;
    }

    private TripUpdate update(Instant now, String message) {
        String id = "update-" + Long.toString(now.toEpochMilli(), 36) + "-"
                + Long.toString(ThreadLocalRandom.current().nextLong(Long.MAX_VALUE), 36);
        return new TripUpdate(id, now, message);
    }

    private String locationReference(Location location) {
        String range = formatRange(location);
        return range.isEmpty() ? location.getName() : location.getName() + " on " + range;
    }

    private String visitReference(Location location) {
        String range = formatRange(location);
        return range.isEmpty() ? location.getName() + " visit" : location.getName() + " visit of " + range;
    }

    static String formatRange(Location location) {
        if (location.getDate() == null) {
            return "";
        }
        LocalDate start = LocalDate.ofInstant(location.getDate(), ZoneOffset.UTC);
        LocalDate end = location.getEndDate() == null ? null : LocalDate.ofInstant(location.getEndDate(), ZoneOffset.UTC);
        if (end == null || end.equals(start)) {
            return DAY_FORMAT.format(start);
        }
        return DAY_FORMAT.format(start) + " - " + DAY_FORMAT.format(end);
    }

    private int countNewPosts(Object before, Object after) {
        if (!(after instanceof Collection)) {
            return 0;
        }
        Set<Object> known = new HashSet<>();
        if (before instanceof Collection) {
            for (Object post : (Collection<?>) before) {
                Object key = postKey(post);
                if (key != null) {
                    known.add(key);
                }
            }
        }
        int count = 0;
        for (Object post : (Collection<?>) after) {
            Object key = postKey(post);
            if (key != null && !known.contains(key)) {
                count++;
            }
        }
        return count;
    }

    private Object postKey(Object post) {
        if (!(post instanceof Map)) {
            return null;
        }
        Map<?, ?> map = (Map<?, ?>) post;
        Object id = map.get("id");
        return Objects.requireNonNullElse(id, map.get("url"));
    }
}
