package com.tripsync.server.document;

import com.tripsync.pojo.entity.Accommodation;
import com.tripsync.pojo.entity.Expense;
import com.tripsync.pojo.entity.FinanceData;
import com.tripsync.pojo.entity.Itinerary;
import com.tripsync.pojo.entity.Location;
import com.tripsync.pojo.entity.Route;
import com.tripsync.pojo.entity.TravelItemType;
import com.tripsync.pojo.entity.TripDocument;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * TripDocument 的空值安全访问工具。各段都可能缺失（旧数据、刚创建的行程），
 * 读取时一律返回空列表，需要写入时用 ensureXxx 补齐。
 */
public final class TripDocuments {

    private TripDocuments() {
    }

    public static List<Location> locations(TripDocument doc) {
        Itinerary itinerary = doc.getItinerary();
        if (itinerary == null || itinerary.getLocations() == null) {
            return Collections.emptyList();
        }
        return itinerary.getLocations();
    }

    public static List<Route> routes(TripDocument doc) {
        Itinerary itinerary = doc.getItinerary();
        if (itinerary == null || itinerary.getRoutes() == null) {
            return Collections.emptyList();
        }
        return itinerary.getRoutes();
    }

    public static List<Accommodation> accommodations(TripDocument doc) {
        return doc.getAccommodations() == null ? Collections.emptyList() : doc.getAccommodations();
    }

    public static List<Expense> expenses(TripDocument doc) {
        FinanceData finance = doc.getFinance();
        if (finance == null || finance.getExpenses() == null) {
            return Collections.emptyList();
        }
        return finance.getExpenses();
    }

    /**
     * 同 ID 多条时保留第一条。
     */
    public static Map<String, Expense> expensesById(TripDocument doc) {
        Map<String, Expense> map = new LinkedHashMap<>();
        for (Expense expense : expenses(doc)) {
            if (expense != null && expense.getId() != null) {
                map.putIfAbsent(expense.getId(), expense);
            }
        }
        return map;
    }

    public static Map<String, Accommodation> accommodationsById(TripDocument doc) {
        Map<String, Accommodation> map = new LinkedHashMap<>();
        for (Accommodation accommodation : accommodations(doc)) {
            if (accommodation != null && accommodation.getId() != null) {
                map.putIfAbsent(accommodation.getId(), accommodation);
            }
        }
        return map;
    }

    /**
     * 路线及其所有层级的子路线，深度优先。
     */
    public static List<Route> flattenRoutes(List<Route> routes) {
        List<Route> result = new ArrayList<>();
        if (routes != null) {
            for (Route route : routes) {
                collect(route, result);
            }
        }
        return result;
    }

    private static void collect(Route route, List<Route> out) {
        if (route == null) {
            return;
        }
        out.add(route);
        if (route.getSubRoutes() != null) {
            for (Route sub : route.getSubRoutes()) {
                collect(sub, out);
            }
        }
    }

    public static List<LinkedItem> linkedItems(TripDocument doc) {
        return ItineraryView.of(doc).linkedItems();
    }

    public static Optional<LinkedItem> findItem(TripDocument doc, TravelItemType type, String id) {
        if (type == null || id == null) {
            return Optional.empty();
        }
        for (LinkedItem item : linkedItems(doc)) {
            if (item.getType() == type && id.equals(item.getId())) {
                return Optional.of(item);
            }
        }
        return Optional.empty();
    }

    public static Optional<Location> findLocation(TripDocument doc, String locationId) {
        return ItineraryView.of(doc).findLocation(locationId);
    }

    public static Itinerary ensureItinerary(TripDocument doc) {
        if (doc.getItinerary() == null) {
            doc.setItinerary(new Itinerary());
        }
        Itinerary itinerary = doc.getItinerary();
        if (itinerary.getLocations() == null) {
            itinerary.setLocations(new ArrayList<>());
        }
        if (itinerary.getRoutes() == null) {
            itinerary.setRoutes(new ArrayList<>());
        }
        return itinerary;
    }

    public static List<Accommodation> ensureAccommodations(TripDocument doc) {
        if (doc.getAccommodations() == null) {
            doc.setAccommodations(new ArrayList<>());
        }
        return doc.getAccommodations();
    }

    public static List<String> ensureAccommodationIds(Location location) {
        if (location.getAccommodationIds() == null) {
            location.setAccommodationIds(new ArrayList<>());
        }
        return location.getAccommodationIds();
    }
}
