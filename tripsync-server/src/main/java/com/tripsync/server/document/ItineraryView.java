package com.tripsync.server.document;

import com.tripsync.pojo.entity.Accommodation;
import com.tripsync.pojo.entity.Location;
import com.tripsync.pojo.entity.Route;
import com.tripsync.pojo.entity.TripDocument;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 单个行程的地点、住宿、路线集合。只从一个 TripDocument 构造，
 * 因此基于它建立的任何索引天然不会混入其他行程的数据。
 */
public class ItineraryView {

    private final String tripTitle;
    private final List<Location> locations;
    private final List<Accommodation> accommodations;
    private final List<Route> routes;

    public ItineraryView(String tripTitle, List<Location> locations,
                         List<Accommodation> accommodations, List<Route> routes) {
        this.tripTitle = tripTitle;
        this.locations = locations == null ? Collections.emptyList() : locations;
        this.accommodations = accommodations == null ? Collections.emptyList() : accommodations;
        this.routes = routes == null ? Collections.emptyList() : routes;
    }

    public static ItineraryView of(TripDocument doc) {
        return new ItineraryView(doc.getTitle(), TripDocuments.locations(doc),
                TripDocuments.accommodations(doc), TripDocuments.routes(doc));
    }

    public String getTripTitle() {
        return tripTitle;
    }

    public List<Location> getLocations() {
        return locations;
    }

    public List<Accommodation> getAccommodations() {
        return accommodations;
    }

    public List<Route> getRoutes() {
        return routes;
    }

    /**
     * 顺序固定：地点、住宿、路线（每条路线后紧跟其子路线，深度优先）。
     */
    public List<LinkedItem> linkedItems() {
        List<LinkedItem> items = new ArrayList<>();
        for (Location location : locations) {
            if (location != null) {
                items.add(LinkedItem.of(location));
            }
        }
        for (Accommodation accommodation : accommodations) {
            if (accommodation != null) {
                items.add(LinkedItem.of(accommodation));
            }
        }
        for (Route route : TripDocuments.flattenRoutes(routes)) {
            items.add(LinkedItem.of(route));
        }
        return items;
    }

    public Optional<Location> findLocation(String locationId) {
        if (locationId == null) {
            return Optional.empty();
        }
        return locations.stream()
                .filter(l -> l != null && locationId.equals(l.getId()))
                .findFirst();
    }
}
