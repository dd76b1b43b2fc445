package com.tripsync.server.service.support;

import com.tripsync.pojo.entity.Location;
import com.tripsync.pojo.entity.Route;
import com.tripsync.pojo.entity.TripUpdate;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.tripsync.server.TripFixtures.NOW;
import static com.tripsync.server.TripFixtures.location;
import static com.tripsync.server.TripFixtures.route;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 公开动态的生成与截断。
 */
class TripUpdateBuilderTest {

    private final TripUpdateBuilder builder = new TripUpdateBuilder();

    @Test
    void build_shouldDescribeAddedCancelledAndRescheduledLocations() {
        Location lisbon = location("loc-1", "Lisbon");
        Location porto = location("loc-2", "Porto");
        porto.setDate(Instant.parse("2024-07-05T00:00:00Z"));
        porto.setEndDate(Instant.parse("2024-07-07T00:00:00Z"));
        Location portoMoved = location("loc-2", "Porto");
        portoMoved.setDate(Instant.parse("2024-07-10T00:00:00Z"));
        Location faro = location("loc-3", "Faro");

        List<TripUpdate> updates = builder.build(List.of(lisbon, porto), List.of(portoMoved, faro),
                null, null, NOW);

        assertEquals(List.of(
                "New trip location added: Faro on Jul 1, 2024.",
                "Visit to Lisbon on Jul 1, 2024 cancelled.",
                "Visit to Porto on Jul 5, 2024 - Jul 7, 2024 rescheduled to Jul 10, 2024."),
                messages(updates));
        assertTrue(updates.stream().allMatch(u -> NOW.equals(u.getCreatedAt()) && u.getId().startsWith("update-")));
    }

    @Test
    void build_shouldDescribeNewRoutesAndPosts() {
        Location before = location("loc-1", "Lisbon");
        before.putExtraProperty("instagramPosts", List.of(Map.of("id", "p1")));
        Location after = location("loc-1", "Lisbon");
        after.putExtraProperty("instagramPosts", List.of(Map.of("id", "p1"), Map.of("id", "p2"), Map.of("url", "u3")));
        Route existing = route("r-1", "Lisbon", "Porto");
        Route added = route("r-2", "Porto", "Madrid");
        added.setType("Flight");

        List<TripUpdate> updates = builder.build(List.of(before), List.of(after), List.of(existing),
                List.of(existing, added), NOW);

        assertEquals(List.of(
                "New Instagram posts added to the Lisbon visit of Jul 1, 2024.",
                "New flight route added between Porto and Madrid."),
                messages(updates));
    }

    @Test
    void build_shouldReturnNothing_whenSectionsUnchangedOrOmitted() {
        Location lisbon = location("loc-1", "Lisbon");

        assertTrue(builder.build(List.of(lisbon), null, List.of(), null, NOW).isEmpty());
        assertTrue(builder.build(List.of(lisbon), List.of(lisbon), List.of(), List.of(), NOW).isEmpty());
    }

    @Test
    void prepend_shouldPutFreshFirstAndCapAtLimit() {
        List<TripUpdate> existing = List.of(new TripUpdate("u-1", NOW, "old 1"), new TripUpdate("u-2", NOW, "old 2"));
        List<TripUpdate> fresh = List.of(new TripUpdate("u-3", NOW, "new"));

        List<TripUpdate> merged = builder.prepend(existing, fresh, 2);

        assertEquals(List.of("new", "old 1"), messages(merged));
    }

    private static List<String> messages(List<TripUpdate> updates) {
        return updates.stream().map(TripUpdate::getMessage).collect(Collectors.toList());
    }
}
