package com.tripsync.server.migration;

import com.tripsync.pojo.entity.Accommodation;
import com.tripsync.pojo.entity.Location;
import com.tripsync.pojo.entity.TravelItemType;
import com.tripsync.pojo.entity.TripDocument;
import com.tripsync.server.TripFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.tripsync.server.TripFixtures.accommodation;
import static com.tripsync.server.TripFixtures.expense;
import static com.tripsync.server.TripFixtures.location;
import static com.tripsync.server.TripFixtures.trip;
import static com.tripsync.server.TripFixtures.withAccommodations;
import static com.tripsync.server.TripFixtures.withExpenses;
import static com.tripsync.server.TripFixtures.withLocations;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 住宿抽取：命名规则，以及早期抽取不完整时遗留形态的收敛。
 */
class AccommodationExtractorTest {

    private final AccommodationExtractor extractor = new AccommodationExtractor();

    @Test
    void deriveName_shouldPreferFrontmatterName() {
        assertEquals("Casa Azul", AccommodationExtractor.deriveName("---\nname: \"Casa Azul\"\ncheckIn: 15:00\n---", "Lisbon"));
        assertEquals("Hostel Central", AccommodationExtractor.deriveName("# Hostel Central\nRoom 4", "Lisbon"));
        assertEquals("Accommodation in Lisbon", AccommodationExtractor.deriveName("address: Rua 1", "Lisbon"));
    }

    @Test
    void extract_shouldReuseExistingAccommodation_whenEmbeddedDataAlreadyExtracted() {
        Location lisbon = location("loc-1", "Lisbon", "e-hotel");
        lisbon.setAccommodationData("Hotel Lisboa");
        Accommodation existing = accommodation("acc-loc-1", "Hotel Lisboa", "loc-1");
        existing.setAccommodationData("Hotel Lisboa");
        TripDocument doc = withExpenses(withAccommodations(withLocations(trip("trip-a", 1), lisbon), existing),
                expense("e-hotel", "Hotel"));
        MigrationContext context = new MigrationContext("trip-a", TripFixtures.NOW);

        extractor.extract(doc, context);

        assertEquals(1, doc.getAccommodations().size());
        assertEquals(List.of("acc-loc-1"), lisbon.getAccommodationIds());
        assertTrue(lisbon.getCostTrackingLinks().isEmpty());
        assertEquals("e-hotel", existing.getCostTrackingLinks().get(0).getExpenseId());
        assertFalse(context.getEntries().stream()
                .anyMatch(e -> e.getAction() == MigrationAction.ACCOMMODATION_EXTRACTED));
    }

    @Test
    void extract_shouldMoveStrayLinks_whenLocationOwnsSingleAccommodation() {
        Location lisbon = location("loc-1", "Lisbon", "e-stay", "e-train");
        Accommodation owned = accommodation("acc-1", "Hotel Lisboa", "loc-1");
        TripDocument doc = withExpenses(withAccommodations(withLocations(trip("trip-a", 5), lisbon), owned),
                expense("e-stay", "Lodging", TravelItemType.LOCATION, "loc-1"),
                expense("e-train", "Transport", TravelItemType.LOCATION, "loc-1"));

        extractor.extract(doc, new MigrationContext("trip-a", TripFixtures.NOW));

        assertEquals("e-train", lisbon.getCostTrackingLinks().get(0).getExpenseId());
        assertEquals(1, lisbon.getCostTrackingLinks().size());
        assertEquals("e-stay", owned.getCostTrackingLinks().get(0).getExpenseId());
        assertEquals("acc-1", doc.getFinance().getExpenses().get(0).getTravelReference().getItemId());
    }
}
