package com.tripsync.server.service.support;

import com.tripsync.pojo.dto.TravelItemRef;
import com.tripsync.pojo.entity.Expense;
import com.tripsync.pojo.entity.TravelItemType;
import com.tripsync.pojo.entity.TripDocument;
import com.tripsync.server.document.TripDocuments;
import org.junit.jupiter.api.Test;

import static com.tripsync.server.TripFixtures.accommodation;
import static com.tripsync.server.TripFixtures.expense;
import static com.tripsync.server.TripFixtures.location;
import static com.tripsync.server.TripFixtures.trip;
import static com.tripsync.server.TripFixtures.withAccommodations;
import static com.tripsync.server.TripFixtures.withExpenses;
import static com.tripsync.server.TripFixtures.withLocations;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 关联编辑：一个费用同一时间只挂在一个条目上，两侧同时更新。
 */
class ExpenseLinkEditorTest {

    private final ExpenseLinkEditor editor = new ExpenseLinkEditor();

    @Test
    void apply_shouldMoveLinkToNewItem_andUpdateReference() {
        TripDocument doc = withExpenses(withAccommodations(
                withLocations(trip("trip-a", 7), location("loc-1", "Lisbon", "e-1")),
                accommodation("acc-1", "Hotel Lisboa", "loc-1")),
                expense("e-1", "Accommodation", TravelItemType.LOCATION, "loc-1"));

        editor.apply(doc, "e-1", TravelItemRef.accommodation("acc-1"), null);

        assertTrue(TripDocuments.locations(doc).get(0).getCostTrackingLinks().isEmpty());
        assertEquals("Hotel Lisboa", doc.getAccommodations().get(0).getCostTrackingLinks().get(0).getDescription());
        Expense expense = TripDocuments.expensesById(doc).get("e-1");
        assertEquals(TravelItemType.ACCOMMODATION, expense.getTravelReference().resolveType());
        assertEquals("acc-1", expense.getTravelReference().getItemId());
    }

    @Test
    void apply_shouldUnlinkBothSides_whenRefIsNull() {
        TripDocument doc = withExpenses(withLocations(trip("trip-a", 7), location("loc-1", "Lisbon", "e-1")),
                expense("e-1", "Food", TravelItemType.LOCATION, "loc-1"));

        editor.apply(doc, "e-1", null, null);

        assertTrue(TripDocuments.locations(doc).get(0).getCostTrackingLinks().isEmpty());
        assertNull(TripDocuments.expensesById(doc).get("e-1").getTravelReference());
    }
}
