package com.tripsync.server.migration.step;

import com.tripsync.common.constant.StorageConstants;
import com.tripsync.pojo.entity.Accommodation;
import com.tripsync.pojo.entity.Location;
import com.tripsync.pojo.entity.TripDocument;
import com.tripsync.server.document.TripDocuments;
import com.tripsync.server.migration.AccommodationExtractor;
import com.tripsync.server.migration.MigrationAction;
import com.tripsync.server.migration.MigrationContext;
import com.tripsync.server.migration.SchemaMigration;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * v5 → v6：修复住宿的占位 locationId，并对仍带有早期不完整抽取痕迹的文档重新执行住宿抽取。
 * <p>
 * 住宿的 locationId 是占位值、为空或指向不存在的地点时，按“哪个地点的 accommodationIds 列出了它”找回真正的归属；
 * 找不到归属时只记录告警，不凭空造一个地点。
 * </p>
 */
@Component
@RequiredArgsConstructor
public class PlaceholderLocationRepairMigration implements SchemaMigration {

    private final AccommodationExtractor accommodationExtractor;

    @Override
    public int fromVersion() {
        return 5;
    }

    @Override
    public String description() {
        return "repair placeholder location references";
    }

    @Override
    public void migrate(TripDocument doc, MigrationContext context) {
        List<Location> locations = TripDocuments.locations(doc);
        for (Accommodation accommodation : TripDocuments.accommodations(doc)) {
            if (accommodation == null || accommodation.getId() == null) {
                continue;
            }
            String locationId = accommodation.getLocationId();
            Optional<Location> current = TripDocuments.findLocation(doc, locationId);
            if (current.isPresent()) {
                List<String> ids = TripDocuments.ensureAccommodationIds(current.get());
                if (!ids.contains(accommodation.getId())) {
                    ids.add(accommodation.getId());
                    context.record(MigrationAction.ACCOMMODATION_ID_ADDED, "location", locationId,
                            accommodation.getId(), "Added accommodation " + accommodation.getId()
                                    + " to location " + locationId);
                }
                continue;
            }
            Location owner = findOwner(locations, accommodation.getId());
            if (owner != null) {
                accommodation.setLocationId(owner.getId());
                context.record(MigrationAction.LOCATION_REBOUND, "accommodation", accommodation.getId(),
                        owner.getId(), "Rebound accommodation " + accommodation.getId() + " from "
                                + describeLocationId(locationId) + " to location " + owner.getId());
            } else if (!Boolean.TRUE.equals(accommodation.getNeedsReview())) {
                context.warn(MigrationAction.ORPHAN_ACCOMMODATION, "accommodation", accommodation.getId(),
                        "Accommodation " + accommodation.getId() + " has no owning location ("
                                + describeLocationId(locationId) + ")");
            }
        }
        accommodationExtractor.extract(doc, context);
    }

    private Location findOwner(List<Location> locations, String accommodationId) {
        for (Location location : locations) {
            if (location != null && location.getAccommodationIds() != null
                    && location.getAccommodationIds().contains(accommodationId)) {
                return location;
            }
        }
        return null;
    }

    private String describeLocationId(String locationId) {
        if (locationId == null || locationId.isBlank()) {
            return "empty location id";
        }
        if (StorageConstants.PLACEHOLDER_LOCATION_ID.equals(locationId)) {
            return "placeholder location id";
        }
        return "missing location " + locationId;
    }
}
