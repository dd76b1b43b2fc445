package com.tripsync.server.migration.step;

import com.tripsync.pojo.entity.TripDocument;
import com.tripsync.server.migration.AccommodationExtractor;
import com.tripsync.server.migration.MigrationContext;
import com.tripsync.server.migration.SchemaMigration;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * v1 → v2：住宿从地点中独立出来。
 */
@Component
@RequiredArgsConstructor
public class AccommodationExtractionMigration implements SchemaMigration {

    private final AccommodationExtractor accommodationExtractor;

    @Override
    public int fromVersion() {
        return 1;
    }

    @Override
    public String description() {
        return "extract embedded accommodations";
    }

    @Override
    public void migrate(TripDocument doc, MigrationContext context) {
        accommodationExtractor.extract(doc, context);
    }
}
