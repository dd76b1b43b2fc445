package com.tripsync.server.service.impl;

import com.tripsync.common.constant.StorageConstants;
import com.tripsync.common.exception.TripConflictException;
import com.tripsync.common.exception.TripNotFoundException;
import com.tripsync.common.exception.TripValidationException;
import com.tripsync.common.properties.StorageProperties;
import com.tripsync.common.result.ErrorCode;
import com.tripsync.pojo.dto.FinanceUpdateDTO;
import com.tripsync.pojo.dto.ItineraryUpdateDTO;
import com.tripsync.pojo.dto.TravelItemRef;
import com.tripsync.pojo.dto.TripCreateDTO;
import com.tripsync.pojo.entity.Accommodation;
import com.tripsync.pojo.entity.FinanceData;
import com.tripsync.pojo.entity.Itinerary;
import com.tripsync.pojo.entity.Location;
import com.tripsync.pojo.entity.Route;
import com.tripsync.pojo.entity.TripDocument;
import com.tripsync.pojo.entity.TripUpdate;
import com.tripsync.pojo.vo.TripSummaryVO;
import com.tripsync.server.backup.BackupRecord;
import com.tripsync.server.document.ItineraryView;
import com.tripsync.server.document.TripDocuments;
import com.tripsync.server.link.TripLinkIndex;
import com.tripsync.server.metrics.MetricsRecorder;
import com.tripsync.server.migration.MigrationReport;
import com.tripsync.server.migration.TripMigrationEngine;
import com.tripsync.server.service.TripDocumentService;
import com.tripsync.server.service.support.AccommodationMerger;
import com.tripsync.server.service.support.ExpenseLinkEditor;
import com.tripsync.server.service.support.TripUpdateBuilder;
import com.tripsync.server.storage.TripDocumentStore;
import com.tripsync.server.storage.TripFilePaths;
import com.tripsync.server.validation.LinkValidationException;
import com.tripsync.server.validation.LinkValidationResult;
import com.tripsync.server.validation.TripBoundaryValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class TripDocumentServiceImpl implements TripDocumentService {

    private final TripDocumentStore tripDocumentStore;
    private final TripMigrationEngine migrationEngine;
    private final TripBoundaryValidator boundaryValidator;
    private final ExpenseLinkEditor expenseLinkEditor;
    private final AccommodationMerger accommodationMerger;
    private final TripUpdateBuilder tripUpdateBuilder;
    private final StorageProperties storageProperties;
    private final MetricsRecorder metricsRecorder;
    private final Clock clock;

    @Override
    public Optional<TripDocument> loadDocument(String tripId) throws IOException {
        return tripDocumentStore.load(tripId);
    }

    @Override
    public TripDocument getDocument(String tripId) throws IOException {
        return tripDocumentStore.load(tripId).orElseThrow(() -> new TripNotFoundException(tripId));
    }

    @Override
    public void saveDocument(TripDocument doc) throws IOException {
        if (doc == null || doc.getId() == null) {
            throw new TripValidationException(ErrorCode.INVALID_UPDATE, "Trip document without id");
        }
        tripDocumentStore.save(doc);
    }

    @Override
    public TripDocument createTrip(TripCreateDTO dto) throws IOException {
        String tripId = dto.getId() == null || dto.getId().isBlank() ? newTripId() : dto.getId();
        TripFilePaths.validateTripId(tripId);
        if (tripDocumentStore.exists(tripId)) {
            throw new TripConflictException("Trip " + tripId + " already exists");
        }
        TripDocument doc = newDocument(tripId, clock.instant());
        doc.setTitle(dto.getTitle());
        doc.setDescription(dto.getDescription());
        doc.setStartDate(dto.getStartDate());
        doc.setEndDate(dto.getEndDate());
        tripDocumentStore.save(doc);
        log.info("新建行程 tripId={}, title={}", tripId, dto.getTitle());
        return doc;
    }

    @Override
    public TripDocument updateItinerary(String tripId, ItineraryUpdateDTO update) throws IOException {
        TripFilePaths.validateTripId(tripId);
        if (update == null) {
            throw new TripValidationException(ErrorCode.INVALID_UPDATE, "Empty itinerary update for trip " + tripId);
        }
        Instant now = clock.instant();
        TripDocument doc = tripDocumentStore.load(tripId).orElseGet(() -> {
            log.info("行程不存在，按新建处理 tripId={}", tripId);
            return newDocument(tripId, now);
        });

        Itinerary itinerary = TripDocuments.ensureItinerary(doc);
        List<Location> previousLocations = new ArrayList<>(itinerary.getLocations());
        List<Route> previousRoutes = new ArrayList<>(itinerary.getRoutes());

        if (update.getTitle() != null) {
            doc.setTitle(update.getTitle());
        }
        if (update.getDescription() != null) {
            doc.setDescription(update.getDescription());
        }
        if (update.getStartDate() != null) {
            doc.setStartDate(update.getStartDate());
        }
        if (update.getEndDate() != null) {
            doc.setEndDate(update.getEndDate());
        }
        if (update.getLocations() != null) {
            itinerary.setLocations(new ArrayList<>(update.getLocations()));
        }
        if (update.getRoutes() != null) {
            itinerary.setRoutes(new ArrayList<>(update.getRoutes()));
        }
        if (update.getDays() != null) {
            itinerary.setDays(new ArrayList<>(update.getDays()));
        }
        if (update.getAccommodations() != null) {
            doc.setAccommodations(accommodationMerger.merge(doc.getAccommodations(), update.getAccommodations(),
                    itinerary.getLocations(), TripDocuments.expenses(doc)));
        }

        List<TripUpdate> fresh = tripUpdateBuilder.build(previousLocations, update.getLocations(),
                previousRoutes, update.getRoutes(), now);
        if (!fresh.isEmpty()) {
            doc.setPublicUpdates(tripUpdateBuilder.prepend(doc.getPublicUpdates(), fresh, publicUpdatesLimit()));
        }
        return reconcileAndSave(doc, now);
    }

    @Override
    public TripDocument updateFinance(String tripId, FinanceUpdateDTO update) throws IOException {
        TripFilePaths.validateTripId(tripId);
        if (update == null) {
            throw new TripValidationException(ErrorCode.INVALID_UPDATE, "Empty finance update for trip " + tripId);
        }
        Instant now = clock.instant();
        TripDocument doc = tripDocumentStore.load(tripId).orElseGet(() -> {
            log.info("行程不存在，按新建处理 tripId={}", tripId);
            return newDocument(tripId, now);
        });
        FinanceData finance = doc.getFinance() == null ? new FinanceData() : doc.getFinance();
        if (update.getOverallBudget() != null) {
            finance.setOverallBudget(update.getOverallBudget());
        }
        if (update.getReservedBudget() != null) {
            finance.setReservedBudget(update.getReservedBudget());
        }
        if (update.getCurrency() != null) {
            finance.setCurrency(update.getCurrency());
        }
        if (update.getCountryBudgets() != null) {
            finance.setCountryBudgets(new ArrayList<>(update.getCountryBudgets()));
        }
        if (update.getExpenses() != null) {
            finance.setExpenses(new ArrayList<>(update.getExpenses()));
        }
        if (update.getCustomCategories() != null) {
            finance.setCustomCategories(new ArrayList<>(update.getCustomCategories()));
        }
        if (update.getImportMetadata() != null) {
            finance.setImportMetadata(update.getImportMetadata());
        }
        doc.setFinance(finance);
        return reconcileAndSave(doc, now);
    }

    @Override
    public LinkValidationResult validateLink(String tripId, String expenseId, TravelItemRef ref) throws IOException {
        TripDocument doc = getDocument(tripId);
        LinkValidationResult result = boundaryValidator.validateLink(doc, expenseId, ref);
        metricsRecorder.recordLinkValidation(result.isValid() ? "ok" : result.getCode().name());
        return result;
    }

    @Override
    public TripDocument linkExpense(String tripId, String expenseId, TravelItemRef ref) throws IOException {
        TripDocument doc = getDocument(tripId);
        LinkValidationResult result = boundaryValidator.validateLink(doc, expenseId, ref);
        metricsRecorder.recordLinkValidation(result.isValid() ? "ok" : result.getCode().name());
        if (!result.isValid()) {
            throw new LinkValidationException(result);
        }
        expenseLinkEditor.apply(doc, expenseId, ref, null);
        doc.setUpdatedAt(clock.instant());
        tripDocumentStore.save(doc);
        log.info("费用关联已更新 tripId={}, expenseId={}, target={}", tripId, expenseId,
                ref == null ? "none" : ref.getType().getValue() + " " + ref.getId());
        return doc;
    }

    @Override
    public TripLinkIndex buildLinkIndex(String tripId) throws IOException {
        return TripLinkIndex.build(tripId, ItineraryView.of(getDocument(tripId)));
    }

    @Override
    public List<TripSummaryVO> listTrips() throws IOException {
        return tripDocumentStore.listTrips();
    }

    @Override
    public BackupRecord deleteTrip(String tripId, String reason) throws IOException {
        return tripDocumentStore.deleteTrip(tripId, reason);
    }

    @Override
    public BackupRecord deleteFinance(String tripId, String reason) throws IOException {
        return tripDocumentStore.deleteFinance(tripId, reason);
    }

    @Override
    public TripDocument restoreTrip(String backupId, boolean overwrite) throws IOException {
        return tripDocumentStore.restoreTrip(backupId, overwrite);
    }

    @Override
    public TripDocument restoreFinance(String backupId, boolean overwrite) throws IOException {
        return tripDocumentStore.restoreFinance(backupId, overwrite);
    }

    @Override
    public List<Accommodation> listAccommodationsNeedingReview(String tripId) throws IOException {
        return TripDocuments.accommodations(getDocument(tripId)).stream()
                .filter(acc -> acc != null && Boolean.TRUE.equals(acc.getNeedsReview()))
                .collect(Collectors.toList());
    }

    @Override
    public TripDocument confirmAccommodation(String tripId, String accommodationId) throws IOException {
        TripDocument doc = getDocument(tripId);
        Accommodation accommodation = TripDocuments.accommodationsById(doc).get(accommodationId);
        if (accommodation == null) {
            throw new TripNotFoundException(ErrorCode.TRAVEL_ITEM_NOT_FOUND,
                    "Travel item " + accommodationId + " not found in trip " + tripId);
        }
        Instant now = clock.instant();
        accommodation.setNeedsReview(null);
        accommodation.setUpdatedAt(now);
        doc.setUpdatedAt(now);
        tripDocumentStore.save(doc);
        return doc;
    }

    /**
     * 整段写入后可能带进悬空或单向的关联，落盘前统一整理一遍。
     */
    private TripDocument reconcileAndSave(TripDocument doc, Instant now) throws IOException {
        MigrationReport report = migrationEngine.reconcileLinks(doc);
        if (!report.getAuditEntries().isEmpty()) {
            log.info("更新后整理关联 tripId={}, repairs={}", doc.getId(), report.getAuditEntries().size());
        }
        TripDocument result = report.getDocument();
        result.setUpdatedAt(now);
        tripDocumentStore.save(result);
        return result;
    }

    private TripDocument newDocument(String tripId, Instant now) {
        TripDocument doc = new TripDocument();
        doc.setSchemaVersion(StorageConstants.CURRENT_SCHEMA_VERSION);
        doc.setId(tripId);
        doc.setTitle("");
        doc.setDescription("");
        doc.setCreatedAt(now);
        doc.setUpdatedAt(now);
        doc.setItinerary(TripDocuments.ensureItinerary(doc));
        doc.setAccommodations(new ArrayList<>());
        doc.setFinance(new FinanceData());
        doc.setPublicUpdates(new ArrayList<>());
        return doc;
    }

    private int publicUpdatesLimit() {
        int limit = storageProperties.getPublicUpdatesLimit();
        return limit > 0 ? limit : StorageConstants.DEFAULT_PUBLIC_UPDATES_LIMIT;
    }

    private static String newTripId() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
