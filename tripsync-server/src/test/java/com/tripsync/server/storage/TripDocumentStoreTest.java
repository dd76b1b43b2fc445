package com.tripsync.server.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripsync.common.exception.TripConflictException;
import com.tripsync.common.exception.TripNotFoundException;
import com.tripsync.common.exception.TripValidationException;
import com.tripsync.common.result.ErrorCode;
import com.tripsync.pojo.entity.Location;
import com.tripsync.pojo.entity.TravelItemType;
import com.tripsync.pojo.entity.TripDocument;
import com.tripsync.pojo.vo.TripSummaryVO;
import com.tripsync.server.TripFixtures;
import com.tripsync.server.TripFixtures.MutableClock;
import com.tripsync.server.backup.BackupRecord;
import com.tripsync.server.backup.BackupType;
import com.tripsync.server.backup.JsonFileBackupCatalog;
import com.tripsync.server.json.TripJson;
import com.tripsync.server.metrics.MetricsRecorder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.tripsync.server.TripFixtures.expense;
import static com.tripsync.server.TripFixtures.location;
import static com.tripsync.server.TripFixtures.trip;
import static com.tripsync.server.TripFixtures.withExpenses;
import static com.tripsync.server.TripFixtures.withLocations;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 行程文件读写：迁移写回、损坏恢复、并发保存、删除与恢复。
 * 使用真实文件系统（临时目录）和真实线程池。
 */
class TripDocumentStoreTest {

    @TempDir
    Path dataDir;

    private ObjectMapper objectMapper;
    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private ExecutorService executor;
    private TripFilePaths paths;
    private TripDocumentStore store;

    @BeforeEach
    void setUp() {
        objectMapper = TripJson.createObjectMapper();
        clock = new MutableClock(TripFixtures.NOW);
        meterRegistry = new SimpleMeterRegistry();
        executor = Executors.newFixedThreadPool(4);
        paths = new TripFilePaths(dataDir, "backups");
        store = new TripDocumentStore(paths,
                new TripWriteQueue(executor),
                objectMapper,
                TripFixtures.migrationEngine(objectMapper, clock),
                new CorruptedJsonRecovery(objectMapper),
                new JsonFileBackupCatalog(dataDir, "backup-metadata.json", objectMapper, clock),
                new MetricsRecorder(meterRegistry),
                clock);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void load_shouldReturnEmpty_whenFileMissing() throws Exception {
        assertTrue(store.load("trip-a").isEmpty());
        assertFalse(store.exists("trip-a"));
    }

    @Test
    void save_shouldWriteCurrentVersionFile_andLoadItBack() throws Exception {
        TripDocument doc = withLocations(trip("trip-a", 7), location("loc-1", "Lisbon"));

        store.save(doc);

        assertTrue(Files.exists(dataDir.resolve("trip-trip-a.json")));
        TripDocument loaded = store.load("trip-a").orElseThrow();
        assertEquals(doc, loaded);
        assertEquals(List.of("trip-a"), store.listTripIds());
    }

    @Test
    void save_shouldMigrateFirst_whenDocumentOlderThanCurrent() throws Exception {
        Location lisbon = location("loc-1", "Lisbon");
        lisbon.setAccommodationData("Hotel Lisboa");

        store.save(withLocations(trip("trip-a", 1), lisbon));

        JsonNode onDisk = objectMapper.readTree(dataDir.resolve("trip-trip-a.json").toFile());
        assertEquals(7, onDisk.get("schemaVersion").asInt());
        assertEquals("acc-loc-1", onDisk.get("accommodations").get(0).get("id").asText());
    }

    @Test
    void load_shouldMigrateAndWriteBack_whenFileHasOldVersion() throws Exception {
        String v2 = "{\"schemaVersion\":2,\"id\":\"trip-a\",\"title\":\"Old\","
                + "\"createdAt\":\"2023-05-01\","
                + "\"travelData\":{\"locations\":[{\"id\":\"loc-1\",\"name\":\"Porto\","
                + "\"costTrackingLinks\":[{\"expenseId\":\"ghost\"}]}]},"
                + "\"costData\":{\"expenses\":[]}}";
        Files.writeString(dataDir.resolve("trip-trip-a.json"), v2);

        TripDocument loaded = store.load("trip-a").orElseThrow();

        assertEquals(Integer.valueOf(7), loaded.getSchemaVersion());
        assertEquals(Instant.parse("2023-05-01T00:00:00Z"), loaded.getCreatedAt());
        assertEquals(TripFixtures.NOW, loaded.getUpdatedAt());
        assertTrue(loaded.getItinerary().getLocations().get(0).getCostTrackingLinks().isEmpty());
        JsonNode onDisk = objectMapper.readTree(dataDir.resolve("trip-trip-a.json").toFile());
        assertEquals(7, onDisk.get("schemaVersion").asInt());
        assertTrue(onDisk.has("itinerary"));
        assertFalse(onDisk.has("travelData"));
        assertEquals(1.0, meterRegistry.get("tripsync.migration.applied").tag("from", "2").counter().count());
    }

    @Test
    void load_shouldUseFileNameAsId_whenDocumentIdDiffers() throws Exception {
        Files.writeString(dataDir.resolve("trip-trip-a.json"), "{\"schemaVersion\":7,\"id\":\"other\"}");

        assertEquals("trip-a", store.load("trip-a").orElseThrow().getId());
    }

    @Test
    void load_shouldRecoverAndQuarantine_whenFileHasTrailingGarbage() throws Exception {
        TripDocument doc = withLocations(trip("trip-a", 7), location("loc-1", "Lisbon"));
        byte[] corrupted = (objectMapper.writeValueAsString(doc) + "\u0000\u0000ions\": []\n}")
                .getBytes(StandardCharsets.UTF_8);
        Path file = dataDir.resolve("trip-trip-a.json");
        Files.write(file, corrupted);

        TripDocument loaded = store.load("trip-a").orElseThrow();

        assertEquals("Lisbon", loaded.getItinerary().getLocations().get(0).getName());
        assertEquals(doc, objectMapper.readValue(Files.readAllBytes(file), TripDocument.class));
        List<Path> quarantined = listBackups("corrupted-trip-trip-a-");
        assertEquals(1, quarantined.size());
        assertTrue(quarantined.get(0).getFileName().toString().endsWith(".json.corrupt"));
        assertArrayEquals(corrupted, Files.readAllBytes(quarantined.get(0)));
        assertEquals(1.0, meterRegistry.get("tripsync.storage.corruption_recovery")
                .tag("outcome", "recovered").counter().count());
    }

    @Test
    void load_shouldReturnEmptyAndKeepFile_whenCorruptionUnrecoverable() throws Exception {
        Path file = dataDir.resolve("trip-trip-a.json");
        Files.writeString(file, "{\"schemaVersion\":7,\"id\":\"trip-a\",\"itin\u0000\u0000");

        Optional<TripDocument> loaded = store.load("trip-a");

        assertTrue(loaded.isEmpty());
        assertTrue(Files.exists(file));
        assertTrue(listBackups("corrupted-trip-").isEmpty());
    }

    @Test
    void saveAsync_shouldLeaveParseableFile_whenLargeAndSmallSavesInterleave() throws Exception {
        for (int round = 0; round < 3; round++) {
            List<CompletableFuture<Void>> futures = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                TripDocument doc = i % 2 == 0 ? largeTrip("trip-a", 300) : trip("trip-a", 7);
                doc.setTitle("round-" + round + "-save-" + i);
                futures.add(store.saveAsync(doc));
            }
            futures.add(store.saveAsync(trip("trip-b", 7)));
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

            byte[] content = Files.readAllBytes(dataDir.resolve("trip-trip-a.json"));
            for (byte b : content) {
                assertTrue(b != 0, "file contains NUL byte");
            }
            TripDocument onDisk = objectMapper.readValue(content, TripDocument.class);
            assertEquals("round-" + round + "-save-19", onDisk.getTitle());
            objectMapper.readValue(dataDir.resolve("trip-trip-b.json").toFile(), TripDocument.class);
        }
        try (Stream<Path> files = Files.list(dataDir)) {
            assertTrue(files.noneMatch(p -> p.getFileName().toString().endsWith(".tmp")));
        }
    }

    @Test
    void saveAsync_shouldKeepFileParseable_whenSavesComeFromManyThreads() throws Exception {
        ExecutorService callers = Executors.newFixedThreadPool(8);
        try {
            List<CompletableFuture<Void>> futures = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                int n = i;
                futures.add(CompletableFuture.supplyAsync(() -> {
                    TripDocument doc = n % 2 == 0 ? largeTrip("trip-a", 200) : trip("trip-a", 7);
                    doc.setTitle("save-" + n);
                    return store.saveAsync(doc);
                }, callers).thenCompose(f -> f));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } finally {
            callers.shutdownNow();
        }

        TripDocument onDisk = objectMapper.readValue(dataDir.resolve("trip-trip-a.json").toFile(), TripDocument.class);
        assertTrue(onDisk.getTitle().startsWith("save-"));
    }

    @Test
    void deleteTrip_shouldWriteBackup_andRestoreTripShouldBringItBack() throws Exception {
        TripDocument doc = withExpenses(withLocations(trip("trip-a", 7), location("loc-1", "Lisbon", "e-1")),
                expense("e-1", "Food", TravelItemType.LOCATION, "loc-1"));
        store.save(doc);

        BackupRecord record = store.deleteTrip("trip-a", "user request");

        assertFalse(store.exists("trip-a"));
        assertEquals(BackupType.TRIP, record.getType());
        assertEquals("trip-a", record.getOriginalId());
        assertEquals("Trip trip-a", record.getTitle());
        JsonNode backup = objectMapper.readTree(paths.resolveRelative(record.getFilePath()).toFile());
        assertEquals("user request", backup.get("backupMetadata").get("deletionReason").asText());
        assertEquals("trip", backup.get("backupMetadata").get("backupType").asText());

        clock.set(TripFixtures.NOW.plusSeconds(60));
        TripDocument restored = store.restoreTrip(record.getId(), false);

        assertEquals(TripFixtures.NOW.plusSeconds(60), restored.getUpdatedAt());
        TripDocument reloaded = store.load("trip-a").orElseThrow();
        assertEquals("e-1", reloaded.getItinerary().getLocations().get(0).getCostTrackingLinks().get(0).getExpenseId());
        assertTrue(reloaded.getExtraProperties().isEmpty());
    }

    @Test
    void restoreTrip_shouldRequireOverwrite_whenTripExistsAgain() throws Exception {
        store.save(trip("trip-a", 7));
        BackupRecord record = store.deleteTrip("trip-a", null);
        TripDocument replacement = trip("trip-a", 7);
        replacement.setTitle("Replacement");
        store.save(replacement);

        TripConflictException e = assertThrows(TripConflictException.class, () -> store.restoreTrip(record.getId(), false));
        assertEquals(ErrorCode.RESTORE_CONFLICT, e.getErrorCode());

        TripDocument restored = store.restoreTrip(record.getId(), true);
        assertEquals("Trip trip-a", restored.getTitle());
    }

    @Test
    void deleteFinance_shouldClearLinks_andRestoreFinanceShouldMergeThemBack() throws Exception {
        TripDocument doc = withExpenses(withLocations(trip("trip-a", 7), location("loc-1", "Lisbon", "e-1")),
                expense("e-1", "Food", TravelItemType.LOCATION, "loc-1"));
        store.save(doc);

        BackupRecord record = store.deleteFinance("trip-a", "reset budget");

        TripDocument afterDelete = store.load("trip-a").orElseThrow();
        assertNull(afterDelete.getFinance());
        assertTrue(afterDelete.getItinerary().getLocations().get(0).getCostTrackingLinks().isEmpty());
        assertEquals(BackupType.COST, record.getType());

        TripDocument restored = store.restoreFinance(record.getId(), false);

        assertEquals("e-1", restored.getFinance().getExpenses().get(0).getId());
        assertEquals("e-1", restored.getItinerary().getLocations().get(0).getCostTrackingLinks().get(0).getExpenseId());
        assertThrows(TripConflictException.class, () -> store.restoreFinance(record.getId(), false));
        assertThrows(TripValidationException.class, () -> store.restoreTrip(record.getId(), true));
    }

    @Test
    void deleteTrip_shouldThrowNotFound_whenTripMissing() {
        TripNotFoundException e = assertThrows(TripNotFoundException.class, () -> store.deleteTrip("nope", null));
        assertEquals(ErrorCode.TRIP_NOT_FOUND, e.getErrorCode());
        assertThrows(TripNotFoundException.class, () -> store.restoreTrip("backup-unknown", true));
    }

    @Test
    void restoreTrip_shouldPropagateIoError_whenBackupCatalogUnreadable() throws Exception {
        Files.writeString(dataDir.resolve("backup-metadata.json"), "{not json");

        assertThrows(IOException.class, () -> store.restoreTrip("backup-1", true));
        assertThrows(IOException.class, () -> store.restoreFinance("backup-1", true));
    }

    @Test
    void tripFile_shouldRejectIdsThatEscapeDataDirectory() {
        TripValidationException e = assertThrows(TripValidationException.class, () -> store.load("../etc/passwd"));
        assertEquals(ErrorCode.INVALID_TRIP_ID, e.getErrorCode());
    }

    @Test
    void listTrips_shouldSortByCreatedAtDescending() throws Exception {
        TripDocument older = trip("trip-old", 7);
        older.setCreatedAt(Instant.parse("2023-01-01T00:00:00Z"));
        TripDocument newer = trip("trip-new", 7);
        newer.setCreatedAt(Instant.parse("2024-03-01T00:00:00Z"));
        store.save(older);
        store.save(newer);
        Files.writeString(dataDir.resolve("notes.txt"), "not a trip");

        List<TripSummaryVO> trips = store.listTrips();

        assertEquals(List.of("trip-new", "trip-old"), trips.stream().map(TripSummaryVO::getId).collect(Collectors.toList()));
        assertTrue(trips.get(0).isHasItinerary());
    }

    private List<Path> listBackups(String prefix) throws Exception {
        Path dir = dataDir.resolve("backups");
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().startsWith(prefix)).collect(Collectors.toList());
        }
    }

    private static TripDocument largeTrip(String id, int locations) {
        TripDocument doc = trip(id, 7);
        for (int i = 0; i < locations; i++) {
            Location location = location("loc-" + i, "Location number " + i);
            location.setNotes("Some fairly long notes to make this document noticeably larger than the small one " + i);
            doc.getItinerary().getLocations().add(location);
        }
        return doc;
    }
}
