package com.tripsync.server.backup;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripsync.server.TripFixtures.MutableClock;
import com.tripsync.server.json.TripJson;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 备份目录：登记、检索、校验和与过期清理。
 */
class JsonFileBackupCatalogTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    @TempDir
    Path dataDir;

    private ObjectMapper objectMapper;
    private MutableClock clock;
    private JsonFileBackupCatalog catalog;

    @BeforeEach
    void setUp() {
        objectMapper = TripJson.createObjectMapper();
        clock = new MutableClock(START);
        catalog = new JsonFileBackupCatalog(dataDir, "backup-metadata.json", objectMapper, clock);
    }

    @Test
    void addBackupMetadata_shouldPersistRecord_andSurviveReload() throws IOException {
        String path = writeBackupFile("deleted-trip-trip-a-1.json", "{\"id\":\"trip-a\"}");

        BackupRecord record = catalog.addBackupMetadata("trip-a", BackupType.TRIP, "Portugal", path, "cleanup");

        assertTrue(record.getId().startsWith("backup-"));
        assertEquals(START, record.getDeletedAt());
        assertEquals("1.0.0", record.getBackupVersion());
        assertTrue(Files.exists(dataDir.resolve("backup-metadata.json")));

        JsonFileBackupCatalog reloaded = new JsonFileBackupCatalog(dataDir, "backup-metadata.json", objectMapper, clock);
        BackupRecord loaded = reloaded.getBackupById(record.getId()).orElseThrow();
        assertEquals(BackupType.TRIP, loaded.getType());
        assertEquals("Portugal", loaded.getTitle());
        assertEquals(record.getChecksum(), loaded.getChecksum());
    }

    @Test
    void addBackupMetadata_shouldLeaveCatalogUnchanged_whenWriteFails() throws IOException {
        String first = writeBackupFile("deleted-trip-trip-a-1.json", "{\"id\":\"trip-a\"}");
        BackupRecord kept = catalog.addBackupMetadata("trip-a", BackupType.TRIP, "Portugal", first, null);
        // 目录文件位置被一个非空目录占住，原子替换必然失败
        Path catalogFile = dataDir.resolve("backup-metadata.json");
        Files.delete(catalogFile);
        Files.createDirectories(catalogFile.resolve("blocker"));
        String second = writeBackupFile("deleted-trip-trip-b-1.json", "{\"id\":\"trip-b\"}");

        assertThrows(IOException.class,
                () -> catalog.addBackupMetadata("trip-b", BackupType.TRIP, "Spain", second, null));
        assertThrows(IOException.class, () -> catalog.removeBackupMetadata(kept.getId()));

        List<BackupRecord> all = catalog.listBackups(BackupFilter.all());
        assertEquals(1, all.size());
        assertEquals(kept.getId(), all.get(0).getId());
        assertTrue(catalog.getBackupById(kept.getId()).isPresent());
    }

    @Test
    void getBackupById_shouldThrow_whenCatalogFileIsCorrupt() throws IOException {
        Files.writeString(dataDir.resolve("backup-metadata.json"), "{not json");

        assertThrows(IOException.class, () -> catalog.getBackupById("backup-1"));
        assertThrows(IOException.class, () -> catalog.listBackups(BackupFilter.all()));
    }

    @Test
    void verifyBackupIntegrity_shouldDetectModifiedOrMissingFile() throws IOException {
        String path = writeBackupFile("deleted-cost-trip-a-1.json", "{\"id\":\"trip-a\"}");
        BackupRecord record = catalog.addBackupMetadata("trip-a", BackupType.COST, "Portugal", path, null);

        assertTrue(catalog.verifyBackupIntegrity(record.getId()));

        Files.writeString(dataDir.resolve(path), "{\"id\":\"tampered\"}");
        assertFalse(catalog.verifyBackupIntegrity(record.getId()));

        Files.delete(dataDir.resolve(path));
        assertFalse(catalog.verifyBackupIntegrity(record.getId()));
        assertFalse(catalog.verifyBackupIntegrity("backup-unknown"));
    }

    @Test
    void listBackups_shouldFilterAndSortNewestFirst() throws IOException {
        BackupRecord older = catalog.addBackupMetadata("trip-a", BackupType.TRIP, "Portugal",
                writeBackupFile("a.json", "{}"), "duplicate");
        clock.set(START.plus(Duration.ofDays(1)));
        BackupRecord newer = catalog.addBackupMetadata("trip-b", BackupType.COST, "Japan",
                writeBackupFile("b.json", "{}"), null);

        List<BackupRecord> all = catalog.listBackups(BackupFilter.all());
        assertEquals(List.of(newer.getId(), older.getId()), List.of(all.get(0).getId(), all.get(1).getId()));

        BackupFilter costOnly = new BackupFilter();
        costOnly.setType(BackupType.COST);
        assertEquals(1, catalog.listBackups(costOnly).size());
        assertEquals(older.getId(), catalog.searchBackups("PORTUGAL").get(0).getId());
        assertEquals(older.getId(), catalog.searchBackups("duplic").get(0).getId());

        BackupStorageStats stats = catalog.getStorageStats();
        assertEquals(2, stats.getTotalBackups());
        assertEquals(1, stats.getTripBackups());
        assertEquals(START, stats.getOldestBackup());
    }

    @Test
    void garbageCollect_shouldRemoveExpiredButKeepLatestPerTrip() throws IOException {
        BackupRecord first = catalog.addBackupMetadata("trip-a", BackupType.TRIP, "A",
                writeBackupFile("a1.json", "{\"n\":1}"), null);
        clock.set(START.plus(Duration.ofDays(1)));
        BackupRecord second = catalog.addBackupMetadata("trip-a", BackupType.TRIP, "A",
                writeBackupFile("a2.json", "{\"n\":2}"), null);
        clock.set(START.plus(Duration.ofDays(2)));
        BackupRecord onlyB = catalog.addBackupMetadata("trip-b", BackupType.TRIP, "B",
                writeBackupFile("b1.json", "{\"n\":3}"), null);
        clock.set(START.plus(Duration.ofDays(200)));

        GarbageCollectionResult dryRun = catalog.garbageCollect(90, 1, true);
        assertTrue(dryRun.isDryRun());
        assertEquals(List.of(first.getId()), dryRun.getRemovedIds());
        assertTrue(Files.exists(dataDir.resolve("backups/a1.json")));

        GarbageCollectionResult result = catalog.garbageCollect(90, 1, false);

        assertEquals(List.of(first.getId()), result.getRemovedIds());
        assertEquals(7, result.getFreedBytes());
        assertFalse(Files.exists(dataDir.resolve("backups/a1.json")));
        assertTrue(catalog.getBackupById(first.getId()).isEmpty());
        assertTrue(catalog.getBackupById(second.getId()).isPresent());
        assertTrue(catalog.getBackupById(onlyB.getId()).isPresent());
    }

    private String writeBackupFile(String name, String content) throws IOException {
        Path file = dataDir.resolve("backups").resolve(name);
        Files.createDirectories(file.getParent());
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return "backups/" + name;
    }
}
