package com.tripsync.server.backup;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripsync.server.storage.AtomicFileWriter;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * 基于单个 JSON 文件的备份目录实现（数据目录下的 backup-metadata.json）。
 * <p>
 * - 首次访问时加载到内存，之后每次修改都整体原子重写；
 * - 所有读写在同一把锁内完成，同一进程内不会互相覆盖。
 * </p>
 */
@Slf4j
public class JsonFileBackupCatalog implements BackupCatalog {

    private static final String ID_PREFIX = "backup-";
    private static final String RANDOM_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";

    private final Path dataDir;
    private final Path catalogFile;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private List<BackupRecord> records;

    public JsonFileBackupCatalog(Path dataDir, String catalogFileName, ObjectMapper objectMapper, Clock clock) {
        this.dataDir = dataDir;
        this.catalogFile = dataDir.resolve(catalogFileName);
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public BackupRecord addBackupMetadata(String originalId, BackupType type, String title, String filePath,
                                          String reason) throws IOException {
        byte[] content = Files.readAllBytes(dataDir.resolve(filePath));
        BackupRecord record = new BackupRecord();
        record.setId(newId());
        record.setOriginalId(originalId);
        record.setType(type);
        record.setTitle(title);
        record.setDeletedAt(clock.instant());
        record.setFilePath(filePath);
        record.setFileSize(content.length);
        record.setChecksum(sha256(content));
        record.setDeletionReason(reason);
        lock.lock();
        try {
            List<BackupRecord> next = new ArrayList<>(loaded());
            next.add(record);
            commit(next);
        } finally {
            lock.unlock();
        }
        log.info("登记备份 backupId={}, originalId={}, type={}, file={}", record.getId(), originalId,
                type.getValue(), filePath);
        return record;
    }

    @Override
    public Optional<BackupRecord> getBackupById(String id) throws IOException {
        lock.lock();
        try {
            return loaded().stream().filter(r -> r.getId().equals(id)).findFirst();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<BackupRecord> listBackups(BackupFilter filter) throws IOException {
        BackupFilter f = filter == null ? BackupFilter.all() : filter;
        List<BackupRecord> snapshot;
        lock.lock();
        try {
            snapshot = new ArrayList<>(loaded());
        } finally {
            lock.unlock();
        }
        return snapshot.stream()
                .filter(r -> f.getType() == null || f.getType() == r.getType())
                .filter(r -> f.getDateFrom() == null || !r.getDeletedAt().isBefore(f.getDateFrom()))
                .filter(r -> f.getDateTo() == null || !r.getDeletedAt().isAfter(f.getDateTo()))
                .filter(r -> matches(r, f.getSearchQuery()))
                .sorted(Comparator.comparing(BackupRecord::getDeletedAt).reversed())
                .collect(Collectors.toList());
    }

    @Override
    public List<BackupRecord> searchBackups(String query) throws IOException {
        BackupFilter filter = new BackupFilter();
        filter.setSearchQuery(query);
        return listBackups(filter);
    }

    @Override
    public boolean verifyBackupIntegrity(String id) throws IOException {
        Optional<BackupRecord> record = getBackupById(id);
        if (record.isEmpty()) {
            return false;
        }
        Path file = dataDir.resolve(record.get().getFilePath());
        if (!Files.exists(file)) {
            log.warn("备份文件不存在 backupId={}, file={}", id, file);
            return false;
        }
        boolean ok = sha256(Files.readAllBytes(file)).equals(record.get().getChecksum());
        if (!ok) {
            log.warn("备份文件校验和不一致 backupId={}", id);
        }
        return ok;
    }

    @Override
    public boolean removeBackupMetadata(String id) throws IOException {
        lock.lock();
        try {
            List<BackupRecord> next = new ArrayList<>(loaded());
            boolean removed = next.removeIf(r -> r.getId().equals(id));
            if (removed) {
                commit(next);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public BackupStorageStats getStorageStats() throws IOException {
        List<BackupRecord> all = listBackups(BackupFilter.all());
        BackupStorageStats stats = new BackupStorageStats();
        stats.setTotalBackups(all.size());
        stats.setTripBackups((int) all.stream().filter(r -> r.getType() == BackupType.TRIP).count());
        stats.setCostBackups((int) all.stream().filter(r -> r.getType() == BackupType.COST).count());
        stats.setTotalSize(all.stream().mapToLong(BackupRecord::getFileSize).sum());
        if (!all.isEmpty()) {
            stats.setNewestBackup(all.get(0).getDeletedAt());
            stats.setOldestBackup(all.get(all.size() - 1).getDeletedAt());
        }
        return stats;
    }

    @Override
    public GarbageCollectionResult garbageCollect(int retentionDays, int keepLatest, boolean dryRun)
            throws IOException {
        Instant cutoff = clock.instant().minus(Duration.ofDays(retentionDays));
        GarbageCollectionResult result = new GarbageCollectionResult();
        result.setDryRun(dryRun);
        lock.lock();
        try {
            List<BackupRecord> all = loaded();
            Map<String, List<BackupRecord>> byOriginal = new LinkedHashMap<>();
            for (BackupRecord r : all) {
                byOriginal.computeIfAbsent(r.getOriginalId(), k -> new ArrayList<>()).add(r);
            }
            List<BackupRecord> expired = new ArrayList<>();
            for (List<BackupRecord> group : byOriginal.values()) {
                group.sort(Comparator.comparing(BackupRecord::getDeletedAt).reversed());
                for (int i = Math.max(keepLatest, 0); i < group.size(); i++) {
                    if (group.get(i).getDeletedAt().isBefore(cutoff)) {
                        expired.add(group.get(i));
                    }
                }
            }
            for (BackupRecord r : expired) {
                if (dryRun) {
                    result.getRemovedIds().add(r.getId());
                    result.setFreedBytes(result.getFreedBytes() + r.getFileSize());
                    continue;
                }
                try {
                    Files.deleteIfExists(dataDir.resolve(r.getFilePath()));
                    result.getRemovedIds().add(r.getId());
                    result.setFreedBytes(result.getFreedBytes() + r.getFileSize());
                } catch (IOException e) {
                    log.warn("删除过期备份文件失败 backupId={}, file={}", r.getId(), r.getFilePath(), e);
                    result.getFailedIds().add(r.getId());
                }
            }
            if (!dryRun && !result.getRemovedIds().isEmpty()) {
                List<BackupRecord> next = new ArrayList<>(all);
                next.removeIf(r -> result.getRemovedIds().contains(r.getId()));
                commit(next);
            }
        } finally {
            lock.unlock();
        }
        log.info("备份清理完成 dryRun={}, removed={}, freedBytes={}, failed={}",
                dryRun, result.getRemovedIds().size(), result.getFreedBytes(), result.getFailedIds().size());
        return result;
    }

    private boolean matches(BackupRecord r, String query) {
        if (query == null || query.isBlank()) {
            return true;
        }
        String q = query.toLowerCase(Locale.ROOT);
        return contains(r.getTitle(), q) || contains(r.getOriginalId(), q) || contains(r.getDeletionReason(), q);
    }

    private static boolean contains(String field, String lowerQuery) {
        return field != null && field.toLowerCase(Locale.ROOT).contains(lowerQuery);
    }

    /**
     * 调用方须持有锁。目录文件读不出来时抛出原始 IOException，不当作空目录处理。
     */
    private List<BackupRecord> loaded() throws IOException {
        if (records == null) {
            if (Files.exists(catalogFile)) {
                CatalogFile file = objectMapper.readValue(catalogFile.toFile(), CatalogFile.class);
                records = file.getBackups() == null ? new ArrayList<>() : new ArrayList<>(file.getBackups());
            } else {
                records = new ArrayList<>();
            }
        }
        return records;
    }

    /**
     * 先落盘再替换内存副本，写失败时内存保持上一次成功写入的状态。调用方须持有锁。
     */
    private void commit(List<BackupRecord> next) throws IOException {
        CatalogFile file = new CatalogFile();
        file.setBackups(next);
        file.setLastUpdated(clock.instant());
        AtomicFileWriter.write(catalogFile, objectMapper.writeValueAsBytes(file));
        records = next;
    }

    private String newId() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder sb = new StringBuilder(ID_PREFIX).append(clock.millis()).append('-');
        for (int i = 0; i < 8; i++) {
            sb.append(RANDOM_ALPHABET.charAt(random.nextInt(RANDOM_ALPHABET.length())));
        }
        return sb.toString();
    }

    static String sha256(byte[] content) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(content));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Data
    static class CatalogFile {
        private List<BackupRecord> backups = new ArrayList<>();
        private Instant lastUpdated;
    }
}
