package com.tripsync.server.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tripsync.common.constant.StorageConstants;
import com.tripsync.common.exception.TripConflictException;
import com.tripsync.common.exception.TripNotFoundException;
import com.tripsync.common.exception.TripValidationException;
import com.tripsync.common.result.ErrorCode;
import com.tripsync.pojo.entity.CostTrackingLink;
import com.tripsync.pojo.entity.FinanceData;
import com.tripsync.pojo.entity.TripDocument;
import com.tripsync.pojo.vo.TripSummaryVO;
import com.tripsync.server.backup.BackupCatalog;
import com.tripsync.server.backup.BackupRecord;
import com.tripsync.server.backup.BackupType;
import com.tripsync.server.document.LinkedItem;
import com.tripsync.server.document.TripDocuments;
import com.tripsync.server.metrics.MetricsRecorder;
import com.tripsync.server.migration.MigrationReport;
import com.tripsync.server.migration.TripMigrationEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 行程文件的读写引擎：一个行程一个文件。
 * <p>
 * 读：解析失败时尝试截断恢复（原文件隔离到 backups 目录），之后统一走迁移；
 * 版本有变化或做过恢复时立即写回。
 * 写：同一文件的写入经 {@link TripWriteQueue} 串行，内容先写临时文件再原子替换；
 * 低于当前版本的文档先迁移再落盘，磁盘上永远是当前版本。
 * </p>
 * IO 异常原样抛出，不包装成业务异常。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TripDocumentStore {

    private final TripFilePaths paths;
    private final TripWriteQueue writeQueue;
    private final ObjectMapper objectMapper;
    private final TripMigrationEngine migrationEngine;
    private final CorruptedJsonRecovery corruptedJsonRecovery;
    private final BackupCatalog backupCatalog;
    private final MetricsRecorder metricsRecorder;
    private final Clock clock;

    /**
     * 读取并迁移行程文档。文件不存在或损坏到无法恢复时返回 empty。
     */
    public Optional<TripDocument> load(String tripId) throws IOException {
        Path file = paths.tripFile(tripId);
        try (TripMdcScope ignored = TripMdcScope.open(tripId)) {
            byte[] bytes;
            try {
                bytes = Files.readAllBytes(file);
            } catch (NoSuchFileException e) {
                return Optional.empty();
            }
            String raw = new String(bytes, StandardCharsets.UTF_8);

            TripDocument doc;
            boolean recovered = false;
            try {
                doc = objectMapper.readValue(raw, TripDocument.class);
            } catch (JsonProcessingException e) {
                log.warn("行程文件解析失败，尝试恢复 tripId={}, error={}", tripId, e.getOriginalMessage());
                Optional<TripDocument> candidate = corruptedJsonRecovery.recover(raw, e);
                if (candidate.isEmpty()) {
                    metricsRecorder.recordCorruptionRecovery("failed");
                    log.error("行程文件损坏且无法恢复，按不存在处理 tripId={}, file={}", tripId, file);
                    return Optional.empty();
                }
                quarantine(tripId, bytes);
                metricsRecorder.recordCorruptionRecovery("recovered");
                doc = candidate.get();
                recovered = true;
            }
            if (doc == null) {
                return Optional.empty();
            }
            if (!tripId.equals(doc.getId())) {
                log.warn("文件内 id 与文件名不一致，以文件名为准 tripId={}, docId={}", tripId, doc.getId());
                doc.setId(tripId);
            }

            MigrationReport report = migrationEngine.migrateWithReport(doc);
            if (report.isMigrated()) {
                metricsRecorder.recordMigration(report.getFromVersion());
            }
            if (report.isMigrated() || recovered) {
                byte[] content = serialize(report.getDocument());
                await(writeQueue.submit(file, () -> AtomicFileWriter.write(file, content)));
                log.info("行程已写回 tripId={}, migrated={}, recovered={}", tripId, report.isMigrated(), recovered);
            }
            return Optional.of(report.getDocument());
        }
    }

    /**
     * 同步保存，等待本次写入真正落盘。
     */
    public void save(TripDocument doc) throws IOException {
        await(saveAsync(doc));
    }

    /**
     * 异步保存。序列化在入队前完成，之后对 doc 的修改不会影响本次写入。
     */
    public CompletableFuture<Void> saveAsync(TripDocument doc) {
        Path file = paths.tripFile(doc.getId());
        try (TripMdcScope ignored = TripMdcScope.open(doc.getId())) {
            TripDocument toWrite = doc;
            Integer version = doc.getSchemaVersion();
            if (version == null || version != TripMigrationEngine.CURRENT_VERSION) {
                toWrite = migrationEngine.migrateToLatestSchema(doc);
            }
            byte[] content;
            try {
                content = serialize(toWrite);
            } catch (JsonProcessingException e) {
                return CompletableFuture.failedFuture(e);
            }
            long start = System.nanoTime();
            return writeQueue.submit(file, () -> AtomicFileWriter.write(file, content))
                    .whenComplete((r, e) -> metricsRecorder.recordSaveLatencyMs(
                            (System.nanoTime() - start) / 1_000_000, e == null ? "ok" : "error"));
        }
    }

    public boolean exists(String tripId) {
        return Files.exists(paths.tripFile(tripId));
    }

    /**
     * 数据目录下所有行程的 ID（按文件名解析，不读内容）。
     */
    public List<String> listTripIds() throws IOException {
        Path dir = paths.getDataDir();
        if (!Files.isDirectory(dir)) {
            return new ArrayList<>();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(Files::isRegularFile)
                    .map(paths::tripIdOf)
                    .flatMap(Optional::stream)
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    /**
     * 行程摘要列表，按创建时间倒序；读不出来的文件跳过。
     */
    public List<TripSummaryVO> listTrips() throws IOException {
        List<TripSummaryVO> summaries = new ArrayList<>();
        for (String tripId : listTripIds()) {
            try {
                readForListing(tripId).map(this::toSummary).ifPresent(summaries::add);
            } catch (IOException | RuntimeException e) {
                log.warn("读取行程摘要失败，已跳过 tripId={}, error={}", tripId, e.getMessage());
            }
        }
        summaries.sort(Comparator.comparing(TripSummaryVO::getCreatedAt,
                Comparator.nullsLast(Comparator.reverseOrder())));
        return summaries;
    }

    private Optional<TripDocument> readForListing(String tripId) throws IOException {
        Path file = paths.tripFile(tripId);
        try {
            JsonNode node = objectMapper.readTree(Files.readAllBytes(file));
            return Optional.ofNullable(objectMapper.treeToValue(node, TripDocument.class));
        } catch (JsonProcessingException e) {
            // 解析失败的交给完整加载流程做恢复
            return load(tripId);
        }
    }

    private TripSummaryVO toSummary(TripDocument doc) {
        TripSummaryVO vo = new TripSummaryVO();
        vo.setId(doc.getId());
        vo.setTitle(doc.getTitle());
        vo.setDescription(doc.getDescription());
        vo.setStartDate(doc.getStartDate());
        vo.setEndDate(doc.getEndDate());
        vo.setCreatedAt(doc.getCreatedAt());
        vo.setUpdatedAt(doc.getUpdatedAt());
        vo.setHasItinerary(doc.getItinerary() != null);
        vo.setHasFinance(doc.getFinance() != null);
        return vo;
    }

    /**
     * 删除整个行程：先写备份并登记，再经写队列删除文件。
     */
    public BackupRecord deleteTrip(String tripId, String reason) throws IOException {
        try (TripMdcScope ignored = TripMdcScope.open(tripId)) {
            TripDocument doc = load(tripId).orElseThrow(() -> new TripNotFoundException(tripId));
            BackupRecord record = writeBackup(doc, BackupType.TRIP, reason);
            Path file = paths.tripFile(tripId);
            await(writeQueue.submit(file, () -> Files.deleteIfExists(file)));
            log.info("行程已删除 tripId={}, backupId={}", tripId, record.getId());
            return record;
        }
    }

    /**
     * 删除费用段：先备份整个文档，再清空 finance 以及所有条目上的费用关联。
     */
    public BackupRecord deleteFinance(String tripId, String reason) throws IOException {
        try (TripMdcScope ignored = TripMdcScope.open(tripId)) {
            TripDocument doc = load(tripId).orElseThrow(() -> new TripNotFoundException(tripId));
            if (doc.getFinance() == null) {
                throw new TripNotFoundException(ErrorCode.TRIP_NOT_FOUND, "Trip " + tripId + " has no finance data");
            }
            BackupRecord record = writeBackup(doc, BackupType.COST, reason);
            doc.setFinance(null);
            for (LinkedItem item : TripDocuments.linkedItems(doc)) {
                item.replaceLinks(new ArrayList<>());
            }
            doc.setUpdatedAt(clock.instant());
            save(doc);
            log.info("费用数据已删除 tripId={}, backupId={}", tripId, record.getId());
            return record;
        }
    }

    /**
     * 从整行程备份恢复。目标行程已存在且未要求覆盖时抛 {@link TripConflictException}。
     */
    public TripDocument restoreTrip(String backupId, boolean overwrite) throws IOException {
        BackupRecord record = requireBackup(backupId, BackupType.TRIP);
        String tripId = record.getOriginalId();
        try (TripMdcScope ignored = TripMdcScope.open(tripId)) {
            if (!overwrite && exists(tripId)) {
                throw new TripConflictException("Trip " + tripId + " already exists, overwrite not confirmed");
            }
            TripDocument backup = migrationEngine.migrateToLatestSchema(readBackup(record));
            TripDocument restored = migrationEngine.reconcileLinks(backup).getDocument();
            restored.setUpdatedAt(clock.instant());
            save(restored);
            log.info("行程已从备份恢复 tripId={}, backupId={}, overwrite={}", tripId, backupId, overwrite);
            return restored;
        }
    }

    /**
     * 从费用备份恢复 finance 段，并把备份里的条目关联按 expenseId 合并回现有条目，最后整理一遍关联。
     */
    public TripDocument restoreFinance(String backupId, boolean overwrite) throws IOException {
        BackupRecord record = requireBackup(backupId, BackupType.COST);
        String tripId = record.getOriginalId();
        try (TripMdcScope ignored = TripMdcScope.open(tripId)) {
            TripDocument target = load(tripId).orElseThrow(() -> new TripNotFoundException(tripId));
            FinanceData existing = target.getFinance();
            if (!overwrite && existing != null && existing.getExpenses() != null && !existing.getExpenses().isEmpty()) {
                throw new TripConflictException("Trip " + tripId + " already has finance data, overwrite not confirmed");
            }
            TripDocument backup = migrationEngine.migrateToLatestSchema(readBackup(record));
            target.setFinance(backup.getFinance());
            for (LinkedItem backupItem : TripDocuments.linkedItems(backup)) {
                TripDocuments.findItem(target, backupItem.getType(), backupItem.getId()).ifPresent(item -> {
                    for (CostTrackingLink link : backupItem.getLinks()) {
                        if (link != null && !item.hasLink(link.getExpenseId())) {
                            item.addLink(link.getExpenseId(), link.getDescription());
                        }
                    }
                });
            }
            TripDocument restored = migrationEngine.reconcileLinks(target).getDocument();
            restored.setUpdatedAt(clock.instant());
            save(restored);
            log.info("费用数据已从备份恢复 tripId={}, backupId={}, overwrite={}", tripId, backupId, overwrite);
            return restored;
        }
    }

    private BackupRecord requireBackup(String backupId, BackupType type) throws IOException {
        BackupRecord record = backupCatalog.getBackupById(backupId)
                .orElseThrow(() -> TripNotFoundException.backup(backupId));
        if (record.getType() != type) {
            throw new TripValidationException(ErrorCode.INVALID_UPDATE,
                    "Backup " + backupId + " is a " + record.getType().getValue() + " backup");
        }
        return record;
    }

    private TripDocument readBackup(BackupRecord record) throws IOException {
        Path file = paths.resolveRelative(record.getFilePath());
        if (!Files.exists(file)) {
            throw new TripNotFoundException(ErrorCode.BACKUP_NOT_FOUND,
                    "Backup file for " + record.getId() + " is missing");
        }
        JsonNode node = objectMapper.readTree(Files.readAllBytes(file));
        if (!(node instanceof ObjectNode)) {
            throw new TripValidationException(ErrorCode.INVALID_UPDATE, "Backup " + record.getId() + " is not a trip document");
        }
        ((ObjectNode) node).remove(StorageConstants.BACKUP_METADATA_FIELD);
        TripDocument doc = objectMapper.treeToValue(node, TripDocument.class);
        doc.setId(record.getOriginalId());
        return doc;
    }

    private BackupRecord writeBackup(TripDocument doc, BackupType type, String reason) throws IOException {
        Instant now = clock.instant();
        Path backupFile = paths.deletedBackupFile(doc.getId(), type.getValue(), now);
        ObjectNode node = objectMapper.valueToTree(doc);
        ObjectNode metadata = node.putObject(StorageConstants.BACKUP_METADATA_FIELD);
        metadata.put("deletedAt", now.toString());
        metadata.put("originalId", doc.getId());
        metadata.put("backupType", type.getValue());
        if (reason != null) {
            metadata.put("deletionReason", reason);
        }
        AtomicFileWriter.write(backupFile, objectMapper.writeValueAsBytes(node));
        metricsRecorder.recordBackupWritten(type.getValue());
        return backupCatalog.addBackupMetadata(doc.getId(), type, doc.getTitle(), paths.relativize(backupFile), reason);
    }

    private void quarantine(String tripId, byte[] original) throws IOException {
        Path target = paths.corruptedBackupFile(tripId, clock.instant());
        AtomicFileWriter.write(target, original);
        log.warn("损坏的原始文件已隔离 tripId={}, file={}", tripId, target);
    }

    private byte[] serialize(TripDocument doc) throws JsonProcessingException {
        return objectMapper.writeValueAsBytes(doc);
    }

    /**
     * 等待写入完成，把 CompletionException 还原成原始异常。
     */
    static void await(CompletableFuture<?> future) throws IOException {
        try {
            future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }
}
