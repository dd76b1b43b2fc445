package com.tripsync.server.storage;

import com.tripsync.common.constant.StorageConstants;
import com.tripsync.common.exception.TripValidationException;
import com.tripsync.common.result.ErrorCode;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 数据目录下各类文件的路径规则。所有路径都经过校验，不会落到数据目录之外。
 */
public class TripFilePaths {

    private static final Pattern TRIP_ID = Pattern.compile(StorageConstants.TRIP_ID_PATTERN);

    private final Path dataDir;
    private final Path backupDir;

    public TripFilePaths(Path dataDir, String backupDirName) {
        this.dataDir = dataDir.toAbsolutePath().normalize();
        this.backupDir = this.dataDir.resolve(backupDirName).normalize();
    }

    public static void validateTripId(String tripId) {
        if (tripId == null || !TRIP_ID.matcher(tripId).matches()) {
            throw new TripValidationException(ErrorCode.INVALID_TRIP_ID, "Invalid trip id: " + tripId);
        }
    }

    public Path getDataDir() {
        return dataDir;
    }

    public Path getBackupDir() {
        return backupDir;
    }

    public Path tripFile(String tripId) {
        validateTripId(tripId);
        return inside(dataDir.resolve(StorageConstants.TRIP_FILE_PREFIX + tripId + StorageConstants.JSON_SUFFIX));
    }

    /**
     * backups/deleted-{kind}-{tripId}-{timestamp}.json
     */
    public Path deletedBackupFile(String tripId, String kind, Instant at) {
        validateTripId(tripId);
        return inside(backupDir.resolve(StorageConstants.DELETED_BACKUP_PREFIX + kind + "-" + tripId + "-"
                + timestamp(at) + StorageConstants.JSON_SUFFIX));
    }

    /**
     * backups/corrupted-trip-{tripId}-{timestamp}.json.corrupt
     */
    public Path corruptedBackupFile(String tripId, Instant at) {
        validateTripId(tripId);
        return inside(backupDir.resolve(StorageConstants.CORRUPTED_BACKUP_PREFIX + tripId + "-"
                + timestamp(at) + StorageConstants.CORRUPTED_SUFFIX));
    }

    /**
     * 备份目录里登记的相对路径 → 绝对路径。
     */
    public Path resolveRelative(String relativePath) {
        if (relativePath == null || relativePath.isBlank()) {
            throw new TripValidationException(ErrorCode.INVALID_UPDATE, "Empty backup file path");
        }
        return inside(dataDir.resolve(relativePath).normalize());
    }

    public String relativize(Path file) {
        return dataDir.relativize(file.toAbsolutePath().normalize()).toString().replace('\\', '/');
    }

    /**
     * trip-{id}.json → id；其他文件返回 empty。
     */
    public Optional<String> tripIdOf(Path file) {
        String name = file.getFileName().toString();
        if (!name.startsWith(StorageConstants.TRIP_FILE_PREFIX) || !name.endsWith(StorageConstants.JSON_SUFFIX)) {
            return Optional.empty();
        }
        String id = name.substring(StorageConstants.TRIP_FILE_PREFIX.length(),
                name.length() - StorageConstants.JSON_SUFFIX.length());
        return TRIP_ID.matcher(id).matches() ? Optional.of(id) : Optional.empty();
    }

    /**
     * ISO 时间里的 ':' 和 '.' 换成 '-'，可以安全地出现在文件名里。
     */
    static String timestamp(Instant at) {
        return at.toString().replace(':', '-').replace('.', '-');
    }

    private Path inside(Path path) {
        Path normalized = path.toAbsolutePath().normalize();
        if (!normalized.startsWith(dataDir)) {
            throw new TripValidationException(ErrorCode.INVALID_TRIP_ID, "Path escapes data directory: " + path);
        }
        return normalized;
    }
}
