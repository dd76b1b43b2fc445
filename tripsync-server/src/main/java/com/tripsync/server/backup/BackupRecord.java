package com.tripsync.server.backup;

import lombok.Data;

import java.time.Instant;

/**
 * 备份目录中的一条记录。
 */
@Data
public class BackupRecord {

    public static final String CURRENT_BACKUP_VERSION = "1.0.0";

    /**
     * backup-{毫秒时间戳}-{随机串}
     */
    private String id;

    private String originalId;

    private BackupType type;

    private String title;

    private Instant deletedAt;

    /**
     * 相对数据目录的路径，如 backups/deleted-trip-abc-2024-01-01T00-00-00-000Z.json
     */
    private String filePath;

    private long fileSize;

    /**
     * 备份文件内容的 SHA-256（十六进制小写）
     */
    private String checksum;

    private String deletionReason;

    private String backupVersion = CURRENT_BACKUP_VERSION;
}
