package com.tripsync.common.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 行程文件存储配置。
 * Storage configuration for trip documents and their backups.
 */
@Data
@ConfigurationProperties(prefix = "tripsync.storage")
public class StorageProperties {

    /**
     * 数据目录，所有 trip-*.json 文件都落在这里。
     * Root directory holding trip-*.json files.
     */
    private String dataDir = "./data";

    /**
     * 备份子目录名（相对 dataDir）。
     */
    private String backupDirName = "backups";

    /**
     * 备份目录文件名（相对 dataDir）。
     */
    private String catalogFileName = "backup-metadata.json";

    /**
     * 写文件线程数；同一个行程的写入始终串行，不同行程之间并行。
     */
    private int writeThreads = 4;

    /**
     * publicUpdates 最多保留条数（最新在前）。
     */
    private int publicUpdatesLimit = 100;

    /**
     * 删除备份保留天数，超过后由清理任务回收。
     */
    private int backupRetentionDays = 90;

    /**
     * 无论是否过期，每个行程至少保留的最新备份数。
     */
    private int keepLatestBackups = 5;

    /**
     * 是否启用定时的关联一致性巡检。
     */
    private boolean linkAuditEnabled = true;
}
