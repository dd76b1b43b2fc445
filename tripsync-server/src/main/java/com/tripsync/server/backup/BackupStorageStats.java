package com.tripsync.server.backup;

import lombok.Data;

import java.time.Instant;

@Data
public class BackupStorageStats {
    private int totalBackups;
    private int tripBackups;
    private int costBackups;
    private long totalSize;
    private Instant oldestBackup;
    private Instant newestBackup;
}
