package com.tripsync.server.consistency;

import com.tripsync.common.properties.StorageProperties;
import com.tripsync.server.backup.BackupCatalog;
import com.tripsync.server.backup.GarbageCollectionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * 删除备份的过期清理任务。
 * 超过保留天数的备份文件连同目录记录一起删除，但每个行程至少保留最新的若干份。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BackupRetentionTask {

    private final BackupCatalog backupCatalog;
    private final StorageProperties storageProperties;

    /**
     * 每天凌晨 3 点执行一次。
     */
    @Scheduled(cron = "0 0 3 * * ?")
    public void purgeExpiredBackups() {
        try {
            GarbageCollectionResult result = backupCatalog.garbageCollect(
                    storageProperties.getBackupRetentionDays(),
                    storageProperties.getKeepLatestBackups(),
                    false);
            if (!result.getFailedIds().isEmpty()) {
                log.warn("部分备份文件删除失败，下次重试: {}", result.getFailedIds());
            }
            log.info("备份清理完成: removed={}, freedBytes={}", result.getRemovedIds().size(), result.getFreedBytes());
        } catch (IOException e) {
            log.error("备份清理失败", e);
        }
    }
}
