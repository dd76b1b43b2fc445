package com.tripsync.server.backup;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * 备份目录：记录删除前写出的备份文件，支持列表、检索、校验和过期清理。
 * 存储层只依赖这个接口，具体格式由实现决定。
 * 目录本身读写失败一律抛出 IOException，不会被当作“备份不存在”。
 */
public interface BackupCatalog {

    /**
     * 登记一个已经落盘的备份文件。
     *
     * @param filePath 相对数据目录的路径
     */
    BackupRecord addBackupMetadata(String originalId, BackupType type, String title, String filePath,
                                   String reason) throws IOException;

    Optional<BackupRecord> getBackupById(String id) throws IOException;

    /**
     * 按删除时间倒序返回。
     */
    List<BackupRecord> listBackups(BackupFilter filter) throws IOException;

    List<BackupRecord> searchBackups(String query) throws IOException;

    /**
     * 重新计算文件校验和并与登记值比较；文件不存在返回 false。
     */
    boolean verifyBackupIntegrity(String id) throws IOException;

    boolean removeBackupMetadata(String id) throws IOException;

    BackupStorageStats getStorageStats() throws IOException;

    /**
     * 删除超过保留天数的备份，但每个行程至少保留最新的 keepLatest 份。
     */
    GarbageCollectionResult garbageCollect(int retentionDays, int keepLatest, boolean dryRun) throws IOException;
}
