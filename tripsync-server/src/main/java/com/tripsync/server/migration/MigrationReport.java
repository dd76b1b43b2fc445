package com.tripsync.server.migration;

import com.tripsync.pojo.entity.TripDocument;
import lombok.Data;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 迁移结果：迁移后的文档副本 + 执行过的步骤 + 全部审计记录。
 */
@Data
public class MigrationReport {

    private final String tripId;

    private final int fromVersion;

    private final int toVersion;

    private final List<String> appliedSteps;

    private final List<MigrationAuditEntry> auditEntries;

    private final TripDocument document;

    public boolean isMigrated() {
        return fromVersion != toVersion;
    }

    /**
     * 本次迁移或整理是否实际修改过数据。
     */
    public boolean hasChanges() {
        return isMigrated() || !auditEntries.isEmpty();
    }

    public List<String> getMessages() {
        return auditEntries.stream().map(MigrationAuditEntry::getMessage).collect(Collectors.toList());
    }
}
