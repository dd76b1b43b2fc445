package com.tripsync.server.backup;

import lombok.Data;

import java.time.Instant;

/**
 * 备份列表的过滤条件，字段为 null 表示不限。
 */
@Data
public class BackupFilter {

    private BackupType type;

    private Instant dateFrom;

    private Instant dateTo;

    /**
     * 在标题、原行程 ID、删除原因中做不区分大小写的包含匹配
     */
    private String searchQuery;

    public static BackupFilter all() {
        return new BackupFilter();
    }
}
