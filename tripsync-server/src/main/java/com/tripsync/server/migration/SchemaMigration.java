package com.tripsync.server.migration;

import com.tripsync.pojo.entity.TripDocument;

/**
 * 单步文档结构迁移：把 fromVersion 的文档原地改写为 toVersion。
 * <p>
 * 约定：
 * - 只修改传入的文档（引擎传入的是副本），不访问文件系统；
 * - 可修复的数据问题一律修复并通过 {@link MigrationContext#record} 留痕，不抛异常；
 * - 对已经满足目标结构的文档再次执行不产生任何变化。
 * </p>
 */
public interface SchemaMigration {

    int fromVersion();

    default int toVersion() {
        return fromVersion() + 1;
    }

    String description();

    void migrate(TripDocument doc, MigrationContext context);
}
