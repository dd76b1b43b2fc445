package com.tripsync.server.migration;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 一条结构化的修复记录。message 保留人类可读描述，其余字段便于按条件检索。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MigrationAuditEntry {

    private String tripId;

    /**
     * 如 v3->v4；对已是最新版本的文档做关联整理时为 reconcile
     */
    private String step;

    private MigrationAction action;

    /**
     * location / accommodation / route / expense
     */
    private String entityType;

    private String entityId;

    /**
     * 关联对象 ID，如被删除的 expenseId
     */
    private String relatedId;

    private String message;
}
