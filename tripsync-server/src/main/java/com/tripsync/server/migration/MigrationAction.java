package com.tripsync.server.migration;

/**
 * 迁移过程中对文档做出的修改类型，写入审计记录。
 */
public enum MigrationAction {
    ACCOMMODATION_EXTRACTED,
    LINK_MOVED,
    LINK_NORMALIZED,
    DANGLING_LINK_REMOVED,
    LINK_ADDED,
    REFERENCE_ADDED,
    REFERENCE_REPLACED,
    CONFLICTING_LINK_REMOVED,
    LOCATION_REBOUND,
    ACCOMMODATION_ID_ADDED,
    ORPHAN_ACCOMMODATION,
    ACCOMMODATION_RECREATED,
    LINK_REATTACHED,
    REFERENCE_CLEARED
}
