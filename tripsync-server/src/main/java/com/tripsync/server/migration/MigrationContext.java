package com.tripsync.server.migration;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一次迁移执行的上下文：收集审计记录，并提供统一的“当前时间”，保证同一次迁移里生成的时间戳一致。
 */
@Slf4j
public class MigrationContext {

    private final String tripId;
    private final Instant now;
    private final List<MigrationAuditEntry> entries = new ArrayList<>();
    private String step = "";

    public MigrationContext(String tripId, Instant now) {
        this.tripId = tripId;
        this.now = now;
    }

    void enterStep(String step) {
        this.step = step;
    }

    public String getTripId() {
        return tripId;
    }

    public Instant now() {
        return now;
    }

    public void record(MigrationAction action, String entityType, String entityId, String relatedId, String message) {
        entries.add(new MigrationAuditEntry(tripId, step, action, entityType, entityId, relatedId, message));
        log.info("迁移修复 tripId={}, step={}, action={}, {}", tripId, step, action, message);
    }

    /**
     * 记录无法自动修复、需要人工关注的情况。
     */
    public void warn(MigrationAction action, String entityType, String entityId, String message) {
        entries.add(new MigrationAuditEntry(tripId, step, action, entityType, entityId, null, message));
        log.warn("迁移发现无法修复的数据 tripId={}, step={}, action={}, {}", tripId, step, action, message);
    }

    public List<MigrationAuditEntry> getEntries() {
        return Collections.unmodifiableList(entries);
    }
}
