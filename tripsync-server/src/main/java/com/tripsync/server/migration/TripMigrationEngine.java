package com.tripsync.server.migration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripsync.common.constant.StorageConstants;
import com.tripsync.common.exception.InvalidSchemaVersionException;
import com.tripsync.pojo.entity.TripDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * 文档结构迁移引擎。
 * <p>
 * 启动时校验注册的迁移步骤恰好构成 1 → 当前版本 的连续链；
 * 迁移时先深拷贝入参，只执行从文档当前版本开始的那一段后缀（v5 文档跳过 v1..v4 的步骤）。
 * </p>
 */
@Component
@Slf4j
public class TripMigrationEngine {

    public static final int CURRENT_VERSION = StorageConstants.CURRENT_SCHEMA_VERSION;

    private static final String RECONCILE_STEP = "reconcile";

    /**
     * 关联整理复用的步骤（按 fromVersion）：规范化、清理悬空关联、双向同步、补建住宿并清空失效引用。
     * 5 → 6 只处理旧版数据的形态问题，不参与整理。
     */
    private static final Set<Integer> RECONCILE_STEPS = Set.of(2, 3, 4, 6);

    private final List<SchemaMigration> chain;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public TripMigrationEngine(List<SchemaMigration> migrations, ObjectMapper objectMapper, Clock clock) {
        this.chain = validateChain(migrations);
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    private static List<SchemaMigration> validateChain(List<SchemaMigration> migrations) {
        List<SchemaMigration> sorted = new ArrayList<>(migrations);
        sorted.sort(Comparator.comparingInt(SchemaMigration::fromVersion));
        int expected = 1;
        for (SchemaMigration migration : sorted) {
            if (migration.fromVersion() != expected || migration.toVersion() != expected + 1) {
                throw new IllegalStateException("迁移链不连续: 期望 v" + expected + "->v" + (expected + 1)
                        + ", 实际 " + migration.getClass().getSimpleName()
                        + " v" + migration.fromVersion() + "->v" + migration.toVersion());
            }
            expected++;
        }
        if (expected != CURRENT_VERSION) {
            throw new IllegalStateException("迁移链终点 v" + expected + " 与当前版本 v" + CURRENT_VERSION + " 不一致");
        }
        return List.copyOf(sorted);
    }

    /**
     * 把任意历史版本的文档迁移到当前版本，返回新对象，入参不被修改。
     *
     * @throws InvalidSchemaVersionException 版本号缺失、小于 1 或高于当前版本
     */
    public TripDocument migrateToLatestSchema(TripDocument doc) {
        return migrateWithReport(doc).getDocument();
    }

    public MigrationReport migrateWithReport(TripDocument doc) {
        Integer version = doc.getSchemaVersion();
        if (!isSupportedVersion(version)) {
            throw new InvalidSchemaVersionException(doc.getId(), version);
        }
        TripDocument working = copyOf(doc);
        MigrationContext context = new MigrationContext(doc.getId(), clock.instant());
        List<String> applied = new ArrayList<>();
        for (SchemaMigration migration : chain) {
            if (migration.fromVersion() < version) {
                continue;
            }
            String step = "v" + migration.fromVersion() + "->v" + migration.toVersion();
            context.enterStep(step);
            migration.migrate(working, context);
            working.setSchemaVersion(migration.toVersion());
            applied.add(step + " " + migration.description());
        }
        if (version < CURRENT_VERSION) {
            working.setUpdatedAt(context.now());
            log.info("文档迁移完成 tripId={}, from={}, to={}, repairs={}",
                    doc.getId(), version, CURRENT_VERSION, context.getEntries().size());
        }
        return new MigrationReport(doc.getId(), version, working.getSchemaVersion(), applied,
                context.getEntries(), working);
    }

    /**
     * 对当前版本文档重新做一遍关联整理，版本号不变。
     * 保存前调用：更新操作和从备份恢复之后的文档同样满足当前版本的关联约束，
     * 因为当前版本的文档在加载时不会再经过迁移链。
     */
    public MigrationReport reconcileLinks(TripDocument doc) {
        Integer version = doc.getSchemaVersion();
        if (version == null || version != CURRENT_VERSION) {
            throw new InvalidSchemaVersionException(doc.getId(), version);
        }
        TripDocument working = copyOf(doc);
        MigrationContext context = new MigrationContext(doc.getId(), clock.instant());
        context.enterStep(RECONCILE_STEP);
        List<String> applied = new ArrayList<>();
        for (SchemaMigration migration : chain) {
            if (RECONCILE_STEPS.contains(migration.fromVersion())) {
                migration.migrate(working, context);
                applied.add(RECONCILE_STEP + " " + migration.description());
            }
        }
        return new MigrationReport(doc.getId(), version, version, applied, context.getEntries(), working);
    }

    public boolean needsMigration(TripDocument doc) {
        Integer version = doc.getSchemaVersion();
        return version == null || version < CURRENT_VERSION;
    }

    public static boolean isSupportedVersion(Integer version) {
        return version != null && version >= 1 && version <= CURRENT_VERSION;
    }

    private TripDocument copyOf(TripDocument doc) {
        try {
            return objectMapper.treeToValue(objectMapper.valueToTree(doc), TripDocument.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("复制行程文档失败, tripId=" + doc.getId(), e);
        }
    }
}
