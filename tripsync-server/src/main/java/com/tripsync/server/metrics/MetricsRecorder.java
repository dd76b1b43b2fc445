package com.tripsync.server.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * 统一的业务指标记录器。
 *
 * 说明：
 * - 使用 Micrometer 的 MeterRegistry 记录 Counter / Timer；
 * - 指标记录失败只打 debug 日志，绝不影响读写主流程；
 * - 命名沿用「组件.业务.动作」，便于按模块聚合。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsRecorder {

    private final MeterRegistry meterRegistry;

    /**
     * 记录一次加载时触发的版本迁移。
     *
     * @param fromVersion 迁移前的版本
     */
    public void recordMigration(int fromVersion) {
        try {
            meterRegistry.counter("tripsync.migration.applied", "from", String.valueOf(fromVersion)).increment();
        } catch (Exception e) {
            log.debug("记录迁移指标失败: {}", e.getMessage());
        }
    }

    /**
     * 记录损坏文件恢复结果：recovered / failed。
     */
    public void recordCorruptionRecovery(String outcome) {
        try {
            meterRegistry.counter("tripsync.storage.corruption_recovery", "outcome", safe(outcome)).increment();
        } catch (Exception e) {
            log.debug("记录损坏恢复指标失败: {}", e.getMessage());
        }
    }

    /**
     * 记录单次落盘耗时（从入队到写完）。
     */
    public void recordSaveLatencyMs(long latencyMs, String outcome) {
        try {
            meterRegistry.timer("tripsync.storage.save.latency", "outcome", safe(outcome))
                    .record(latencyMs, TimeUnit.MILLISECONDS);
        } catch (Exception e) {
            log.debug("记录落盘耗时指标失败: {}", e.getMessage());
        }
    }

    /**
     * 记录关联校验结果，code 为 ok 或错误码名称。
     */
    public void recordLinkValidation(String code) {
        try {
            meterRegistry.counter("tripsync.link.validation", "code", safe(code)).increment();
        } catch (Exception e) {
            log.debug("记录关联校验指标失败: {}", e.getMessage());
        }
    }

    /**
     * 记录删除前写入的备份：trip / cost。
     */
    public void recordBackupWritten(String type) {
        try {
            meterRegistry.counter("tripsync.backup.written", "type", safe(type)).increment();
        } catch (Exception e) {
            log.debug("记录备份指标失败: {}", e.getMessage());
        }
    }

    /**
     * 记录巡检发现的关联问题数量。
     */
    public void recordAuditViolations(int count) {
        if (count <= 0) {
            return;
        }
        try {
            meterRegistry.counter("tripsync.link.audit.violations").increment(count);
        } catch (Exception e) {
            log.debug("记录巡检指标失败: {}", e.getMessage());
        }
    }

    private String safe(String s) {
        if (s == null || s.isBlank()) {
            return "unknown";
        }
        // tag 不宜过长，避免高基数
        return s.length() > 32 ? s.substring(0, 32) : s;
    }
}
