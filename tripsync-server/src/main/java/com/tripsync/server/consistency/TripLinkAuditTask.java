package com.tripsync.server.consistency;

import com.tripsync.common.properties.StorageProperties;
import com.tripsync.pojo.entity.TripDocument;
import com.tripsync.server.storage.TripDocumentStore;
import com.tripsync.server.storage.TripMdcScope;
import com.tripsync.server.metrics.MetricsRecorder;
import com.tripsync.server.validation.LinkViolation;
import com.tripsync.server.validation.TripBoundaryValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * 费用关联巡检任务。
 *
 * <p>周期性加载所有行程，检查费用与行程条目之间是否存在跨行程或悬空的关联，只记录不修改。
 * 加载本身会触发迁移和损坏恢复，所以巡检也顺带把旧文件升级到当前版本。</p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TripLinkAuditTask {

    private final TripDocumentStore tripDocumentStore;
    private final TripBoundaryValidator boundaryValidator;
    private final StorageProperties storageProperties;
    private final MetricsRecorder metricsRecorder;

    @Scheduled(cron = "0 30 * * * ?")
    public void auditAllTrips() {
        if (!storageProperties.isLinkAuditEnabled()) {
            return;
        }
        List<String> tripIds;
        try {
            tripIds = tripDocumentStore.listTripIds();
        } catch (IOException e) {
            log.error("关联巡检失败: 无法列出行程文件", e);
            return;
        }
        int total = 0;
        for (String tripId : tripIds) {
            total += auditTrip(tripId);
        }
        metricsRecorder.recordAuditViolations(total);
        log.info("关联巡检完成: trips={}, violations={}", tripIds.size(), total);
    }

    /**
     * @return 该行程的违规条数，加载失败记 0
     */
    int auditTrip(String tripId) {
        try (TripMdcScope ignored = TripMdcScope.open(tripId)) {
            Optional<TripDocument> doc = tripDocumentStore.load(tripId);
            if (doc.isEmpty()) {
                return 0;
            }
            List<LinkViolation> violations = boundaryValidator.validateAllTripBoundaries(doc.get());
            for (LinkViolation violation : violations) {
                log.warn("关联违规 tripId={}, code={}, message={}", tripId, violation.getCode(), violation.getMessage());
            }
            return violations.size();
        } catch (IOException | RuntimeException e) {
            log.warn("巡检行程失败，已跳过 tripId={}, error={}", tripId, e.getMessage());
            return 0;
        }
    }
}
