package com.tripsync.server.service.support;

import com.tripsync.pojo.entity.Accommodation;
import com.tripsync.pojo.entity.Expense;
import com.tripsync.pojo.entity.Location;
import com.tripsync.pojo.entity.TravelItemType;
import com.tripsync.pojo.entity.TravelReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 行程编辑器提交的住宿列表与已存住宿的合并。
 * <p>
 * 编辑器的自动保存可能带着过期的住宿数组到达：
 * - 同 ID 时，已存版本的 updatedAt 更新则保留已存版本；
 * - 提交里缺失、但仍被某个地点的 accommodationIds 或某条费用引用的已存住宿继续保留；
 * - 其余以提交内容为准（包括删除）。
 * </p>
 */
@Component
@Slf4j
public class AccommodationMerger {

    public List<Accommodation> merge(List<Accommodation> stored, List<Accommodation> incoming,
                                     List<Location> locations, List<Expense> expenses) {
        Map<String, Accommodation> storedById = new LinkedHashMap<>();
        if (stored != null) {
            for (Accommodation acc : stored) {
                if (acc != null && acc.getId() != null) {
                    storedById.putIfAbsent(acc.getId(), acc);
                }
            }
        }

        List<Accommodation> result = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        if (incoming != null) {
            for (Accommodation acc : incoming) {
                if (acc == null || acc.getId() == null || !seen.add(acc.getId())) {
                    continue;
                }
                Accommodation existing = storedById.get(acc.getId());
                if (existing != null && isNewer(existing, acc)) {
                    log.info("提交的住宿比已存版本旧，保留已存版本 accommodationId={}", acc.getId());
                    result.add(existing);
                } else {
                    result.add(acc);
                }
            }
        }

        Set<String> referenced = referencedIds(locations, expenses);
        for (Accommodation acc : storedById.values()) {
            if (!seen.contains(acc.getId()) && referenced.contains(acc.getId())) {
                log.info("提交中缺失但仍被引用的住宿予以保留 accommodationId={}", acc.getId());
                result.add(acc);
                seen.add(acc.getId());
            }
        }
        return result;
    }

    private boolean isNewer(Accommodation stored, Accommodation incoming) {
        if (stored.getUpdatedAt() == null) {
            return false;
        }
        return incoming.getUpdatedAt() == null || stored.getUpdatedAt().isAfter(incoming.getUpdatedAt());
    }

    private Set<String> referencedIds(List<Location> locations, List<Expense> expenses) {
        Set<String> ids = new HashSet<>();
        if (locations != null) {
            for (Location location : locations) {
                if (location != null && location.getAccommodationIds() != null) {
                    ids.addAll(location.getAccommodationIds());
                }
            }
        }
        if (expenses != null) {
            for (Expense expense : expenses) {
                TravelReference ref = expense == null ? null : expense.getTravelReference();
                if (ref != null && ref.resolveType() == TravelItemType.ACCOMMODATION && ref.getItemId() != null) {
                    ids.add(ref.getItemId());
                }
            }
        }
        return ids;
    }
}
