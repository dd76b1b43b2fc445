package com.tripsync.server.backup;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 备份清理结果。dryRun 时 removedIds 表示“将会”被删除的记录。
 */
@Data
public class GarbageCollectionResult {

    private boolean dryRun;

    private List<String> removedIds = new ArrayList<>();

    private long freedBytes;

    /**
     * 文件删除失败的备份，记录保留，下次重试
     */
    private List<String> failedIds = new ArrayList<>();
}
