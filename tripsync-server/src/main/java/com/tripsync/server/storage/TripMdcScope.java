package com.tripsync.server.storage;

import com.tripsync.common.constant.StorageConstants;
import org.slf4j.MDC;

/**
 * 在 MDC 中写入当前行程 ID，关闭时恢复进入前的值（支持嵌套调用）。
 */
public final class TripMdcScope implements AutoCloseable {

    private final String previous;

    private TripMdcScope(String previous) {
        this.previous = previous;
    }

    public static TripMdcScope open(String tripId) {
        String previous = MDC.get(StorageConstants.MDC_TRIP_ID);
        if (tripId != null) {
            MDC.put(StorageConstants.MDC_TRIP_ID, tripId);
        }
        return new TripMdcScope(previous);
    }

    @Override
    public void close() {
        if (previous == null) {
            MDC.remove(StorageConstants.MDC_TRIP_ID);
        } else {
            MDC.put(StorageConstants.MDC_TRIP_ID, previous);
        }
    }
}
