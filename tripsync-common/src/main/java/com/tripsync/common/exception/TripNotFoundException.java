package com.tripsync.common.exception;

import com.tripsync.common.result.ErrorCode;

/**
 * 行程或备份不存在。
 */
public class TripNotFoundException extends BaseException {

    public TripNotFoundException(String tripId) {
        super(ErrorCode.TRIP_NOT_FOUND, "Trip " + tripId + " not found");
    }

    public TripNotFoundException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public static TripNotFoundException backup(String backupId) {
        return new TripNotFoundException(ErrorCode.BACKUP_NOT_FOUND, "Backup " + backupId + " not found");
    }
}
