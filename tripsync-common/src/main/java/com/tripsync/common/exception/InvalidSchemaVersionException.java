package com.tripsync.common.exception;

import com.tripsync.common.result.ErrorCode;

/**
 * 文档 schemaVersion 缺失、小于 1，或高于当前程序支持的版本。
 * 属于调用方无法自动修复的错误，迁移引擎不会尝试修复。
 */
public class InvalidSchemaVersionException extends TripValidationException {

    private final Integer schemaVersion;

    public InvalidSchemaVersionException(String tripId, Integer schemaVersion) {
        super(ErrorCode.INVALID_SCHEMA_VERSION,
                "Invalid schema version " + schemaVersion + " for trip " + tripId);
        this.schemaVersion = schemaVersion;
    }

    public Integer getSchemaVersion() {
        return schemaVersion;
    }
}
