package com.tripsync.server.backup;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum BackupType {

    /** 整个行程被删除前的完整备份 */
    TRIP("trip"),

    /** 费用段被删除前的备份 */
    COST("cost");

    private final String value;

    BackupType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static BackupType fromValue(String value) {
        for (BackupType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown backup type: " + value);
    }
}
