package com.tripsync.pojo.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 可被费用关联的行程条目类型。
 */
public enum TravelItemType {

    LOCATION("location"),
    ACCOMMODATION("accommodation"),
    ROUTE("route");

    private final String value;

    TravelItemType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * 兼容旧数据里的 transportation 写法
     */
    @JsonCreator
    public static TravelItemType fromValue(String value) {
        if (value == null) {
            return null;
        }
        String v = value.trim().toLowerCase();
        if ("transportation".equals(v)) {
            return ROUTE;
        }
        for (TravelItemType type : values()) {
            if (type.value.equals(v)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown travel item type: " + value);
    }
}
