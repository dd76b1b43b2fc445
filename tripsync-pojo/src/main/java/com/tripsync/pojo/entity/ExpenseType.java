package com.tripsync.pojo.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ExpenseType {

    ACTUAL("actual"),
    PLANNED("planned");

    private final String value;

    ExpenseType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ExpenseType fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (ExpenseType type : values()) {
            if (type.value.equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        // 未知值按实际支出处理，旧数据里出现过 "spent" 之类的写法
        return ACTUAL;
    }
}
