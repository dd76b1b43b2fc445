package com.tripsync.common.result;

/**
 * 对外暴露的错误码枚举。
 * <p>枚举名本身即稳定的机器可读错误码（如 CROSS_TRIP_EXPENSE），调用方应按名称判断，
 * 数字 code 仅用于日志与兼容。</p>
 */
public enum ErrorCode {

    /** 通用错误（未细分场景时的兜底） */
    COMMON_ERROR(1, "error"),

    /** 行程不存在 */
    TRIP_NOT_FOUND(2001, "行程不存在"),

    /** 备份记录不存在 */
    BACKUP_NOT_FOUND(2002, "备份不存在"),

    /** 费用条目不存在（单条校验违规） */
    EXPENSE_NOT_FOUND(2003, "费用条目不存在"),

    /** 行程条目（地点/住宿/路线）不存在（单条校验违规） */
    TRAVEL_ITEM_NOT_FOUND(2004, "行程条目不存在"),

    /** 关联的费用不属于当前行程 */
    CROSS_TRIP_EXPENSE(3001, "费用不属于当前行程"),

    /** 关联的行程条目不属于当前行程 */
    CROSS_TRIP_TRAVEL_ITEM(3002, "行程条目不属于当前行程"),

    /** 文档 schemaVersion 缺失或非法 */
    INVALID_SCHEMA_VERSION(3003, "文档版本号非法"),

    /** 行程 ID 非法（为空、过长或含非法字符） */
    INVALID_TRIP_ID(3004, "行程 ID 不合法"),

    /** 更新内容不合法 */
    INVALID_UPDATE(3005, "更新内容不合法"),

    /** 恢复目标已存在数据，需要显式覆盖 */
    RESTORE_CONFLICT(4001, "目标行程已有数据，需确认覆盖");

    private final int code;
    private final String msg;

    ErrorCode(int code, String msg) {
        this.code = code;
        this.msg = msg;
    }

    public int getCode() {
        return code;
    }

    public String getMsg() {
        return msg;
    }
}
