package com.tripsync.common.exception;

import com.tripsync.common.result.ErrorCode;

/**
 * 写入目标已有数据且调用方未显式要求覆盖（例如从备份恢复到已存在的行程）。
 * 与 not-found / validation 区分开，便于上层提供“是否覆盖”的交互。
 */
public class TripConflictException extends BaseException {

    public TripConflictException(String message) {
        super(ErrorCode.RESTORE_CONFLICT, message);
    }
}
