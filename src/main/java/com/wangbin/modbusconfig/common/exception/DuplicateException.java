package com.wangbin.modbusconfig.common.exception;

import com.wangbin.modbusconfig.common.web.result.ResultCode;

/**
 * 重复冲突：违反单文件单控制器约束、唯一键冲突、严格模式下控制器已存在
 */
public class DuplicateException extends BusinessException {

    public DuplicateException(String message) {
        super(ResultCode.DATA_EXISTS, message);
    }

    public static DuplicateException controllerExists(String host, int port) {
        return new DuplicateException(
                String.format("Controller with host %s and port %d already exists", host, port));
    }

    public static DuplicateException singleController(String unit, int found) {
        return new DuplicateException(String.format(
                "Only one controller per import is supported: expected exactly one %s, found %d", unit, found));
    }
}
