package com.wangbin.modbusconfig.common.exception;

import com.wangbin.modbusconfig.common.web.result.ResultCode;

/**
 * 配置导入导出异常基类
 */
public class ModbusConfigException extends BusinessException {

    public ModbusConfigException(String message) {
        super(ResultCode.CONFIG_ERROR, message);
    }

    protected ModbusConfigException(ResultCode resultCode, String message) {
        super(resultCode, message);
    }
}
