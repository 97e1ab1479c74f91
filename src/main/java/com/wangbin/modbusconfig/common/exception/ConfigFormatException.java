package com.wangbin.modbusconfig.common.exception;

import com.wangbin.modbusconfig.common.web.result.ResultCode;

/**
 * 配置文件结构错误：缺少必填字段、字段取值非法、方言不受支持等。
 * 原样返回给调用方，不做重试。
 */
public class ConfigFormatException extends ModbusConfigException {

    public ConfigFormatException(String message) {
        super(ResultCode.CONFIG_INVALID, message);
    }

    protected ConfigFormatException(ResultCode resultCode, String message) {
        super(resultCode, message);
    }
}
