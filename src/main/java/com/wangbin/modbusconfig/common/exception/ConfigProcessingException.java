package com.wangbin.modbusconfig.common.exception;

import com.wangbin.modbusconfig.common.web.result.ResultCode;
import lombok.Getter;

/**
 * 单个点位无法映射（功能码未知、类型非法、地址为负等）。
 * 导入时按点位捕获并降级为点位级错误结果。
 */
@Getter
public class ConfigProcessingException extends ModbusConfigException {

    private final String pointName;

    public ConfigProcessingException(String pointName, String message) {
        super(ResultCode.CONFIG_PROCESS_ERROR, message);
        this.pointName = pointName;
    }
}
