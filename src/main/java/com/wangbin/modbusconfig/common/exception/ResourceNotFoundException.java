package com.wangbin.modbusconfig.common.exception;

import com.wangbin.modbusconfig.common.web.result.ResultCode;

public class ResourceNotFoundException extends BusinessException {

    public ResourceNotFoundException(String message) {
        super(ResultCode.DATA_NOT_FOUND, message);
    }

    public static ResourceNotFoundException controller(String controllerId) {
        return new ResourceNotFoundException("Controller " + controllerId + " not found");
    }
}
