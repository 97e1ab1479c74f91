package com.wangbin.modbusconfig.common.exception;

import com.wangbin.modbusconfig.common.enums.ConfigDialect;
import com.wangbin.modbusconfig.common.web.result.ResultCode;
import lombok.Getter;

/**
 * 文件呈现的是另一种方言的结构特征
 */
@Getter
public class ConfigFormatMismatchException extends ConfigFormatException {

    private final ConfigDialect expected;
    private final ConfigDialect detected;

    public ConfigFormatMismatchException(ConfigDialect expected, ConfigDialect detected) {
        super(ResultCode.CONFIG_FORMAT_MISMATCH, String.format(
                "Configuration appears to be in %s format, but %s format was expected. "
                        + "Please select '%s' format for this file.",
                detected.getValue(), expected.getValue(), detected.getValue()));
        this.expected = expected;
        this.detected = detected;
    }
}
