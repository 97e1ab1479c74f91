package com.wangbin.modbusconfig.common.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * 点位数据编码
 */
@Getter
public enum PointEncoding {
    BOOL("bool", "bits"),
    INT16("int16", "int16"),
    UINT16("uint16", "uint16"),
    INT32("int32", "int32"),
    UINT32("uint32", "uint32"),
    FLOAT32("float32", "float32"),
    FLOAT64("float64", "float64"),
    STRING("string", "string");

    /** 网关方言中表示原始字节的类型标签 */
    public static final String GATEWAY_BYTES_LABEL = "bytes";

    private final String value;
    private final String gatewayLabel;

    PointEncoding(String value, String gatewayLabel) {
        this.value = value;
        this.gatewayLabel = gatewayLabel;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static PointEncoding fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase();
        for (PointEncoding encoding : values()) {
            if (encoding.value.equals(normalized)) {
                return encoding;
            }
        }
        return null;
    }

    /**
     * 网关类型标签转换为编码，"bytes" 视为 uint16，未知标签返回 null
     */
    public static PointEncoding fromGatewayLabel(String label) {
        if (label == null) {
            return null;
        }
        String normalized = label.trim().toLowerCase();
        if (GATEWAY_BYTES_LABEL.equals(normalized)) {
            return UINT16;
        }
        for (PointEncoding encoding : values()) {
            if (encoding.gatewayLabel.equals(normalized)) {
                return encoding;
            }
        }
        return null;
    }
}
