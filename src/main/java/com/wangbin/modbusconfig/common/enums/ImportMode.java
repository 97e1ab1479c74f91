package com.wangbin.modbusconfig.common.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import com.wangbin.modbusconfig.common.exception.ConfigFormatException;
import lombok.Getter;

/**
 * 导入冲突处理策略
 */
@Getter
public enum ImportMode {
    SKIP_CONTROLLER("skip_controller"),
    OVERWRITE_CONTROLLER("overwrite_controller"),
    SKIP_DUPLICATE_POINTS("skip_duplicate_points"),
    OVERWRITE_DUPLICATE_POINTS("overwrite_duplicate_points");

    private final String value;

    ImportMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * 解析导入模式，空值返回 null（严格模式：已存在的控制器直接报冲突）
     */
    public static ImportMode fromValue(String value) {
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        String normalized = value.trim().toLowerCase().replace('-', '_');
        for (ImportMode mode : values()) {
            if (mode.value.equals(normalized)) {
                return mode;
            }
        }
        throw new ConfigFormatException("Unsupported import mode: " + value);
    }
}
