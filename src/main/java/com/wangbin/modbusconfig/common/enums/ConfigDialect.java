package com.wangbin.modbusconfig.common.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import com.wangbin.modbusconfig.common.exception.ConfigFormatException;
import lombok.Getter;

/**
 * 配置文件方言
 */
@Getter
public enum ConfigDialect {
    NATIVE("native", "native"),
    GATEWAY("gateway", "thingsboard");

    private final String value;
    /** 历史版本中使用的别名 */
    private final String alias;

    ConfigDialect(String value, String alias) {
        this.value = value;
        this.alias = alias;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public ConfigDialect other() {
        return this == NATIVE ? GATEWAY : NATIVE;
    }

    /**
     * 解析方言，空值默认为 native
     */
    public static ConfigDialect fromValue(String value) {
        if (value == null || value.trim().isEmpty()) {
            return NATIVE;
        }
        String normalized = value.trim().toLowerCase();
        for (ConfigDialect dialect : values()) {
            if (dialect.value.equals(normalized) || dialect.alias.equals(normalized)) {
                return dialect;
            }
        }
        throw new ConfigFormatException("Unsupported format: " + value);
    }
}
