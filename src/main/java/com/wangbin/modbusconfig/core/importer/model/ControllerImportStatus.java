package com.wangbin.modbusconfig.core.importer.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * 控制器导入结果状态
 */
@Getter
public enum ControllerImportStatus {
    SUCCESS("success"),
    FAILED("failed"),
    SKIPPED("skipped");

    private final String value;

    ControllerImportStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
