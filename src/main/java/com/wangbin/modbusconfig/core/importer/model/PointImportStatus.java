package com.wangbin.modbusconfig.core.importer.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * 点位导入结果状态
 */
@Getter
public enum PointImportStatus {
    SUCCESS("success"),
    SKIPPED("skipped"),
    ERROR("error");

    private final String value;

    PointImportStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
