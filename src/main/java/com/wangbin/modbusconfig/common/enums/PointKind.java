package com.wangbin.modbusconfig.common.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * 点位访问类别，对应 Modbus 四类数据区
 */
@Getter
public enum PointKind {
    /** 线圈 */
    COIL("coil", true),
    /** 离散输入 */
    INPUT("input", false),
    /** 保持寄存器 */
    HOLDING_REGISTER("holding_register", true),
    /** 输入寄存器 */
    INPUT_REGISTER("input_register", false);

    private final String value;
    private final boolean writable;

    PointKind(String value, boolean writable) {
        this.value = value;
        this.writable = writable;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * 位类型（线圈、离散输入）导出到 attributes，寄存器类型导出到 timeseries
     */
    public boolean isBitType() {
        return this == COIL || this == INPUT;
    }

    /**
     * 根据配置文件中的取值获取枚举，未知取值返回 null
     */
    @JsonCreator
    public static PointKind fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase();
        for (PointKind kind : values()) {
            if (kind.value.equals(normalized)) {
                return kind;
            }
        }
        return null;
    }
}
