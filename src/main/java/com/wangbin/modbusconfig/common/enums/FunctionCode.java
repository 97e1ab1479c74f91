package com.wangbin.modbusconfig.common.enums;

import lombok.Getter;

/**
 * Modbus 功能码，仅作为映射键使用
 */
@Getter
public enum FunctionCode {
    READ_COILS(1, PointKind.COIL, Access.READ),
    READ_DISCRETE_INPUTS(2, PointKind.INPUT, Access.READ),
    READ_HOLDING_REGISTERS(3, PointKind.HOLDING_REGISTER, Access.READ),
    READ_INPUT_REGISTERS(4, PointKind.INPUT_REGISTER, Access.READ),
    WRITE_SINGLE_COIL(5, PointKind.COIL, Access.WRITE),
    WRITE_SINGLE_REGISTER(6, PointKind.HOLDING_REGISTER, Access.WRITE),
    WRITE_MULTIPLE_COILS(15, PointKind.COIL, Access.WRITE),
    WRITE_MULTIPLE_REGISTERS(16, PointKind.HOLDING_REGISTER, Access.WRITE);

    private final int code;
    private final PointKind kind;
    private final Access access;

    FunctionCode(int code, PointKind kind, Access access) {
        this.code = code;
        this.kind = kind;
        this.access = access;
    }

    public static FunctionCode fromCode(int code) {
        for (FunctionCode functionCode : values()) {
            if (functionCode.code == code) {
                return functionCode;
            }
        }
        return null;
    }

    public enum Access {
        READ, WRITE
    }
}
