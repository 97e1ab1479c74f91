package com.wangbin.modbusconfig.common.domain.entity;

import com.wangbin.modbusconfig.common.enums.PointKind;

/**
 * 点位自然键，同一键已存在即视为重复点位
 */
public record PointKey(String controllerId, Integer unitId, Integer address, PointKind kind) {

    @Override
    public String toString() {
        return controllerId + "/" + unitId + "/" + kind + ":" + address;
    }
}
