package com.wangbin.modbusconfig.common.domain.entity;

import com.wangbin.modbusconfig.common.enums.PointEncoding;
import com.wangbin.modbusconfig.common.enums.PointKind;
import lombok.Data;

import java.util.Date;

/**
 * Modbus 点位实体
 * 描述：控制器上一个可寻址的数据项（一个位或一段寄存器）
 */
@Data
public class ModbusPoint {

    /**
     * 点位ID，由目录存储生成
     */
    private String id;

    /**
     * 所属控制器ID
     */
    private String controllerId;

    /**
     * 点位名称
     */
    private String name;

    /**
     * 描述（可选）
     */
    private String description;

    /**
     * 点位类别：coil / input / holding_register / input_register
     */
    private PointKind type;

    /**
     * 数据编码
     */
    private PointEncoding dataType;

    /**
     * 起始地址（非负）
     */
    private Integer address;

    /**
     * 寄存器或位数量，默认 1
     */
    private Integer len = 1;

    /**
     * 从站单元ID，默认 1
     */
    private Integer unitId = 1;

    /**
     * 换算公式，例如 x * 0.1
     */
    private String formula;

    /**
     * 单位
     * 例如：℃, %, Pa, kW
     */
    private String unit;

    /**
     * 最小值（范围校验）
     */
    private Double minValue;

    /**
     * 最大值（范围校验）
     */
    private Double maxValue;

    /**
     * 创建时间
     */
    private Date createTime;

    /**
     * 更新时间
     */
    private Date updateTime;

    /**
     * 点位自然键 (控制器ID, 单元ID, 地址, 类别)
     */
    public PointKey naturalKey() {
        return new PointKey(controllerId, unitId, address, type);
    }

    /**
     * 覆盖可变字段：名称、描述、编码、长度、公式、单位、上下限
     */
    public void applyMutableFields(ModbusPoint source) {
        this.name = source.name;
        this.description = source.description;
        this.dataType = source.dataType;
        this.len = source.len;
        this.formula = source.formula;
        this.unit = source.unit;
        this.minValue = source.minValue;
        this.maxValue = source.maxValue;
    }

    public ModbusPoint copy() {
        ModbusPoint copy = new ModbusPoint();
        copy.setId(id);
        copy.setControllerId(controllerId);
        copy.applyMutableFields(this);
        copy.setType(type);
        copy.setAddress(address);
        copy.setUnitId(unitId);
        copy.setCreateTime(createTime);
        copy.setUpdateTime(updateTime);
        return copy;
    }

    @Override
    public String toString() {
        return String.format(
                "ModbusPoint{id='%s', name='%s', controllerId='%s', type=%s, address=%s, unitId=%s, dataType=%s}",
                id, name, controllerId, type, address, unitId, dataType
        );
    }
}
