package com.wangbin.modbusconfig.core.codec.model;

import lombok.Data;

/**
 * 从配置文件解析出的点位定义
 *
 * 保留文件中的原始取值，类别与编码的合法性在导入落库前逐个点位校验，
 * 以便单个点位出错时不影响同批次的其他点位。
 */
@Data
public class PointDefinition {

    private String name;

    private String description;

    /** 点位类别原始取值 */
    private String type;

    /** 数据编码原始取值 */
    private String dataType;

    private Integer address;

    private Integer len;

    private Integer unitId;

    private String formula;

    private String unit;

    private Double minValue;

    private Double maxValue;
}
