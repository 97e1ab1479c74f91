package com.wangbin.modbusconfig.core.codec.model;

import com.wangbin.modbusconfig.common.enums.ConfigDialect;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 解析结果：一个控制器及其点位，与方言无关
 */
@Data
public class DecodedConfig {

    private ConfigDialect dialect;

    private ControllerDefinition controller;

    private List<PointDefinition> points = new ArrayList<>();

    /** 解析过程中的非致命提示，例如被忽略的写能力 */
    private List<String> warnings = new ArrayList<>();

    public void addWarning(String warning) {
        warnings.add(warning);
    }
}
