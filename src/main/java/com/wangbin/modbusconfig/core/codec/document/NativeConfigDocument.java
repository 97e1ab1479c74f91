package com.wangbin.modbusconfig.core.codec.document;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.wangbin.modbusconfig.common.enums.ConfigDialect;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * native 方言：{controller: {...}, points: [...]}
 * 兼容旧版多控制器结构 {controllers: [...]}
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class NativeConfigDocument implements ConfigDocument {

    private String format = ConfigDialect.NATIVE.getValue();

    @JsonProperty("export_time")
    private String exportTime;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private ControllerSection controller;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private List<PointEntry> points;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private List<ControllerSection> controllers;

    @Override
    public ConfigDialect dialect() {
        return ConfigDialect.NATIVE;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ControllerSection {
        private String name;
        private String host;
        private Integer port;
        private Integer timeout;

        /** 仅旧版 controllers 列表中出现 */
        @JsonInclude(JsonInclude.Include.NON_NULL)
        private List<PointEntry> points;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PointEntry {
        private String name;
        private String description;
        private String type;
        @JsonProperty("data_type")
        private String dataType;
        private Integer address;
        private Integer len;
        @JsonProperty("unit_id")
        private Integer unitId;
        private String formula;
        private String unit;
        @JsonProperty("min_value")
        private Double minValue;
        @JsonProperty("max_value")
        private Double maxValue;
    }

    public static NativeConfigDocument of(ControllerSection controller, List<PointEntry> points) {
        NativeConfigDocument document = new NativeConfigDocument();
        document.setController(controller);
        document.setPoints(points != null ? points : new ArrayList<>());
        return document;
    }
}
