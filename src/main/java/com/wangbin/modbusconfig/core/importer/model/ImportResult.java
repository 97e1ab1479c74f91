package com.wangbin.modbusconfig.core.importer.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 导入结果报告：一个控制器结果加逐个点位结果
 */
@Data
public class ImportResult {

    private ControllerResult controller;

    private List<PointResult> points = new ArrayList<>();

    /** 解析阶段的非致命提示 */
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private List<String> warnings = new ArrayList<>();

    @JsonProperty("total_points")
    public int getTotalPoints() {
        return points.size();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ControllerResult {
        private String id;
        private String name;
        private ControllerImportStatus status;
        private String message;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PointResult {
        private String id;
        private String name;
        private PointImportStatus status;
        private String message;

        public static PointResult created(String id, String name) {
            return new PointResult(id, name, PointImportStatus.SUCCESS, "created");
        }

        public static PointResult updated(String id, String name) {
            return new PointResult(id, name, PointImportStatus.SUCCESS, "updated");
        }

        public static PointResult skipped(String id, String name) {
            return new PointResult(id, name, PointImportStatus.SKIPPED, "already exists");
        }

        public static PointResult error(String name, String reason) {
            return new PointResult(null, name, PointImportStatus.ERROR, reason);
        }
    }
}
