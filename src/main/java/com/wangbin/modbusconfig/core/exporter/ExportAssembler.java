package com.wangbin.modbusconfig.core.exporter;

import com.wangbin.modbusconfig.common.domain.entity.ModbusController;
import com.wangbin.modbusconfig.common.domain.entity.ModbusPoint;
import com.wangbin.modbusconfig.common.enums.ConfigDialect;
import com.wangbin.modbusconfig.common.exception.ConfigFormatException;
import com.wangbin.modbusconfig.common.exception.ResourceNotFoundException;
import com.wangbin.modbusconfig.common.utils.FileNameUtil;
import com.wangbin.modbusconfig.core.catalog.ModbusCatalog;
import com.wangbin.modbusconfig.core.codec.ConfigDocumentReader;
import com.wangbin.modbusconfig.core.codec.FormatCodec;
import com.wangbin.modbusconfig.core.codec.document.ConfigDocument;
import com.wangbin.modbusconfig.core.codec.document.GatewayConfigDocument;
import com.wangbin.modbusconfig.core.config.ModbusConfigProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 导出组装：读取控制器与点位，gateway 方言按单元ID分组逐组编码后合并为一个文档
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExportAssembler {

    private final ModbusCatalog catalog;
    private final FormatCodec codec;
    private final ConfigDocumentReader reader;
    private final ModbusConfigProperties properties;

    public ExportedConfig export(String controllerId, ConfigDialect dialect) {
        if (dialect == null) {
            throw new ConfigFormatException("Unsupported format: null");
        }
        ModbusController controller = catalog.findController(controllerId);
        if (controller == null) {
            throw ResourceNotFoundException.controller(controllerId);
        }
        List<ModbusPoint> points = catalog.findPoints(controllerId);

        ConfigDocument document = switch (dialect) {
            case NATIVE -> codec.encode(controller, points, ConfigDialect.NATIVE);
            case GATEWAY -> assembleGateway(controller, points);
        };

        String filename = FileNameUtil.exportFileName(properties.getExportFilePrefix(), controller.getName(), dialect.getValue());
        byte[] content = reader.write(document);
        log.info("导出控制器 {} ({})，格式 {}，点位 {} 个，文件 {}",
                controller.getName(), controller.getEndpoint(), dialect.getValue(), points.size(), filename);
        return new ExportedConfig(document, filename, content);
    }

    private GatewayConfigDocument assembleGateway(ModbusController controller, List<ModbusPoint> points) {
        Map<Integer, List<ModbusPoint>> groups = groupByUnitId(points);
        GatewayConfigDocument merged = null;
        for (List<ModbusPoint> group : groups.values()) {
            GatewayConfigDocument part = (GatewayConfigDocument) codec.encode(controller, group, ConfigDialect.GATEWAY);
            if (merged == null) {
                merged = part;
            } else {
                merged.getMaster().getSlaves().addAll(part.slaves());
            }
        }
        if (merged == null) {
            merged = (GatewayConfigDocument) codec.encode(controller, List.of(), ConfigDialect.GATEWAY);
        }
        return merged;
    }

    /**
     * 按单元ID分组，组内保持地址顺序
     */
    private Map<Integer, List<ModbusPoint>> groupByUnitId(List<ModbusPoint> points) {
        Map<Integer, List<ModbusPoint>> groups = new TreeMap<>();
        for (ModbusPoint point : points) {
            int unitId = point.getUnitId() != null ? point.getUnitId() : properties.getDefaultUnitId();
            groups.computeIfAbsent(unitId, k -> new ArrayList<>()).add(point);
        }
        return groups;
    }
}
