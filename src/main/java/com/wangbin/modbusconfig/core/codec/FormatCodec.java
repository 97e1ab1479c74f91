package com.wangbin.modbusconfig.core.codec;

import com.wangbin.modbusconfig.common.domain.entity.ModbusController;
import com.wangbin.modbusconfig.common.domain.entity.ModbusPoint;
import com.wangbin.modbusconfig.common.enums.ConfigDialect;
import com.wangbin.modbusconfig.common.enums.FunctionCode;
import com.wangbin.modbusconfig.common.enums.PointKind;
import com.wangbin.modbusconfig.common.exception.ConfigFormatException;
import com.wangbin.modbusconfig.common.exception.ConfigFormatMismatchException;
import com.wangbin.modbusconfig.common.exception.DuplicateException;
import com.wangbin.modbusconfig.core.codec.document.ConfigDocument;
import com.wangbin.modbusconfig.core.codec.document.GatewayConfigDocument;
import com.wangbin.modbusconfig.core.codec.document.GatewaySection;
import com.wangbin.modbusconfig.core.codec.document.NativeConfigDocument;
import com.wangbin.modbusconfig.core.codec.model.ControllerDefinition;
import com.wangbin.modbusconfig.core.codec.model.DecodedConfig;
import com.wangbin.modbusconfig.core.codec.model.PointDefinition;
import com.wangbin.modbusconfig.core.config.ModbusConfigProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 配置文件编解码器
 *
 * <ul>
 *     <li>native：控制器与点位原样输出，不做类别转换</li>
 *     <li>gateway：按单元ID分组为 slave，位类型读点位进 attributes，寄存器读点位进 timeseries，
 *     可写点位额外生成带前缀标签的 rpc 条目</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FormatCodec {

    private final ModbusConfigProperties properties;
    private final Clock clock;

    // ==================== 编码 ====================

    public ConfigDocument encode(ModbusController controller, List<ModbusPoint> points, ConfigDialect dialect) {
        if (dialect == null) {
            throw new ConfigFormatException("Unsupported format: null");
        }
        List<ModbusPoint> safePoints = points != null ? points : List.of();
        ConfigDocument document = switch (dialect) {
            case NATIVE -> encodeNative(controller, safePoints);
            case GATEWAY -> encodeGateway(controller, safePoints);
        };
        log.debug("控制器 {} 编码为 {} 格式，点位数 {}", controller.getName(), dialect.getValue(), safePoints.size());
        return document;
    }

    private NativeConfigDocument encodeNative(ModbusController controller, List<ModbusPoint> points) {
        NativeConfigDocument.ControllerSection section = new NativeConfigDocument.ControllerSection();
        section.setName(controller.getName());
        section.setHost(controller.getHost());
        section.setPort(controller.getPort());
        section.setTimeout(controller.getTimeout());

        List<NativeConfigDocument.PointEntry> entries = new ArrayList<>(points.size());
        for (ModbusPoint point : points) {
            NativeConfigDocument.PointEntry entry = new NativeConfigDocument.PointEntry();
            entry.setName(point.getName());
            entry.setDescription(point.getDescription());
            entry.setType(point.getType() != null ? point.getType().getValue() : null);
            entry.setDataType(point.getDataType() != null ? point.getDataType().getValue() : null);
            entry.setAddress(point.getAddress());
            entry.setLen(point.getLen());
            entry.setUnitId(point.getUnitId());
            entry.setFormula(point.getFormula());
            entry.setUnit(point.getUnit());
            entry.setMinValue(point.getMinValue());
            entry.setMaxValue(point.getMaxValue());
            entries.add(entry);
        }

        NativeConfigDocument document = NativeConfigDocument.of(section, entries);
        document.setExportTime(exportTime());
        return document;
    }

    private GatewayConfigDocument encodeGateway(ModbusController controller, List<ModbusPoint> points) {
        Map<Integer, List<ModbusPoint>> pointsByUnit = new TreeMap<>();
        for (ModbusPoint point : points) {
            int unitId = point.getUnitId() != null ? point.getUnitId() : properties.getDefaultUnitId();
            pointsByUnit.computeIfAbsent(unitId, k -> new ArrayList<>()).add(point);
        }
        if (pointsByUnit.isEmpty()) {
            // 没有点位时仍输出一个 slave，保证文件可被重新导入
            pointsByUnit.put(properties.getDefaultUnitId(), new ArrayList<>());
        }

        GatewayConfigDocument document = new GatewayConfigDocument();
        for (Map.Entry<Integer, List<ModbusPoint>> entry : pointsByUnit.entrySet()) {
            document.getMaster().getSlaves().add(encodeSlave(controller, entry.getKey(), entry.getValue()));
        }
        document.setExportTime(exportTime());
        return document;
    }

    private GatewayConfigDocument.Slave encodeSlave(ModbusController controller, int unitId, List<ModbusPoint> points) {
        GatewayConfigDocument.Slave slave = new GatewayConfigDocument.Slave();
        slave.setHost(controller.getHost());
        slave.setPort(controller.getPort());
        slave.setTimeout(controller.getTimeout());
        slave.setRetries(properties.getRetries());
        slave.setPollPeriod(properties.getPollPeriod());
        slave.setUnitId(unitId);
        slave.setDeviceName(controller.getName());
        slave.setDeviceType(controller.getName() != null ? controller.getName().toLowerCase().replace(" ", "_") : null);

        for (ModbusPoint point : points) {
            PointKind kind = point.getType();
            if (kind == null) {
                throw new ConfigFormatException("Point " + point.getName() + " has no type");
            }
            String wireType = point.getDataType() != null ? point.getDataType().getGatewayLabel() : null;
            int length = point.getLen() != null ? point.getLen() : properties.getDefaultLength();

            GatewayConfigDocument.PointEntry readEntry = new GatewayConfigDocument.PointEntry();
            readEntry.setTag(point.getName());
            readEntry.setType(wireType);
            readEntry.setFunctionCode(FunctionCodeMap.readCode(kind).getCode());
            readEntry.setObjectsCount(length);
            readEntry.setAddress(point.getAddress());
            if (kind.isBitType()) {
                slave.getAttributes().add(readEntry);
            } else {
                slave.getTimeseries().add(readEntry);
            }

            FunctionCode writeCode = FunctionCodeMap.writeCode(kind);
            if (writeCode != null) {
                GatewayConfigDocument.PointEntry rpcEntry = new GatewayConfigDocument.PointEntry();
                rpcEntry.setTag(properties.getRpcTagPrefix() + point.getName());
                rpcEntry.setType(wireType);
                rpcEntry.setFunctionCode(writeCode.getCode());
                rpcEntry.setAddress(point.getAddress());
                if (!kind.isBitType()) {
                    rpcEntry.setObjectsCount(length);
                }
                slave.getRpc().add(rpcEntry);
            }
        }
        return slave;
    }

    private String exportTime() {
        return LocalDateTime.now(clock).format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
    }

    // ==================== 解码 ====================

    public DecodedConfig decode(ConfigDocument document, ConfigDialect dialect) {
        if (dialect == null) {
            throw new ConfigFormatException("Unsupported format: null");
        }
        if (document.dialect() != dialect) {
            throw new ConfigFormatMismatchException(dialect, document.dialect());
        }
        DecodedConfig decoded;
        if (document instanceof NativeConfigDocument nativeDocument) {
            decoded = decodeNative(nativeDocument);
        } else if (document instanceof GatewayConfigDocument gatewayDocument) {
            decoded = decodeGateway(gatewayDocument);
        } else {
            throw new ConfigFormatException("Unsupported format: " + dialect.getValue());
        }
        decoded.setDialect(dialect);
        return decoded;
    }

    private DecodedConfig decodeNative(NativeConfigDocument document) {
        NativeConfigDocument.ControllerSection section;
        List<NativeConfigDocument.PointEntry> entries;
        if (document.getController() != null) {
            section = document.getController();
            entries = document.getPoints();
        } else if (document.getControllers() != null) {
            if (document.getControllers().size() != 1) {
                throw DuplicateException.singleController("controller", document.getControllers().size());
            }
            section = document.getControllers().get(0);
            entries = section.getPoints();
        } else {
            throw new ConfigFormatException("Missing 'controller' and 'points' sections in native format");
        }

        ControllerDefinition controller = new ControllerDefinition();
        controller.setName(section.getName());
        controller.setHost(section.getHost());
        controller.setPort(section.getPort());
        controller.setTimeout(section.getTimeout() != null ? section.getTimeout() : properties.getDefaultTimeout());

        DecodedConfig decoded = new DecodedConfig();
        decoded.setController(controller);
        if (entries == null) {
            return decoded;
        }
        for (NativeConfigDocument.PointEntry entry : entries) {
            PointDefinition definition = new PointDefinition();
            definition.setName(entry.getName());
            definition.setDescription(entry.getDescription());
            definition.setType(entry.getType());
            definition.setDataType(entry.getDataType());
            definition.setAddress(entry.getAddress());
            definition.setLen(entry.getLen() != null ? entry.getLen() : properties.getDefaultLength());
            definition.setUnitId(entry.getUnitId() != null ? entry.getUnitId() : properties.getDefaultUnitId());
            definition.setFormula(entry.getFormula());
            definition.setUnit(entry.getUnit());
            definition.setMinValue(entry.getMinValue());
            definition.setMaxValue(entry.getMaxValue());
            decoded.getPoints().add(definition);
        }
        return decoded;
    }

    private DecodedConfig decodeGateway(GatewayConfigDocument document) {
        List<GatewayConfigDocument.Slave> slaves = document.slaves();
        if (slaves.isEmpty()) {
            throw new ConfigFormatException("Missing 'slaves' section in master");
        }
        if (slaves.size() > 1) {
            throw DuplicateException.singleController("slave", slaves.size());
        }
        GatewayConfigDocument.Slave slave = slaves.get(0);

        ControllerDefinition controller = new ControllerDefinition();
        controller.setName(slave.getDeviceName() != null ? slave.getDeviceName() : properties.getDefaultControllerName());
        controller.setHost(slave.getHost() != null ? slave.getHost() : properties.getDefaultHost());
        controller.setPort(slave.getPort() != null ? slave.getPort() : properties.getDefaultPort());
        controller.setTimeout(slave.getTimeout() != null ? slave.getTimeout() : properties.getDefaultTimeout());

        int unitId = slave.getUnitId() != null ? slave.getUnitId() : properties.getDefaultUnitId();
        GatewayPointMerger merger = new GatewayPointMerger(unitId, properties.getRpcTagPrefix(),
                properties.getDefaultLength(), properties.getDefaultPointName());
        for (GatewaySection section : GatewaySection.values()) {
            for (GatewayConfigDocument.PointEntry entry : slave.entries(section)) {
                merger.accept(section, entry);
            }
        }

        DecodedConfig decoded = new DecodedConfig();
        decoded.setController(controller);
        decoded.getPoints().addAll(merger.build());
        merger.getWarnings().forEach(decoded::addWarning);
        log.debug("gateway 配置解析完成，设备 {}，合并后点位数 {}", controller.getName(), decoded.getPoints().size());
        return decoded;
    }
}
