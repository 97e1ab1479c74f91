package com.wangbin.modbusconfig.core.importer;

import com.wangbin.modbusconfig.common.domain.entity.ModbusController;
import com.wangbin.modbusconfig.common.domain.entity.ModbusPoint;
import com.wangbin.modbusconfig.common.enums.PointEncoding;
import com.wangbin.modbusconfig.common.enums.PointKind;
import com.wangbin.modbusconfig.common.exception.ConfigProcessingException;
import com.wangbin.modbusconfig.core.codec.model.ControllerDefinition;
import com.wangbin.modbusconfig.core.codec.model.PointDefinition;
import com.wangbin.modbusconfig.core.config.ModbusConfigProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 解析结果到目录实体的转换
 *
 * 点位的类别、编码、地址、长度在这里逐个校验，不合法时抛出 {@link ConfigProcessingException}，
 * 由导入流程降级为该点位的错误结果。
 */
@Component
@RequiredArgsConstructor
public class PointMapper {

    private static final int MAX_UNIT_ID = 255;

    private final ModbusConfigProperties properties;

    public ModbusController toController(ControllerDefinition definition) {
        ModbusController controller = new ModbusController();
        controller.setName(definition.getName() != null ? definition.getName() : properties.getDefaultControllerName());
        controller.setHost(definition.getHost() != null ? definition.getHost() : properties.getDefaultHost());
        controller.setPort(definition.getPort() != null ? definition.getPort() : properties.getDefaultPort());
        controller.setTimeout(definition.getTimeout() != null ? definition.getTimeout() : properties.getDefaultTimeout());
        // 导入的控制器尚未连通
        controller.setStatus(false);
        return controller;
    }

    public ModbusPoint toPoint(PointDefinition definition, String controllerId) {
        String name = definition.getName() != null && !definition.getName().isBlank()
                ? definition.getName()
                : properties.getDefaultPointName();

        PointKind kind = PointKind.fromValue(definition.getType());
        if (kind == null) {
            throw new ConfigProcessingException(name,
                    String.format("Invalid point type '%s' for point '%s'", definition.getType(), name));
        }
        PointEncoding encoding = PointEncoding.fromValue(definition.getDataType());
        if (encoding == null) {
            throw new ConfigProcessingException(name,
                    String.format("Invalid data type '%s' for point '%s'", definition.getDataType(), name));
        }
        Integer address = definition.getAddress();
        if (address == null || address < 0) {
            throw new ConfigProcessingException(name,
                    String.format("Invalid address %s for point '%s'", address, name));
        }
        int len = definition.getLen() != null ? definition.getLen() : properties.getDefaultLength();
        if (len < 1) {
            throw new ConfigProcessingException(name,
                    String.format("Invalid length %d for point '%s'", len, name));
        }
        int unitId = definition.getUnitId() != null ? definition.getUnitId() : properties.getDefaultUnitId();
        if (unitId < 0 || unitId > MAX_UNIT_ID) {
            throw new ConfigProcessingException(name,
                    String.format("Invalid unit id %d for point '%s'", unitId, name));
        }
        ModbusPoint point = new ModbusPoint();
        point.setControllerId(controllerId);
        point.setName(name);
        point.setDescription(definition.getDescription());
        point.setType(kind);
        point.setDataType(encoding);
        point.setAddress(address);
        point.setLen(len);
        point.setUnitId(unitId);
        point.setFormula(definition.getFormula());
        point.setUnit(definition.getUnit());
        point.setMinValue(definition.getMinValue());
        point.setMaxValue(definition.getMaxValue());
        return point;
    }
}
