package com.wangbin.modbusconfig;

import com.wangbin.modbusconfig.common.domain.entity.ModbusController;
import com.wangbin.modbusconfig.common.domain.entity.ModbusPoint;
import com.wangbin.modbusconfig.common.enums.PointEncoding;
import com.wangbin.modbusconfig.common.enums.PointKind;
import com.wangbin.modbusconfig.core.catalog.CatalogUnitOfWork;
import com.wangbin.modbusconfig.core.catalog.ModbusCatalog;
import com.wangbin.modbusconfig.core.codec.FormatCodec;
import com.wangbin.modbusconfig.core.config.ModbusConfigProperties;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * 测试公共数据
 */
public final class ModbusFixtures {

    public static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T08:00:00Z"), ZoneOffset.UTC);

    private ModbusFixtures() {
    }

    public static ModbusConfigProperties properties() {
        return new ModbusConfigProperties();
    }

    public static FormatCodec codec() {
        return new FormatCodec(properties(), CLOCK);
    }

    public static ModbusController controller(String name, String host, int port) {
        ModbusController controller = new ModbusController();
        controller.setName(name);
        controller.setHost(host);
        controller.setPort(port);
        controller.setTimeout(10);
        controller.setStatus(false);
        return controller;
    }

    public static ModbusPoint point(String name, PointKind kind, PointEncoding encoding, int address, int len, int unitId) {
        ModbusPoint point = new ModbusPoint();
        point.setName(name);
        point.setType(kind);
        point.setDataType(encoding);
        point.setAddress(address);
        point.setLen(len);
        point.setUnitId(unitId);
        return point;
    }

    /**
     * 按 host:port 查找已提交的控制器，不存在返回 null
     */
    public static ModbusController controllerAt(ModbusCatalog catalog, String host, int port) {
        try (CatalogUnitOfWork uow = catalog.begin()) {
            return uow.findControllerByHostPort(host, port);
        }
    }

    /**
     * 单引号写法的 JSON，便于在测试里内联
     */
    public static byte[] json(String text) {
        return text.replace('\'', '"').getBytes(StandardCharsets.UTF_8);
    }
}
