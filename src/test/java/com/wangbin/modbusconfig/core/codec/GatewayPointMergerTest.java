package com.wangbin.modbusconfig.core.codec;

import com.wangbin.modbusconfig.core.codec.document.GatewayConfigDocument.PointEntry;
import com.wangbin.modbusconfig.core.codec.document.GatewaySection;
import com.wangbin.modbusconfig.core.codec.model.PointDefinition;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GatewayPointMergerTest {

    private PointEntry entry(String tag, String type, int functionCode, int address) {
        PointEntry entry = new PointEntry();
        entry.setTag(tag);
        entry.setType(type);
        entry.setFunctionCode(functionCode);
        entry.setAddress(address);
        return entry;
    }

    private GatewayPointMerger merger() {
        return new GatewayPointMerger(3, "set_", 1, "Imported Point");
    }

    @Test
    void rpcOnlyEntryBecomesWriteOnlyPoint() {
        GatewayPointMerger merger = merger();
        PointEntry setpoint = entry("set_setpoint", "int32", 16, 40);
        setpoint.setObjectsCount(2);

        merger.accept(GatewaySection.RPC, setpoint);
        List<PointDefinition> points = merger.build();

        assertEquals(1, points.size());
        PointDefinition point = points.get(0);
        assertEquals("setpoint", point.getName());
        assertEquals("holding_register", point.getType());
        assertEquals("int32", point.getDataType());
        assertEquals(2, point.getLen());
        assertEquals(3, point.getUnitId());
        assertTrue(merger.getWarnings().isEmpty());
    }

    @Test
    void sameAddressInBothReadSectionsKeepsFirstName() {
        GatewayPointMerger merger = merger();
        merger.accept(GatewaySection.ATTRIBUTES, entry("status", "uint16", 3, 8));
        merger.accept(GatewaySection.TIMESERIES, entry("status_ts", "uint16", 3, 8));

        List<PointDefinition> points = merger.build();

        assertEquals(1, points.size());
        assertEquals("status", points.get(0).getName());
        assertEquals("holding_register", points.get(0).getType());
    }

    @Test
    void sameAddressDifferentKindStaysSeparate() {
        GatewayPointMerger merger = merger();
        merger.accept(GatewaySection.ATTRIBUTES, entry("run", "bits", 1, 0));
        merger.accept(GatewaySection.TIMESERIES, entry("speed", "uint16", 3, 0));

        List<PointDefinition> points = merger.build();

        assertEquals(2, points.size());
        assertEquals("coil", points.get(0).getType());
        assertEquals("holding_register", points.get(1).getType());
    }

    @Test
    void unknownTypeLabelFallsBackWithWarning() {
        GatewayPointMerger merger = merger();
        merger.accept(GatewaySection.TIMESERIES, entry("odd", "decimal", 4, 1));

        List<PointDefinition> points = merger.build();

        assertEquals("uint16", points.get(0).getDataType());
        assertEquals(1, merger.getWarnings().size());
        assertTrue(merger.getWarnings().get(0).contains("'decimal'"));
    }

    @Test
    void repeatedTagOnDifferentKeysIsReported() {
        GatewayPointMerger merger = merger();
        merger.accept(GatewaySection.TIMESERIES, entry("temp", "uint16", 3, 1));
        merger.accept(GatewaySection.TIMESERIES, entry("temp", "uint16", 3, 2));

        List<PointDefinition> points = merger.build();

        assertEquals(2, points.size());
        assertEquals(1, merger.getWarnings().size());
        assertTrue(merger.getWarnings().get(0).startsWith("Tag 'temp' is used by more than one point"));
    }
}
