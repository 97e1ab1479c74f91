package com.wangbin.modbusconfig.common.enums;

import com.wangbin.modbusconfig.common.exception.ConfigFormatException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConfigEnumsTest {

    @Test
    void onlyCoilAndHoldingRegisterAreWritable() {
        assertTrue(PointKind.COIL.isWritable());
        assertTrue(PointKind.HOLDING_REGISTER.isWritable());
        assertFalse(PointKind.INPUT.isWritable());
        assertFalse(PointKind.INPUT_REGISTER.isWritable());
        assertTrue(PointKind.INPUT.isBitType());
        assertFalse(PointKind.INPUT_REGISTER.isBitType());
    }

    @Test
    void unknownKindOrEncodingResolvesToNull() {
        assertEquals(PointKind.HOLDING_REGISTER, PointKind.fromValue("holding_register"));
        assertNull(PointKind.fromValue("discrete_input"));
        assertEquals(PointEncoding.FLOAT64, PointEncoding.fromValue("FLOAT64"));
        assertNull(PointEncoding.fromValue("decimal"));
    }

    @Test
    void gatewayLabels() {
        assertEquals("bits", PointEncoding.BOOL.getGatewayLabel());
        assertEquals(PointEncoding.BOOL, PointEncoding.fromGatewayLabel("bits"));
        assertEquals(PointEncoding.UINT16, PointEncoding.fromGatewayLabel(PointEncoding.GATEWAY_BYTES_LABEL));
        assertNull(PointEncoding.fromGatewayLabel("bool"));
    }

    @Test
    void dialectParsing() {
        assertEquals(ConfigDialect.NATIVE, ConfigDialect.fromValue(null));
        assertEquals(ConfigDialect.GATEWAY, ConfigDialect.fromValue(" Gateway "));
        assertEquals(ConfigDialect.GATEWAY, ConfigDialect.fromValue("thingsboard"));
        assertEquals(ConfigDialect.NATIVE, ConfigDialect.GATEWAY.other());
        assertThrows(ConfigFormatException.class, () -> ConfigDialect.fromValue("yaml"));
    }

    @Test
    void importModeParsing() {
        assertNull(ImportMode.fromValue(""));
        assertEquals(ImportMode.OVERWRITE_DUPLICATE_POINTS, ImportMode.fromValue("overwrite-duplicate-points"));
        assertEquals(ImportMode.SKIP_CONTROLLER, ImportMode.fromValue(" Skip_Controller "));
        assertThrows(ConfigFormatException.class, () -> ImportMode.fromValue("merge"));
    }
}
