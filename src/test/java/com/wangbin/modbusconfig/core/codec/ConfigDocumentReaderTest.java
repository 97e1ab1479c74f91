package com.wangbin.modbusconfig.core.codec;

import com.wangbin.modbusconfig.common.enums.ConfigDialect;
import com.wangbin.modbusconfig.common.exception.ConfigFormatException;
import com.wangbin.modbusconfig.core.codec.document.NativeConfigDocument;
import org.junit.jupiter.api.Test;

import static com.wangbin.modbusconfig.ModbusFixtures.json;
import static org.junit.jupiter.api.Assertions.*;

class ConfigDocumentReaderTest {

    private final ConfigDocumentReader reader = new ConfigDocumentReader();

    @Test
    void malformedJsonIsFormatError() {
        ConfigFormatException e = assertThrows(ConfigFormatException.class,
                () -> reader.readTree(json("{'controller':{'name':")));
        assertEquals("Invalid JSON format", e.getMessage());
    }

    @Test
    void topLevelMustBeObject() {
        ConfigFormatException e = assertThrows(ConfigFormatException.class,
                () -> reader.readTree(json("[{'name':'p'}]")));
        assertEquals("Invalid JSON format: top-level value must be an object", e.getMessage());

        assertThrows(ConfigFormatException.class, () -> reader.readTree(new byte[0]));
    }

    @Test
    void treeBindsToNativeDocument() {
        NativeConfigDocument document = (NativeConfigDocument) reader.toDocument(
                reader.readTree(json("{'controller':{'name':'锅炉','host':'10.0.0.5','port':502},'points':[],'extra':1}")),
                ConfigDialect.NATIVE);

        assertEquals("锅炉", document.getController().getName());
        assertEquals(502, document.getController().getPort());
        assertTrue(document.getPoints().isEmpty());
    }
}
