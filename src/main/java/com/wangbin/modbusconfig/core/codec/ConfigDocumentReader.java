package com.wangbin.modbusconfig.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.wangbin.modbusconfig.common.enums.ConfigDialect;
import com.wangbin.modbusconfig.common.exception.ConfigFormatException;
import com.wangbin.modbusconfig.core.codec.document.ConfigDocument;
import com.wangbin.modbusconfig.core.codec.document.GatewayConfigDocument;
import com.wangbin.modbusconfig.core.codec.document.NativeConfigDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * 配置文件读写：字节 ⇄ JSON 树 ⇄ 方言文档
 */
@Slf4j
@Component
public class ConfigDocumentReader {

    private final ObjectMapper objectMapper;

    public ConfigDocumentReader() {
        this.objectMapper = new ObjectMapper();
        objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        objectMapper.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * 解析上传内容为 JSON 树，顶层必须是对象
     */
    public JsonNode readTree(byte[] content) {
        if (content == null || content.length == 0) {
            throw new ConfigFormatException("Invalid JSON format: empty content");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            log.warn("配置文件不是合法的 JSON: {}", e.getOriginalMessage());
            throw new ConfigFormatException("Invalid JSON format");
        } catch (IOException e) {
            log.warn("配置文件读取失败: {}", e.getMessage());
            throw new ConfigFormatException("Invalid JSON format");
        }
        if (root == null || !root.isObject()) {
            throw new ConfigFormatException("Invalid JSON format: top-level value must be an object");
        }
        return root;
    }

    /**
     * 按已校验过的方言把 JSON 树绑定为文档对象
     */
    public ConfigDocument toDocument(JsonNode root, ConfigDialect dialect) {
        Class<? extends ConfigDocument> type = dialect == ConfigDialect.GATEWAY
                ? GatewayConfigDocument.class
                : NativeConfigDocument.class;
        try {
            return objectMapper.treeToValue(root, type);
        } catch (JsonProcessingException e) {
            log.warn("配置文件绑定为 {} 文档失败: {}", dialect.getValue(), e.getOriginalMessage());
            throw new ConfigFormatException("Invalid " + dialect.getValue() + " configuration: " + e.getOriginalMessage());
        }
    }

    public byte[] write(ConfigDocument document) {
        try {
            return objectMapper.writeValueAsBytes(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("配置文件序列化失败", e);
        }
    }
}
