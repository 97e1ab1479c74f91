package com.wangbin.modbusconfig.core.exporter;

import com.wangbin.modbusconfig.core.codec.document.ConfigDocument;

/**
 * 导出结果：文档对象、建议文件名与序列化后的内容
 */
public record ExportedConfig(ConfigDocument document, String filename, byte[] content) {
}
