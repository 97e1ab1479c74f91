package com.wangbin.modbusconfig.core.codec.document;

import com.wangbin.modbusconfig.common.enums.ConfigDialect;

/**
 * 配置文件，按方言区分的两种结构
 */
public sealed interface ConfigDocument permits NativeConfigDocument, GatewayConfigDocument {

    ConfigDialect dialect();
}
