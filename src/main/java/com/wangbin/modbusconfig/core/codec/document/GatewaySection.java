package com.wangbin.modbusconfig.core.codec.document;

import com.wangbin.modbusconfig.common.enums.FunctionCode.Access;
import lombok.Getter;

/**
 * gateway 方言中 slave 的点位区段，解析时按声明顺序遍历
 */
@Getter
public enum GatewaySection {
    ATTRIBUTES("attributes", Access.READ),
    TIMESERIES("timeseries", Access.READ),
    RPC("rpc", Access.WRITE);

    private final String key;
    /** 区段承载的访问能力 */
    private final Access access;

    GatewaySection(String key, Access access) {
        this.key = key;
        this.access = access;
    }
}
