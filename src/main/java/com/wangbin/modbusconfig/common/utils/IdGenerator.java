package com.wangbin.modbusconfig.common.utils;

import java.util.UUID;

/**
 * ID生成器工具类
 */
public class IdGenerator {

    private IdGenerator() {
        // 工具类，防止实例化
    }

    /**
     * 生成UUID（带横线），用作控制器与点位主键
     */
    public static String generateUuid() {
        return UUID.randomUUID().toString();
    }
}
