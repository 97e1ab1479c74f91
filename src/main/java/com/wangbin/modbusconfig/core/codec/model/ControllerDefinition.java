package com.wangbin.modbusconfig.core.codec.model;

import lombok.Data;

/**
 * 从配置文件解析出的控制器定义（尚未写入目录）
 */
@Data
public class ControllerDefinition {

    private String name;

    private String host;

    private Integer port;

    /** 超时时间（秒） */
    private Integer timeout;
}
