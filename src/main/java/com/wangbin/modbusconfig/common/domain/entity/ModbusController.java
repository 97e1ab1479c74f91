package com.wangbin.modbusconfig.common.domain.entity;

import lombok.Data;

import java.util.Date;

/**
 * Modbus 控制器实体
 *
 * 一台现场总线设备，导入时以 (host, port) 判定是否为同一设备，与名称无关
 */
@Data
public class ModbusController {

    // ==================== 基本信息 ====================

    /** 控制器ID，由目录存储生成 */
    private String id;

    /** 控制器名称 */
    private String name;

    // ==================== 连接配置 ====================

    /** 设备IP地址 */
    private String host;

    /** 设备端口号 */
    private Integer port;

    /** 超时时间（秒） */
    private Integer timeout;

    // ==================== 设备状态 ====================

    /** 连通状态，导入的控制器初始为 false */
    private Boolean status;

    // ==================== 系统字段 ====================

    /** 创建时间 */
    private Date createTime;

    /** 更新时间 */
    private Date updateTime;

    /**
     * 设备端点标识 host:port
     */
    public String getEndpoint() {
        return host + ":" + port;
    }

    /**
     * 判断是否为同一物理设备
     */
    public boolean sameEndpoint(String otherHost, Integer otherPort) {
        return host != null && host.equals(otherHost) && port != null && port.equals(otherPort);
    }

    public ModbusController copy() {
        ModbusController copy = new ModbusController();
        copy.setId(id);
        copy.setName(name);
        copy.setHost(host);
        copy.setPort(port);
        copy.setTimeout(timeout);
        copy.setStatus(status);
        copy.setCreateTime(createTime);
        copy.setUpdateTime(updateTime);
        return copy;
    }
}
