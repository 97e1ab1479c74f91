package com.wangbin.modbusconfig.core.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * modbus.config 配置映射
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "modbus.config")
public class ModbusConfigProperties {

    /**
     * 控制器默认超时时间（秒）
     */
    @Min(value = 1, message = "默认超时时间必须大于0")
    private int defaultTimeout = 10;

    /**
     * 控制器默认端口
     */
    @Min(value = 1, message = "端口必须在1-65535之间")
    @Max(value = 65535, message = "端口必须在1-65535之间")
    private int defaultPort = 502;

    /**
     * 网关方言缺省主机
     */
    @NotBlank(message = "缺省主机不能为空")
    private String defaultHost = "localhost";

    /**
     * 导入时缺省的控制器名称
     */
    private String defaultControllerName = "Imported Controller";

    /**
     * 导入时缺省的点位名称
     */
    private String defaultPointName = "Imported Point";

    /**
     * 点位默认长度
     */
    @Min(value = 1, message = "点位默认长度必须大于0")
    private int defaultLength = 1;

    /**
     * 点位默认单元ID
     */
    @Min(value = 0, message = "单元ID必须在0-255之间")
    @Max(value = 255, message = "单元ID必须在0-255之间")
    private int defaultUnitId = 1;

    /**
     * 网关方言：重试次数
     */
    private int retries = 3;

    /**
     * 网关方言：轮询周期（毫秒）
     */
    private int pollPeriod = 1000;

    /**
     * 网关方言：写入点位 rpc 标签前缀
     */
    @NotBlank(message = "rpc 标签前缀不能为空")
    private String rpcTagPrefix = "set_";

    /**
     * 导出文件名前缀
     */
    @NotBlank(message = "导出文件名前缀不能为空")
    private String exportFilePrefix = "modbus";
}
