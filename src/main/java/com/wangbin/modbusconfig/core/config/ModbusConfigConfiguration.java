package com.wangbin.modbusconfig.core.config;

import com.wangbin.modbusconfig.core.catalog.ModbusCatalog;
import com.wangbin.modbusconfig.core.catalog.memory.InMemoryModbusCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 配置导入导出引擎的基础 Bean
 */
@Slf4j
@Configuration
public class ModbusConfigConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * 未接入外部目录存储时使用内存实现
     */
    @Bean
    @ConditionalOnMissingBean(ModbusCatalog.class)
    public ModbusCatalog modbusCatalog() {
        log.info("未配置外部目录存储，使用内存目录");
        return new InMemoryModbusCatalog();
    }
}
