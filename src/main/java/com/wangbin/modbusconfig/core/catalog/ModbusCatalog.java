package com.wangbin.modbusconfig.core.catalog;

import com.wangbin.modbusconfig.common.domain.entity.ModbusController;
import com.wangbin.modbusconfig.common.domain.entity.ModbusPoint;

import java.util.List;

/**
 * 控制器与点位目录存储
 *
 * 存储负责生成ID与维护创建/更新时间，并保证 (host, port) 与点位自然键唯一。
 * 写操作只能在 {@link CatalogUnitOfWork} 中进行。
 */
public interface ModbusCatalog {

    /**
     * 开启一个事务，调用方负责提交或关闭（未提交即回滚）
     */
    CatalogUnitOfWork begin();

    /**
     * 按ID查询控制器，不存在返回 null
     */
    ModbusController findController(String controllerId);

    /**
     * 查询控制器下全部点位，按单元ID、地址排序
     */
    List<ModbusPoint> findPoints(String controllerId);
}
