package com.wangbin.modbusconfig.core.catalog;

import com.wangbin.modbusconfig.common.domain.entity.ModbusController;
import com.wangbin.modbusconfig.common.domain.entity.ModbusPoint;
import com.wangbin.modbusconfig.common.domain.entity.PointKey;

import java.util.List;

/**
 * 一次导入调用对应的事务
 *
 * 查重读取与随后的写入必须在同一事务内完成；{@link #close()} 时若未提交则回滚全部变更。
 */
public interface CatalogUnitOfWork extends AutoCloseable {

    ModbusController findControllerByHostPort(String host, int port);

    ModbusPoint findPointByNaturalKey(PointKey key);

    List<ModbusPoint> findPointsByController(String controllerId);

    /**
     * 新建控制器，返回带ID与时间戳的副本
     *
     * @throws com.wangbin.modbusconfig.common.exception.DuplicateException (host, port) 已存在
     */
    ModbusController createController(ModbusController controller);

    /**
     * 更新控制器名称与超时时间
     */
    ModbusController updateController(ModbusController controller);

    /**
     * 新建点位，返回带ID与时间戳的副本
     *
     * @throws com.wangbin.modbusconfig.common.exception.DuplicateException 自然键已存在
     */
    ModbusPoint createPoint(ModbusPoint point);

    /**
     * 更新点位可变字段并刷新更新时间
     */
    ModbusPoint updatePoint(ModbusPoint point);

    /**
     * 删除控制器下全部点位，返回删除数量
     */
    int deletePointsByController(String controllerId);

    void commit();

    void rollback();

    @Override
    void close();
}
