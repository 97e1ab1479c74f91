package com.wangbin.modbusconfig.core.catalog.memory;

import com.wangbin.modbusconfig.common.domain.entity.ModbusController;
import com.wangbin.modbusconfig.common.domain.entity.ModbusPoint;
import com.wangbin.modbusconfig.common.domain.entity.PointKey;
import com.wangbin.modbusconfig.common.exception.DuplicateException;
import com.wangbin.modbusconfig.common.exception.ResourceNotFoundException;
import com.wangbin.modbusconfig.common.utils.IdGenerator;
import com.wangbin.modbusconfig.core.catalog.CatalogUnitOfWork;
import com.wangbin.modbusconfig.core.catalog.ModbusCatalog;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 内存目录存储
 *
 * 事务持有写锁，在私有副本上修改，提交时整体替换；未提交关闭即丢弃副本。
 * 读操作持有读锁，返回实体副本。
 */
@Slf4j
public class InMemoryModbusCatalog implements ModbusCatalog {

    private static final Comparator<ModbusPoint> POINT_ORDER = Comparator
            .comparing((ModbusPoint p) -> p.getUnitId() != null ? p.getUnitId() : 0)
            .thenComparing(p -> p.getAddress() != null ? p.getAddress() : 0)
            .thenComparing(p -> p.getType() != null ? p.getType().ordinal() : 0);

    /**
     * 控制器 key:控制器ID
     */
    private final Map<String, ModbusController> controllers = new ConcurrentHashMap<>();

    /**
     * 点位 key:点位ID
     */
    private final Map<String, ModbusPoint> points = new ConcurrentHashMap<>();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final Clock clock;

    public InMemoryModbusCatalog() {
        this(Clock.systemDefaultZone());
    }

    public InMemoryModbusCatalog(Clock clock) {
        this.clock = clock;
    }

    @Override
    public CatalogUnitOfWork begin() {
        lock.writeLock().lock();
        try {
            return new InMemoryUnitOfWork(copyOf(controllers, ModbusController::copy), copyOf(points, ModbusPoint::copy));
        } catch (RuntimeException e) {
            lock.writeLock().unlock();
            throw e;
        }
    }

    @Override
    public ModbusController findController(String controllerId) {
        lock.readLock().lock();
        try {
            ModbusController controller = controllerId != null ? controllers.get(controllerId) : null;
            return controller != null ? controller.copy() : null;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<ModbusPoint> findPoints(String controllerId) {
        lock.readLock().lock();
        try {
            return pointsOf(points, controllerId);
        } finally {
            lock.readLock().unlock();
        }
    }

    private static List<ModbusPoint> pointsOf(Map<String, ModbusPoint> source, String controllerId) {
        List<ModbusPoint> result = new ArrayList<>();
        for (ModbusPoint point : source.values()) {
            if (point.getControllerId() != null && point.getControllerId().equals(controllerId)) {
                result.add(point.copy());
            }
        }
        result.sort(POINT_ORDER);
        return result;
    }

    private static <T> Map<String, T> copyOf(Map<String, T> source, java.util.function.UnaryOperator<T> copier) {
        Map<String, T> copy = new HashMap<>(source.size());
        source.forEach((id, value) -> copy.put(id, copier.apply(value)));
        return copy;
    }

    private Date now() {
        return Date.from(clock.instant());
    }

    private enum State {
        OPEN, COMMITTED, ROLLED_BACK
    }

    private final class InMemoryUnitOfWork implements CatalogUnitOfWork {

        private final Map<String, ModbusController> workingControllers;
        private final Map<String, ModbusPoint> workingPoints;
        private State state = State.OPEN;

        private InMemoryUnitOfWork(Map<String, ModbusController> workingControllers,
                                   Map<String, ModbusPoint> workingPoints) {
            this.workingControllers = workingControllers;
            this.workingPoints = workingPoints;
        }

        @Override
        public ModbusController findControllerByHostPort(String host, int port) {
            ensureOpen();
            for (ModbusController controller : workingControllers.values()) {
                if (controller.sameEndpoint(host, port)) {
                    return controller.copy();
                }
            }
            return null;
        }

        @Override
        public ModbusPoint findPointByNaturalKey(PointKey key) {
            ensureOpen();
            ModbusPoint point = lookup(key);
            return point != null ? point.copy() : null;
        }

        @Override
        public List<ModbusPoint> findPointsByController(String controllerId) {
            ensureOpen();
            return pointsOf(workingPoints, controllerId);
        }

        @Override
        public ModbusController createController(ModbusController controller) {
            ensureOpen();
            if (findControllerByHostPort(controller.getHost(), controller.getPort()) != null) {
                throw DuplicateException.controllerExists(controller.getHost(), controller.getPort());
            }
            ModbusController stored = controller.copy();
            stored.setId(IdGenerator.generateUuid());
            Date now = now();
            stored.setCreateTime(now);
            stored.setUpdateTime(now);
            workingControllers.put(stored.getId(), stored);
            return stored.copy();
        }

        @Override
        public ModbusController updateController(ModbusController controller) {
            ensureOpen();
            ModbusController stored = workingControllers.get(controller.getId());
            if (stored == null) {
                throw ResourceNotFoundException.controller(controller.getId());
            }
            stored.setName(controller.getName());
            stored.setTimeout(controller.getTimeout());
            stored.setUpdateTime(now());
            return stored.copy();
        }

        @Override
        public ModbusPoint createPoint(ModbusPoint point) {
            ensureOpen();
            if (!workingControllers.containsKey(point.getControllerId())) {
                throw ResourceNotFoundException.controller(point.getControllerId());
            }
            PointKey key = point.naturalKey();
            if (lookup(key) != null) {
                throw new DuplicateException("Point with key " + key + " already exists");
            }
            ModbusPoint stored = point.copy();
            stored.setId(IdGenerator.generateUuid());
            Date now = now();
            stored.setCreateTime(now);
            stored.setUpdateTime(now);
            workingPoints.put(stored.getId(), stored);
            return stored.copy();
        }

        @Override
        public ModbusPoint updatePoint(ModbusPoint point) {
            ensureOpen();
            ModbusPoint stored = workingPoints.get(point.getId());
            if (stored == null) {
                throw new ResourceNotFoundException("Point " + point.getId() + " not found");
            }
            stored.applyMutableFields(point);
            stored.setUpdateTime(now());
            return stored.copy();
        }

        @Override
        public int deletePointsByController(String controllerId) {
            ensureOpen();
            int before = workingPoints.size();
            workingPoints.values().removeIf(p -> controllerId.equals(p.getControllerId()));
            return before - workingPoints.size();
        }

        @Override
        public void commit() {
            ensureOpen();
            try {
                controllers.clear();
                controllers.putAll(workingControllers);
                points.clear();
                points.putAll(workingPoints);
                state = State.COMMITTED;
                log.debug("目录事务提交，控制器 {} 个，点位 {} 个", controllers.size(), points.size());
            } finally {
                lock.writeLock().unlock();
            }
        }

        @Override
        public void rollback() {
            ensureOpen();
            state = State.ROLLED_BACK;
            lock.writeLock().unlock();
            log.debug("目录事务回滚");
        }

        @Override
        public void close() {
            if (state == State.OPEN) {
                rollback();
            }
        }

        private ModbusPoint lookup(PointKey key) {
            for (ModbusPoint point : workingPoints.values()) {
                if (key.equals(point.naturalKey())) {
                    return point;
                }
            }
            return null;
        }

        private void ensureOpen() {
            if (state != State.OPEN) {
                throw new IllegalStateException("目录事务已结束: " + state);
            }
        }
    }
}
