package com.wangbin.modbusconfig.core.catalog.memory;

import com.wangbin.modbusconfig.common.domain.entity.ModbusController;
import com.wangbin.modbusconfig.common.domain.entity.ModbusPoint;
import com.wangbin.modbusconfig.common.domain.entity.PointKey;
import com.wangbin.modbusconfig.common.enums.PointEncoding;
import com.wangbin.modbusconfig.common.enums.PointKind;
import com.wangbin.modbusconfig.common.exception.DuplicateException;
import com.wangbin.modbusconfig.common.exception.ResourceNotFoundException;
import com.wangbin.modbusconfig.core.catalog.CatalogUnitOfWork;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.wangbin.modbusconfig.ModbusFixtures.CLOCK;
import static com.wangbin.modbusconfig.ModbusFixtures.controller;
import static com.wangbin.modbusconfig.ModbusFixtures.controllerAt;
import static com.wangbin.modbusconfig.ModbusFixtures.point;
import static org.junit.jupiter.api.Assertions.*;

class InMemoryModbusCatalogTest {

    private final InMemoryModbusCatalog catalog = new InMemoryModbusCatalog(CLOCK);

    private ModbusController seed() {
        try (CatalogUnitOfWork uow = catalog.begin()) {
            ModbusController created = uow.createController(controller("Boiler", "10.0.0.5", 502));
            ModbusPoint temp = point("temp", PointKind.HOLDING_REGISTER, PointEncoding.UINT16, 100, 1, 1);
            temp.setControllerId(created.getId());
            uow.createPoint(temp);
            uow.commit();
            return created;
        }
    }

    @Test
    void commitPublishesChangesWithGeneratedIds() {
        ModbusController created = seed();

        assertNotNull(created.getId());
        assertNotNull(created.getCreateTime());
        ModbusController stored = catalog.findController(created.getId());
        assertEquals("Boiler", stored.getName());
        List<ModbusPoint> points = catalog.findPoints(created.getId());
        assertEquals(1, points.size());
        assertNotNull(points.get(0).getId());
        assertEquals(CLOCK.millis(), points.get(0).getCreateTime().getTime());
    }

    @Test
    void closeWithoutCommitDiscardsChanges() {
        ModbusController created = seed();

        try (CatalogUnitOfWork uow = catalog.begin()) {
            uow.deletePointsByController(created.getId());
            uow.createController(controller("Other", "10.0.0.6", 502));
            assertTrue(uow.findPointsByController(created.getId()).isEmpty());
        }

        assertEquals(1, catalog.findPoints(created.getId()).size());
        assertNull(controllerAt(catalog, "10.0.0.6", 502));
        assertNotNull(controllerAt(catalog, "10.0.0.5", 502));
    }

    @Test
    void controllerEndpointIsUnique() {
        seed();

        try (CatalogUnitOfWork uow = catalog.begin()) {
            DuplicateException e = assertThrows(DuplicateException.class,
                    () -> uow.createController(controller("Renamed", "10.0.0.5", 502)));
            assertEquals("Controller with host 10.0.0.5 and port 502 already exists", e.getMessage());
            assertNotNull(uow.findControllerByHostPort("10.0.0.5", 502));
            assertNull(uow.findControllerByHostPort("10.0.0.5", 503));
        }
    }

    @Test
    void pointNaturalKeyIsUnique() {
        ModbusController created = seed();

        try (CatalogUnitOfWork uow = catalog.begin()) {
            ModbusPoint clash = point("temp2", PointKind.HOLDING_REGISTER, PointEncoding.INT16, 100, 1, 1);
            clash.setControllerId(created.getId());
            assertThrows(DuplicateException.class, () -> uow.createPoint(clash));

            // 类别不同即为不同点位
            ModbusPoint coil = point("run", PointKind.COIL, PointEncoding.BOOL, 100, 1, 1);
            coil.setControllerId(created.getId());
            assertNotNull(uow.createPoint(coil).getId());

            PointKey key = new PointKey(created.getId(), 1, 100, PointKind.HOLDING_REGISTER);
            assertEquals("temp", uow.findPointByNaturalKey(key).getName());
        }
    }

    @Test
    void updatePointChangesMutableFieldsOnly() {
        ModbusController created = seed();

        try (CatalogUnitOfWork uow = catalog.begin()) {
            ModbusPoint stored = uow.findPointsByController(created.getId()).get(0);
            stored.setName("temp2");
            stored.setUnit("℃");
            stored.setAddress(999);
            uow.updatePoint(stored);
            uow.commit();
        }

        ModbusPoint updated = catalog.findPoints(created.getId()).get(0);
        assertEquals("temp2", updated.getName());
        assertEquals("℃", updated.getUnit());
        assertEquals(100, updated.getAddress());
    }

    @Test
    void returnedEntitiesAreCopies() {
        ModbusController created = seed();

        catalog.findController(created.getId()).setName("changed");
        catalog.findPoints(created.getId()).get(0).setName("changed");

        assertEquals("Boiler", catalog.findController(created.getId()).getName());
        assertEquals("temp", catalog.findPoints(created.getId()).get(0).getName());
    }

    @Test
    void finishedUnitOfWorkRejectsFurtherUse() {
        CatalogUnitOfWork uow = catalog.begin();
        uow.commit();

        assertThrows(IllegalStateException.class, () -> uow.findControllerByHostPort("h", 1));
        assertThrows(IllegalStateException.class, uow::commit);
        uow.close();
    }

    @Test
    void pointsRequireExistingController() {
        try (CatalogUnitOfWork uow = catalog.begin()) {
            ModbusPoint orphan = point("orphan", PointKind.COIL, PointEncoding.BOOL, 1, 1, 1);
            orphan.setControllerId("missing");
            assertThrows(ResourceNotFoundException.class, () -> uow.createPoint(orphan));
        }
    }
}
