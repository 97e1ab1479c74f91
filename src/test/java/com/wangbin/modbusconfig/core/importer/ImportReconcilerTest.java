package com.wangbin.modbusconfig.core.importer;

import com.wangbin.modbusconfig.common.domain.entity.ModbusController;
import com.wangbin.modbusconfig.common.domain.entity.ModbusPoint;
import com.wangbin.modbusconfig.common.enums.ImportMode;
import com.wangbin.modbusconfig.common.enums.PointEncoding;
import com.wangbin.modbusconfig.common.enums.PointKind;
import com.wangbin.modbusconfig.common.exception.DuplicateException;
import com.wangbin.modbusconfig.core.catalog.CatalogUnitOfWork;
import com.wangbin.modbusconfig.core.catalog.memory.InMemoryModbusCatalog;
import com.wangbin.modbusconfig.core.codec.model.ControllerDefinition;
import com.wangbin.modbusconfig.core.codec.model.DecodedConfig;
import com.wangbin.modbusconfig.core.codec.model.PointDefinition;
import com.wangbin.modbusconfig.core.importer.model.ControllerImportStatus;
import com.wangbin.modbusconfig.core.importer.model.ImportResult;
import com.wangbin.modbusconfig.core.importer.model.PointImportStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static com.wangbin.modbusconfig.ModbusFixtures.CLOCK;
import static com.wangbin.modbusconfig.ModbusFixtures.controller;
import static com.wangbin.modbusconfig.ModbusFixtures.point;
import static com.wangbin.modbusconfig.ModbusFixtures.properties;
import static org.junit.jupiter.api.Assertions.*;

class ImportReconcilerTest {

    private static final String HOST = "10.0.0.5";
    private static final int PORT = 502;

    private final ImportReconciler reconciler = new ImportReconciler(new PointMapper(properties()));
    private InMemoryModbusCatalog catalog;
    private ModbusController boiler;
    private ModbusPoint temp;

    @BeforeEach
    void setUp() {
        catalog = new InMemoryModbusCatalog(CLOCK);
        try (CatalogUnitOfWork uow = catalog.begin()) {
            boiler = uow.createController(controller("Boiler", HOST, PORT));
            ModbusPoint point = point("temp", PointKind.HOLDING_REGISTER, PointEncoding.UINT16, 100, 1, 1);
            point.setControllerId(boiler.getId());
            temp = uow.createPoint(point);
            uow.commit();
        }
    }

    private PointDefinition definition(String name, String type, int address) {
        PointDefinition definition = new PointDefinition();
        definition.setName(name);
        definition.setType(type);
        definition.setDataType("uint16");
        definition.setAddress(address);
        definition.setLen(1);
        definition.setUnitId(1);
        return definition;
    }

    private DecodedConfig decoded(String name, String host, PointDefinition... points) {
        ControllerDefinition controller = new ControllerDefinition();
        controller.setName(name);
        controller.setHost(host);
        controller.setPort(PORT);
        controller.setTimeout(20);
        DecodedConfig decoded = new DecodedConfig();
        decoded.setController(controller);
        decoded.getPoints().addAll(List.of(points));
        return decoded;
    }

    private ImportResult run(DecodedConfig decoded, ImportMode mode) {
        try (CatalogUnitOfWork uow = catalog.begin()) {
            ImportResult result = reconciler.reconcile(decoded, mode, uow);
            uow.commit();
            return result;
        }
    }

    private List<PointImportStatus> statuses(ImportResult result) {
        return result.getPoints().stream().map(ImportResult.PointResult::getStatus).collect(Collectors.toList());
    }

    @Test
    void newControllerIsCreatedWithAllPoints() {
        ImportResult result = run(decoded("Chiller", "10.0.0.6",
                definition("supply", "holding_register", 1),
                definition("run", "coil", 2)), ImportMode.SKIP_CONTROLLER);

        assertEquals(ControllerImportStatus.SUCCESS, result.getController().getStatus());
        assertEquals("Controller created", result.getController().getMessage());
        assertEquals(2, result.getTotalPoints());
        assertEquals(List.of(PointImportStatus.SUCCESS, PointImportStatus.SUCCESS), statuses(result));
        assertEquals("created", result.getPoints().get(0).getMessage());

        ModbusController chiller = catalog.findController(result.getController().getId());
        assertEquals("Chiller", chiller.getName());
        assertFalse(chiller.getStatus());
        assertEquals(2, catalog.findPoints(chiller.getId()).size());
    }

    @Test
    void skipDuplicatePointsLeavesCatalogAlone() {
        ImportResult result = run(decoded("Boiler", HOST, definition("temp2", "holding_register", 100)),
                ImportMode.SKIP_DUPLICATE_POINTS);

        assertEquals(1, result.getTotalPoints());
        ImportResult.PointResult pointResult = result.getPoints().get(0);
        assertEquals(PointImportStatus.SKIPPED, pointResult.getStatus());
        assertEquals("already exists", pointResult.getMessage());
        assertEquals(temp.getId(), pointResult.getId());
        assertEquals(ControllerImportStatus.FAILED, result.getController().getStatus());
        assertEquals("All points already exist", result.getController().getMessage());

        assertEquals("temp", catalog.findPoints(boiler.getId()).get(0).getName());
        assertEquals("Boiler", catalog.findController(boiler.getId()).getName());
    }

    @Test
    void overwriteDuplicatePointsUpdatesInPlace() {
        ImportResult result = run(decoded("Boiler", HOST, definition("temp2", "holding_register", 100)),
                ImportMode.OVERWRITE_DUPLICATE_POINTS);

        ImportResult.PointResult pointResult = result.getPoints().get(0);
        assertEquals(PointImportStatus.SUCCESS, pointResult.getStatus());
        assertEquals("updated", pointResult.getMessage());
        assertEquals(ControllerImportStatus.SUCCESS, result.getController().getStatus());

        List<ModbusPoint> points = catalog.findPoints(boiler.getId());
        assertEquals(1, points.size());
        assertEquals("temp2", points.get(0).getName());
        assertEquals(temp.getId(), points.get(0).getId());
    }

    @Test
    void overwriteControllerRecreatesPoints() {
        ImportResult result = run(decoded("Boiler v2", HOST, definition("temp2", "holding_register", 100)),
                ImportMode.OVERWRITE_CONTROLLER);

        assertEquals(ControllerImportStatus.SUCCESS, result.getController().getStatus());
        assertEquals(boiler.getId(), result.getController().getId());
        assertEquals("created", result.getPoints().get(0).getMessage());

        ModbusController updated = catalog.findController(boiler.getId());
        assertEquals("Boiler v2", updated.getName());
        assertEquals(20, updated.getTimeout());
        List<ModbusPoint> points = catalog.findPoints(boiler.getId());
        assertEquals(1, points.size());
        assertEquals("temp2", points.get(0).getName());
        assertNotEquals(temp.getId(), points.get(0).getId());
    }

    @Test
    void skipControllerProcessesNoPoints() {
        ImportResult result = run(decoded("Boiler", HOST, definition("temp2", "holding_register", 100)),
                ImportMode.SKIP_CONTROLLER);

        assertEquals(ControllerImportStatus.SKIPPED, result.getController().getStatus());
        assertEquals("Controller already exists", result.getController().getMessage());
        assertEquals(0, result.getTotalPoints());
        assertTrue(result.getPoints().isEmpty());
        assertEquals("temp", catalog.findPoints(boiler.getId()).get(0).getName());
    }

    @Test
    void existingControllerWithoutModeIsConflict() {
        DecodedConfig decoded = decoded("Boiler", HOST, definition("temp2", "holding_register", 100));

        DuplicateException e = assertThrows(DuplicateException.class, () -> run(decoded, null));
        assertEquals("Controller with host 10.0.0.5 and port 502 already exists", e.getMessage());
    }

    @Test
    void partialFailureStillSucceeds() {
        ImportResult result = run(decoded("Boiler", HOST,
                definition("temp2", "holding_register", 100),
                definition("flow", "holding_register", 101),
                definition("broken", "valve", 102)), ImportMode.SKIP_DUPLICATE_POINTS);

        assertEquals(3, result.getTotalPoints());
        assertEquals(List.of(PointImportStatus.SKIPPED, PointImportStatus.SUCCESS, PointImportStatus.ERROR),
                statuses(result));
        assertEquals(ControllerImportStatus.SUCCESS, result.getController().getStatus());
        assertEquals("Invalid point type 'valve' for point 'broken'", result.getPoints().get(2).getMessage());
        assertNull(result.getPoints().get(2).getId());
        assertEquals(2, catalog.findPoints(boiler.getId()).size());
    }

    @Test
    void allPointsFailingMarksControllerFailed() {
        PointDefinition negative = definition("negative", "coil", 0);
        negative.setAddress(-1);
        ImportResult result = run(decoded("Chiller", "10.0.0.6",
                definition("broken", "register", 1), negative), null);

        assertEquals(ControllerImportStatus.FAILED, result.getController().getStatus());
        assertEquals("All points failed", result.getController().getMessage());
        assertEquals("Invalid address -1 for point 'negative'", result.getPoints().get(1).getMessage());
    }

    @Test
    void duplicateKeyInsideOneDocumentOnlyFailsThatPoint() {
        ImportResult result = run(decoded("Chiller", "10.0.0.6",
                definition("first", "holding_register", 5),
                definition("second", "holding_register", 5)), null);

        assertEquals(List.of(PointImportStatus.SUCCESS, PointImportStatus.ERROR), statuses(result));
        assertEquals(ControllerImportStatus.SUCCESS, result.getController().getStatus());
    }

    @Test
    void emptyDocumentCountsAsSuccess() {
        ImportResult result = run(decoded("Chiller", "10.0.0.6"), null);

        assertEquals(ControllerImportStatus.SUCCESS, result.getController().getStatus());
        assertEquals(0, result.getTotalPoints());
    }

    @Test
    void decodeWarningsAreCarriedIntoResult() {
        DecodedConfig decoded = decoded("Chiller", "10.0.0.6", definition("p", "input_register", 1));
        decoded.addWarning("Point p (type: input_register) cannot be written, ignoring write capability");

        ImportResult result = run(decoded, null);

        assertEquals(decoded.getWarnings(), result.getWarnings());
    }
}
