package com.wangbin.modbusconfig.core.importer;

import com.wangbin.modbusconfig.common.domain.entity.ModbusController;
import com.wangbin.modbusconfig.common.domain.entity.ModbusPoint;
import com.wangbin.modbusconfig.common.enums.ImportMode;
import com.wangbin.modbusconfig.common.exception.ConfigProcessingException;
import com.wangbin.modbusconfig.common.exception.DuplicateException;
import com.wangbin.modbusconfig.core.catalog.CatalogUnitOfWork;
import com.wangbin.modbusconfig.core.codec.model.ControllerDefinition;
import com.wangbin.modbusconfig.core.codec.model.DecodedConfig;
import com.wangbin.modbusconfig.core.codec.model.PointDefinition;
import com.wangbin.modbusconfig.core.importer.model.ControllerImportStatus;
import com.wangbin.modbusconfig.core.importer.model.ImportResult;
import com.wangbin.modbusconfig.core.importer.model.ImportResult.ControllerResult;
import com.wangbin.modbusconfig.core.importer.model.ImportResult.PointResult;
import com.wangbin.modbusconfig.core.importer.model.PointImportStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 导入对账
 *
 * 以 (host, port) 匹配已有控制器，按导入模式处理冲突：
 * <ul>
 *     <li>控制器不存在：创建控制器及全部点位</li>
 *     <li>skip_controller：跳过，不处理任何点位</li>
 *     <li>overwrite_controller：更新名称与超时，删除原有点位后重建</li>
 *     <li>skip/overwrite_duplicate_points：按自然键逐个点位跳过或覆盖，未匹配的新建</li>
 *     <li>未指定模式：控制器已存在即报冲突</li>
 * </ul>
 * 单个点位的映射错误或唯一键冲突只影响该点位，其余异常向上抛出由调用方回滚。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ImportReconciler {

    private final PointMapper pointMapper;

    public ImportResult reconcile(DecodedConfig decoded, ImportMode mode, CatalogUnitOfWork unitOfWork) {
        ControllerDefinition definition = decoded.getController();
        ModbusController incoming = pointMapper.toController(definition);
        ModbusController existing = unitOfWork.findControllerByHostPort(incoming.getHost(), incoming.getPort());

        ImportResult result = new ImportResult();
        result.getWarnings().addAll(decoded.getWarnings());

        if (existing == null) {
            ModbusController created = unitOfWork.createController(incoming);
            log.info("创建控制器 {} ({})", created.getName(), created.getEndpoint());
            createAll(decoded.getPoints(), created.getId(), unitOfWork, result);
            result.setController(aggregate(created, "Controller created", result.getPoints()));
            return result;
        }

        if (mode == null) {
            log.warn("控制器 {} 已存在且未指定导入模式", existing.getEndpoint());
            throw DuplicateException.controllerExists(existing.getHost(), existing.getPort());
        }

        switch (mode) {
            case SKIP_CONTROLLER -> {
                log.warn("控制器 {} ({}) 已存在，跳过导入", existing.getName(), existing.getEndpoint());
                result.setController(new ControllerResult(existing.getId(), existing.getName(),
                        ControllerImportStatus.SKIPPED, "Controller already exists"));
            }
            case OVERWRITE_CONTROLLER -> {
                existing.setName(incoming.getName());
                existing.setTimeout(incoming.getTimeout());
                ModbusController updated = unitOfWork.updateController(existing);
                int removed = unitOfWork.deletePointsByController(updated.getId());
                log.info("覆盖控制器 {} ({})，删除原有点位 {} 个", updated.getName(), updated.getEndpoint(), removed);
                createAll(decoded.getPoints(), updated.getId(), unitOfWork, result);
                result.setController(aggregate(updated, "Controller updated", result.getPoints()));
            }
            case SKIP_DUPLICATE_POINTS, OVERWRITE_DUPLICATE_POINTS -> {
                log.info("控制器 {} ({}) 已存在，按点位合并，模式 {}", existing.getName(), existing.getEndpoint(), mode.getValue());
                mergePoints(decoded.getPoints(), existing.getId(), mode, unitOfWork, result);
                result.setController(aggregate(existing, "Controller already exists, points merged", result.getPoints()));
            }
        }
        return result;
    }

    private void createAll(List<PointDefinition> definitions, String controllerId,
                           CatalogUnitOfWork unitOfWork, ImportResult result) {
        for (PointDefinition definition : definitions) {
            try {
                ModbusPoint created = unitOfWork.createPoint(pointMapper.toPoint(definition, controllerId));
                result.getPoints().add(PointResult.created(created.getId(), created.getName()));
            } catch (ConfigProcessingException | DuplicateException e) {
                result.getPoints().add(pointError(definition, e));
            }
        }
    }

    private void mergePoints(List<PointDefinition> definitions, String controllerId, ImportMode mode,
                             CatalogUnitOfWork unitOfWork, ImportResult result) {
        for (PointDefinition definition : definitions) {
            try {
                ModbusPoint point = pointMapper.toPoint(definition, controllerId);
                ModbusPoint match = unitOfWork.findPointByNaturalKey(point.naturalKey());
                if (match == null) {
                    ModbusPoint created = unitOfWork.createPoint(point);
                    result.getPoints().add(PointResult.created(created.getId(), created.getName()));
                } else if (mode == ImportMode.SKIP_DUPLICATE_POINTS) {
                    log.debug("点位 {} 已存在，跳过", match);
                    result.getPoints().add(PointResult.skipped(match.getId(), point.getName()));
                } else {
                    match.applyMutableFields(point);
                    ModbusPoint updated = unitOfWork.updatePoint(match);
                    result.getPoints().add(PointResult.updated(updated.getId(), updated.getName()));
                }
            } catch (ConfigProcessingException | DuplicateException e) {
                result.getPoints().add(pointError(definition, e));
            }
        }
    }

    private PointResult pointError(PointDefinition definition, RuntimeException e) {
        log.warn("点位 {} 导入失败: {}", definition.getName(), e.getMessage());
        return PointResult.error(definition.getName(), e.getMessage());
    }

    /**
     * 汇总控制器状态：有成功即成功；全部错误或全部跳过为失败；其余为成功
     */
    static ControllerResult aggregate(ModbusController controller, String message, List<PointResult> points) {
        long success = count(points, PointImportStatus.SUCCESS);
        long skipped = count(points, PointImportStatus.SKIPPED);
        long errors = count(points, PointImportStatus.ERROR);

        ControllerImportStatus status = ControllerImportStatus.SUCCESS;
        if (success == 0 && !points.isEmpty()) {
            if (errors == points.size()) {
                status = ControllerImportStatus.FAILED;
                message = "All points failed";
            } else if (skipped == points.size()) {
                status = ControllerImportStatus.FAILED;
                message = "All points already exist";
            }
        }
        return new ControllerResult(controller.getId(), controller.getName(), status, message);
    }

    private static long count(List<PointResult> points, PointImportStatus status) {
        return points.stream().filter(p -> p.getStatus() == status).count();
    }
}
