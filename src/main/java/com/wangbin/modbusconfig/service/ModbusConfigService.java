package com.wangbin.modbusconfig.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.wangbin.modbusconfig.common.enums.ConfigDialect;
import com.wangbin.modbusconfig.common.enums.ImportMode;
import com.wangbin.modbusconfig.common.exception.BusinessException;
import com.wangbin.modbusconfig.common.exception.ServerException;
import com.wangbin.modbusconfig.core.catalog.CatalogUnitOfWork;
import com.wangbin.modbusconfig.core.catalog.ModbusCatalog;
import com.wangbin.modbusconfig.core.codec.ConfigDocumentReader;
import com.wangbin.modbusconfig.core.codec.FormatCodec;
import com.wangbin.modbusconfig.core.codec.document.ConfigDocument;
import com.wangbin.modbusconfig.core.codec.model.DecodedConfig;
import com.wangbin.modbusconfig.core.exporter.ExportAssembler;
import com.wangbin.modbusconfig.core.exporter.ExportedConfig;
import com.wangbin.modbusconfig.core.importer.ImportReconciler;
import com.wangbin.modbusconfig.core.importer.model.ImportResult;
import com.wangbin.modbusconfig.core.validator.ConfigValidator;
import com.wangbin.modbusconfig.core.validator.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 配置导入导出服务
 *
 * 导入流程：解析 JSON → 方言与结构校验 → 解码 → 在同一个目录事务中对账 → 提交。
 * 业务异常原样抛出；其他异常回滚后包装为 {@link ServerException}。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModbusConfigService {

    private final ModbusCatalog catalog;
    private final ConfigDocumentReader reader;
    private final ConfigValidator validator;
    private final FormatCodec codec;
    private final ImportReconciler reconciler;
    private final ExportAssembler assembler;

    public ExportedConfig exportConfig(String controllerId, String format) {
        ConfigDialect dialect = ConfigDialect.fromValue(format);
        try {
            return assembler.export(controllerId, dialect);
        } catch (BusinessException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("导出控制器 {} 配置失败", controllerId, e);
            throw ServerException.wrap("Export failed", e);
        }
    }

    public ImportResult importConfig(byte[] content, String format, String mode) {
        ConfigDialect dialect = ConfigDialect.fromValue(format);
        ImportMode importMode = ImportMode.fromValue(mode);
        try {
            JsonNode root = reader.readTree(content);
            validator.requireValid(root, dialect);
            ConfigDocument document = reader.toDocument(root, dialect);
            DecodedConfig decoded = codec.decode(document, dialect);

            try (CatalogUnitOfWork unitOfWork = catalog.begin()) {
                ImportResult result = reconciler.reconcile(decoded, importMode, unitOfWork);
                unitOfWork.commit();
                log.info("配置导入完成，格式 {}，模式 {}，控制器 {} [{}]，点位 {} 个",
                        dialect.getValue(), importMode != null ? importMode.getValue() : "strict",
                        result.getController().getName(), result.getController().getStatus().getValue(),
                        result.getTotalPoints());
                return result;
            }
        } catch (BusinessException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("配置导入失败，已回滚", e);
            throw ServerException.wrap("Import failed", e);
        }
    }

    public ValidationResult validateConfig(byte[] content, String format) {
        ConfigDialect dialect = ConfigDialect.fromValue(format);
        JsonNode root = reader.readTree(content);
        return validator.validate(root, dialect);
    }
}
