package com.wangbin.modbusconfig.api.controller;

import com.wangbin.modbusconfig.common.exception.BusinessException;
import com.wangbin.modbusconfig.common.web.result.ApiResult;
import com.wangbin.modbusconfig.common.web.result.ResultCode;
import com.wangbin.modbusconfig.core.exporter.ExportedConfig;
import com.wangbin.modbusconfig.core.importer.model.ImportResult;
import com.wangbin.modbusconfig.core.validator.ValidationResult;
import com.wangbin.modbusconfig.service.ModbusConfigService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Modbus 配置导入导出接口
 */
@Slf4j
@RestController
@RequestMapping("/api/modbus")
@RequiredArgsConstructor
public class ModbusConfigController {

    private final ModbusConfigService configService;

    /**
     * 导出控制器配置文件
     */
    @GetMapping("/controllers/{controllerId}/export")
    public ResponseEntity<byte[]> exportConfig(@PathVariable String controllerId,
                                               @RequestParam(defaultValue = "native") String format) {
        ExportedConfig exported = configService.exportConfig(controllerId, format);
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment()
                                .filename(exported.filename(), StandardCharsets.UTF_8)
                                .build()
                                .toString())
                .body(exported.content());
    }

    /**
     * 导入配置文件
     */
    @PostMapping("/config/import")
    public ApiResult<ImportResult> importConfig(@RequestParam("file") MultipartFile file,
                                                @RequestParam(defaultValue = "native") String format,
                                                @RequestParam(required = false) String mode) throws IOException {
        checkJsonFile(file);
        log.info("收到配置导入请求: 文件 {}，格式 {}，模式 {}", file.getOriginalFilename(), format, mode);
        ImportResult result = configService.importConfig(file.getBytes(), format, mode);
        return ApiResult.success("Configuration imported successfully", result);
    }

    /**
     * 校验配置文件，方言不匹配时直接报错
     */
    @PostMapping("/config/validate")
    public ApiResult<ValidationResult> validateConfig(@RequestParam("file") MultipartFile file,
                                                      @RequestParam(defaultValue = "native") String format) throws IOException {
        checkJsonFile(file);
        ValidationResult result = configService.validateConfig(file.getBytes(), format);
        return ApiResult.success("Configuration validation completed", result);
    }

    private void checkJsonFile(MultipartFile file) {
        String filename = file.getOriginalFilename();
        if (filename == null || !filename.toLowerCase().endsWith(".json")) {
            throw new BusinessException(ResultCode.PARAM_ERROR, "Only JSON files are supported");
        }
    }
}
