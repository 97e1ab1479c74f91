package com.wangbin.modbusconfig.core.validator;

import com.fasterxml.jackson.databind.JsonNode;
import com.wangbin.modbusconfig.common.enums.ConfigDialect;
import com.wangbin.modbusconfig.common.enums.PointEncoding;
import com.wangbin.modbusconfig.common.enums.PointKind;
import com.wangbin.modbusconfig.common.exception.ConfigFormatException;
import com.wangbin.modbusconfig.common.exception.ConfigFormatMismatchException;
import com.wangbin.modbusconfig.common.exception.DuplicateException;
import com.wangbin.modbusconfig.core.codec.FunctionCodeMap;
import com.wangbin.modbusconfig.core.codec.document.GatewaySection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 配置文件校验器，在解码之前执行
 *
 * 1. 方言识别：文件带有另一种方言的结构特征时直接抛出格式不匹配异常，与必填字段是否齐全无关；
 * 2. 结构校验：必填字段、点位类别取值、单文件单控制器约束。
 */
@Slf4j
@Component
public class ConfigValidator {

    private static final List<String> CONTROLLER_FIELDS = List.of("name", "host", "port");
    private static final List<String> NATIVE_POINT_FIELDS = List.of("name", "type", "data_type", "address");
    private static final List<String> SLAVE_FIELDS = List.of("host", "port", "deviceName");
    private static final List<String> GATEWAY_ENTRY_FIELDS = List.of("tag", "functionCode", "address");

    /**
     * 方言识别：带有另一方言特征时抛出 {@link ConfigFormatMismatchException}
     */
    public void checkDialect(JsonNode root, ConfigDialect expected) {
        if (expected == null) {
            throw new ConfigFormatException("Unsupported format: null");
        }
        boolean foreign = expected == ConfigDialect.NATIVE ? hasGatewayFingerprint(root) : hasNativeFingerprint(root);
        if (foreign) {
            log.warn("配置文件方言不匹配，期望 {}，检测到 {}", expected.getValue(), expected.other().getValue());
            throw new ConfigFormatMismatchException(expected, expected.other());
        }
    }

    /**
     * 完整校验，收集全部错误与提示
     */
    public ValidationResult validate(JsonNode root, ConfigDialect expected) {
        checkDialect(root, expected);
        ValidationResult result = new ValidationResult();
        if (expected == ConfigDialect.NATIVE) {
            validateNative(root, result);
        } else {
            validateGateway(root, result);
        }
        log.debug("{} 配置校验完成，错误 {} 条，提示 {} 条", expected.getValue(),
                result.getErrors().size(), result.getWarnings().size());
        return result;
    }

    /**
     * 导入前校验：违反单控制器约束抛出 {@link DuplicateException}，其他结构错误抛出第一条
     */
    public ValidationResult requireValid(JsonNode root, ConfigDialect expected) {
        checkDialect(root, expected);
        int controllers = controllerCount(root, expected);
        if (controllers > 1) {
            throw DuplicateException.singleController(expected == ConfigDialect.NATIVE ? "controller" : "slave", controllers);
        }
        ValidationResult result = validate(root, expected);
        if (!result.isValid()) {
            throw new ConfigFormatException(result.firstError());
        }
        return result;
    }

    // ==================== 方言特征 ====================

    private boolean hasNativeFingerprint(JsonNode root) {
        return (root.has("controller") && root.has("points")) || root.has("controllers");
    }

    private boolean hasGatewayFingerprint(JsonNode root) {
        JsonNode master = root.get("master");
        return master != null && master.isObject() && master.has("slaves");
    }

    private int controllerCount(JsonNode root, ConfigDialect dialect) {
        if (dialect == ConfigDialect.NATIVE) {
            JsonNode controllers = root.get("controllers");
            if (root.has("controller") || controllers == null || !controllers.isArray()) {
                return 1;
            }
            return controllers.size();
        }
        JsonNode slaves = root.path("master").get("slaves");
        return slaves != null && slaves.isArray() ? slaves.size() : 0;
    }

    // ==================== native ====================

    private void validateNative(JsonNode root, ValidationResult result) {
        boolean single = root.has("controller") && root.has("points");
        JsonNode controllers = root.get("controllers");
        if (!single && controllers == null) {
            result.addError("Missing 'controller' and 'points' sections or 'controllers' section in native format");
            return;
        }

        if (single) {
            JsonNode controller = root.get("controller");
            if (!controller.isObject()) {
                result.addError("Field 'controller' must be an object");
            } else {
                requireFields(controller, CONTROLLER_FIELDS, "", " in controller", result);
            }
            validateNativePoints(root.get("points"), "", result);
            return;
        }

        if (!controllers.isArray()) {
            result.addError("Field 'controllers' must be an array");
            return;
        }
        if (controllers.size() != 1) {
            result.addError(String.format(
                    "Only one controller per import is supported: expected exactly one controller, found %d",
                    controllers.size()));
        }
        for (int i = 0; i < controllers.size(); i++) {
            JsonNode controller = controllers.get(i);
            String position = "Controller " + i;
            if (!controller.isObject()) {
                result.addError(position + ": Entry must be an object");
                continue;
            }
            requireFields(controller, CONTROLLER_FIELDS, position + ": ", "", result);
            JsonNode points = controller.get("points");
            if (points != null) {
                validateNativePoints(points, position + " ", result);
            } else {
                result.addWarning(position + ": No points defined");
            }
        }
    }

    private void validateNativePoints(JsonNode points, String prefix, ValidationResult result) {
        if (!points.isArray()) {
            result.addError(prefix + "Field 'points' must be an array");
            return;
        }
        if (points.isEmpty()) {
            result.addWarning(prefix + "No points defined");
        }
        for (int j = 0; j < points.size(); j++) {
            JsonNode point = points.get(j);
            String position = prefix + "Point " + j;
            if (!point.isObject()) {
                result.addError(position + ": Entry must be an object");
                continue;
            }
            requireFields(point, NATIVE_POINT_FIELDS, position + ": ", "", result);

            JsonNode type = point.get("type");
            if (type != null && PointKind.fromValue(type.asText()) == null) {
                result.addError(String.format("%s: Invalid type '%s'", position, type.asText()));
            }
            JsonNode address = point.get("address");
            if (address != null && !address.canConvertToInt()) {
                result.addError(String.format("%s: Field 'address' must be an integer", position));
            }
            JsonNode dataType = point.get("data_type");
            if (dataType != null && PointEncoding.fromValue(dataType.asText()) == null) {
                result.addWarning(String.format("%s: Unknown data_type '%s'", position, dataType.asText()));
            }
        }
    }

    // ==================== gateway ====================

    private void validateGateway(JsonNode root, ValidationResult result) {
        JsonNode master = root.get("master");
        if (master == null || !master.isObject()) {
            result.addError("Missing 'master' section in gateway format");
            return;
        }
        JsonNode slaves = master.get("slaves");
        if (slaves == null) {
            result.addError("Missing 'slaves' section in master");
            return;
        }
        if (!slaves.isArray()) {
            result.addError("Field 'master.slaves' must be an array");
            return;
        }
        if (slaves.size() != 1) {
            result.addError(String.format(
                    "Only one controller per import is supported: expected exactly one slave, found %d",
                    slaves.size()));
        }

        for (int i = 0; i < slaves.size(); i++) {
            JsonNode slave = slaves.get(i);
            String position = "Slave " + i;
            if (!slave.isObject()) {
                result.addError(position + ": Entry must be an object");
                continue;
            }
            requireFields(slave, SLAVE_FIELDS, position + ": ", "", result);
            if (!slave.has("unitId")) {
                result.addWarning(position + ": 'unitId' not set, default unit id will be used");
            }

            int entries = 0;
            for (GatewaySection section : GatewaySection.values()) {
                JsonNode items = slave.get(section.getKey());
                if (items == null) {
                    continue;
                }
                if (!items.isArray()) {
                    result.addError(String.format("%s: Field '%s' must be an array", position, section.getKey()));
                    continue;
                }
                entries += items.size();
                for (int j = 0; j < items.size(); j++) {
                    validateGatewayEntry(items.get(j), section, position + " " + section.getKey() + " " + j, result);
                }
            }
            if (entries == 0) {
                result.addWarning(position + ": No points defined");
            }
        }
    }

    private void validateGatewayEntry(JsonNode item, GatewaySection section, String position, ValidationResult result) {
        if (!item.isObject()) {
            result.addError(position + ": Entry must be an object");
            return;
        }
        for (String field : GATEWAY_ENTRY_FIELDS) {
            if (!item.has(field)) {
                result.addError(String.format("%s: Missing '%s' field", position, field));
            }
        }
        JsonNode functionCode = item.get("functionCode");
        if (functionCode == null) {
            return;
        }
        PointKind kind = functionCode.canConvertToInt() ? FunctionCodeMap.kindOf(functionCode.asInt()) : null;
        if (kind == null) {
            result.addError(String.format("%s: Unsupported function code '%s' for tag '%s'",
                    position, functionCode.asText(), item.path("tag").asText()));
        } else if (section == GatewaySection.RPC && !kind.isWritable()) {
            result.addWarning(String.format("%s: Tag '%s' targets read-only type '%s', write capability will be ignored",
                    position, item.path("tag").asText(), kind.getValue()));
        }
    }

    private void requireFields(JsonNode node, List<String> fields, String prefix, String suffix, ValidationResult result) {
        for (String field : fields) {
            if (!node.has(field)) {
                result.addError(String.format("%sMissing required field '%s'%s", prefix, field, suffix));
            }
        }
    }
}
