package com.wangbin.modbusconfig.core.codec;

import com.wangbin.modbusconfig.common.enums.FunctionCode;
import com.wangbin.modbusconfig.common.enums.FunctionCode.Access;
import com.wangbin.modbusconfig.common.enums.PointKind;
import com.wangbin.modbusconfig.common.exception.ConfigProcessingException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 功能码与 {点位类别, 读写方向} 的双向映射
 *
 * 导出时每个 (类别, 方向) 只取一个功能码；解析时所有已知功能码都能反查类别。
 * 映射表在类加载时校验完整性，缺项直接抛出 IllegalStateException。
 */
public final class FunctionCodeMap {

    /** 导出使用的功能码 */
    private static final List<FunctionCode> EXPORT_CODES = List.of(
            FunctionCode.READ_COILS,
            FunctionCode.READ_DISCRETE_INPUTS,
            FunctionCode.READ_HOLDING_REGISTERS,
            FunctionCode.READ_INPUT_REGISTERS,
            FunctionCode.WRITE_SINGLE_COIL,
            FunctionCode.WRITE_SINGLE_REGISTER
    );

    private static final Map<PointKind, Map<Access, FunctionCode>> BY_KIND = build(EXPORT_CODES);

    private FunctionCodeMap() {
    }

    static Map<PointKind, Map<Access, FunctionCode>> build(List<FunctionCode> codes) {
        Map<PointKind, Map<Access, FunctionCode>> table = new EnumMap<>(PointKind.class);
        for (FunctionCode code : codes) {
            Map<Access, FunctionCode> byAccess = table.computeIfAbsent(code.getKind(), k -> new EnumMap<>(Access.class));
            if (byAccess.putIfAbsent(code.getAccess(), code) != null) {
                throw new IllegalStateException("功能码映射重复: " + code.getKind() + "/" + code.getAccess());
            }
        }
        verify(table);
        Map<PointKind, Map<Access, FunctionCode>> readOnly = new EnumMap<>(PointKind.class);
        table.forEach((kind, byAccess) -> readOnly.put(kind, Collections.unmodifiableMap(byAccess)));
        return Collections.unmodifiableMap(readOnly);
    }

    /**
     * 每个类别必须有读功能码；可写类别必须有写功能码，只读类别不得有
     */
    static void verify(Map<PointKind, Map<Access, FunctionCode>> table) {
        for (PointKind kind : PointKind.values()) {
            Map<Access, FunctionCode> byAccess = table.getOrDefault(kind, Map.of());
            if (!byAccess.containsKey(Access.READ)) {
                throw new IllegalStateException("点位类别缺少读功能码: " + kind);
            }
            boolean hasWrite = byAccess.containsKey(Access.WRITE);
            if (kind.isWritable() != hasWrite) {
                throw new IllegalStateException("点位类别写功能码配置与可写性不一致: " + kind);
            }
        }
    }

    /**
     * 读功能码，任何类别都存在
     */
    public static FunctionCode readCode(PointKind kind) {
        return BY_KIND.get(kind).get(Access.READ);
    }

    /**
     * 写功能码，只读类别返回 null
     */
    public static FunctionCode writeCode(PointKind kind) {
        return BY_KIND.get(kind).get(Access.WRITE);
    }

    /**
     * 功能码反查点位类别，未知功能码返回 null
     */
    public static PointKind kindOf(Integer code) {
        if (code == null) {
            return null;
        }
        FunctionCode functionCode = FunctionCode.fromCode(code);
        return functionCode != null ? functionCode.getKind() : null;
    }

    /**
     * 功能码反查点位类别，无法映射时抛出异常并指明标签
     */
    public static PointKind resolveKind(Integer code, String tag) {
        PointKind kind = kindOf(code);
        if (kind == null) {
            throw new ConfigProcessingException(tag,
                    String.format("Unsupported function code %s for tag '%s'", code, tag));
        }
        return kind;
    }
}
