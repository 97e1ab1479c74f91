package com.wangbin.modbusconfig.core.codec;

import com.wangbin.modbusconfig.common.enums.FunctionCode.Access;
import com.wangbin.modbusconfig.common.enums.PointEncoding;
import com.wangbin.modbusconfig.common.enums.PointKind;
import com.wangbin.modbusconfig.core.codec.document.GatewayConfigDocument;
import com.wangbin.modbusconfig.core.codec.document.GatewaySection;
import com.wangbin.modbusconfig.core.codec.model.PointDefinition;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * gateway 方言点位合并器
 *
 * 同一 (类别, 地址, 单元ID) 可能同时出现在 attributes / timeseries / rpc 多个区段，
 * 这里按键累积读写能力与名称，最后一次性生成点位定义，保持首次出现的顺序。
 */
@Slf4j
public class GatewayPointMerger {

    private final int unitId;
    private final String rpcTagPrefix;
    private final int defaultLength;
    private final String defaultPointName;

    private final Map<MergeKey, Accumulator> accumulators = new LinkedHashMap<>();
    private final List<String> warnings = new ArrayList<>();

    public GatewayPointMerger(int unitId, String rpcTagPrefix, int defaultLength, String defaultPointName) {
        this.unitId = unitId;
        this.rpcTagPrefix = rpcTagPrefix;
        this.defaultLength = defaultLength;
        this.defaultPointName = defaultPointName;
    }

    /**
     * 按区段顺序累积一个点位条目
     */
    public void accept(GatewaySection section, GatewayConfigDocument.PointEntry entry) {
        String tag = entry.getTag() != null ? entry.getTag() : defaultPointName;
        PointKind kind = FunctionCodeMap.resolveKind(entry.getFunctionCode(), tag);
        int address = entry.getAddress() != null ? entry.getAddress() : 0;
        MergeKey key = new MergeKey(kind, address, unitId);

        Accumulator accumulator = accumulators.get(key);
        if (section.getAccess() == Access.READ) {
            if (accumulator == null) {
                accumulators.put(key, newAccumulator(section, entry, tag));
            } else {
                log.debug("点位 {} 在区段 {} 中重复出现，合并到 {}", tag, section.getKey(), accumulator.name);
            }
            return;
        }

        boolean marked = tag.startsWith(rpcTagPrefix) && tag.length() > rpcTagPrefix.length();
        String writeName = marked ? tag.substring(rpcTagPrefix.length()) : tag;
        if (accumulator == null) {
            Accumulator created = newAccumulator(section, entry, writeName);
            created.writable = true;
            accumulators.put(key, created);
            return;
        }
        accumulator.writable = true;
        if (marked && !writeName.equals(accumulator.name)) {
            log.debug("写入标签 {} 与读取标签 {} 不一致，使用写入标签名称", tag, accumulator.name);
            accumulator.name = writeName;
        }
    }

    /**
     * 生成最终点位定义；只读类别上的写能力被丢弃并记录提示
     */
    public List<PointDefinition> build() {
        List<PointDefinition> definitions = new ArrayList<>(accumulators.size());
        Map<String, MergeKey> seenNames = new HashMap<>();
        for (Map.Entry<MergeKey, Accumulator> entry : accumulators.entrySet()) {
            MergeKey key = entry.getKey();
            Accumulator accumulator = entry.getValue();
            if (accumulator.writable && !key.kind().isWritable()) {
                String warning = String.format("Point %s (type: %s) cannot be written, ignoring write capability",
                        accumulator.name, key.kind().getValue());
                log.warn("点位 {} 类别为 {}，不支持写入，忽略写能力", accumulator.name, key.kind().getValue());
                warnings.add(warning);
                accumulator.writable = false;
            }
            MergeKey previous = seenNames.putIfAbsent(accumulator.name, key);
            if (previous != null) {
                warnings.add(String.format("Tag '%s' is used by more than one point (%s:%d and %s:%d)",
                        accumulator.name, previous.kind().getValue(), previous.address(),
                        key.kind().getValue(), key.address()));
            }
            definitions.add(accumulator.toDefinition(key));
        }
        return definitions;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    private Accumulator newAccumulator(GatewaySection section, GatewayConfigDocument.PointEntry entry, String name) {
        Accumulator accumulator = new Accumulator();
        accumulator.name = name;
        accumulator.encoding = resolveEncoding(section, entry, name);
        accumulator.length = entry.getObjectsCount() != null ? entry.getObjectsCount() : defaultLength;
        return accumulator;
    }

    private PointEncoding resolveEncoding(GatewaySection section, GatewayConfigDocument.PointEntry entry, String name) {
        PointEncoding fallback = section == GatewaySection.ATTRIBUTES ? PointEncoding.BOOL : PointEncoding.UINT16;
        if (entry.getType() == null) {
            return fallback;
        }
        PointEncoding encoding = PointEncoding.fromGatewayLabel(entry.getType());
        if (encoding == null) {
            warnings.add(String.format("Point %s: unknown type '%s', using '%s'",
                    name, entry.getType(), fallback.getValue()));
            return fallback;
        }
        return encoding;
    }

    private record MergeKey(PointKind kind, int address, int unitId) {
    }

    private static final class Accumulator {
        private String name;
        private PointEncoding encoding;
        private int length;
        /** 出现在 rpc 区段，仅用于识别只读类别上的写入条目 */
        private boolean writable;

        private PointDefinition toDefinition(MergeKey key) {
            PointDefinition definition = new PointDefinition();
            definition.setName(name);
            definition.setType(key.kind().getValue());
            definition.setDataType(encoding.getValue());
            definition.setAddress(key.address());
            definition.setLen(length);
            definition.setUnitId(key.unitId());
            return definition;
        }
    }
}
