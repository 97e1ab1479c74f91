package com.wangbin.modbusconfig.core.codec.document;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.wangbin.modbusconfig.common.enums.ConfigDialect;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * gateway 方言：{master: {slaves: [...]}}
 * 每个 slave 对应控制器下一个单元ID，点位按 attributes / timeseries / rpc 三个区段分布
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GatewayConfigDocument implements ConfigDocument {

    private Master master = new Master();

    @JsonProperty("export_time")
    private String exportTime;

    private String format = ConfigDialect.GATEWAY.getValue();

    @Override
    public ConfigDialect dialect() {
        return ConfigDialect.GATEWAY;
    }

    public List<Slave> slaves() {
        return master != null && master.getSlaves() != null ? master.getSlaves() : List.of();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Master {
        private List<Slave> slaves = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Slave {
        private String method = "socket";
        private String type = "tcp";
        private String host;
        private Integer port;
        private Integer timeout;
        private Integer retries;
        private Integer pollPeriod;
        private Integer unitId;
        private String deviceName;
        private String deviceType;
        private List<PointEntry> attributes = new ArrayList<>();
        private List<PointEntry> timeseries = new ArrayList<>();
        private List<PointEntry> rpc = new ArrayList<>();

        public List<PointEntry> entries(GatewaySection section) {
            List<PointEntry> entries = switch (section) {
                case ATTRIBUTES -> attributes;
                case TIMESERIES -> timeseries;
                case RPC -> rpc;
            };
            return entries != null ? entries : List.of();
        }
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PointEntry {
        private String tag;
        private String type;
        private Integer functionCode;
        private Integer address;
        private Integer objectsCount;
    }
}
