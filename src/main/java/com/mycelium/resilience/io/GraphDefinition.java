package com.mycelium.resilience.io;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.mycelium.resilience.engine.EngineConfig;

import lombok.Data;

/**
 * POJO representation of a network topology.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GraphDefinition {
    private GraphInfo graph;

    /** Meta-information, engine configuration and elements of the network. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class GraphInfo {
        private String name;
        private EngineConfig config;
        private List<NodeDef> nodes;
        private List<EdgeDef> edges;
    }

    /** Definition of a single node. Missing fields take the defaults below. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class NodeDef {
        private String id;
        private double resources = 100.0;
        private double capacity = 1000.0;
        private String role;
    }

    /** Definition of a single edge. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class EdgeDef {
        private String from, to;
        private double cost = 1.0;
        private double capacity = 10.0;
    }
}
