package com.lynx.anomaly.export;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Tree-ensemble-as-graph interchange document, laid out after an ONNX graph: a
 * {@code TreeEnsembleRegressor} that averages adjusted leaf path lengths, followed
 * by the arithmetic that turns the mean path length into a decision score.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TreeEnsembleGraph {

    @JsonProperty("producer_name")
    private String producerName;

    @JsonProperty("opset_import")
    private Map<String, Integer> opsetImport;

    @JsonProperty("inputs")
    private List<ValueInfo> inputs;

    @JsonProperty("outputs")
    private List<ValueInfo> outputs;

    @JsonProperty("initializers")
    private Map<String, Double> initializers;

    @JsonProperty("nodes")
    private List<GraphNode> nodes;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ValueInfo {
        private String name;
        private String elemType;
        private List<Integer> shape;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GraphNode {
        private String name;
        private String opType;
        private String domain;
        private List<String> inputs;
        private List<String> outputs;
        private Map<String, Object> attributes;
    }
}
