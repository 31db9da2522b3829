package com.samterminal.core.engine.flow.impl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.samterminal.core.exception.flow.SamTerminalFlowImportFailed;
import com.samterminal.integration.contract.ISamTerminalObjectMapper;
import com.samterminal.integration.enumerations.SamTerminalFlowEdgeType;
import com.samterminal.integration.enumerations.SamTerminalFlowNodeType;
import com.samterminal.integration.models.conditions.SamTerminalCondition;
import com.samterminal.integration.models.conditions.SamTerminalSingleCondition;
import com.samterminal.integration.models.flows.SamTerminalFlow;
import com.samterminal.integration.models.flows.SamTerminalFlowEdge;
import com.samterminal.integration.models.flows.SamTerminalFlowNode;
import com.samterminal.integration.models.flows.data.SamTerminalFlowNodeData;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Flow interchange JSON, {@code {id, name, nodes: [{id, type, name, data}], edges: [...]}}.
 * Node {@code data} is decoded into the variant selected by the node {@code type}.
 */
class SamTerminalFlowCodec {

    private final ISamTerminalObjectMapper objectMapper;

    SamTerminalFlowCodec(ISamTerminalObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    String toJson(SamTerminalFlow flow) {
        FlowJson json = new FlowJson();
        json.setId(flow.getId());
        json.setName(flow.getName());
        json.setDescription(flow.getDescription());
        json.setVersion(flow.getVersion());
        json.setCreatedAt(flow.getCreatedAt());
        json.setUpdatedAt(flow.getUpdatedAt());
        json.setNodes(flow.getNodes().stream().map(this::toJson).toList());
        json.setEdges(flow.getEdges().stream().map(this::toJson).toList());
        return objectMapper.writeValueAsString(json);
    }

    @SuppressWarnings("unchecked")
    private NodeJson toJson(SamTerminalFlowNode node) {
        NodeJson json = new NodeJson();
        json.setId(node.getId());
        json.setType(node.getType());
        json.setName(node.getName());
        json.setDescription(node.getDescription());
        json.setData(node.getData() == null ? null : objectMapper.convertValue(node.getData(), Map.class));
        return json;
    }

    private EdgeJson toJson(SamTerminalFlowEdge edge) {
        EdgeJson json = new EdgeJson();
        json.setId(edge.getId());
        json.setSource(edge.getSource());
        json.setTarget(edge.getTarget());
        json.setSourceHandle(edge.getSourceHandle());
        json.setTargetHandle(edge.getTargetHandle());
        json.setType(edge.getType());
        json.setLabel(edge.getLabel());
        json.setCondition(edge.getCondition());
        return json;
    }

    SamTerminalFlow fromJson(String content) {
        FlowJson json;
        try {
            json = objectMapper.readValue(content, FlowJson.class);
        } catch (IllegalArgumentException e) {
            throw new SamTerminalFlowImportFailed("Flow JSON could not be parsed: " + e.getMessage(), e);
        }
        if (json == null) {
            throw new SamTerminalFlowImportFailed("Flow JSON is empty");
        }

        List<SamTerminalFlowNode> nodes = new ArrayList<>();
        for (NodeJson node : listOrEmpty(json.getNodes())) {
            nodes.add(fromJson(node));
        }
        List<SamTerminalFlowEdge> edges = new ArrayList<>();
        for (EdgeJson edge : listOrEmpty(json.getEdges())) {
            edges.add(fromJson(edge));
        }

        return SamTerminalFlow.builder()
                .id(json.getId())
                .name(json.getName())
                .description(json.getDescription())
                .version(json.getVersion())
                .nodes(nodes)
                .edges(edges)
                .createdAt(json.getCreatedAt())
                .updatedAt(json.getUpdatedAt())
                .build();
    }

    private SamTerminalFlowNode fromJson(NodeJson json) {
        if (json.getType() == null) {
            throw new SamTerminalFlowImportFailed("Node has no type: " + json.getId());
        }

        SamTerminalFlowNodeData data;
        try {
            Object raw = json.getData() == null ? Map.of() : json.getData();
            data = objectMapper.convertValue(raw, SamTerminalFlowNodeData.dataTypeOf(json.getType()));
        } catch (IllegalArgumentException e) {
            throw new SamTerminalFlowImportFailed("Node data invalid: " + json.getId() + ", " + e.getMessage(), e);
        }

        return SamTerminalFlowNode.builder()
                .id(json.getId())
                .type(json.getType())
                .name(json.getName())
                .description(json.getDescription())
                .data(data)
                .build();
    }

    private SamTerminalFlowEdge fromJson(EdgeJson json) {
        SamTerminalSingleCondition condition = null;
        if (json.getCondition() instanceof SamTerminalSingleCondition single) {
            condition = single;
        } else if (json.getCondition() != null) {
            throw new SamTerminalFlowImportFailed("Edge condition must be a single condition: " + json.getId());
        }

        return SamTerminalFlowEdge.builder()
                .id(json.getId())
                .source(json.getSource())
                .target(json.getTarget())
                .sourceHandle(json.getSourceHandle())
                .targetHandle(json.getTargetHandle())
                .type(json.getType() == null ? SamTerminalFlowEdgeType.DEFAULT : json.getType())
                .label(json.getLabel())
                .condition(condition)
                .build();
    }

    private static <T> List<T> listOrEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class FlowJson {
        private String id;
        private String name;
        private String description;
        private String version;
        private List<NodeJson> nodes;
        private List<EdgeJson> edges;
        private Instant createdAt;
        private Instant updatedAt;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class NodeJson {
        private String id;
        private SamTerminalFlowNodeType type;
        private String name;
        private String description;
        private Map<String, Object> data;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class EdgeJson {
        private String id;
        private String source;
        private String target;
        private String sourceHandle;
        private String targetHandle;
        private SamTerminalFlowEdgeType type;
        private String label;
        private SamTerminalCondition condition;
    }
}
