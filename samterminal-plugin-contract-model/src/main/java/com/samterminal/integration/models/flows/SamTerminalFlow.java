package com.samterminal.integration.models.flows;

import com.samterminal.integration.enumerations.SamTerminalFlowNodeType;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Immutable flow graph. Executing a flow never changes it, so one instance may be executed
 * any number of times, concurrently as well.
 */
@Getter
@ToString(of = {"id", "name", "version"})
@EqualsAndHashCode
public class SamTerminalFlow {
    private final String id;
    private final String name;
    private final String description;
    private final String version;
    private final List<SamTerminalFlowNode> nodes;
    private final List<SamTerminalFlowEdge> edges;
    private final Instant createdAt;
    private final Instant updatedAt;

    @Builder(toBuilder = true)
    private SamTerminalFlow(
            String id,
            String name,
            String description,
            String version,
            List<SamTerminalFlowNode> nodes,
            List<SamTerminalFlowEdge> edges,
            Instant createdAt,
            Instant updatedAt) {

        this.id = id;
        this.name = name;
        this.description = description;
        this.version = version == null ? "1.0.0" : version;
        this.nodes = nodes == null ? List.of() : List.copyOf(nodes);
        this.edges = edges == null ? List.of() : List.copyOf(edges);
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    public Optional<SamTerminalFlowNode> findNode(String nodeId) {
        return nodes.stream().filter(node -> node.getId().equals(nodeId)).findFirst();
    }

    public List<SamTerminalFlowNode> findNodes(SamTerminalFlowNodeType type) {
        return nodes.stream().filter(node -> node.getType() == type).toList();
    }

    public List<SamTerminalFlowEdge> outgoingEdges(String nodeId) {
        return edges.stream().filter(edge -> nodeId.equals(edge.getSource())).toList();
    }

    public List<SamTerminalFlowEdge> incomingEdges(String nodeId) {
        return edges.stream().filter(edge -> nodeId.equals(edge.getTarget())).toList();
    }

    /**
     * Node lookup table keyed by id, first node wins on duplicate ids.
     */
    public Map<String, SamTerminalFlowNode> nodesById() {
        return nodes.stream().collect(Collectors.toMap(
                SamTerminalFlowNode::getId,
                Function.identity(),
                (first, second) -> first,
                LinkedHashMap::new));
    }
}
