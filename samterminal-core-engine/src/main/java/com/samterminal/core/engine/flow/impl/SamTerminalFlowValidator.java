package com.samterminal.core.engine.flow.impl;

import com.samterminal.core.engine.flow.ISamTerminalFlowValidator;
import com.samterminal.core.models.SamTerminalFlowValidationResult;
import com.samterminal.core.util.CommonUtil;
import com.samterminal.integration.enumerations.SamTerminalFlowNodeType;
import com.samterminal.integration.models.flows.SamTerminalFlow;
import com.samterminal.integration.models.flows.SamTerminalFlowEdge;
import com.samterminal.integration.models.flows.SamTerminalFlowNode;
import com.samterminal.integration.models.flows.data.SamTerminalFlowNodeData;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
public class SamTerminalFlowValidator implements ISamTerminalFlowValidator {

    @Override
    public SamTerminalFlowValidationResult validate(SamTerminalFlow flow) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (CommonUtil.isNullOrBlank(flow.getName())) {
            errors.add("flow name is required");
        }
        if (flow.getNodes().isEmpty()) {
            errors.add("flow has no nodes");
        }

        Set<String> nodeIds = new LinkedHashSet<>();
        for (SamTerminalFlowNode node : flow.getNodes()) {
            validateNode(node, nodeIds, errors);
        }

        List<SamTerminalFlowNode> triggers = flow.findNodes(SamTerminalFlowNodeType.TRIGGER);
        if (triggers.size() != 1) {
            errors.add("flow must have exactly one trigger node, found " + triggers.size());
        }
        for (SamTerminalFlowNode trigger : triggers) {
            if (!flow.incomingEdges(trigger.getId()).isEmpty()) {
                errors.add("trigger node " + trigger.getId() + " must not have incoming edges");
            }
        }

        for (SamTerminalFlowEdge edge : flow.getEdges()) {
            if (!nodeIds.contains(edge.getSource())) {
                errors.add("edge " + edge.getId() + " has unknown source " + edge.getSource());
            }
            if (!nodeIds.contains(edge.getTarget())) {
                errors.add("edge " + edge.getId() + " has unknown target " + edge.getTarget());
            }
            if (edge.getSource() != null && edge.getSource().equals(edge.getTarget())) {
                warnings.add("edge " + edge.getId() + " loops on node " + edge.getSource());
            }
        }

        Map<String, List<String>> adjacency = adjacencyOf(flow, nodeIds);
        findCycles(adjacency).forEach(cycle -> warnings.add("cycle: " + String.join(" -> ", cycle)));
        if (triggers.size() == 1) {
            Set<String> reachable = reachableFrom(triggers.get(0).getId(), adjacency);
            flow.getNodes().stream()
                    .map(SamTerminalFlowNode::getId)
                    .filter(id -> id != null && !reachable.contains(id))
                    .distinct()
                    .forEach(id -> warnings.add("node " + id + " is unreachable from the trigger"));
        }

        SamTerminalFlowValidationResult result = new SamTerminalFlowValidationResult(errors, warnings);
        if (!result.isValid()) {
            log.debug("Invalid flow: [{}], Errors: {}", flow.getId(), errors);
        }
        return result;
    }

    private void validateNode(SamTerminalFlowNode node, Set<String> nodeIds, List<String> errors) {
        if (CommonUtil.isNullOrBlank(node.getId())) {
            errors.add("node without id");
            return;
        }
        if (!nodeIds.add(node.getId())) {
            errors.add("duplicate node id " + node.getId());
        }
        if (node.getType() == null) {
            errors.add("node " + node.getId() + " has no type");
        } else if (node.getData() == null) {
            errors.add("node " + node.getId() + " has no data");
        } else if (!SamTerminalFlowNodeData.dataTypeOf(node.getType()).isInstance(node.getData())) {
            errors.add("node " + node.getId() + " data does not match type " + node.getType().getValue());
        }
    }

    private @NotNull Map<String, List<String>> adjacencyOf(SamTerminalFlow flow, Set<String> nodeIds) {
        Map<String, List<String>> adjacency = new LinkedHashMap<>();
        nodeIds.forEach(id -> adjacency.put(id, new ArrayList<>()));
        for (SamTerminalFlowEdge edge : flow.getEdges()) {
            if (nodeIds.contains(edge.getSource()) && nodeIds.contains(edge.getTarget())) {
                adjacency.get(edge.getSource()).add(edge.getTarget());
            }
        }
        return adjacency;
    }

    private Set<String> reachableFrom(String start, Map<String, List<String>> adjacency) {
        Set<String> reachable = new HashSet<>();
        Deque<String> pending = new ArrayDeque<>();
        pending.push(start);
        while (!pending.isEmpty()) {
            String current = pending.pop();
            if (reachable.add(current)) {
                adjacency.getOrDefault(current, List.of()).forEach(pending::push);
            }
        }
        return reachable;
    }

    // self loops are reported on their own
    private List<List<String>> findCycles(Map<String, List<String>> adjacency) {
        List<List<String>> cycles = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        for (String id : adjacency.keySet()) {
            findCycles(id, adjacency, visited, new LinkedHashSet<>(), cycles);
        }
        return cycles;
    }

    private void findCycles(
            String id,
            Map<String, List<String>> adjacency,
            Set<String> visited,
            LinkedHashSet<String> path,
            List<List<String>> cycles) {

        if (path.contains(id)) {
            List<String> cycle = new ArrayList<>();
            boolean inCycle = false;
            for (String onPath : path) {
                inCycle = inCycle || onPath.equals(id);
                if (inCycle) {
                    cycle.add(onPath);
                }
            }
            if (cycle.size() > 1) {
                cycle.add(id);
                cycles.add(cycle);
            }
            return;
        }
        if (!visited.add(id)) {
            return;
        }

        path.add(id);
        for (String next : adjacency.getOrDefault(id, List.of())) {
            findCycles(next, adjacency, visited, path, cycles);
        }
        path.remove(id);
    }
}
