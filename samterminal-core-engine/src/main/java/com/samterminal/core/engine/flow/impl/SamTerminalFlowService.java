package com.samterminal.core.engine.flow.impl;

import com.samterminal.core.engine.flow.ISamTerminalFlowExecutor;
import com.samterminal.core.engine.flow.ISamTerminalFlowService;
import com.samterminal.core.engine.flow.ISamTerminalFlowValidator;
import com.samterminal.core.exception.flow.SamTerminalFlowNotFound;
import com.samterminal.core.models.SamTerminalFlowExecution;
import com.samterminal.core.models.SamTerminalFlowValidationResult;
import com.samterminal.integration.contract.ISamTerminalObjectMapper;
import com.samterminal.integration.models.flows.SamTerminalFlow;
import com.samterminal.integration.models.flows.SamTerminalFlowNode;
import com.samterminal.integration.models.flows.data.SamTerminalTriggerNodeData;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
public class SamTerminalFlowService implements ISamTerminalFlowService {

    private static final String TRIGGER_NODE_ID = "trigger";
    private static final String CLONE_SUFFIX = " (copy)";

    private final ISamTerminalFlowExecutor flowExecutor;
    private final ISamTerminalFlowValidator flowValidator;
    private final SamTerminalFlowCodec flowCodec;
    private final Map<String, SamTerminalFlow> flows = new ConcurrentHashMap<>();

    public SamTerminalFlowService(
            ISamTerminalFlowExecutor flowExecutor,
            ISamTerminalFlowValidator flowValidator,
            ISamTerminalObjectMapper objectMapper) {

        this.flowExecutor = flowExecutor;
        this.flowValidator = flowValidator;
        this.flowCodec = new SamTerminalFlowCodec(objectMapper);
    }

    @Override
    public SamTerminalFlow create(SamTerminalFlow flow) {
        Instant now = Instant.now();
        SamTerminalFlow created = flow.toBuilder()
                .id(flow.getId() == null ? UUID.randomUUID().toString() : flow.getId())
                .createdAt(now)
                .updatedAt(now)
                .build();
        flows.put(created.getId(), created);
        log.info("Created flow: [{}], name: [{}]", created.getId(), created.getName());
        return created;
    }

    @Override
    public SamTerminalFlow createEmpty(String name) {
        SamTerminalFlowNode trigger = SamTerminalFlowNode.of(TRIGGER_NODE_ID, "Trigger", SamTerminalTriggerNodeData.builder().build());
        return create(SamTerminalFlow.builder()
                .name(name)
                .nodes(List.of(trigger))
                .build());
    }

    @Override
    public SamTerminalFlow get(String flowId) {
        return find(flowId).orElseThrow(() -> new SamTerminalFlowNotFound(flowId));
    }

    @Override
    public Optional<SamTerminalFlow> find(String flowId) {
        return Optional.ofNullable(flowId).map(flows::get);
    }

    @Override
    public List<SamTerminalFlow> getAll() {
        return flows.values().stream()
                .sorted(Comparator.comparing(SamTerminalFlow::getCreatedAt).thenComparing(SamTerminalFlow::getId))
                .toList();
    }

    @Override
    public List<SamTerminalFlow> search(String query) {
        String needle = query == null ? "" : query.toLowerCase(Locale.ROOT);
        return getAll().stream()
                .filter(flow -> contains(flow.getName(), needle) || contains(flow.getDescription(), needle))
                .toList();
    }

    private static boolean contains(String haystack, String needle) {
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needle);
    }

    @Override
    public SamTerminalFlow update(SamTerminalFlow flow) {
        SamTerminalFlow existing = get(flow.getId());
        SamTerminalFlow updated = flow.toBuilder()
                .createdAt(existing.getCreatedAt())
                .updatedAt(Instant.now())
                .build();
        flows.put(updated.getId(), updated);
        log.info("Updated flow: [{}]", updated.getId());
        return updated;
    }

    @Override
    public boolean delete(String flowId) {
        boolean deleted = flowId != null && flows.remove(flowId) != null;
        if (deleted) {
            log.info("Deleted flow: [{}]", flowId);
        }
        return deleted;
    }

    @Override
    public SamTerminalFlow clone(String flowId) {
        SamTerminalFlow source = get(flowId);
        return create(source.toBuilder()
                .id(null)
                .name(source.getName() + CLONE_SUFFIX)
                .build());
    }

    @Override
    public String exportJson(String flowId) {
        return flowCodec.toJson(get(flowId));
    }

    /**
     * Stores the decoded flow. A flow without id gets a new one, an id already present is
     * replaced.
     */
    @Override
    public SamTerminalFlow importJson(String json) {
        SamTerminalFlow imported = create(flowCodec.fromJson(json));
        log.info("Imported flow: [{}], nodes: [{}], edges: [{}]", imported.getId(), imported.getNodes().size(), imported.getEdges().size());
        return imported;
    }

    @Override
    public SamTerminalFlowValidationResult validate(String flowId) {
        return flowValidator.validate(get(flowId));
    }

    @Override
    public Mono<SamTerminalFlowExecution> execute(String flowId, Map<String, Object> variables) {
        return Mono.fromCallable(() -> get(flowId))
                .flatMap(flow -> flowExecutor.execute(flow, variables));
    }

    @Override
    public Optional<SamTerminalFlowExecution> getExecution(String executionId) {
        return flowExecutor.getExecution(executionId);
    }
}
