package com.keystone.workflow.core.engine.flow.impl;

import com.keystone.workflow.core.engine.config.KeystoneWorkflowEngineConfig;
import com.keystone.workflow.core.engine.flow.IKeystoneFlowEngine;
import com.keystone.workflow.core.engine.flow.condition.KeystoneConditionEvaluator;
import com.keystone.workflow.core.exception.KeystoneWorkflowRuntimeException;
import com.keystone.workflow.core.exception.flow.HandlerFailureException;
import com.keystone.workflow.core.exception.flow.NodeNotFoundException;
import com.keystone.workflow.core.exception.flow.TraversalLimitExceededException;
import com.keystone.workflow.core.exception.instance.InvalidLifecycleException;
import com.keystone.workflow.core.utils.KeystoneIdGenerator;
import com.keystone.workflow.integration.constant.KeystoneWorkflowConstants;
import com.keystone.workflow.integration.contract.flow.IKeystoneFlowNodeHandler;
import com.keystone.workflow.integration.enumerations.KeystoneDefinitionKind;
import com.keystone.workflow.integration.enumerations.KeystoneFlowNodeType;
import com.keystone.workflow.integration.enumerations.KeystoneWorkflowStatus;
import com.keystone.workflow.integration.models.definition.flow.KeystoneFlowDefinition;
import com.keystone.workflow.integration.models.definition.flow.KeystoneFlowEdge;
import com.keystone.workflow.integration.models.definition.flow.KeystoneFlowNode;
import com.keystone.workflow.integration.models.flow.KeystoneFlowExecutionResult;
import com.keystone.workflow.integration.models.flow.KeystoneFlowNodeResult;
import com.keystone.workflow.integration.models.instance.KeystoneStateHistoryEntry;
import com.keystone.workflow.integration.models.instance.KeystoneWorkflowInstance;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Slf4j
public class KeystoneFlowEngine implements IKeystoneFlowEngine {

    private final KeystoneWorkflowEngineConfig config;
    private final KeystoneConditionEvaluator conditionEvaluator;
    private final Map<String, IKeystoneFlowNodeHandler> handlers = new ConcurrentHashMap<>();

    public KeystoneFlowEngine() {
        this(KeystoneWorkflowEngineConfig.defaultConfig());
    }

    public KeystoneFlowEngine(KeystoneWorkflowEngineConfig config) {
        this(config, new KeystoneConditionEvaluator());
    }

    public KeystoneFlowEngine(KeystoneWorkflowEngineConfig config, KeystoneConditionEvaluator conditionEvaluator) {
        config.validate();
        this.config = config;
        this.conditionEvaluator = conditionEvaluator;
        this.handlers.putAll(DefaultFlowNodeHandlers.all());
    }

    @Override
    public void registerHandler(String nodeType, IKeystoneFlowNodeHandler handler) {
        IKeystoneFlowNodeHandler previous = handlers.put(nodeType, handler);
        log.debug("Registered flow node handler: type={}, replaced={}", nodeType, previous != null);
    }

    @Override
    public KeystoneWorkflowInstance createInstance(KeystoneFlowDefinition flow, Map<String, Object> data, String startedBy) {
        String startNodeId = flow.findStartNode()
                .or(() -> flow.getNodes().stream().findFirst())
                .map(KeystoneFlowNode::getId)
                .orElse(null);

        KeystoneWorkflowInstance instance = KeystoneWorkflowInstance.builder()
                .id(KeystoneIdGenerator.next(config.getFlowInstanceIdPrefix(), config.getClock()))
                .workflowId(flow.getId() != null ? flow.getId() : flow.getName())
                .version(flow.getVersion() != null ? flow.getVersion() : KeystoneWorkflowConstants.DEFAULT_FLOW_VERSION)
                .definitionKind(KeystoneDefinitionKind.FLOW)
                .currentState(startNodeId)
                .status(KeystoneWorkflowStatus.PENDING)
                .data(data == null ? new LinkedHashMap<>() : new LinkedHashMap<>(data))
                .history(new ArrayList<>())
                .createdAt(now())
                .startedBy(startedBy)
                .build();
        log.debug("Created flow instance: id={}, flow={}, startNode={}", instance.getId(), instance.getWorkflowId(), startNodeId);
        return instance;
    }

    @Override
    public Mono<KeystoneFlowExecutionResult> execute(
            KeystoneFlowDefinition flow,
            KeystoneWorkflowInstance instance,
            Map<String, Object> initialVariables) {

        return Mono.defer(() -> {
            if (instance.isTerminal()) {
                return Mono.error(new InvalidLifecycleException("execute", instance.getId(), instance.getStatus()));
            }

            instance.setStatus(KeystoneWorkflowStatus.RUNNING);
            instance.setStartedAt(now());
            log.info("Executing flow instance: id={}, flow={}, fromNode={}",
                    instance.getId(), instance.getWorkflowId(), instance.getCurrentState());

            Traversal traversal = new Traversal(
                    flow,
                    instance,
                    new KeystoneFlowExecutionContext(flow, instance, initialVariables, log),
                    indexNodes(flow));

            // one slot per allowed node visit; the first emitted result ends the traversal
            return Flux.range(0, config.getMaxNodes())
                    .concatMap(ignored -> visitCurrentNode(traversal))
                    .next()
                    .switchIfEmpty(Mono.fromCallable(() -> fail(traversal,
                            new TraversalLimitExceededException(config.getMaxNodes()))));
        });
    }

    @Override
    public List<String> findMissingHandlers(KeystoneFlowDefinition flow) {
        return flow.getNodes().stream()
                .map(KeystoneFlowNode::getTypeName)
                .distinct()
                .filter(typeName -> !handlers.containsKey(typeName))
                .collect(Collectors.toList());
    }

    // ========================================================================
    // TRAVERSAL
    // ========================================================================

    /**
     * Visits the node under the cursor. Completes empty when the traversal moved on to another node.
     */
    private Mono<KeystoneFlowExecutionResult> visitCurrentNode(Traversal traversal) {
        return Mono.defer(() -> {
            String nodeId = traversal.instance.getCurrentState();
            if (nodeId == null || nodeId.isBlank()) {
                return Mono.just(complete(traversal));
            }
            KeystoneFlowNode node = traversal.nodeIndex.get(nodeId);
            if (node == null) {
                return Mono.just(fail(traversal, new NodeNotFoundException(nodeId)));
            }

            traversal.nodesVisited++;
            log.debug("Visiting flow node: instance={}, node={}, type={}", traversal.instance.getId(), nodeId, node.getTypeName());

            return invokeHandler(node, traversal.context)
                    .flatMap(result -> Mono.justOrEmpty(afterNode(traversal, node, result)))
                    .onErrorResume(throwable -> {
                        log.error("Flow node handler threw: instance={}, node={}, type={}",
                                traversal.instance.getId(), node.getId(), node.getTypeName(), throwable);
                        return Mono.just(fail(traversal,
                                new HandlerFailureException(node.getId(), node.getTypeName(), throwable)));
                    });
        });
    }

    private Mono<KeystoneFlowNodeResult> invokeHandler(KeystoneFlowNode node, KeystoneFlowExecutionContext context) {
        IKeystoneFlowNodeHandler handler = handlers.get(node.getTypeName());
        if (handler == null) {
            if (config.isHandlerRequired(node.getTypeName())) {
                return Mono.just(KeystoneFlowNodeResult.failure(
                        "No handler registered for node type \"" + node.getTypeName() + "\""));
            }
            log.warn("No handler registered for node type [{}], node [{}] passes through", node.getTypeName(), node.getId());
            return Mono.just(KeystoneFlowNodeResult.ok());
        }
        return Mono.defer(() -> handler.handle(node, context))
                .defaultIfEmpty(KeystoneFlowNodeResult.ok());
    }

    private Optional<KeystoneFlowExecutionResult> afterNode(Traversal traversal, KeystoneFlowNode node, KeystoneFlowNodeResult result) {
        if (!result.isSuccess()) {
            String reason = result.getError() != null ? result.getError() : "Node " + node.getId() + " failed";
            log.error("Flow node failed: instance={}, node={}, reason={}", traversal.instance.getId(), node.getId(), reason);
            return Optional.of(fail(traversal, new HandlerFailureException(node.getId(), node.getTypeName(), reason)));
        }

        traversal.context.mergeOutput(result.getOutput());

        if (node.isOfType(KeystoneFlowNodeType.END)) {
            traversal.instance.setCurrentState(node.getId());
            return Optional.of(complete(traversal));
        }

        String nextNodeId = resolveNextNode(traversal.flow, node, traversal.context.getVariables(), result.getNextEdge());
        if (nextNodeId == null) {
            log.debug("Flow node has no outgoing edge, completing: instance={}, node={}", traversal.instance.getId(), node.getId());
            return Optional.of(complete(traversal));
        }

        traversal.instance.appendHistory(KeystoneStateHistoryEntry.builder()
                .fromState(node.getId())
                .toState(nextNodeId)
                .transition(node.getTypeName() + KeystoneWorkflowConstants.FLOW_TRANSITION_SUFFIX)
                .timestamp(now())
                .triggeredBy(traversal.instance.getStartedBy())
                .build());
        traversal.instance.setCurrentState(nextNodeId);
        return Optional.empty();
    }

    /**
     * Picks the target of the next hop from the outgoing edges of {@code node}, or {@code null} at a dead end.
     */
    String resolveNextNode(KeystoneFlowDefinition flow, KeystoneFlowNode node, Map<String, Object> variables, String preferredEdge) {
        List<KeystoneFlowEdge> outgoing = flow.outgoingEdges(node.getId());
        if (outgoing.isEmpty()) {
            return null;
        }

        if (preferredEdge != null && !preferredEdge.isEmpty()) {
            Optional<KeystoneFlowEdge> preferred = outgoing.stream()
                    .filter(edge -> preferredEdge.equals(edge.getLabel()))
                    .findFirst();
            if (preferred.isPresent()) {
                return preferred.get().getTarget();
            }
        }

        if (node.isOfType(KeystoneFlowNodeType.DECISION)) {
            for (KeystoneFlowEdge edge : outgoing) {
                if (edge.hasCondition() && conditionEvaluator.evaluate(edge.getCondition(), variables)) {
                    return edge.getTarget();
                }
            }
        }

        return outgoing.stream()
                .filter(edge -> !edge.hasCondition())
                .findFirst()
                .orElse(outgoing.get(0))
                .getTarget();
    }

    // ========================================================================
    // OUTCOMES
    // ========================================================================

    private KeystoneFlowExecutionResult complete(Traversal traversal) {
        KeystoneWorkflowInstance instance = traversal.instance;
        instance.setStatus(KeystoneWorkflowStatus.COMPLETED);
        instance.setCompletedAt(now());
        log.info("Flow instance completed: id={}, node={}, nodesVisited={}",
                instance.getId(), instance.getCurrentState(), traversal.nodesVisited);
        return KeystoneFlowExecutionResult.builder()
                .success(true)
                .instance(instance)
                .variables(snapshot(traversal.context.getVariables()))
                .nodesVisited(traversal.nodesVisited)
                .build();
    }

    private KeystoneFlowExecutionResult fail(Traversal traversal, KeystoneWorkflowRuntimeException failure) {
        String error = failure instanceof HandlerFailureException handlerFailure
                ? handlerFailure.getReason()
                : failure.getMessage();

        KeystoneWorkflowInstance instance = traversal.instance;
        instance.setStatus(KeystoneWorkflowStatus.FAILED);
        instance.setFailedAt(now());
        instance.setError(error);
        if (failure instanceof TraversalLimitExceededException) {
            log.error("Flow instance exceeded the node limit: id={}, maxNodes={}", instance.getId(), config.getMaxNodes());
        } else {
            log.warn("Flow instance failed: id={}, node={}, error={}", instance.getId(), instance.getCurrentState(), error);
        }
        return KeystoneFlowExecutionResult.builder()
                .success(false)
                .instance(instance)
                .variables(snapshot(traversal.context.getVariables()))
                .error(error)
                .failure(failure)
                .nodesVisited(traversal.nodesVisited)
                .build();
    }

    private Map<String, KeystoneFlowNode> indexNodes(KeystoneFlowDefinition flow) {
        Map<String, KeystoneFlowNode> index = new LinkedHashMap<>();
        flow.getNodes().forEach(node -> index.put(node.getId(), node));
        return index;
    }

    private Map<String, Object> snapshot(Map<String, Object> variables) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    private Instant now() {
        return Instant.now(config.getClock());
    }

    /**
     * Mutable cursor of one {@code execute} call.
     */
    private static final class Traversal {
        private final KeystoneFlowDefinition flow;
        private final KeystoneWorkflowInstance instance;
        private final KeystoneFlowExecutionContext context;
        private final Map<String, KeystoneFlowNode> nodeIndex;
        private int nodesVisited;

        private Traversal(
                KeystoneFlowDefinition flow,
                KeystoneWorkflowInstance instance,
                KeystoneFlowExecutionContext context,
                Map<String, KeystoneFlowNode> nodeIndex) {

            this.flow = flow;
            this.instance = instance;
            this.context = context;
            this.nodeIndex = nodeIndex;
        }
    }
}
