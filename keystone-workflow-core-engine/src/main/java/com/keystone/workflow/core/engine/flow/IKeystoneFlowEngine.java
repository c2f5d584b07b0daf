package com.keystone.workflow.core.engine.flow;

import com.keystone.workflow.integration.contract.flow.IKeystoneFlowNodeHandler;
import com.keystone.workflow.integration.enumerations.KeystoneFlowNodeType;
import com.keystone.workflow.integration.models.definition.flow.KeystoneFlowDefinition;
import com.keystone.workflow.integration.models.flow.KeystoneFlowExecutionResult;
import com.keystone.workflow.integration.models.instance.KeystoneWorkflowInstance;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Runs flow graphs from the current node to an end node, a dead end or a failure in one call.
 *
 * <p>Handler failures, missing nodes and the traversal bound do not signal errors: they mark the
 * instance failed and are reported in the returned {@link KeystoneFlowExecutionResult}.
 */
public interface IKeystoneFlowEngine {

    /**
     * Registers or replaces the handler for a node type name, e.g. {@code "http_request"}.
     */
    void registerHandler(String nodeType, IKeystoneFlowNodeHandler handler);

    default void registerHandler(KeystoneFlowNodeType nodeType, IKeystoneFlowNodeHandler handler) {
        registerHandler(nodeType.getWireName(), handler);
    }

    /**
     * Creates a pending instance positioned on the start node, or on the first node when none is typed start.
     */
    KeystoneWorkflowInstance createInstance(KeystoneFlowDefinition flow, Map<String, Object> data, String startedBy);

    /**
     * Executes the instance. Signals {@code InvalidLifecycleException} for an instance that is already terminal.
     */
    Mono<KeystoneFlowExecutionResult> execute(
            KeystoneFlowDefinition flow,
            KeystoneWorkflowInstance instance,
            Map<String, Object> initialVariables);

    /**
     * Node type names used by the flow that would fall back to the pass-through behavior.
     */
    List<String> findMissingHandlers(KeystoneFlowDefinition flow);
}
