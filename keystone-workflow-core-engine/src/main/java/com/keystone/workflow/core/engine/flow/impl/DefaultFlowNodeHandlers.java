package com.keystone.workflow.core.engine.flow.impl;

import com.keystone.workflow.integration.contract.flow.IKeystoneFlowNodeHandler;
import com.keystone.workflow.integration.enumerations.KeystoneFlowNodeType;
import com.keystone.workflow.integration.models.flow.KeystoneFlowNodeResult;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Handlers installed on every flow engine before user registrations.
 * <p>
 * The script handler does not run code. Deployments that execute scripts register their
 * own handler for {@code script} that delegates to a sandboxed executor.
 */
public final class DefaultFlowNodeHandlers {

    static final String SCRIPT_CONFIG_KEY = "script";

    private DefaultFlowNodeHandlers() {
    }

    public static Map<String, IKeystoneFlowNodeHandler> all() {
        Map<String, IKeystoneFlowNodeHandler> handlers = new LinkedHashMap<>();
        handlers.put(KeystoneFlowNodeType.START.getWireName(), noOp());
        handlers.put(KeystoneFlowNodeType.END.getWireName(), noOp());
        handlers.put(KeystoneFlowNodeType.DECISION.getWireName(), noOp());
        handlers.put(KeystoneFlowNodeType.WAIT.getWireName(), noOp());
        handlers.put(KeystoneFlowNodeType.ASSIGNMENT.getWireName(), assignment());
        handlers.put(KeystoneFlowNodeType.SCRIPT.getWireName(), script());
        return handlers;
    }

    /**
     * Passes through. Decision routing happens on the outgoing edges.
     */
    public static IKeystoneFlowNodeHandler noOp() {
        return (node, context) -> Mono.just(KeystoneFlowNodeResult.ok());
    }

    /**
     * Copies every entry of the node config into the flow variables.
     */
    public static IKeystoneFlowNodeHandler assignment() {
        return (node, context) -> Mono.fromCallable(() -> {
            node.getConfig().forEach(context::setVariable);
            return KeystoneFlowNodeResult.ok();
        });
    }

    public static IKeystoneFlowNodeHandler script() {
        return (node, context) -> Mono.fromCallable(() -> {
            Object script = node.getConfig().get(SCRIPT_CONFIG_KEY);
            if (script != null) {
                context.getLogger().warn("Default script handler used for node [{}], script not executed. "
                        + "Register a sandboxed handler for production", node.getId());
            }
            return KeystoneFlowNodeResult.ok();
        });
    }
}
