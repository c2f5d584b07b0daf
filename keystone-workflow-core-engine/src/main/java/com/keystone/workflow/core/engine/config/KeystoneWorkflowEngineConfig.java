package com.keystone.workflow.core.engine.config;

import com.keystone.workflow.integration.constant.KeystoneWorkflowConstants;
import com.keystone.workflow.integration.enumerations.KeystoneFlowNodeType;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.time.Clock;
import java.time.Duration;
import java.util.Set;

/**
 * Tunable parameters of the workflow engines and services.
 *
 * Uses the Builder pattern; unset values fall back to the defaults below.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public final class KeystoneWorkflowEngineConfig {

    // Flow traversal
    @Builder.Default
    private final int maxNodes = KeystoneWorkflowConstants.DEFAULT_MAX_NODES;

    /**
     * Node type names that must have a registered handler. A flow reaching such a node
     * without a handler fails instead of passing through as a no-op.
     */
    @Singular
    private final Set<String> requiredHandlerTypes;

    // Id generation
    @Builder.Default
    private final String stateMachineInstanceIdPrefix = KeystoneWorkflowConstants.STATE_MACHINE_INSTANCE_ID_PREFIX;

    @Builder.Default
    private final String flowInstanceIdPrefix = KeystoneWorkflowConstants.FLOW_INSTANCE_ID_PREFIX;

    @Builder.Default
    private final String taskIdPrefix = KeystoneWorkflowConstants.TASK_ID_PREFIX;

    // Instance locking
    @Builder.Default
    private final Duration lockDuration = Duration.ofMinutes(5);

    @Builder.Default
    private final Duration lockWaitTimeout = Duration.ofSeconds(5);

    /**
     * Reject definitions at registration when they reference guards or actions that are not registered.
     * When false the runtime only logs them.
     */
    @Builder.Default
    private final boolean rejectUnresolvedHooks = false;

    @Builder.Default
    private final Clock clock = Clock.systemUTC();

    /**
     * Creates the default configuration.
     */
    public static KeystoneWorkflowEngineConfig defaultConfig() {
        return KeystoneWorkflowEngineConfig.builder().build();
    }

    /**
     * Creates a configuration that rejects unresolved hooks and requires handlers for
     * every built-in node type the engine cannot execute on its own.
     */
    public static KeystoneWorkflowEngineConfig strict() {
        return KeystoneWorkflowEngineConfig.builder()
                .rejectUnresolvedHooks(true)
                .requiredHandlerType(KeystoneFlowNodeType.LOOP.getWireName())
                .requiredHandlerType(KeystoneFlowNodeType.CREATE_RECORD.getWireName())
                .requiredHandlerType(KeystoneFlowNodeType.UPDATE_RECORD.getWireName())
                .requiredHandlerType(KeystoneFlowNodeType.DELETE_RECORD.getWireName())
                .requiredHandlerType(KeystoneFlowNodeType.GET_RECORD.getWireName())
                .requiredHandlerType(KeystoneFlowNodeType.HTTP_REQUEST.getWireName())
                .requiredHandlerType(KeystoneFlowNodeType.SUBFLOW.getWireName())
                .requiredHandlerType(KeystoneFlowNodeType.CONNECTOR_ACTION.getWireName())
                .build();
    }

    /**
     * Validates the configuration.
     *
     * @throws IllegalStateException if configuration is invalid
     */
    public void validate() {
        if (maxNodes <= 0) {
            throw new IllegalStateException("maxNodes must be positive");
        }
        if (taskIdPrefix == null || stateMachineInstanceIdPrefix == null || flowInstanceIdPrefix == null) {
            throw new IllegalStateException("id prefixes must not be null");
        }
        if (lockDuration.isNegative() || lockDuration.isZero()) {
            throw new IllegalStateException("lockDuration must be positive");
        }
        if (lockWaitTimeout.isNegative()) {
            throw new IllegalStateException("lockWaitTimeout must not be negative");
        }
    }

    public boolean isHandlerRequired(String nodeTypeName) {
        return requiredHandlerTypes.contains(nodeTypeName);
    }
}
