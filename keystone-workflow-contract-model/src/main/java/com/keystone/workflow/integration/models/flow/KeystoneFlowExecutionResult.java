package com.keystone.workflow.integration.models.flow;

import com.keystone.workflow.integration.models.instance.KeystoneWorkflowInstance;
import lombok.Builder;
import lombok.Data;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * Result of running a flow instance to completion or failure.
 */
@Data
@Builder
public class KeystoneFlowExecutionResult {
    private final boolean success;
    private final KeystoneWorkflowInstance instance;

    @Builder.Default
    private final Map<String, Object> variables = Collections.emptyMap();

    private final String error;

    /**
     * Exception describing the fault when {@code success} is false.
     */
    private final RuntimeException failure;

    private final int nodesVisited;

    public Optional<RuntimeException> getFailureIfAny() {
        return Optional.ofNullable(failure);
    }
}
