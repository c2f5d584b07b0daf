package com.keystone.workflow.integration.models.flow;

import lombok.Data;

import java.util.Collections;
import java.util.Map;

/**
 * Outcome of a flow node handler. On success {@code output} is merged into the flow variables;
 * {@code nextEdge}, when present, selects the outgoing edge carrying that label.
 */
@Data
public class KeystoneFlowNodeResult {
    private final boolean success;
    private final Map<String, Object> output;
    private final String error;
    private final String nextEdge;

    private KeystoneFlowNodeResult(boolean success, Map<String, Object> output, String error, String nextEdge) {
        this.success = success;
        this.output = output == null ? Collections.emptyMap() : output;
        this.error = error;
        this.nextEdge = nextEdge;
    }

    public static KeystoneFlowNodeResult ok() {
        return new KeystoneFlowNodeResult(true, null, null, null);
    }

    public static KeystoneFlowNodeResult ok(Map<String, Object> output) {
        return new KeystoneFlowNodeResult(true, output, null, null);
    }

    public static KeystoneFlowNodeResult okWithEdge(String nextEdge) {
        return new KeystoneFlowNodeResult(true, null, null, nextEdge);
    }

    public static KeystoneFlowNodeResult ok(Map<String, Object> output, String nextEdge) {
        return new KeystoneFlowNodeResult(true, output, null, nextEdge);
    }

    public static KeystoneFlowNodeResult failure(String error) {
        return new KeystoneFlowNodeResult(false, null, error, null);
    }
}
