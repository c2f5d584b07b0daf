package com.keystone.workflow.integration.enumerations;

/**
 * Lifecycle status of a workflow instance.
 * Instances only move forward: PENDING, then RUNNING, then one of the terminal states.
 */
public enum KeystoneWorkflowStatus {

    /**
     * Instance has been created but not yet started.
     */
    PENDING,

    /**
     * Instance is executing and accepts transitions.
     */
    RUNNING,

    /**
     * Instance reached a final state or an end node.
     */
    COMPLETED,

    /**
     * Instance was aborted by an external request.
     */
    ABORTED,

    /**
     * Instance failed because of a handler error or the traversal bound.
     */
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ABORTED || this == FAILED;
    }
}
