package com.keystone.workflow.integration.enumerations;

/**
 * Status of a human task. A task resolves exactly once.
 */
public enum KeystoneWorkflowTaskStatus {
    PENDING,
    COMPLETED,
    REJECTED;

    public boolean isResolved() {
        return this != PENDING;
    }
}
