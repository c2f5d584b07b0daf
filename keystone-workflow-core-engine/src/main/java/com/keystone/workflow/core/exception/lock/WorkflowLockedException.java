package com.keystone.workflow.core.exception.lock;

import com.keystone.workflow.core.exception.KeystoneWorkflowRuntimeException;
import com.keystone.workflow.core.exception.codes.KeystoneWorkflowErrorCodes;
import lombok.Getter;

@Getter
public class WorkflowLockedException extends KeystoneWorkflowRuntimeException {
    private final String instanceId;

    public WorkflowLockedException(String instanceId) {
        super(KeystoneWorkflowErrorCodes.WORKFLOW_LOCKED, instanceId);
        this.instanceId = instanceId;
    }
}
