package com.keystone.workflow.core.exception.instance;

import com.keystone.workflow.core.exception.KeystoneWorkflowRuntimeException;
import com.keystone.workflow.core.exception.codes.KeystoneWorkflowErrorCodes;
import com.keystone.workflow.integration.enumerations.KeystoneWorkflowStatus;
import lombok.Getter;

/**
 * Operation attempted on an instance whose status does not allow it.
 */
@Getter
public class InvalidLifecycleException extends KeystoneWorkflowRuntimeException {
    private final String instanceId;
    private final KeystoneWorkflowStatus status;

    public InvalidLifecycleException(String operation, String instanceId, KeystoneWorkflowStatus status) {
        super(KeystoneWorkflowErrorCodes.INVALID_LIFECYCLE, operation, instanceId, status);
        this.instanceId = instanceId;
        this.status = status;
    }
}
