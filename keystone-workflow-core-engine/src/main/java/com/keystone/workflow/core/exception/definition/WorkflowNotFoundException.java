package com.keystone.workflow.core.exception.definition;

import com.keystone.workflow.core.exception.KeystoneWorkflowRuntimeException;
import com.keystone.workflow.core.exception.codes.KeystoneWorkflowErrorCodes;
import lombok.Getter;

@Getter
public class WorkflowNotFoundException extends KeystoneWorkflowRuntimeException {
    private final String identifier;

    private WorkflowNotFoundException(String what, String identifier) {
        super(KeystoneWorkflowErrorCodes.WORKFLOW_NOT_FOUND, what, identifier);
        this.identifier = identifier;
    }

    public static WorkflowNotFoundException definition(String definitionId, String version) {
        return new WorkflowNotFoundException("definition",
                version == null ? definitionId : definitionId + "@" + version);
    }

    public static WorkflowNotFoundException instance(String instanceId) {
        return new WorkflowNotFoundException("instance", instanceId);
    }
}
