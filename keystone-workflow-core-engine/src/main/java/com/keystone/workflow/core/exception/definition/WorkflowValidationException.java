package com.keystone.workflow.core.exception.definition;

import com.keystone.workflow.core.exception.KeystoneWorkflowRuntimeException;
import com.keystone.workflow.core.exception.codes.KeystoneWorkflowErrorCodes;
import lombok.Getter;

import java.util.List;

@Getter
public class WorkflowValidationException extends KeystoneWorkflowRuntimeException {
    private final String definitionId;
    private final List<String> errors;

    public WorkflowValidationException(String definitionId, List<String> errors) {
        super(KeystoneWorkflowErrorCodes.WORKFLOW_VALIDATION, definitionId, String.join("; ", errors));
        this.definitionId = definitionId;
        this.errors = List.copyOf(errors);
    }
}
