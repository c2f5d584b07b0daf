package com.keystone.workflow.core.exception.task;

import com.keystone.workflow.core.exception.KeystoneWorkflowRuntimeException;
import com.keystone.workflow.core.exception.codes.KeystoneWorkflowErrorCodes;
import com.keystone.workflow.integration.enumerations.KeystoneWorkflowTaskStatus;
import lombok.Getter;

@Getter
public class InvalidTaskStateException extends KeystoneWorkflowRuntimeException {
    private final String taskId;
    private final KeystoneWorkflowTaskStatus status;

    public InvalidTaskStateException(String operation, String taskId, KeystoneWorkflowTaskStatus status) {
        super(KeystoneWorkflowErrorCodes.INVALID_TASK_STATE, operation, taskId, status);
        this.taskId = taskId;
        this.status = status;
    }
}
