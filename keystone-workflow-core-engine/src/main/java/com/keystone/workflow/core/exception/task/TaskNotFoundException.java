package com.keystone.workflow.core.exception.task;

import com.keystone.workflow.core.exception.KeystoneWorkflowRuntimeException;
import com.keystone.workflow.core.exception.codes.KeystoneWorkflowErrorCodes;
import lombok.Getter;

@Getter
public class TaskNotFoundException extends KeystoneWorkflowRuntimeException {
    private final String taskId;

    public TaskNotFoundException(String taskId) {
        super(KeystoneWorkflowErrorCodes.TASK_NOT_FOUND, taskId);
        this.taskId = taskId;
    }
}
