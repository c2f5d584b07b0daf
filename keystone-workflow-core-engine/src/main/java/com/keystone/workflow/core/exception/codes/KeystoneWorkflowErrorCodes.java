package com.keystone.workflow.core.exception.codes;

import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum KeystoneWorkflowErrorCodes {

    INVALID_LIFECYCLE(
            "KWF_ERR_0001",
            "Cannot %s workflow instance [%s] in status %s",
            "Re-fetch the instance and check its status before retrying"
    ),

    UNKNOWN_TRANSITION(
            "KWF_ERR_0002",
            "Transition \"%s\" not found in state \"%s\"",
            "Check that the instance was created from the same definition version"
    ),

    NODE_NOT_FOUND(
            "KWF_ERR_0003",
            "Node not found: %s",
            "Check that the instance was created from the same flow version"
    ),

    GUARD_REJECTED(
            "KWF_ERR_0004",
            "Transition \"%s\" blocked by guard \"%s\"",
            "The transition is not allowed for the current instance data"
    ),

    HANDLER_FAILURE(
            "KWF_ERR_0005",
            "Handler for node \"%s\" of type %s failed: %s",
            "Inspect the handler registered for the node type"
    ),

    TRAVERSAL_LIMIT_EXCEEDED(
            "KWF_ERR_0006",
            "Max node limit (%d) exceeded - possible infinite loop",
            "Check the flow for cycles without an exit condition or raise maxNodes"
    ),

    TASK_NOT_FOUND(
            "KWF_ERR_0007",
            "Task not found: %s",
            "Check the task id"
    ),

    INVALID_TASK_STATE(
            "KWF_ERR_0008",
            "Cannot %s task [%s] in status %s",
            "Only pending tasks can be completed, rejected, delegated or escalated"
    ),

    WORKFLOW_PARSE(
            "KWF_ERR_0009",
            "Failed to parse workflow definition: %s",
            "Fix the definition document"
    ),

    WORKFLOW_VALIDATION(
            "KWF_ERR_0010",
            "Invalid workflow definition [%s]: %s",
            "Fix the listed structural errors"
    ),

    WORKFLOW_NOT_FOUND(
            "KWF_ERR_0011",
            "Workflow %s not found: %s",
            "Register the definition or check the instance id"
    ),

    WORKFLOW_LOCKED(
            "KWF_ERR_0012",
            "Workflow instance [%s] is locked by another operation",
            "Retry once the concurrent operation has finished"
    ),

    TASK_REQUEST_VALIDATION(
            "KWF_ERR_0013",
            "Invalid %s: %s",
            "Fix the listed constraint violations"
    )

    ;

    private final String errorCode;
    private final String messageTemplate;
    private final String resolution;

    public String format(Object... args) {
        return String.format(messageTemplate, args);
    }
}
