package com.keystone.workflow.core.exception.flow;

import com.keystone.workflow.core.exception.KeystoneWorkflowRuntimeException;
import com.keystone.workflow.core.exception.codes.KeystoneWorkflowErrorCodes;
import lombok.Getter;

@Getter
public class HandlerFailureException extends KeystoneWorkflowRuntimeException {
    private final String nodeId;
    private final String nodeType;
    private final String reason;

    public HandlerFailureException(String nodeId, String nodeType, String reason) {
        super(KeystoneWorkflowErrorCodes.HANDLER_FAILURE, nodeId, nodeType, reason);
        this.nodeId = nodeId;
        this.nodeType = nodeType;
        this.reason = reason;
    }

    public HandlerFailureException(String nodeId, String nodeType, Throwable cause) {
        super(KeystoneWorkflowErrorCodes.HANDLER_FAILURE, cause, nodeId, nodeType, describe(cause));
        this.nodeId = nodeId;
        this.nodeType = nodeType;
        this.reason = describe(cause);
    }

    // message-less throwables are reported by their type
    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.toString();
    }
}
