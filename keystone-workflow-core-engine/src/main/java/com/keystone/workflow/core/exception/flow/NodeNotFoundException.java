package com.keystone.workflow.core.exception.flow;

import com.keystone.workflow.core.exception.KeystoneWorkflowRuntimeException;
import com.keystone.workflow.core.exception.codes.KeystoneWorkflowErrorCodes;
import lombok.Getter;

@Getter
public class NodeNotFoundException extends KeystoneWorkflowRuntimeException {
    private final String nodeId;

    public NodeNotFoundException(String nodeId) {
        super(KeystoneWorkflowErrorCodes.NODE_NOT_FOUND, nodeId);
        this.nodeId = nodeId;
    }
}
