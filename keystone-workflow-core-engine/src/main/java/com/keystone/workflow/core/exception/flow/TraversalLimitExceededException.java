package com.keystone.workflow.core.exception.flow;

import com.keystone.workflow.core.exception.KeystoneWorkflowRuntimeException;
import com.keystone.workflow.core.exception.codes.KeystoneWorkflowErrorCodes;
import lombok.Getter;

@Getter
public class TraversalLimitExceededException extends KeystoneWorkflowRuntimeException {
    private final int maxNodes;

    public TraversalLimitExceededException(int maxNodes) {
        super(KeystoneWorkflowErrorCodes.TRAVERSAL_LIMIT_EXCEEDED, maxNodes);
        this.maxNodes = maxNodes;
    }
}
