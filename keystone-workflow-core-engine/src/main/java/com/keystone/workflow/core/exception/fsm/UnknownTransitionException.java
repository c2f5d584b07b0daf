package com.keystone.workflow.core.exception.fsm;

import com.keystone.workflow.core.exception.KeystoneWorkflowRuntimeException;
import com.keystone.workflow.core.exception.codes.KeystoneWorkflowErrorCodes;
import lombok.Getter;

@Getter
public class UnknownTransitionException extends KeystoneWorkflowRuntimeException {
    private final String transitionName;
    private final String stateName;

    public UnknownTransitionException(String transitionName, String stateName) {
        super(KeystoneWorkflowErrorCodes.UNKNOWN_TRANSITION, transitionName, stateName);
        this.transitionName = transitionName;
        this.stateName = stateName;
    }
}
