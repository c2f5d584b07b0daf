package com.keystone.workflow.core.exception.fsm;

import com.keystone.workflow.core.exception.KeystoneWorkflowRuntimeException;
import com.keystone.workflow.core.exception.codes.KeystoneWorkflowErrorCodes;
import lombok.Getter;

/**
 * Business-rule rejection: a guard evaluated false or no guard is registered under the referenced name.
 */
@Getter
public class GuardRejectedException extends KeystoneWorkflowRuntimeException {
    private final String transitionName;
    private final String guardName;
    private final boolean unresolved;

    public GuardRejectedException(String transitionName, String guardName, boolean unresolved) {
        super(KeystoneWorkflowErrorCodes.GUARD_REJECTED, transitionName, guardName);
        this.transitionName = transitionName;
        this.guardName = guardName;
        this.unresolved = unresolved;
    }
}
