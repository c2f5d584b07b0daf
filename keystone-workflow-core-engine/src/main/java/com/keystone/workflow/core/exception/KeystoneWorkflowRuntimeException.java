package com.keystone.workflow.core.exception;

import com.keystone.workflow.core.exception.codes.KeystoneWorkflowErrorCodes;
import lombok.Getter;

@Getter
public class KeystoneWorkflowRuntimeException extends RuntimeException {

    private final KeystoneWorkflowErrorCodes errorCode;

    public KeystoneWorkflowRuntimeException(KeystoneWorkflowErrorCodes errorCode, Object... args) {
        super(errorCode.format(args));
        this.errorCode = errorCode;
    }

    public KeystoneWorkflowRuntimeException(KeystoneWorkflowErrorCodes errorCode, Throwable cause, Object... args) {
        super(errorCode.format(args), cause);
        this.errorCode = errorCode;
    }
}
