package com.keystone.workflow.core.exception.definition;

import com.keystone.workflow.core.exception.KeystoneWorkflowRuntimeException;
import com.keystone.workflow.core.exception.codes.KeystoneWorkflowErrorCodes;

/**
 * Definition text could not be read or violates the document shape. Raised at load time.
 */
public class WorkflowParseException extends KeystoneWorkflowRuntimeException {

    public WorkflowParseException(String detail) {
        super(KeystoneWorkflowErrorCodes.WORKFLOW_PARSE, detail);
    }

    public WorkflowParseException(String detail, Throwable cause) {
        super(KeystoneWorkflowErrorCodes.WORKFLOW_PARSE, cause, detail);
    }

    /**
     * Parser-level message without the error-code prefix.
     */
    public String getDetail() {
        String message = getMessage();
        int separator = message.indexOf(": ");
        return separator < 0 ? message : message.substring(separator + 2);
    }
}
