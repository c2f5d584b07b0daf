package com.keystone.workflow.core.exception.task;

import com.keystone.workflow.core.exception.KeystoneWorkflowRuntimeException;
import com.keystone.workflow.core.exception.codes.KeystoneWorkflowErrorCodes;
import com.keystone.workflow.core.models.KeystoneConstraintViolation;
import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

@Getter
public class TaskRequestValidationException extends KeystoneWorkflowRuntimeException {
    private final List<KeystoneConstraintViolation> violations;

    public TaskRequestValidationException(String requestType, List<KeystoneConstraintViolation> violations) {
        super(KeystoneWorkflowErrorCodes.TASK_REQUEST_VALIDATION, requestType, describe(violations));
        this.violations = List.copyOf(violations);
    }

    private static String describe(List<KeystoneConstraintViolation> violations) {
        return violations.stream()
                .map(violation -> violation.getPropertyPath() + " " + violation.getMessage())
                .collect(Collectors.joining("; "));
    }
}
