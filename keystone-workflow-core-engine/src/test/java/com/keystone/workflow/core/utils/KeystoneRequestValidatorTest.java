package com.keystone.workflow.core.utils;

import com.keystone.workflow.core.exception.codes.KeystoneWorkflowErrorCodes;
import com.keystone.workflow.core.exception.task.TaskRequestValidationException;
import com.keystone.workflow.core.models.KeystoneConstraintViolation;
import com.keystone.workflow.integration.models.task.KeystoneApprovalChain;
import com.keystone.workflow.integration.models.task.KeystoneApprovalLevel;
import com.keystone.workflow.integration.models.task.KeystoneEscalationRequest;
import com.keystone.workflow.integration.models.task.KeystoneTaskRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KeystoneRequestValidatorTest {

    @Test
    @DisplayName("should return a valid request unchanged")
    void shouldAcceptValidRequest() {
        KeystoneTaskRequest request = KeystoneTaskRequest.builder().instanceId("wf_1").name("review").build();

        assertSame(request, KeystoneRequestValidator.validate(request));
    }

    @Test
    @DisplayName("should interpolate constraint parameters into bundle messages")
    void shouldInterpolateParameters() {
        // Given
        KeystoneEscalationRequest request = KeystoneEscalationRequest.builder()
                .taskId("task_1")
                .escalateTo("carol")
                .reason("x".repeat(2001))
                .build();

        // When
        List<KeystoneConstraintViolation> violations = KeystoneRequestValidator.findViolations(request);

        // Then
        assertEquals(1, violations.size());
        KeystoneConstraintViolation violation = violations.get(0);
        assertEquals("reason", violation.getPropertyPath());
        assertEquals("Escalation reason must be at most 2000 characters", violation.getMessage());
        assertEquals("2000", violation.getTemplateVariables().get("max"));
        assertEquals(KeystoneEscalationRequest.class, violation.getClazz());
    }

    @Test
    @DisplayName("should cascade into approval levels")
    void shouldValidateNestedLevels() {
        // Given
        KeystoneApprovalChain chain = KeystoneApprovalChain.builder()
                .level(KeystoneApprovalLevel.builder().level(0).approver("manager").build())
                .build();

        // When
        TaskRequestValidationException error = assertThrows(TaskRequestValidationException.class,
                () -> KeystoneRequestValidator.validate(chain));

        // Then
        assertEquals(KeystoneWorkflowErrorCodes.TASK_REQUEST_VALIDATION, error.getErrorCode());
        assertEquals("levels[0].level", error.getViolations().get(0).getPropertyPath());
        assertEquals("Approval level must be 1 or greater", error.getViolations().get(0).getMessage());
        assertTrue(error.getMessage().startsWith("Invalid KeystoneApprovalChain: "));
    }

    @Test
    @DisplayName("should refuse a null request")
    void shouldRejectNull() {
        assertThrows(IllegalArgumentException.class, () -> KeystoneRequestValidator.validate(null));
    }
}
