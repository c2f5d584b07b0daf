package com.keystone.workflow.integration.models.task;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class KeystoneEscalationRequest {

    @NotBlank(message = "{task.escalation.taskId.null}")
    private final String taskId;

    @NotBlank(message = "{task.escalation.escalateTo.null}")
    private final String escalateTo;

    @Size(max = 2000, message = "{task.escalation.reason.invalid.length}")
    private final String reason;

    private final String escalatedBy;

    /**
     * Set by the overdue-task sweep.
     */
    private final boolean automatic;
}
