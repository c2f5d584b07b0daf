package com.keystone.workflow.integration.models.task;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class KeystoneDelegationRequest {

    @NotBlank(message = "{task.delegation.taskId.null}")
    private final String taskId;

    @NotBlank(message = "{task.delegation.delegateTo.null}")
    private final String delegateTo;

    @NotBlank(message = "{task.delegation.delegatedBy.null}")
    private final String delegatedBy;

    @Size(max = 2000, message = "{task.delegation.reason.invalid.length}")
    private final String reason;
}
