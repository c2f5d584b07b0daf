package com.keystone.workflow.integration.models.task;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Data;

import java.time.Duration;

@Data
@Builder
public class KeystoneApprovalLevel {

    @Min(value = 1, message = "{approval.level.level.invalid}")
    private final int level;

    /**
     * Approving user or role.
     */
    @NotBlank(message = "{approval.level.approver.null}")
    private final String approver;

    private final String description;

    @Builder.Default
    private final boolean required = true;

    private final String escalationTarget;

    /**
     * Time after creation when the level task becomes overdue.
     */
    private final Duration escalationTimeout;
}
