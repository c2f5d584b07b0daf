package com.keystone.workflow.integration.models.task;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.List;

/**
 * Ordered approval levels; each level becomes one pending task.
 */
@Data
@Builder
public class KeystoneApprovalChain {

    @Valid
    @NotEmpty(message = "{approval.chain.levels.empty}")
    @Singular
    private final List<KeystoneApprovalLevel> levels;
}
