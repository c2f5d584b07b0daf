package com.keystone.workflow.integration.models.task;

import com.keystone.workflow.integration.enumerations.KeystoneWorkflowTaskStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Human work item attached to a workflow instance.
 * <p>
 * Delegation and escalation are independent audit trails: escalating a delegated task leaves
 * the delegation fields in place. The assignee who should act now is
 * {@link #getEffectiveAssignee()}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class KeystoneWorkflowTask implements Serializable {

    private static final long serialVersionUID = 1L;

    // ========================================================================
    // IDENTITY
    // ========================================================================

    private String id;
    private String instanceId;
    private String name;
    private String description;

    // ========================================================================
    // ASSIGNMENT AND STATUS
    // ========================================================================

    private String assignedTo;

    @Builder.Default
    private KeystoneWorkflowTaskStatus status = KeystoneWorkflowTaskStatus.PENDING;

    @Builder.Default
    private Map<String, Object> data = new LinkedHashMap<>();

    private Map<String, Object> result;
    private Instant createdAt;
    private Instant completedAt;

    // ========================================================================
    // SLA
    // ========================================================================

    private Instant dueDate;
    private boolean autoEscalate;
    private String escalationTarget;

    // ========================================================================
    // DELEGATION
    // ========================================================================

    private String delegatedTo;

    /**
     * Assignee before the first delegation. Never overwritten by later delegations.
     */
    private String originalAssignee;
    private String delegationReason;
    private String delegatedBy;
    private Instant delegatedAt;

    // ========================================================================
    // ESCALATION
    // ========================================================================

    private String escalatedTo;
    private String escalationReason;
    private String escalatedBy;
    private Instant escalatedAt;

    public String getEffectiveAssignee() {
        if (escalatedTo != null) {
            return escalatedTo;
        }
        if (delegatedTo != null) {
            return delegatedTo;
        }
        return assignedTo;
    }

    public boolean isPending() {
        return status == KeystoneWorkflowTaskStatus.PENDING;
    }

    public boolean isOverdue(Instant now) {
        return dueDate != null && now.isAfter(dueDate);
    }

    public KeystoneWorkflowTask copy() {
        return this.toBuilder()
                .data(data == null ? new LinkedHashMap<>() : new LinkedHashMap<>(data))
                .result(result == null ? null : new LinkedHashMap<>(result))
                .build();
    }
}
