package com.keystone.workflow.integration.models.instance;

import com.keystone.workflow.integration.enumerations.KeystoneDefinitionKind;
import com.keystone.workflow.integration.enumerations.KeystoneWorkflowStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A single execution of a workflow definition.
 * <p>
 * Instances are mutated in place by the engines. Anything crossing a storage boundary
 * should go through {@link #copy()} so callers never share the data map or history list.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   PENDING --start--> RUNNING --final state / end node--> COMPLETED
 *                         |------abort--------------------> ABORTED
 *                         |------handler error / bound----> FAILED
 * </pre>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class KeystoneWorkflowInstance implements Serializable {

    private static final long serialVersionUID = 1L;

    // ========================================================================
    // IDENTITY
    // ========================================================================

    private String id;
    private String workflowId;
    private String version;
    private KeystoneDefinitionKind definitionKind;

    // ========================================================================
    // EXECUTION STATE
    // ========================================================================

    /**
     * State name for state machines, node id for flows.
     */
    private String currentState;

    @Builder.Default
    private KeystoneWorkflowStatus status = KeystoneWorkflowStatus.PENDING;

    /**
     * Working memory of the process.
     */
    @Builder.Default
    private Map<String, Object> data = new LinkedHashMap<>();

    @Builder.Default
    private List<KeystoneStateHistoryEntry> history = new ArrayList<>();

    private String error;

    // ========================================================================
    // TIMESTAMPS AND ACTORS
    // ========================================================================

    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;
    private Instant abortedAt;
    private Instant failedAt;
    private String startedBy;
    private String completedBy;

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    public void appendHistory(KeystoneStateHistoryEntry entry) {
        history.add(entry);
    }

    public List<KeystoneStateHistoryEntry> getHistoryView() {
        return Collections.unmodifiableList(history);
    }

    /**
     * Snapshot with its own data map and history list. History entries are immutable and shared.
     */
    public KeystoneWorkflowInstance copy() {
        return this.toBuilder()
                .data(data == null ? new LinkedHashMap<>() : new LinkedHashMap<>(data))
                .history(history == null ? new ArrayList<>() : new ArrayList<>(history))
                .build();
    }
}
