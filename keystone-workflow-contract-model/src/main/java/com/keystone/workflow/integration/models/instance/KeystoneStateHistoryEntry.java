package com.keystone.workflow.integration.models.instance;

import lombok.Builder;
import lombok.Data;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;

/**
 * One hop of an instance: a state-machine transition or a flow node traversal.
 * Entries are never modified after they are appended.
 */
@Data
@Builder
public class KeystoneStateHistoryEntry implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String fromState;
    private final String toState;

    /**
     * Transition name, or a label synthesized from the node type for flow hops.
     */
    private final String transition;
    private final Instant timestamp;
    private final String triggeredBy;

    /**
     * Payload supplied by the caller for this hop.
     */
    @Builder.Default
    private final Map<String, Object> data = Collections.emptyMap();
}
