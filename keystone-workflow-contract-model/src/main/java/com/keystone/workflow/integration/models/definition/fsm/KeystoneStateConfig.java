package com.keystone.workflow.integration.models.definition.fsm;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.io.Serializable;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One state of a state-machine definition. Transitions keep their declaration order.
 */
@Data
@Builder(toBuilder = true)
public class KeystoneStateConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String name;
    private final boolean initial;
    private final boolean finalState;

    @Singular("onEnterAction")
    private final List<KeystoneHookReference> onEnter;

    @Singular("onExitAction")
    private final List<KeystoneHookReference> onExit;

    @Singular
    private final Map<String, KeystoneTransitionConfig> transitions;

    @Singular("metadataEntry")
    private final Map<String, Object> metadata;

    public Optional<KeystoneTransitionConfig> findTransition(String transitionName) {
        return Optional.ofNullable(transitions.get(transitionName));
    }
}
