package com.keystone.workflow.integration.models.definition.fsm;

import com.keystone.workflow.integration.enumerations.KeystoneDefinitionKind;
import com.keystone.workflow.integration.enumerations.KeystoneWorkflowType;
import com.keystone.workflow.integration.models.definition.IKeystoneDefinition;
import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.io.Serializable;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * State-machine workflow template: a name to state map plus the initial state.
 * Instances of this class are not modified once registered; use {@code toBuilder()} to derive variants.
 */
@Data
@Builder(toBuilder = true)
public class KeystoneWorkflowDefinition implements IKeystoneDefinition, Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;
    private final String name;
    private final String description;
    private final String version;

    @Builder.Default
    private final KeystoneWorkflowType type = KeystoneWorkflowType.SEQUENTIAL;

    /**
     * States keyed by name, in declaration order.
     */
    @Singular
    private final Map<String, KeystoneStateConfig> states;

    private final String initialState;

    @Singular("metadataEntry")
    private final Map<String, Object> metadata;

    @Override
    public KeystoneDefinitionKind getKind() {
        return KeystoneDefinitionKind.STATE_MACHINE;
    }

    public Optional<KeystoneStateConfig> findState(String stateName) {
        if (stateName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(states.get(stateName));
    }

    public List<String> getFinalStates() {
        return states.entrySet().stream()
                .filter(entry -> entry.getValue().isFinalState())
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }
}
