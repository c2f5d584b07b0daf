package com.keystone.workflow.integration.models.definition.fsm;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

@Data
@Builder(toBuilder = true)
public class KeystoneTransitionConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * Name of the state this transition leads to.
     */
    private final String target;

    /**
     * Evaluated in order; all must pass.
     */
    @Singular
    private final List<KeystoneHookReference> guards;

    @Singular
    private final List<KeystoneHookReference> actions;

    @Singular("metadataEntry")
    private final Map<String, Object> metadata;

    public static KeystoneTransitionConfig to(String target) {
        return KeystoneTransitionConfig.builder().target(target).build();
    }
}
