package com.keystone.workflow.integration.models.definition.fsm;

import com.keystone.workflow.integration.enumerations.KeystoneHookKind;
import lombok.Builder;
import lombok.Data;

import java.io.Serializable;
import java.util.Collections;
import java.util.Map;

/**
 * Reference from a definition to a registered guard or action.
 * <p>
 * A {@link KeystoneHookKind#NAMED} reference carries only the registry name. An
 * {@link KeystoneHookKind#INLINE} reference is the {@code {type, params}} form: {@code name}
 * holds the type, which is looked up in the same registry, and {@code params} are handed to the hook.
 */
@Data
@Builder(toBuilder = true)
public class KeystoneHookReference implements Serializable {

    private static final long serialVersionUID = 1L;

    private final KeystoneHookKind kind;
    private final String name;

    @Builder.Default
    private final Map<String, Object> params = Collections.emptyMap();

    public static KeystoneHookReference named(String name) {
        return KeystoneHookReference.builder()
                .kind(KeystoneHookKind.NAMED)
                .name(name)
                .build();
    }

    public static KeystoneHookReference inline(String type, Map<String, Object> params) {
        return KeystoneHookReference.builder()
                .kind(KeystoneHookKind.INLINE)
                .name(type)
                .params(params == null ? Collections.emptyMap() : Collections.unmodifiableMap(params))
                .build();
    }

    public boolean isInline() {
        return kind == KeystoneHookKind.INLINE;
    }

    @Override
    public String toString() {
        return isInline() ? name + params : name;
    }
}
