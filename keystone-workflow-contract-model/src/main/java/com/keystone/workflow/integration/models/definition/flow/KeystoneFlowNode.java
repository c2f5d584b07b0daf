package com.keystone.workflow.integration.models.definition.flow;

import com.keystone.workflow.integration.enumerations.KeystoneFlowNodeType;
import lombok.Builder;
import lombok.Data;

import java.io.Serializable;
import java.util.Collections;
import java.util.Map;

/**
 * A node of a flow graph. {@code config} is interpreted by the handler of the node type,
 * {@code position} is layout information carried through untouched.
 */
@Data
@Builder(toBuilder = true)
public class KeystoneFlowNode implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;
    private final String label;
    private final KeystoneFlowNodeType type;

    /**
     * Type string as written in the definition. Differs from the enum wire name only for custom types.
     */
    private final String rawType;

    @Builder.Default
    private final Map<String, Object> config = Collections.emptyMap();

    @Builder.Default
    private final Map<String, Object> position = Collections.emptyMap();

    public static KeystoneFlowNode of(String id, KeystoneFlowNodeType type) {
        return KeystoneFlowNode.builder().id(id).type(type).build();
    }

    public static KeystoneFlowNode of(String id, KeystoneFlowNodeType type, Map<String, Object> config) {
        return KeystoneFlowNode.builder().id(id).type(type).config(config).build();
    }

    /**
     * Key used to look up the handler of this node.
     */
    public String getTypeName() {
        if (rawType != null && !rawType.isBlank()) {
            return rawType;
        }
        return type == null ? KeystoneFlowNodeType.CUSTOM.getWireName() : type.getWireName();
    }

    public boolean isOfType(KeystoneFlowNodeType nodeType) {
        return type == nodeType;
    }
}
