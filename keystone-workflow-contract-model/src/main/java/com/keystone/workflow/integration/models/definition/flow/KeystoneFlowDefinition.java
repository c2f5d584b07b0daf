package com.keystone.workflow.integration.models.definition.flow;

import com.keystone.workflow.integration.enumerations.KeystoneDefinitionKind;
import com.keystone.workflow.integration.enumerations.KeystoneFlowNodeType;
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
 * Graph workflow template: ordered nodes joined by ordered, optionally conditional edges.
 */
@Data
@Builder(toBuilder = true)
public class KeystoneFlowDefinition implements IKeystoneDefinition, Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;
    private final String name;
    private final String label;
    private final String description;

    @Builder.Default
    private final String version = "1";

    @Singular
    private final List<KeystoneFlowNode> nodes;

    @Singular
    private final List<KeystoneFlowEdge> edges;

    @Singular("metadataEntry")
    private final Map<String, Object> metadata;

    @Override
    public KeystoneDefinitionKind getKind() {
        return KeystoneDefinitionKind.FLOW;
    }

    public Optional<KeystoneFlowNode> findNode(String nodeId) {
        return nodes.stream().filter(node -> nodeId.equals(node.getId())).findFirst();
    }

    public Optional<KeystoneFlowNode> findStartNode() {
        return nodes.stream().filter(node -> node.isOfType(KeystoneFlowNodeType.START)).findFirst();
    }

    /**
     * Outgoing edges of a node, in definition order.
     */
    public List<KeystoneFlowEdge> outgoingEdges(String nodeId) {
        return edges.stream()
                .filter(edge -> nodeId.equals(edge.getSource()))
                .collect(Collectors.toList());
    }
}
