package com.keystone.workflow.core.engine.definition;

import com.keystone.workflow.integration.enumerations.KeystoneFlowNodeType;
import com.keystone.workflow.integration.models.definition.flow.KeystoneFlowDefinition;
import com.keystone.workflow.integration.models.definition.flow.KeystoneFlowEdge;
import com.keystone.workflow.integration.models.definition.flow.KeystoneFlowNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Structural checks on a flow graph: start and end nodes, dangling edges and nodes that cannot be
 * reached or left.
 */
public final class KeystoneFlowValidator {

    private KeystoneFlowValidator() {
        // Utility class
    }

    public static List<String> validate(KeystoneFlowDefinition flow) {
        List<String> errors = new ArrayList<>();

        if (flow.getName() == null || flow.getName().isBlank()) {
            errors.add("Flow must have a name");
        }
        if (flow.getNodes() == null || flow.getNodes().isEmpty()) {
            errors.add("Flow must have at least one node");
            return errors;
        }

        long startNodes = countOfType(flow, KeystoneFlowNodeType.START);
        if (startNodes == 0) {
            errors.add("Flow must have at least one start node");
        } else if (startNodes > 1) {
            errors.add("Flow should have exactly one start node");
        }
        if (countOfType(flow, KeystoneFlowNodeType.END) == 0) {
            errors.add("Flow must have at least one end node");
        }

        Set<String> nodeIds = flow.getNodes().stream().map(KeystoneFlowNode::getId).collect(Collectors.toSet());
        Set<String> withIncoming = new HashSet<>();
        Set<String> withOutgoing = new HashSet<>();
        for (KeystoneFlowEdge edge : flow.getEdges()) {
            if (!nodeIds.contains(edge.getSource())) {
                errors.add("Edge " + edge.getId() + " references unknown source node: " + edge.getSource());
            }
            if (!nodeIds.contains(edge.getTarget())) {
                errors.add("Edge " + edge.getId() + " references unknown target node: " + edge.getTarget());
            }
            withOutgoing.add(edge.getSource());
            withIncoming.add(edge.getTarget());
        }

        for (KeystoneFlowNode node : flow.getNodes()) {
            String label = node.getLabel() != null ? node.getLabel() : node.getId();
            if (!node.isOfType(KeystoneFlowNodeType.START) && !withIncoming.contains(node.getId())) {
                errors.add("Node " + label + " (" + node.getId() + ") has no incoming edges");
            }
            if (!node.isOfType(KeystoneFlowNodeType.END) && !withOutgoing.contains(node.getId())) {
                errors.add("Node " + label + " (" + node.getId() + ") has no outgoing edges");
            }
        }

        return errors;
    }

    private static long countOfType(KeystoneFlowDefinition flow, KeystoneFlowNodeType type) {
        return flow.getNodes().stream().filter(node -> node.isOfType(type)).count();
    }
}
