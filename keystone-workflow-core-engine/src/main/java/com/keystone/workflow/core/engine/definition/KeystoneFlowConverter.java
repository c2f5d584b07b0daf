package com.keystone.workflow.core.engine.definition;

import com.keystone.workflow.integration.constant.KeystoneWorkflowConstants;
import com.keystone.workflow.integration.enumerations.KeystoneFlowNodeType;
import com.keystone.workflow.integration.enumerations.KeystoneWorkflowType;
import com.keystone.workflow.integration.models.definition.flow.KeystoneFlowDefinition;
import com.keystone.workflow.integration.models.definition.flow.KeystoneFlowEdge;
import com.keystone.workflow.integration.models.definition.flow.KeystoneFlowNode;
import com.keystone.workflow.integration.models.definition.fsm.KeystoneHookReference;
import com.keystone.workflow.integration.models.definition.fsm.KeystoneStateConfig;
import com.keystone.workflow.integration.models.definition.fsm.KeystoneTransitionConfig;
import com.keystone.workflow.integration.models.definition.fsm.KeystoneWorkflowDefinition;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Converts between state-machine definitions and flow graphs.
 * <p>
 * State to node: the initial state becomes a {@code start} node, final states become {@code end}
 * nodes and every other state an {@code assignment} node labelled with the state name. Each
 * transition becomes an edge labelled with the transition name whose condition is the guard
 * names joined by {@code &&}.
 * <p>
 * Node to state: states are named after node labels, edges become transitions named after the
 * edge label (or {@code to_<target>}) and an edge condition becomes a named guard.
 */
@Slf4j
public final class KeystoneFlowConverter {

    private KeystoneFlowConverter() {
        // Utility class
    }

    public static KeystoneFlowDefinition toFlow(KeystoneWorkflowDefinition definition) {
        List<KeystoneFlowNode> nodes = new ArrayList<>();
        Map<String, String> nodeIdByState = new HashMap<>();

        int nodeIndex = 0;
        for (Map.Entry<String, KeystoneStateConfig> entry : definition.getStates().entrySet()) {
            String nodeId = "node_" + nodeIndex++;
            nodeIdByState.put(entry.getKey(), nodeId);
            KeystoneStateConfig state = entry.getValue();
            KeystoneFlowNodeType type = state.isInitial()
                    ? KeystoneFlowNodeType.START
                    : state.isFinalState() ? KeystoneFlowNodeType.END : KeystoneFlowNodeType.ASSIGNMENT;
            nodes.add(KeystoneFlowNode.builder()
                    .id(nodeId)
                    .label(entry.getKey())
                    .type(type)
                    .config(stateConfigToNodeConfig(state))
                    .build());
        }

        List<KeystoneFlowEdge> edges = new ArrayList<>();
        int edgeIndex = 0;
        for (Map.Entry<String, KeystoneStateConfig> entry : definition.getStates().entrySet()) {
            String source = nodeIdByState.get(entry.getKey());
            for (Map.Entry<String, KeystoneTransitionConfig> transition : entry.getValue().getTransitions().entrySet()) {
                String target = nodeIdByState.get(transition.getValue().getTarget());
                if (target == null) {
                    log.warn("Skipping transition {} of state {}: unknown target state {}",
                            transition.getKey(), entry.getKey(), transition.getValue().getTarget());
                    continue;
                }
                List<KeystoneHookReference> guards = transition.getValue().getGuards();
                edges.add(KeystoneFlowEdge.builder()
                        .id("edge_" + edgeIndex++)
                        .source(source)
                        .target(target)
                        .label(transition.getKey())
                        .condition(guards.isEmpty() ? null : hookNames(guards, " && "))
                        .build());
            }
        }

        return KeystoneFlowDefinition.builder()
                .id(definition.getId())
                .name(definition.getName())
                .label(definition.getName())
                .description(definition.getDescription())
                .version(definition.getVersion() == null
                        ? KeystoneWorkflowConstants.DEFAULT_FLOW_VERSION
                        : definition.getVersion())
                .nodes(nodes)
                .edges(edges)
                .build();
    }

    public static KeystoneWorkflowDefinition toStateMachine(KeystoneFlowDefinition flow) {
        return toStateMachine(flow, null, null, Clock.systemUTC());
    }

    public static KeystoneWorkflowDefinition toStateMachine(KeystoneFlowDefinition flow, String id, KeystoneWorkflowType type) {
        return toStateMachine(flow, id, type, Clock.systemUTC());
    }

    /**
     * @param id    definition id; defaults to the flow id, then to {@code flow_<epoch millis>}
     * @param type  workflow type; defaults to {@link KeystoneWorkflowType#SEQUENTIAL}
     * @param clock source of the fallback id
     */
    public static KeystoneWorkflowDefinition toStateMachine(KeystoneFlowDefinition flow, String id,
                                                            KeystoneWorkflowType type, Clock clock) {
        Map<String, String> stateByNodeId = new HashMap<>();
        for (KeystoneFlowNode node : flow.getNodes()) {
            stateByNodeId.put(node.getId(), stateName(node));
        }

        Map<String, Map<String, KeystoneTransitionConfig>> transitionsByState = new LinkedHashMap<>();
        flow.getNodes().forEach(node -> transitionsByState.put(stateName(node), new LinkedHashMap<>()));
        for (KeystoneFlowEdge edge : flow.getEdges()) {
            String source = stateByNodeId.get(edge.getSource());
            String target = stateByNodeId.get(edge.getTarget());
            if (source == null || target == null) {
                continue;
            }
            String transitionName = edge.getLabel() != null && !edge.getLabel().isBlank()
                    ? edge.getLabel()
                    : "to_" + target;
            KeystoneTransitionConfig.KeystoneTransitionConfigBuilder transition = KeystoneTransitionConfig.builder().target(target);
            if (edge.hasCondition()) {
                transition.guard(KeystoneHookReference.named(edge.getCondition()));
            }
            transitionsByState.get(source).put(transitionName, transition.build());
        }

        // first start node, or the first node when the flow has none
        String initialState = flow.getNodes().stream()
                .filter(node -> node.isOfType(KeystoneFlowNodeType.START))
                .findFirst()
                .or(() -> flow.getNodes().stream().findFirst())
                .map(KeystoneFlowConverter::stateName)
                .orElse(null);

        Map<String, KeystoneStateConfig> states = new LinkedHashMap<>();
        for (KeystoneFlowNode node : flow.getNodes()) {
            String name = stateName(node);
            states.put(name, KeystoneStateConfig.builder()
                    .name(name)
                    .initial(name.equals(initialState))
                    .finalState(node.isOfType(KeystoneFlowNodeType.END))
                    .transitions(transitionsByState.get(name))
                    .metadata(node.getConfig())
                    .build());
        }

        String definitionId = id != null ? id
                : flow.getId() != null ? flow.getId()
                : KeystoneWorkflowConstants.FLOW_INSTANCE_ID_PREFIX + clock.millis();
        return KeystoneWorkflowDefinition.builder()
                .id(definitionId)
                .name(flow.getName())
                .description(flow.getDescription())
                .type(type != null ? type : KeystoneWorkflowType.SEQUENTIAL)
                .version(flow.getVersion() != null ? flow.getVersion() : KeystoneWorkflowConstants.DEFAULT_DEFINITION_VERSION)
                .states(states)
                .initialState(initialState)
                .build();
    }

    private static Map<String, Object> stateConfigToNodeConfig(KeystoneStateConfig state) {
        Map<String, Object> config = new LinkedHashMap<>();
        if (!state.getMetadata().isEmpty()) {
            config.put("metadata", state.getMetadata());
        }
        if (!state.getOnEnter().isEmpty()) {
            config.put("onEnter", hookNameList(state.getOnEnter()));
        }
        if (!state.getOnExit().isEmpty()) {
            config.put("onExit", hookNameList(state.getOnExit()));
        }
        return config;
    }

    private static String stateName(KeystoneFlowNode node) {
        return node.getLabel() != null && !node.getLabel().isBlank() ? node.getLabel() : node.getId();
    }

    private static List<String> hookNameList(List<KeystoneHookReference> references) {
        return references.stream().map(KeystoneHookReference::getName).collect(Collectors.toList());
    }

    private static String hookNames(List<KeystoneHookReference> references, String delimiter) {
        return String.join(delimiter, hookNameList(references));
    }
}
