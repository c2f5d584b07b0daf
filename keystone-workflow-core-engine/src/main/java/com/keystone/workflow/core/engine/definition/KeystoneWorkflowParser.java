package com.keystone.workflow.core.engine.definition;

import com.keystone.workflow.core.exception.definition.WorkflowParseException;
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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads workflow definitions from YAML or JSON text.
 *
 * <h2>State machine document</h2>
 * <pre>{@code
 * name: Expense Approval
 * type: approval
 * states:
 *   draft:
 *     initial: true
 *     on_exit: [stampSubmission]
 *     transitions:
 *       submit: review                 # shorthand: target state only
 *   review:
 *     transitions:
 *       approve:
 *         target: approved
 *         guards: [isManager, {type: amountBelow, params: {limit: 5000}}]
 *         actions: [notifyRequester]
 *   approved:
 *     final: true
 * }</pre>
 *
 * <h2>Flow document</h2>
 * <pre>{@code
 * name: Order Routing
 * nodes:
 *   - {id: start, type: start}
 *   - {id: check, type: decision}
 *   - {id: done, type: end}
 * edges:
 *   - {source: start, target: check}
 *   - {source: check, target: done, condition: "priority == high"}
 * }</pre>
 *
 * <p>Hook references are either a registered name or a {@code {type, params}} mapping. Scalar or
 * list params are wrapped as {@code {value: params}}.
 */
@Slf4j
public final class KeystoneWorkflowParser {

    private KeystoneWorkflowParser() {
        // Utility class
    }

    // ========================================================================
    // STATE MACHINE
    // ========================================================================

    public static KeystoneWorkflowDefinition parseStateMachine(String text) {
        return parseStateMachine(text, null);
    }

    /**
     * Parses a state-machine definition.
     *
     * @param text YAML or JSON document
     * @param id   id to assign, or {@code null} to use the document id or derive one from the name
     * @throws WorkflowParseException for a malformed document, a missing name, no states,
     *                                no or several initial states, or a transition to an unknown state
     */
    public static KeystoneWorkflowDefinition parseStateMachine(String text, String id) {
        Map<String, Object> document = KeystoneWorkflowSerializer.readDocument(text);

        String name = asString(document.get("name"));
        if (name == null || name.isBlank()) {
            throw new WorkflowParseException("Workflow definition must have a name");
        }

        Map<String, Object> rawStates = asMap(document.get("states"), "states");
        if (rawStates.isEmpty()) {
            throw new WorkflowParseException("Workflow definition must have at least one state");
        }

        List<String> initialStates = rawStates.entrySet().stream()
                .filter(entry -> entry.getValue() instanceof Map
                        && Boolean.TRUE.equals(((Map<?, ?>) entry.getValue()).get("initial")))
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
        if (initialStates.isEmpty()) {
            throw new WorkflowParseException("Workflow definition must have an initial state");
        }
        if (initialStates.size() > 1) {
            throw new WorkflowParseException("Workflow definition must have exactly one initial state, found: "
                    + String.join(", ", initialStates));
        }

        Map<String, KeystoneStateConfig> states = new LinkedHashMap<>();
        rawStates.forEach((stateName, rawState) -> states.put(stateName, parseState(stateName, rawState)));

        states.forEach((stateName, state) -> state.getTransitions().forEach((transitionName, transition) -> {
            if (!states.containsKey(transition.getTarget())) {
                throw new WorkflowParseException("Invalid transition \"" + transitionName + "\" in state \""
                        + stateName + "\": target state \"" + transition.getTarget() + "\" does not exist");
            }
        }));

        KeystoneWorkflowDefinition definition = KeystoneWorkflowDefinition.builder()
                .id(resolveId(id, document, name))
                .name(name)
                .description(asString(document.get("description")))
                .type(parseType(document.get("type")))
                .version(versionOrDefault(document.get("version"), KeystoneWorkflowConstants.DEFAULT_DEFINITION_VERSION))
                .states(states)
                .initialState(initialStates.get(0))
                .metadata(asMap(document.get("metadata"), "metadata"))
                .build();
        log.debug("Parsed state machine definition: id={}, states={}", definition.getId(), states.keySet());
        return definition;
    }

    private static KeystoneStateConfig parseState(String stateName, Object rawState) {
        Map<String, Object> state = asMap(rawState, "state \"" + stateName + "\"");

        Map<String, KeystoneTransitionConfig> transitions = new LinkedHashMap<>();
        asMap(state.get("transitions"), "transitions of state \"" + stateName + "\"")
                .forEach((transitionName, rawTransition) ->
                        transitions.put(transitionName, parseTransition(transitionName, rawTransition)));

        return KeystoneStateConfig.builder()
                .name(stateName)
                .initial(Boolean.TRUE.equals(state.get("initial")))
                .finalState(Boolean.TRUE.equals(state.get("final")))
                .onEnter(parseHooks(firstPresent(state, "on_enter", "onEnter"), "on_enter of state \"" + stateName + "\""))
                .onExit(parseHooks(firstPresent(state, "on_exit", "onExit"), "on_exit of state \"" + stateName + "\""))
                .transitions(transitions)
                .metadata(asMap(state.get("metadata"), "metadata of state \"" + stateName + "\""))
                .build();
    }

    private static KeystoneTransitionConfig parseTransition(String transitionName, Object rawTransition) {
        if (rawTransition instanceof String target) {
            return KeystoneTransitionConfig.to(target);
        }
        if (!(rawTransition instanceof Map)) {
            throw new WorkflowParseException("Transition \"" + transitionName + "\" must have a target state");
        }
        Map<String, Object> transition = asMap(rawTransition, "transition \"" + transitionName + "\"");
        String target = asString(transition.get("target"));
        if (target == null || target.isBlank()) {
            throw new WorkflowParseException("Transition \"" + transitionName + "\" must have a target state");
        }
        return KeystoneTransitionConfig.builder()
                .target(target)
                .guards(parseHooks(transition.get("guards"), "guards of transition \"" + transitionName + "\""))
                .actions(parseHooks(transition.get("actions"), "actions of transition \"" + transitionName + "\""))
                .metadata(asMap(transition.get("metadata"), "metadata of transition \"" + transitionName + "\""))
                .build();
    }

    private static List<KeystoneHookReference> parseHooks(Object raw, String location) {
        if (raw == null) {
            return Collections.emptyList();
        }
        List<?> items = raw instanceof List<?> list ? list : List.of(raw);
        List<KeystoneHookReference> references = new ArrayList<>(items.size());
        for (Object item : items) {
            if (item instanceof String name) {
                references.add(KeystoneHookReference.named(name));
            } else if (item instanceof Map<?, ?> inline) {
                String type = asString(inline.get("type"));
                if (type == null || type.isBlank()) {
                    throw new WorkflowParseException("Hook reference in " + location + " must have a type");
                }
                references.add(KeystoneHookReference.inline(type, asParams(inline.get("params"))));
            } else {
                throw new WorkflowParseException("Unsupported hook reference in " + location + ": " + item);
            }
        }
        return references;
    }

    // ========================================================================
    // FLOW
    // ========================================================================

    public static KeystoneFlowDefinition parseFlow(String text) {
        return parseFlow(text, null);
    }

    /**
     * Parses a flow definition. Structural rules beyond node and edge references are checked by
     * {@link KeystoneFlowValidator}.
     *
     * @throws WorkflowParseException for a malformed document, a missing name, no nodes,
     *                                duplicate node ids or an edge to an unknown node
     */
    public static KeystoneFlowDefinition parseFlow(String text, String id) {
        Map<String, Object> document = KeystoneWorkflowSerializer.readDocument(text);

        String name = asString(document.get("name"));
        if (name == null || name.isBlank()) {
            throw new WorkflowParseException("Flow definition must have a name");
        }

        List<?> rawNodes = asList(document.get("nodes"), "nodes");
        if (rawNodes.isEmpty()) {
            throw new WorkflowParseException("Flow definition must have at least one node");
        }

        List<KeystoneFlowNode> nodes = new ArrayList<>(rawNodes.size());
        Set<String> nodeIds = new HashSet<>();
        for (int i = 0; i < rawNodes.size(); i++) {
            KeystoneFlowNode node = parseNode(i, rawNodes.get(i));
            if (!nodeIds.add(node.getId())) {
                throw new WorkflowParseException("Duplicate node id \"" + node.getId() + "\"");
            }
            nodes.add(node);
        }

        List<?> rawEdges = asList(document.get("edges"), "edges");
        List<KeystoneFlowEdge> edges = new ArrayList<>(rawEdges.size());
        for (int i = 0; i < rawEdges.size(); i++) {
            KeystoneFlowEdge edge = parseEdge(i, rawEdges.get(i));
            if (!nodeIds.contains(edge.getSource())) {
                throw new WorkflowParseException("Edge \"" + edge.getId() + "\" references unknown source node \""
                        + edge.getSource() + "\"");
            }
            if (!nodeIds.contains(edge.getTarget())) {
                throw new WorkflowParseException("Edge \"" + edge.getId() + "\" references unknown target node \""
                        + edge.getTarget() + "\"");
            }
            edges.add(edge);
        }

        KeystoneFlowDefinition flow = KeystoneFlowDefinition.builder()
                .id(resolveId(id, document, name))
                .name(name)
                .label(asString(document.get("label")))
                .description(asString(document.get("description")))
                .version(versionOrDefault(document.get("version"), KeystoneWorkflowConstants.DEFAULT_FLOW_VERSION))
                .nodes(nodes)
                .edges(edges)
                .metadata(asMap(document.get("metadata"), "metadata"))
                .build();
        log.debug("Parsed flow definition: id={}, nodes={}, edges={}", flow.getId(), nodes.size(), edges.size());
        return flow;
    }

    private static KeystoneFlowNode parseNode(int index, Object rawNode) {
        Map<String, Object> node = asMap(rawNode, "node at index " + index);
        String nodeId = asString(node.get("id"));
        if (nodeId == null || nodeId.isBlank()) {
            throw new WorkflowParseException("Node at index " + index + " must have an id");
        }
        String rawType = asString(node.get("type"));
        if (rawType == null || rawType.isBlank()) {
            throw new WorkflowParseException("Node \"" + nodeId + "\" must have a type");
        }
        String label = asString(node.get("label"));
        return KeystoneFlowNode.builder()
                .id(nodeId)
                .label(label != null ? label : nodeId)
                .type(KeystoneFlowNodeType.fromWireName(rawType))
                .rawType(rawType.trim())
                .config(asMap(node.get("config"), "config of node \"" + nodeId + "\""))
                .position(asMap(node.get("position"), "position of node \"" + nodeId + "\""))
                .build();
    }

    private static KeystoneFlowEdge parseEdge(int index, Object rawEdge) {
        Map<String, Object> edge = asMap(rawEdge, "edge at index " + index);
        String edgeId = asString(edge.get("id"));
        if (edgeId == null) {
            edgeId = "edge_" + index;
        }
        String source = asString(edge.get("source"));
        String target = asString(edge.get("target"));
        if (source == null || target == null) {
            throw new WorkflowParseException("Edge \"" + edgeId + "\" must have a source and a target");
        }
        return KeystoneFlowEdge.builder()
                .id(edgeId)
                .source(source)
                .target(target)
                .condition(asString(edge.get("condition")))
                .label(asString(edge.get("label")))
                .build();
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    /**
     * Lower-cases the name and collapses every run of other characters than {@code a-z0-9} into {@code _}.
     */
    // explicit id, then the document's own id, then a slug of the name
    private static String resolveId(String id, Map<String, Object> document, String name) {
        if (id != null) {
            return id;
        }
        String documentId = asString(document.get("id"));
        return documentId != null && !documentId.isBlank() ? documentId : generateId(name);
    }

    public static String generateId(String name) {
        return name.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "_")
                .replaceAll("^_+|_+$", "");
    }

    private static KeystoneWorkflowType parseType(Object rawType) {
        String type = asString(rawType);
        try {
            return KeystoneWorkflowType.fromWireName(type);
        } catch (IllegalArgumentException e) {
            throw new WorkflowParseException("Unknown workflow type \"" + type + "\"", e);
        }
    }

    private static String versionOrDefault(Object rawVersion, String defaultVersion) {
        String version = asString(rawVersion);
        return version == null || version.isBlank() ? defaultVersion : version;
    }

    private static Object firstPresent(Map<String, Object> map, String key, String alternativeKey) {
        return map.containsKey(key) ? map.get(key) : map.get(alternativeKey);
    }

    private static String asString(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value, String what) {
        if (value == null) {
            return Collections.emptyMap();
        }
        if (!(value instanceof Map)) {
            throw new WorkflowParseException("Expected a mapping for " + what);
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        ((Map<Object, Object>) value).forEach((key, entry) -> copy.put(String.valueOf(key), entry));
        return copy;
    }

    private static List<?> asList(Object value, String what) {
        if (value == null) {
            return Collections.emptyList();
        }
        if (!(value instanceof List<?> list)) {
            throw new WorkflowParseException("Expected a list for " + what);
        }
        return list;
    }

    private static Map<String, Object> asParams(Object params) {
        if (params == null) {
            return Collections.emptyMap();
        }
        if (params instanceof Map) {
            return asMap(params, "params");
        }
        Map<String, Object> wrapped = new LinkedHashMap<>();
        wrapped.put("value", params);
        return wrapped;
    }
}
