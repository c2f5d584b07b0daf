package com.keystone.workflow.core.engine.definition;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.keystone.workflow.core.exception.definition.WorkflowParseException;
import com.keystone.workflow.integration.models.definition.IKeystoneDefinition;
import com.keystone.workflow.integration.models.definition.flow.KeystoneFlowDefinition;
import com.keystone.workflow.integration.models.definition.flow.KeystoneFlowEdge;
import com.keystone.workflow.integration.models.definition.flow.KeystoneFlowNode;
import com.keystone.workflow.integration.models.definition.fsm.KeystoneHookReference;
import com.keystone.workflow.integration.models.definition.fsm.KeystoneStateConfig;
import com.keystone.workflow.integration.models.definition.fsm.KeystoneTransitionConfig;
import com.keystone.workflow.integration.models.definition.fsm.KeystoneWorkflowDefinition;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Serialization of workflow definitions to the YAML/JSON document format read by
 * {@link KeystoneWorkflowParser}.
 *
 * <p>Supports:</p>
 * <ul>
 *   <li>State machines with shorthand transitions where a transition has no guards, actions or metadata</li>
 *   <li>Flow graphs with nodes and edges</li>
 *   <li>Human-readable YAML output and indented JSON output</li>
 * </ul>
 */
@Slf4j
public final class KeystoneWorkflowSerializer {

    private static final ObjectMapper JSON_MAPPER;
    private static final ObjectMapper YAML_MAPPER;

    static {
        JSON_MAPPER = new ObjectMapper();
        configureMapper(JSON_MAPPER);

        YAMLFactory yamlFactory = new YAMLFactory()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES);
        YAML_MAPPER = new ObjectMapper(yamlFactory);
        configureMapper(YAML_MAPPER);
    }

    private static void configureMapper(ObjectMapper mapper) {
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.setDefaultPropertyInclusion(
                JsonInclude.Value.construct(JsonInclude.Include.NON_NULL, JsonInclude.Include.NON_NULL));
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    private KeystoneWorkflowSerializer() {
        // Utility class
    }

    public static String toYaml(IKeystoneDefinition definition) {
        try {
            return YAML_MAPPER.writeValueAsString(toDocument(definition));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize workflow definition to YAML: {}", e.getMessage(), e);
            throw new IllegalStateException("Failed to serialize workflow definition to YAML", e);
        }
    }

    public static String toJson(IKeystoneDefinition definition) {
        try {
            return JSON_MAPPER.writeValueAsString(toDocument(definition));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize workflow definition to JSON: {}", e.getMessage(), e);
            throw new IllegalStateException("Failed to serialize workflow definition to JSON", e);
        }
    }

    /**
     * Reads a YAML or JSON document into a map. JSON is read by the YAML mapper as well.
     *
     * @throws WorkflowParseException if the text is not a mapping document
     */
    @SuppressWarnings("unchecked")
    static Map<String, Object> readDocument(String text) {
        if (text == null || text.isBlank()) {
            throw new WorkflowParseException("Invalid workflow definition document");
        }
        Object document;
        try {
            document = YAML_MAPPER.readValue(text, Object.class);
        } catch (JsonProcessingException e) {
            log.debug("Failed to read workflow definition document: {}", e.getOriginalMessage());
            throw new WorkflowParseException("Invalid workflow definition document: " + e.getOriginalMessage(), e);
        }
        if (!(document instanceof Map)) {
            throw new WorkflowParseException("Invalid workflow definition document");
        }
        return (Map<String, Object>) document;
    }

    // ========================================================================
    // DOCUMENT MAPPING
    // ========================================================================

    static Map<String, Object> toDocument(IKeystoneDefinition definition) {
        if (definition instanceof KeystoneWorkflowDefinition stateMachine) {
            return stateMachineToDocument(stateMachine);
        }
        if (definition instanceof KeystoneFlowDefinition flow) {
            return flowToDocument(flow);
        }
        throw new IllegalArgumentException("Unsupported definition type: " + definition.getClass().getName());
    }

    private static Map<String, Object> stateMachineToDocument(KeystoneWorkflowDefinition definition) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("id", definition.getId());
        document.put("name", definition.getName());
        document.put("description", definition.getDescription());
        document.put("type", definition.getType() == null ? null : definition.getType().wireName());
        document.put("version", definition.getVersion());

        Map<String, Object> states = new LinkedHashMap<>();
        definition.getStates().forEach((stateName, state) -> states.put(stateName, stateToDocument(state)));
        document.put("states", states);
        putIfNotEmpty(document, "metadata", definition.getMetadata());
        return document;
    }

    private static Map<String, Object> stateToDocument(KeystoneStateConfig state) {
        Map<String, Object> document = new LinkedHashMap<>();
        if (state.isInitial()) {
            document.put("initial", true);
        }
        if (state.isFinalState()) {
            document.put("final", true);
        }
        putIfNotEmpty(document, "on_enter", hooksToDocument(state.getOnEnter()));
        putIfNotEmpty(document, "on_exit", hooksToDocument(state.getOnExit()));

        Map<String, Object> transitions = new LinkedHashMap<>();
        state.getTransitions().forEach((name, transition) -> transitions.put(name, transitionToDocument(transition)));
        putIfNotEmpty(document, "transitions", transitions);
        putIfNotEmpty(document, "metadata", state.getMetadata());
        return document;
    }

    private static Object transitionToDocument(KeystoneTransitionConfig transition) {
        if (transition.getGuards().isEmpty() && transition.getActions().isEmpty() && transition.getMetadata().isEmpty()) {
            return transition.getTarget();
        }
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("target", transition.getTarget());
        putIfNotEmpty(document, "guards", hooksToDocument(transition.getGuards()));
        putIfNotEmpty(document, "actions", hooksToDocument(transition.getActions()));
        putIfNotEmpty(document, "metadata", transition.getMetadata());
        return document;
    }

    private static List<Object> hooksToDocument(List<KeystoneHookReference> references) {
        return references.stream()
                .map(reference -> {
                    if (!reference.isInline()) {
                        return (Object) reference.getName();
                    }
                    Map<String, Object> inline = new LinkedHashMap<>();
                    inline.put("type", reference.getName());
                    putIfNotEmpty(inline, "params", reference.getParams());
                    return inline;
                })
                .collect(Collectors.toList());
    }

    private static Map<String, Object> flowToDocument(KeystoneFlowDefinition flow) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("id", flow.getId());
        document.put("name", flow.getName());
        document.put("label", flow.getLabel());
        document.put("description", flow.getDescription());
        document.put("version", flow.getVersion());
        document.put("nodes", flow.getNodes().stream()
                .map(KeystoneWorkflowSerializer::nodeToDocument)
                .collect(Collectors.toList()));
        document.put("edges", flow.getEdges().stream()
                .map(KeystoneWorkflowSerializer::edgeToDocument)
                .collect(Collectors.toList()));
        putIfNotEmpty(document, "metadata", flow.getMetadata());
        return document;
    }

    private static Map<String, Object> nodeToDocument(KeystoneFlowNode node) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("id", node.getId());
        document.put("label", node.getLabel());
        document.put("type", node.getTypeName());
        putIfNotEmpty(document, "config", node.getConfig());
        putIfNotEmpty(document, "position", node.getPosition());
        return document;
    }

    private static Map<String, Object> edgeToDocument(KeystoneFlowEdge edge) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("id", edge.getId());
        document.put("source", edge.getSource());
        document.put("target", edge.getTarget());
        document.put("condition", edge.getCondition());
        document.put("label", edge.getLabel());
        return document;
    }

    private static void putIfNotEmpty(Map<String, Object> document, String key, Map<String, ?> value) {
        if (value != null && !value.isEmpty()) {
            document.put(key, value);
        }
    }

    private static void putIfNotEmpty(Map<String, Object> document, String key, List<?> value) {
        if (value != null && !value.isEmpty()) {
            document.put(key, value);
        }
    }
}
