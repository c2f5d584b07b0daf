package com.keystone.workflow.core.engine.definition;

import com.keystone.workflow.integration.models.definition.fsm.KeystoneStateConfig;
import com.keystone.workflow.integration.models.definition.fsm.KeystoneWorkflowDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Structural checks on a state-machine definition. An empty result means the definition is valid.
 */
public final class KeystoneWorkflowValidator {

    private KeystoneWorkflowValidator() {
        // Utility class
    }

    public static List<String> validate(KeystoneWorkflowDefinition definition) {
        List<String> errors = new ArrayList<>();

        if (isBlank(definition.getId())) {
            errors.add("Workflow must have an ID");
        }
        if (isBlank(definition.getName())) {
            errors.add("Workflow must have a name");
        }
        if (isBlank(definition.getVersion())) {
            errors.add("Workflow must have a version");
        }

        Map<String, KeystoneStateConfig> states = definition.getStates();
        if (states == null || states.isEmpty()) {
            errors.add("Workflow must have at least one state");
            return errors;
        }

        if (isBlank(definition.getInitialState())) {
            errors.add("Workflow must have an initial state");
        } else if (!states.containsKey(definition.getInitialState())) {
            errors.add("Initial state \"" + definition.getInitialState() + "\" does not exist");
        }

        List<String> flaggedInitial = states.entrySet().stream()
                .filter(entry -> entry.getValue().isInitial())
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
        if (flaggedInitial.size() != 1) {
            errors.add("Workflow must have exactly one initial state");
        } else if (!isBlank(definition.getInitialState())
                && !flaggedInitial.get(0).equals(definition.getInitialState())) {
            errors.add("State \"" + flaggedInitial.get(0) + "\" is flagged initial but the initial state is \""
                    + definition.getInitialState() + "\"");
        }

        if (definition.getFinalStates().isEmpty()) {
            errors.add("Workflow must have at least one final state");
        }

        states.forEach((stateName, state) -> state.getTransitions().forEach((transitionName, transition) -> {
            if (isBlank(transition.getTarget())) {
                errors.add("Transition \"" + transitionName + "\" in state \"" + stateName + "\" must have a target state");
            } else if (!states.containsKey(transition.getTarget())) {
                errors.add("Invalid transition \"" + transitionName + "\" in state \"" + stateName
                        + "\": target state \"" + transition.getTarget() + "\" does not exist");
            }
        }));

        return errors;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
