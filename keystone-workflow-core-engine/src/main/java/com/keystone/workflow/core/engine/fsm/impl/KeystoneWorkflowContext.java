package com.keystone.workflow.core.engine.fsm.impl;

import com.keystone.workflow.integration.contract.fsm.IKeystoneWorkflowContext;
import com.keystone.workflow.integration.models.definition.fsm.KeystoneStateConfig;
import com.keystone.workflow.integration.models.definition.fsm.KeystoneTransitionConfig;
import com.keystone.workflow.integration.models.definition.fsm.KeystoneWorkflowDefinition;
import com.keystone.workflow.integration.models.instance.KeystoneWorkflowInstance;
import lombok.Getter;
import org.slf4j.Logger;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * Context bound to one instance for one engine call. Writes go straight to {@code instance.data}.
 */
public class KeystoneWorkflowContext implements IKeystoneWorkflowContext {

    @Getter
    private final KeystoneWorkflowInstance instance;
    @Getter
    private final KeystoneWorkflowDefinition definition;
    @Getter
    private final KeystoneStateConfig currentState;
    private final String transitionName;
    private final KeystoneTransitionConfig transition;
    @Getter
    private final Logger logger;

    public KeystoneWorkflowContext(
            KeystoneWorkflowInstance instance,
            KeystoneWorkflowDefinition definition,
            KeystoneStateConfig currentState,
            String transitionName,
            KeystoneTransitionConfig transition,
            Logger logger) {

        this.instance = instance;
        this.definition = definition;
        this.currentState = currentState;
        this.transitionName = transitionName;
        this.transition = transition;
        this.logger = logger;
    }

    public static KeystoneWorkflowContext forState(
            KeystoneWorkflowInstance instance,
            KeystoneWorkflowDefinition definition,
            KeystoneStateConfig state,
            Logger logger) {

        return new KeystoneWorkflowContext(instance, definition, state, null, null, logger);
    }

    @Override
    public Optional<String> getTransitionName() {
        return Optional.ofNullable(transitionName);
    }

    @Override
    public Optional<KeystoneTransitionConfig> getTransition() {
        return Optional.ofNullable(transition);
    }

    @Override
    public Map<String, Object> getData() {
        return Collections.unmodifiableMap(instance.getData());
    }

    @Override
    public Object getData(String key) {
        return instance.getData().get(key);
    }

    @Override
    public void setData(String key, Object value) {
        instance.getData().put(key, value);
    }

    @Override
    public boolean hasData(String key) {
        return instance.getData().containsKey(key);
    }
}
