package com.keystone.workflow.integration.contract.fsm;

import com.keystone.workflow.integration.models.definition.fsm.KeystoneStateConfig;
import com.keystone.workflow.integration.models.definition.fsm.KeystoneTransitionConfig;
import com.keystone.workflow.integration.models.definition.fsm.KeystoneWorkflowDefinition;
import com.keystone.workflow.integration.models.instance.KeystoneWorkflowInstance;
import org.slf4j.Logger;

import java.util.Map;
import java.util.Optional;

/**
 * View handed to guards and actions while the state machine evaluates or performs a transition.
 * <p>
 * Instance data is read and written only through {@link #getData(String)} and
 * {@link #setData(String, Object)}; {@link #getData()} returns a read-only view.
 */
public interface IKeystoneWorkflowContext {

    KeystoneWorkflowInstance getInstance();

    KeystoneWorkflowDefinition getDefinition();

    /**
     * Configuration of the state the instance is in when the hook runs.
     */
    KeystoneStateConfig getCurrentState();

    /**
     * Name of the transition being executed, empty for start, abort and state-entry hooks.
     */
    Optional<String> getTransitionName();

    Optional<KeystoneTransitionConfig> getTransition();

    Map<String, Object> getData();

    Object getData(String key);

    void setData(String key, Object value);

    boolean hasData(String key);

    Logger getLogger();
}
