package com.keystone.workflow.core.engine.fsm;

import com.keystone.workflow.integration.contract.fsm.IKeystoneAction;
import com.keystone.workflow.integration.contract.fsm.IKeystoneGuard;
import com.keystone.workflow.integration.models.definition.fsm.KeystoneWorkflowDefinition;
import com.keystone.workflow.integration.models.instance.KeystoneWorkflowInstance;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Executes state-machine workflows one transition at a time.
 *
 * <p>The engine mutates the instance it is given and performs no locking; callers serialize
 * operations on the same instance. Guards and actions of one call run strictly one after another.
 *
 * <h2>Transition Order</h2>
 * <ol>
 *   <li>Guards, in order; the first failing or unregistered guard blocks the transition</li>
 *   <li>{@code onExit} actions of the current state</li>
 *   <li>Actions of the transition</li>
 *   <li>{@code currentState} update and history entry</li>
 *   <li>{@code onEnter} actions of the target state</li>
 *   <li>Completion when the target state is final</li>
 * </ol>
 *
 * <p>Unregistered actions are logged and skipped. An action error aborts the call and is
 * propagated unchanged; the instance keeps whatever mutations happened before it.
 */
public interface IKeystoneStateMachineEngine {

    void registerGuard(String name, IKeystoneGuard guard);

    void registerAction(String name, IKeystoneAction action);

    /**
     * Creates a pending instance positioned on the initial state. No hooks run.
     */
    KeystoneWorkflowInstance createInstance(KeystoneWorkflowDefinition definition, Map<String, Object> data, String startedBy);

    /**
     * Moves a pending instance to running and runs the initial state's {@code onEnter} actions.
     * An instance whose initial state is final completes immediately.
     */
    Mono<KeystoneWorkflowInstance> startInstance(KeystoneWorkflowInstance instance, KeystoneWorkflowDefinition definition);

    Mono<KeystoneWorkflowInstance> executeTransition(
            KeystoneWorkflowInstance instance,
            KeystoneWorkflowDefinition definition,
            String transitionName,
            String triggeredBy,
            Map<String, Object> data);

    default Mono<KeystoneWorkflowInstance> executeTransition(
            KeystoneWorkflowInstance instance,
            KeystoneWorkflowDefinition definition,
            String transitionName) {
        return executeTransition(instance, definition, transitionName, null, null);
    }

    /**
     * Runs the current state's {@code onExit} actions, then marks the running instance aborted.
     */
    Mono<KeystoneWorkflowInstance> abortInstance(KeystoneWorkflowInstance instance, KeystoneWorkflowDefinition definition, String abortedBy);

    /**
     * Transition names of the current state, in declaration order. Guards are not evaluated.
     */
    List<String> getAvailableTransitions(KeystoneWorkflowInstance instance, KeystoneWorkflowDefinition definition);

    /**
     * Evaluates the guards of a transition without running actions. Emits {@code false}
     * instead of an error for anything that would make the transition fail.
     */
    Mono<Boolean> canExecuteTransition(KeystoneWorkflowInstance instance, KeystoneWorkflowDefinition definition, String transitionName);

    /**
     * Guard and action references of the definition that have no registered implementation.
     */
    List<String> findUnresolvedReferences(KeystoneWorkflowDefinition definition);
}
