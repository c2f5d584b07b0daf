package com.keystone.workflow.core.engine.fsm.impl;

import com.keystone.workflow.core.engine.config.KeystoneWorkflowEngineConfig;
import com.keystone.workflow.core.engine.fsm.IKeystoneStateMachineEngine;
import com.keystone.workflow.core.exception.definition.WorkflowValidationException;
import com.keystone.workflow.core.exception.fsm.GuardRejectedException;
import com.keystone.workflow.core.exception.fsm.UnknownTransitionException;
import com.keystone.workflow.core.exception.instance.InvalidLifecycleException;
import com.keystone.workflow.core.utils.KeystoneIdGenerator;
import com.keystone.workflow.integration.contract.fsm.IKeystoneAction;
import com.keystone.workflow.integration.contract.fsm.IKeystoneGuard;
import com.keystone.workflow.integration.enumerations.KeystoneDefinitionKind;
import com.keystone.workflow.integration.enumerations.KeystoneWorkflowStatus;
import com.keystone.workflow.integration.models.definition.fsm.KeystoneHookReference;
import com.keystone.workflow.integration.models.definition.fsm.KeystoneStateConfig;
import com.keystone.workflow.integration.models.definition.fsm.KeystoneTransitionConfig;
import com.keystone.workflow.integration.models.definition.fsm.KeystoneWorkflowDefinition;
import com.keystone.workflow.integration.models.instance.KeystoneStateHistoryEntry;
import com.keystone.workflow.integration.models.instance.KeystoneWorkflowInstance;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
public class KeystoneStateMachineEngine implements IKeystoneStateMachineEngine {

    private final KeystoneWorkflowEngineConfig config;
    private final KeystoneHookRegistry<IKeystoneGuard> guards = new KeystoneHookRegistry<>("guard");
    private final KeystoneHookRegistry<IKeystoneAction> actions = new KeystoneHookRegistry<>("action");

    public KeystoneStateMachineEngine() {
        this(KeystoneWorkflowEngineConfig.defaultConfig());
    }

    public KeystoneStateMachineEngine(KeystoneWorkflowEngineConfig config) {
        config.validate();
        this.config = config;
    }

    // ========================================================================
    // REGISTRY
    // ========================================================================

    @Override
    public void registerGuard(String name, IKeystoneGuard guard) {
        guards.register(name, guard);
    }

    @Override
    public void registerAction(String name, IKeystoneAction action) {
        actions.register(name, action);
    }

    // ========================================================================
    // LIFECYCLE
    // ========================================================================

    @Override
    public KeystoneWorkflowInstance createInstance(
            KeystoneWorkflowDefinition definition,
            Map<String, Object> data,
            String startedBy) {

        KeystoneWorkflowInstance instance = KeystoneWorkflowInstance.builder()
                .id(KeystoneIdGenerator.next(config.getStateMachineInstanceIdPrefix(), config.getClock()))
                .workflowId(definition.getId())
                .version(definition.getVersion())
                .definitionKind(KeystoneDefinitionKind.STATE_MACHINE)
                .currentState(definition.getInitialState())
                .status(KeystoneWorkflowStatus.PENDING)
                .data(data == null ? new LinkedHashMap<>() : new LinkedHashMap<>(data))
                .history(new ArrayList<>())
                .createdAt(now())
                .startedBy(startedBy)
                .build();
        log.debug("Created workflow instance: id={}, workflow={}, version={}",
                instance.getId(), definition.getId(), definition.getVersion());
        return instance;
    }

    @Override
    public Mono<KeystoneWorkflowInstance> startInstance(
            KeystoneWorkflowInstance instance,
            KeystoneWorkflowDefinition definition) {

        return Mono.defer(() -> {
            if (instance.getStatus() != KeystoneWorkflowStatus.PENDING) {
                return Mono.error(new InvalidLifecycleException("start", instance.getId(), instance.getStatus()));
            }
            KeystoneStateConfig initialState = requireState(definition, instance.getCurrentState());

            instance.setStatus(KeystoneWorkflowStatus.RUNNING);
            instance.setStartedAt(now());
            log.info("Started workflow instance: id={}, workflow={}, state={}",
                    instance.getId(), definition.getId(), initialState.getName());

            KeystoneWorkflowContext context = KeystoneWorkflowContext.forState(instance, definition, initialState, log);
            return runActions(initialState.getOnEnter(), context, ActionPhase.ON_ENTER)
                    .then(Mono.fromCallable(() -> {
                        if (initialState.isFinalState()) {
                            instance.setStatus(KeystoneWorkflowStatus.COMPLETED);
                            instance.setCompletedAt(now());
                            log.info("Workflow instance completed in its initial state: id={}, state={}",
                                    instance.getId(), initialState.getName());
                        }
                        return instance;
                    }));
        });
    }

    @Override
    public Mono<KeystoneWorkflowInstance> executeTransition(
            KeystoneWorkflowInstance instance,
            KeystoneWorkflowDefinition definition,
            String transitionName,
            String triggeredBy,
            Map<String, Object> data) {

        return Mono.defer(() -> {
            if (instance.getStatus() != KeystoneWorkflowStatus.RUNNING) {
                return Mono.error(new InvalidLifecycleException(
                        "execute transition \"" + transitionName + "\" on", instance.getId(), instance.getStatus()));
            }

            String fromState = instance.getCurrentState();
            KeystoneStateConfig currentState = definition.findState(fromState)
                    .orElseThrow(() -> new UnknownTransitionException(transitionName, fromState));
            KeystoneTransitionConfig transition = currentState.findTransition(transitionName)
                    .orElseThrow(() -> new UnknownTransitionException(transitionName, fromState));
            KeystoneStateConfig targetState = requireState(definition, transition.getTarget());

            KeystoneWorkflowContext context = new KeystoneWorkflowContext(
                    instance, definition, currentState, transitionName, transition, log);

            return checkGuards(transition.getGuards(), context, transitionName)
                    .then(Mono.defer(() -> runActions(currentState.getOnExit(), context, ActionPhase.ON_EXIT)))
                    .then(Mono.defer(() -> runActions(transition.getActions(), context, ActionPhase.TRANSITION)))
                    .then(Mono.fromRunnable(() -> moveToState(instance, fromState, targetState, transitionName, triggeredBy, data)))
                    .then(Mono.defer(() -> runActions(
                            targetState.getOnEnter(),
                            KeystoneWorkflowContext.forState(instance, definition, targetState, log),
                            ActionPhase.ON_ENTER)))
                    .then(Mono.fromCallable(() -> {
                        if (targetState.isFinalState()) {
                            instance.setStatus(KeystoneWorkflowStatus.COMPLETED);
                            instance.setCompletedAt(now());
                            instance.setCompletedBy(triggeredBy);
                            log.info("Workflow instance completed: id={}, state={}, completedBy={}",
                                    instance.getId(), targetState.getName(), triggeredBy);
                        }
                        return instance;
                    }));
        });
    }

    @Override
    public Mono<KeystoneWorkflowInstance> abortInstance(
            KeystoneWorkflowInstance instance,
            KeystoneWorkflowDefinition definition,
            String abortedBy) {

        return Mono.defer(() -> {
            if (instance.getStatus() != KeystoneWorkflowStatus.RUNNING) {
                return Mono.error(new InvalidLifecycleException("abort", instance.getId(), instance.getStatus()));
            }

            Optional<KeystoneStateConfig> currentState = definition.findState(instance.getCurrentState());
            Mono<Void> exitActions = currentState
                    .map(state -> runActions(
                            state.getOnExit(),
                            KeystoneWorkflowContext.forState(instance, definition, state, log),
                            ActionPhase.ON_EXIT))
                    .orElseGet(Mono::empty);

            return exitActions.then(Mono.fromCallable(() -> {
                instance.setStatus(KeystoneWorkflowStatus.ABORTED);
                instance.setAbortedAt(now());
                instance.setCompletedBy(abortedBy);
                log.info("Aborted workflow instance: id={}, state={}, abortedBy={}",
                        instance.getId(), instance.getCurrentState(), abortedBy);
                return instance;
            }));
        });
    }

    // ========================================================================
    // INTROSPECTION
    // ========================================================================

    @Override
    public List<String> getAvailableTransitions(KeystoneWorkflowInstance instance, KeystoneWorkflowDefinition definition) {
        return definition.findState(instance.getCurrentState())
                .map(state -> List.copyOf(state.getTransitions().keySet()))
                .orElse(Collections.emptyList());
    }

    @Override
    public Mono<Boolean> canExecuteTransition(
            KeystoneWorkflowInstance instance,
            KeystoneWorkflowDefinition definition,
            String transitionName) {

        return Mono.defer(() -> {
            if (instance.getStatus() != KeystoneWorkflowStatus.RUNNING) {
                return Mono.just(false);
            }
            Optional<KeystoneStateConfig> currentState = definition.findState(instance.getCurrentState());
            Optional<KeystoneTransitionConfig> transition = currentState.flatMap(state -> state.findTransition(transitionName));
            if (transition.isEmpty() || definition.findState(transition.get().getTarget()).isEmpty()) {
                return Mono.just(false);
            }

            KeystoneWorkflowContext context = new KeystoneWorkflowContext(
                    instance, definition, currentState.get(), transitionName, transition.get(), log);
            return checkGuards(transition.get().getGuards(), context, transitionName)
                    .thenReturn(true);
        }).onErrorResume(throwable -> {
            log.debug("Transition [{}] not executable for instance [{}]: {}",
                    transitionName, instance.getId(), throwable.getMessage());
            return Mono.just(false);
        });
    }

    @Override
    public List<String> findUnresolvedReferences(KeystoneWorkflowDefinition definition) {
        List<String> unresolved = new ArrayList<>();
        definition.getStates().forEach((stateName, state) -> {
            collectUnresolved(unresolved, actions, state.getOnEnter(), "state \"" + stateName + "\" on_enter");
            collectUnresolved(unresolved, actions, state.getOnExit(), "state \"" + stateName + "\" on_exit");
            state.getTransitions().forEach((transitionName, transition) -> {
                String location = "transition \"" + transitionName + "\" of state \"" + stateName + "\"";
                collectUnresolved(unresolved, guards, transition.getGuards(), location);
                collectUnresolved(unresolved, actions, transition.getActions(), location);
            });
        });
        return unresolved;
    }

    // ========================================================================
    // INTERNALS
    // ========================================================================

    private Mono<Void> checkGuards(List<KeystoneHookReference> references, KeystoneWorkflowContext context, String transitionName) {
        if (references == null || references.isEmpty()) {
            return Mono.empty();
        }
        return Flux.fromIterable(references)
                .concatMap(reference -> checkGuard(reference, context, transitionName))
                .then();
    }

    private Mono<Void> checkGuard(KeystoneHookReference reference, KeystoneWorkflowContext context, String transitionName) {
        Optional<IKeystoneGuard> guard = guards.find(reference);
        if (guard.isEmpty()) {
            log.warn("Guard [{}] is not registered, blocking transition [{}] of instance [{}]",
                    reference.getName(), transitionName, context.getInstance().getId());
            return Mono.error(new GuardRejectedException(transitionName, reference.getName(), true));
        }
        return Mono.defer(() -> guard.get().evaluate(context, reference.getParams()))
                .defaultIfEmpty(false)
                .flatMap(passed -> {
                    if (Boolean.TRUE.equals(passed)) {
                        return Mono.<Void>empty();
                    }
                    log.debug("Guard [{}] rejected transition [{}] of instance [{}]",
                            reference.getName(), transitionName, context.getInstance().getId());
                    return Mono.<Void>error(new GuardRejectedException(transitionName, reference.getName(), false));
                });
    }

    private Mono<Void> runActions(List<KeystoneHookReference> references, KeystoneWorkflowContext context, ActionPhase phase) {
        if (references == null || references.isEmpty()) {
            return Mono.empty();
        }
        return Flux.fromIterable(references)
                .concatMap(reference -> runAction(reference, context, phase))
                .then();
    }

    private Mono<Void> runAction(KeystoneHookReference reference, KeystoneWorkflowContext context, ActionPhase phase) {
        Optional<IKeystoneAction> action = actions.find(reference);
        if (action.isEmpty()) {
            log.warn("Action [{}] ({}) is not registered, skipping. instance=[{}]",
                    reference.getName(), phase.getLabel(), context.getInstance().getId());
            return Mono.empty();
        }
        return Mono.defer(() -> action.get().execute(context, reference.getParams()))
                .doOnError(throwable -> log.error("Action [{}] ({}) failed for instance [{}]",
                        reference.getName(), phase.getLabel(), context.getInstance().getId(), throwable));
    }

    private void moveToState(
            KeystoneWorkflowInstance instance,
            String fromState,
            KeystoneStateConfig targetState,
            String transitionName,
            String triggeredBy,
            Map<String, Object> data) {

        instance.setCurrentState(targetState.getName());
        instance.appendHistory(KeystoneStateHistoryEntry.builder()
                .fromState(fromState)
                .toState(targetState.getName())
                .transition(transitionName)
                .timestamp(now())
                .triggeredBy(triggeredBy)
                .data(data == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(data)))
                .build());
        log.info("Workflow instance transitioned: id={}, {} --{}--> {}, triggeredBy={}",
                instance.getId(), fromState, transitionName, targetState.getName(), triggeredBy);
    }

    private KeystoneStateConfig requireState(KeystoneWorkflowDefinition definition, String stateName) {
        return definition.findState(stateName)
                .orElseThrow(() -> new WorkflowValidationException(definition.getId(),
                        List.of("State \"" + stateName + "\" does not exist")));
    }

    private <H> void collectUnresolved(
            List<String> unresolved,
            KeystoneHookRegistry<H> registry,
            List<KeystoneHookReference> references,
            String location) {

        if (references == null) {
            return;
        }
        references.stream()
                .filter(reference -> !registry.contains(reference.getName()))
                .forEach(reference -> unresolved.add(
                        registry.getHookKind() + " \"" + reference.getName() + "\" in " + location));
    }

    private Instant now() {
        return Instant.now(config.getClock());
    }

    private enum ActionPhase {
        ON_ENTER("onEnter"),
        ON_EXIT("onExit"),
        TRANSITION("transition");

        private final String label;

        ActionPhase(String label) {
            this.label = label;
        }

        String getLabel() {
            return label;
        }
    }
}
