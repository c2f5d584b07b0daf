package com.keystone.workflow.core.engine;

import com.keystone.workflow.core.engine.approval.IKeystoneApprovalService;
import com.keystone.workflow.core.engine.approval.impl.KeystoneApprovalService;
import com.keystone.workflow.core.engine.config.KeystoneWorkflowEngineConfig;
import com.keystone.workflow.core.engine.definition.KeystoneFlowValidator;
import com.keystone.workflow.core.engine.definition.KeystoneWorkflowValidator;
import com.keystone.workflow.core.engine.flow.IKeystoneFlowEngine;
import com.keystone.workflow.core.engine.flow.impl.KeystoneFlowEngine;
import com.keystone.workflow.core.engine.fsm.IKeystoneStateMachineEngine;
import com.keystone.workflow.core.engine.fsm.impl.KeystoneStateMachineEngine;
import com.keystone.workflow.core.engine.lock.IKeystoneInstanceLockService;
import com.keystone.workflow.core.engine.lock.impl.InMemoryInstanceLockService;
import com.keystone.workflow.core.engine.storage.impl.InMemoryWorkflowStorage;
import com.keystone.workflow.core.exception.definition.WorkflowNotFoundException;
import com.keystone.workflow.core.exception.definition.WorkflowValidationException;
import com.keystone.workflow.integration.contract.storage.IKeystoneWorkflowStorage;
import com.keystone.workflow.integration.models.definition.IKeystoneDefinition;
import com.keystone.workflow.integration.models.definition.flow.KeystoneFlowDefinition;
import com.keystone.workflow.integration.models.definition.fsm.KeystoneWorkflowDefinition;
import com.keystone.workflow.integration.models.flow.KeystoneFlowExecutionResult;
import com.keystone.workflow.integration.models.instance.KeystoneWorkflowInstance;
import com.keystone.workflow.integration.models.query.KeystoneInstanceQuery;
import com.keystone.workflow.integration.models.task.KeystoneDelegationRequest;
import com.keystone.workflow.integration.models.task.KeystoneEscalationRequest;
import com.keystone.workflow.integration.models.task.KeystoneTaskRequest;
import com.keystone.workflow.integration.models.task.KeystoneWorkflowTask;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Default {@link IKeystoneWorkflowRuntime}.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * KeystoneWorkflowRuntime runtime = KeystoneWorkflowRuntime.create();
 * runtime.getStateMachineEngine().registerGuard("isManager",
 *     (context, params) -> Mono.just("manager".equals(context.getData("role"))));
 *
 * runtime.registerWorkflow(KeystoneWorkflowParser.parseStateMachine(yaml)).block();
 * KeystoneWorkflowInstance instance = runtime.startWorkflow("expense_approval", Map.of("amount", 500), "alice").block();
 * runtime.executeTransition(instance.getId(), "submit", "alice", null).block();
 * }</pre>
 */
@Slf4j
@Getter
public class KeystoneWorkflowRuntime implements IKeystoneWorkflowRuntime {

    private static final Duration LOCK_RETRY_INTERVAL = Duration.ofMillis(20);

    private final KeystoneWorkflowEngineConfig config;
    private final IKeystoneWorkflowStorage storage;
    private final IKeystoneStateMachineEngine stateMachineEngine;
    private final IKeystoneFlowEngine flowEngine;
    private final IKeystoneApprovalService approvalService;
    private final IKeystoneInstanceLockService lockService;

    public KeystoneWorkflowRuntime(
            KeystoneWorkflowEngineConfig config,
            IKeystoneWorkflowStorage storage,
            IKeystoneStateMachineEngine stateMachineEngine,
            IKeystoneFlowEngine flowEngine,
            IKeystoneApprovalService approvalService,
            IKeystoneInstanceLockService lockService) {

        config.validate();
        this.config = config;
        this.storage = storage;
        this.stateMachineEngine = stateMachineEngine;
        this.flowEngine = flowEngine;
        this.approvalService = approvalService;
        this.lockService = lockService;
    }

    /**
     * Runtime over in-memory storage and locking with the default configuration.
     */
    public static KeystoneWorkflowRuntime create() {
        return create(KeystoneWorkflowEngineConfig.defaultConfig());
    }

    public static KeystoneWorkflowRuntime create(KeystoneWorkflowEngineConfig config) {
        InMemoryWorkflowStorage storage = InMemoryWorkflowStorage.create();
        return new KeystoneWorkflowRuntime(
                config,
                storage,
                new KeystoneStateMachineEngine(config),
                new KeystoneFlowEngine(config),
                new KeystoneApprovalService(storage, config),
                new InMemoryInstanceLockService(config.getClock(), LOCK_RETRY_INTERVAL));
    }

    // ========================================================================
    // DEFINITIONS
    // ========================================================================

    @Override
    public Mono<KeystoneWorkflowDefinition> registerWorkflow(KeystoneWorkflowDefinition definition) {
        return Mono.defer(() -> {
            List<String> errors = KeystoneWorkflowValidator.validate(definition);
            if (!errors.isEmpty()) {
                log.warn("Rejected workflow definition [{}]: {}", definition.getId(), errors);
                return Mono.<KeystoneWorkflowDefinition>error(new WorkflowValidationException(definition.getId(), errors));
            }

            List<String> unresolved = stateMachineEngine.findUnresolvedReferences(definition);
            if (!unresolved.isEmpty()) {
                if (config.isRejectUnresolvedHooks()) {
                    return Mono.<KeystoneWorkflowDefinition>error(new WorkflowValidationException(definition.getId(),
                            unresolved.stream().map(reference -> "Unregistered " + reference).collect(Collectors.toList())));
                }
                log.warn("Workflow definition [{}] references unregistered hooks: {}", definition.getId(), unresolved);
            }

            return storage.saveDefinition(definition).thenReturn(definition);
        }).doOnNext(saved -> log.info("Registered workflow definition: id={}, version={}", saved.getId(), saved.getVersion()));
    }

    @Override
    public Mono<KeystoneFlowDefinition> registerFlow(KeystoneFlowDefinition flow) {
        return Mono.defer(() -> {
            List<String> errors = new ArrayList<>(KeystoneFlowValidator.validate(flow));
            if (flow.getId() == null || flow.getId().isBlank()) {
                errors.add(0, "Flow must have an ID");
            }

            List<String> missingHandlers = flowEngine.findMissingHandlers(flow);
            missingHandlers.stream()
                    .filter(config::isHandlerRequired)
                    .forEach(type -> errors.add("No handler registered for required node type \"" + type + "\""));

            if (!errors.isEmpty()) {
                log.warn("Rejected flow definition [{}]: {}", flow.getId(), errors);
                return Mono.<KeystoneFlowDefinition>error(new WorkflowValidationException(flow.getId(), errors));
            }
            if (!missingHandlers.isEmpty()) {
                log.warn("Flow definition [{}] uses node types without handlers, they will pass through: {}",
                        flow.getId(), missingHandlers);
            }

            return storage.saveDefinition(flow).thenReturn(flow);
        }).doOnNext(saved -> log.info("Registered flow definition: id={}, version={}", saved.getId(), saved.getVersion()));
    }

    @Override
    public Mono<IKeystoneDefinition> getWorkflow(String workflowId, String version) {
        return storage.getDefinition(workflowId, version);
    }

    @Override
    public Flux<IKeystoneDefinition> listWorkflows() {
        return storage.listDefinitions();
    }

    // ========================================================================
    // STATE MACHINE INSTANCES
    // ========================================================================

    @Override
    public Mono<KeystoneWorkflowInstance> startWorkflow(String workflowId, Map<String, Object> data,
                                                        String startedBy, String version) {
        return loadDefinition(workflowId, version, KeystoneWorkflowDefinition.class)
                .flatMap(definition -> {
                    KeystoneWorkflowInstance instance = stateMachineEngine.createInstance(definition, data, startedBy);
                    return storage.saveInstance(instance)
                            .then(withLock(instance.getId(), "start",
                                    persisting(instance, stateMachineEngine.startInstance(instance, definition))));
                });
    }

    @Override
    public Mono<KeystoneWorkflowInstance> executeTransition(String instanceId, String transitionName,
                                                            String triggeredBy, Map<String, Object> data) {
        return withLock(instanceId, "transition " + transitionName,
                loadInstance(instanceId).flatMap(instance -> definitionOf(instance)
                        .flatMap(definition -> persisting(instance,
                                stateMachineEngine.executeTransition(instance, definition, transitionName, triggeredBy, data)))));
    }

    @Override
    public Mono<KeystoneWorkflowInstance> abortWorkflow(String instanceId, String abortedBy) {
        return withLock(instanceId, "abort",
                loadInstance(instanceId).flatMap(instance -> definitionOf(instance)
                        .flatMap(definition -> persisting(instance,
                                stateMachineEngine.abortInstance(instance, definition, abortedBy)))));
    }

    @Override
    public Mono<KeystoneWorkflowInstance> getWorkflowStatus(String instanceId) {
        return storage.getInstance(instanceId);
    }

    @Override
    public Flux<KeystoneWorkflowInstance> queryWorkflows(KeystoneInstanceQuery query) {
        return storage.queryInstances(query);
    }

    @Override
    public Mono<List<String>> getAvailableTransitions(String instanceId) {
        return loadInstance(instanceId)
                .flatMap(instance -> definitionOf(instance)
                        .map(definition -> stateMachineEngine.getAvailableTransitions(instance, definition)));
    }

    @Override
    public Mono<Boolean> canExecuteTransition(String instanceId, String transitionName) {
        return storage.getInstance(instanceId)
                .flatMap(instance -> storage.getDefinition(instance.getWorkflowId(), instance.getVersion())
                        .filter(KeystoneWorkflowDefinition.class::isInstance)
                        .cast(KeystoneWorkflowDefinition.class)
                        .flatMap(definition -> stateMachineEngine.canExecuteTransition(instance, definition, transitionName)))
                .defaultIfEmpty(false);
    }

    // ========================================================================
    // FLOWS
    // ========================================================================

    @Override
    public Mono<KeystoneFlowExecutionResult> runFlow(String flowId, Map<String, Object> variables,
                                                     String startedBy, String version) {
        return loadDefinition(flowId, version, KeystoneFlowDefinition.class)
                .flatMap(flow -> {
                    KeystoneWorkflowInstance instance = flowEngine.createInstance(flow, variables, startedBy);
                    return storage.saveInstance(instance)
                            .then(withLock(instance.getId(), "run flow",
                                    flowEngine.execute(flow, instance, variables)
                                            .flatMap(result -> writeBack(result.getInstance()).thenReturn(result))
                                            .onErrorResume(error -> writeBack(instance)
                                                    .then(Mono.<KeystoneFlowExecutionResult>error(error)))));
                });
    }

    // ========================================================================
    // TASKS
    // ========================================================================

    @Override
    public Mono<KeystoneWorkflowTask> createTask(KeystoneTaskRequest request) {
        return approvalService.createTask(request);
    }

    @Override
    public Mono<KeystoneWorkflowTask> getTask(String taskId) {
        return approvalService.getTask(taskId);
    }

    @Override
    public Flux<KeystoneWorkflowTask> getInstanceTasks(String instanceId) {
        return approvalService.getInstanceTasks(instanceId);
    }

    @Override
    public Mono<KeystoneWorkflowTask> completeTask(String taskId, Map<String, Object> result) {
        return approvalService.completeTask(taskId, result);
    }

    @Override
    public Mono<KeystoneWorkflowTask> rejectTask(String taskId, Map<String, Object> result) {
        return approvalService.rejectTask(taskId, result);
    }

    @Override
    public Mono<KeystoneWorkflowTask> delegateTask(String taskId, String delegateTo, String delegatedBy, String reason) {
        return approvalService.delegateTask(KeystoneDelegationRequest.builder()
                .taskId(taskId)
                .delegateTo(delegateTo)
                .delegatedBy(delegatedBy)
                .reason(reason)
                .build());
    }

    @Override
    public Mono<KeystoneWorkflowTask> escalateTask(String taskId, String escalateTo, String reason, String escalatedBy) {
        return approvalService.escalateTask(KeystoneEscalationRequest.builder()
                .taskId(taskId)
                .escalateTo(escalateTo)
                .reason(reason)
                .escalatedBy(escalatedBy)
                .build());
    }

    // ========================================================================
    // INTERNALS
    // ========================================================================

    private <T> Mono<T> withLock(String instanceId, String operation, Mono<T> action) {
        String ownerId = UUID.randomUUID().toString();
        return lockService.executeWithLock(instanceId, ownerId,
                config.getLockDuration(), config.getLockWaitTimeout(), operation, action);
    }

    /**
     * Writes the instance back after the engine call, on success and on failure.
     */
    private Mono<KeystoneWorkflowInstance> persisting(KeystoneWorkflowInstance instance,
                                                     Mono<KeystoneWorkflowInstance> operation) {
        return operation
                .flatMap(this::writeBack)
                .onErrorResume(error -> writeBack(instance)
                        .then(Mono.<KeystoneWorkflowInstance>error(error)));
    }

    private Mono<KeystoneWorkflowInstance> writeBack(KeystoneWorkflowInstance instance) {
        return storage.updateInstance(instance.getId(), stored -> overwrite(stored, instance));
    }

    private Mono<KeystoneWorkflowInstance> loadInstance(String instanceId) {
        return storage.getInstance(instanceId)
                .switchIfEmpty(Mono.error(() -> WorkflowNotFoundException.instance(instanceId)));
    }

    private Mono<KeystoneWorkflowDefinition> definitionOf(KeystoneWorkflowInstance instance) {
        return loadDefinition(instance.getWorkflowId(), instance.getVersion(), KeystoneWorkflowDefinition.class);
    }

    private <D extends IKeystoneDefinition> Mono<D> loadDefinition(String id, String version, Class<D> type) {
        return storage.getDefinition(id, version)
                .switchIfEmpty(Mono.error(() -> WorkflowNotFoundException.definition(id, version)))
                .flatMap(definition -> {
                    if (!type.isInstance(definition)) {
                        return Mono.<D>error(new IllegalArgumentException("Definition [" + id + "] is a "
                                + definition.getKind() + " definition, expected " + type.getSimpleName()));
                    }
                    return Mono.just(type.cast(definition));
                });
    }

    private static void overwrite(KeystoneWorkflowInstance target, KeystoneWorkflowInstance instance) {
        KeystoneWorkflowInstance source = instance.copy();
        target.setWorkflowId(source.getWorkflowId());
        target.setVersion(source.getVersion());
        target.setDefinitionKind(source.getDefinitionKind());
        target.setCurrentState(source.getCurrentState());
        target.setStatus(source.getStatus());
        target.setData(source.getData());
        target.setHistory(source.getHistory());
        target.setError(source.getError());
        target.setCreatedAt(source.getCreatedAt());
        target.setStartedAt(source.getStartedAt());
        target.setCompletedAt(source.getCompletedAt());
        target.setAbortedAt(source.getAbortedAt());
        target.setFailedAt(source.getFailedAt());
        target.setStartedBy(source.getStartedBy());
        target.setCompletedBy(source.getCompletedBy());
    }
}
