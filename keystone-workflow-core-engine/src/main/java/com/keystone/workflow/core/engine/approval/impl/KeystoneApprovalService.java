package com.keystone.workflow.core.engine.approval.impl;

import com.keystone.workflow.core.engine.approval.IKeystoneApprovalService;
import com.keystone.workflow.core.engine.config.KeystoneWorkflowEngineConfig;
import com.keystone.workflow.core.exception.task.InvalidTaskStateException;
import com.keystone.workflow.core.exception.task.TaskNotFoundException;
import com.keystone.workflow.core.utils.KeystoneIdGenerator;
import com.keystone.workflow.core.utils.KeystoneRequestValidator;
import com.keystone.workflow.integration.constant.KeystoneWorkflowConstants;
import com.keystone.workflow.integration.contract.storage.IKeystoneWorkflowStorage;
import com.keystone.workflow.integration.enumerations.KeystoneWorkflowTaskStatus;
import com.keystone.workflow.integration.models.task.KeystoneApprovalChain;
import com.keystone.workflow.integration.models.task.KeystoneApprovalLevel;
import com.keystone.workflow.integration.models.task.KeystoneDelegationRequest;
import com.keystone.workflow.integration.models.task.KeystoneEscalationRequest;
import com.keystone.workflow.integration.models.task.KeystoneTaskRequest;
import com.keystone.workflow.integration.models.task.KeystoneWorkflowTask;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Storage-backed implementation of {@link IKeystoneApprovalService}.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * KeystoneApprovalService approvals = KeystoneApprovalService.create(storage);
 *
 * KeystoneWorkflowTask task = approvals.createTask(KeystoneTaskRequest.builder()
 *     .instanceId(instance.getId())
 *     .name("manager_review")
 *     .assignedTo("alice")
 *     .build()).block();
 *
 * approvals.delegateTask(KeystoneDelegationRequest.builder()
 *     .taskId(task.getId()).delegateTo("bob").delegatedBy("alice").build()).block();
 *
 * approvals.completeTask(task.getId(), Map.of("approved", true)).block();
 * }</pre>
 *
 * <p>Pending checks run inside the storage update, so two concurrent resolutions of the same task
 * cannot both succeed.</p>
 */
@Slf4j
public class KeystoneApprovalService implements IKeystoneApprovalService {

    private final IKeystoneWorkflowStorage storage;
    private final KeystoneWorkflowEngineConfig config;

    public KeystoneApprovalService(IKeystoneWorkflowStorage storage, KeystoneWorkflowEngineConfig config) {
        this.storage = storage;
        this.config = config;
    }

    public static KeystoneApprovalService create(IKeystoneWorkflowStorage storage) {
        return new KeystoneApprovalService(storage, KeystoneWorkflowEngineConfig.defaultConfig());
    }

    // ========================================================================
    // TASK LIFECYCLE
    // ========================================================================

    @Override
    public Mono<KeystoneWorkflowTask> createTask(KeystoneTaskRequest request) {
        return Mono.fromCallable(() -> KeystoneRequestValidator.validate(request))
                .map(valid -> KeystoneWorkflowTask.builder()
                        .id(KeystoneIdGenerator.next(config.getTaskIdPrefix(), clock()))
                        .instanceId(valid.getInstanceId())
                        .name(valid.getName())
                        .description(valid.getDescription())
                        .assignedTo(valid.getAssignedTo())
                        .status(KeystoneWorkflowTaskStatus.PENDING)
                        .data(valid.getData() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(valid.getData()))
                        .createdAt(clock().instant())
                        .dueDate(valid.getDueDate())
                        .autoEscalate(valid.isAutoEscalate())
                        .escalationTarget(valid.getEscalationTarget())
                        .build())
                .flatMap(task -> storage.saveTask(task).thenReturn(task))
                .doOnNext(task -> log.info("Created task: id={}, instance={}, name={}, assignee={}",
                        task.getId(), task.getInstanceId(), task.getName(), task.getAssignedTo()));
    }

    @Override
    public Mono<KeystoneWorkflowTask> getTask(String taskId) {
        return storage.getTask(taskId);
    }

    @Override
    public Flux<KeystoneWorkflowTask> getInstanceTasks(String instanceId) {
        return storage.getInstanceTasks(instanceId);
    }

    @Override
    public Mono<KeystoneWorkflowTask> completeTask(String taskId, Map<String, Object> result) {
        return resolve(taskId, "complete", KeystoneWorkflowTaskStatus.COMPLETED, result);
    }

    @Override
    public Mono<KeystoneWorkflowTask> rejectTask(String taskId, Map<String, Object> result) {
        return resolve(taskId, "reject", KeystoneWorkflowTaskStatus.REJECTED, result);
    }

    private Mono<KeystoneWorkflowTask> resolve(String taskId, String operation,
                                               KeystoneWorkflowTaskStatus status, Map<String, Object> result) {
        return updatePendingTask(taskId, operation, task -> {
            task.setStatus(status);
            task.setCompletedAt(clock().instant());
            task.setResult(result == null ? null : new LinkedHashMap<>(result));
        }).doOnNext(task -> log.info("Task {}: id={}, actor={}", status, taskId, task.getEffectiveAssignee()));
    }

    // ========================================================================
    // DELEGATION AND ESCALATION
    // ========================================================================

    @Override
    public Mono<KeystoneWorkflowTask> delegateTask(KeystoneDelegationRequest request) {
        return Mono.fromCallable(() -> KeystoneRequestValidator.validate(request))
                .flatMap(valid -> updatePendingTask(valid.getTaskId(), "delegate", task -> {
                    if (task.getOriginalAssignee() == null) {
                        task.setOriginalAssignee(task.getAssignedTo());
                    }
                    task.setDelegatedTo(valid.getDelegateTo());
                    task.setDelegatedBy(valid.getDelegatedBy());
                    task.setDelegationReason(valid.getReason());
                    task.setDelegatedAt(clock().instant());
                }))
                .doOnNext(task -> log.info("Delegated task: id={}, from={}, to={}, by={}",
                        task.getId(), task.getOriginalAssignee(), task.getDelegatedTo(), task.getDelegatedBy()));
    }

    @Override
    public Mono<KeystoneWorkflowTask> escalateTask(KeystoneEscalationRequest request) {
        return Mono.fromCallable(() -> KeystoneRequestValidator.validate(request))
                .flatMap(valid -> updatePendingTask(valid.getTaskId(), "escalate", task -> {
                    String reason = valid.getReason();
                    if (reason == null && valid.isAutomatic()) {
                        reason = KeystoneWorkflowConstants.AUTO_ESCALATION_DEFAULT_REASON;
                    }
                    task.setEscalatedTo(valid.getEscalateTo());
                    task.setEscalationReason(reason);
                    task.setEscalatedBy(valid.getEscalatedBy());
                    task.setEscalatedAt(clock().instant());
                }))
                .doOnNext(task -> log.info("Escalated task: id={}, to={}, reason={}",
                        task.getId(), task.getEscalatedTo(), task.getEscalationReason()));
    }

    @Override
    public Mono<String> effectiveAssignee(String taskId) {
        return getTaskOrError(taskId).mapNotNull(KeystoneWorkflowTask::getEffectiveAssignee);
    }

    // ========================================================================
    // APPROVAL CHAINS
    // ========================================================================

    @Override
    public Mono<List<KeystoneWorkflowTask>> createApprovalChain(String instanceId, KeystoneApprovalChain chain,
                                                               String workflowName) {
        return Mono.fromCallable(() -> KeystoneRequestValidator.validate(chain))
                .flatMapMany(valid -> Flux.fromIterable(valid.getLevels()))
                .concatMap(level -> createLevelTask(instanceId, level, workflowName))
                .collectList()
                .doOnNext(tasks -> log.info("Created approval chain: instance={}, levels={}", instanceId, tasks.size()));
    }

    private Mono<KeystoneWorkflowTask> createLevelTask(String instanceId, KeystoneApprovalLevel level, String workflowName) {
        return Mono.fromCallable(() -> {
            Instant now = clock().instant();
            Map<String, Object> data = new LinkedHashMap<>();
            data.put(KeystoneWorkflowConstants.APPROVAL_LEVEL_KEY, level.getLevel());
            data.put(KeystoneWorkflowConstants.APPROVAL_REQUIRED_KEY, level.isRequired());
            return KeystoneWorkflowTask.builder()
                    .id(KeystoneIdGenerator.next(config.getTaskIdPrefix(), clock()))
                    .instanceId(instanceId)
                    .name(workflowName + KeystoneWorkflowConstants.APPROVAL_TASK_NAME_INFIX + level.getLevel())
                    .description(level.getDescription() != null
                            ? level.getDescription()
                            : "Approval required at level " + level.getLevel())
                    .assignedTo(level.getApprover())
                    .status(KeystoneWorkflowTaskStatus.PENDING)
                    .data(data)
                    .createdAt(now)
                    .autoEscalate(level.getEscalationTarget() != null)
                    .escalationTarget(level.getEscalationTarget())
                    .dueDate(level.getEscalationTimeout() == null ? null : now.plus(level.getEscalationTimeout()))
                    .build();
        }).flatMap(task -> storage.saveTask(task).thenReturn(task));
    }

    @Override
    public Mono<Boolean> isApprovalChainComplete(String instanceId) {
        return storage.getInstanceTasks(instanceId)
                .filter(task -> !Boolean.FALSE.equals(task.getData().get(KeystoneWorkflowConstants.APPROVAL_REQUIRED_KEY)))
                .all(task -> task.getStatus() == KeystoneWorkflowTaskStatus.COMPLETED);
    }

    @Override
    public Mono<Boolean> hasRejectedApproval(String instanceId) {
        return storage.getInstanceTasks(instanceId)
                .any(task -> task.getStatus() == KeystoneWorkflowTaskStatus.REJECTED);
    }

    @Override
    public Flux<KeystoneWorkflowTask> getApprovalHistory(String instanceId) {
        return storage.getInstanceTasks(instanceId)
                .sort(Comparator.comparing(KeystoneWorkflowTask::getCompletedAt,
                        Comparator.nullsLast(Comparator.naturalOrder())));
    }

    @Override
    public Flux<KeystoneWorkflowTask> checkAutoEscalation(Instant now) {
        return storage.listPendingTasks()
                .filter(task -> task.isAutoEscalate()
                        && task.getEscalationTarget() != null
                        && task.getEscalatedTo() == null
                        && task.isOverdue(now))
                .concatMap(task -> escalateTask(KeystoneEscalationRequest.builder()
                        .taskId(task.getId())
                        .escalateTo(task.getEscalationTarget())
                        .reason(KeystoneWorkflowConstants.AUTO_ESCALATION_REASON_PREFIX + task.getDueDate())
                        .automatic(true)
                        .build()));
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    private Mono<KeystoneWorkflowTask> getTaskOrError(String taskId) {
        return storage.getTask(taskId)
                .switchIfEmpty(Mono.error(() -> new TaskNotFoundException(taskId)));
    }

    private Mono<KeystoneWorkflowTask> updatePendingTask(String taskId, String operation,
                                                         Consumer<KeystoneWorkflowTask> mutation) {
        return getTaskOrError(taskId)
                .flatMap(found -> storage.updateTask(taskId, task -> {
                    if (!task.isPending()) {
                        throw new InvalidTaskStateException(operation, taskId, task.getStatus());
                    }
                    mutation.accept(task);
                }))
                .doOnError(InvalidTaskStateException.class,
                        e -> log.warn("Rejected task operation: {}", e.getMessage()));
    }

    private Clock clock() {
        return config.getClock();
    }
}
