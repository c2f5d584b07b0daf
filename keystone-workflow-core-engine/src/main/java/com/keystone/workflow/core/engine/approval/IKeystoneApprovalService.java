package com.keystone.workflow.core.engine.approval;

import com.keystone.workflow.core.exception.task.InvalidTaskStateException;
import com.keystone.workflow.core.exception.task.TaskNotFoundException;
import com.keystone.workflow.core.exception.task.TaskRequestValidationException;
import com.keystone.workflow.integration.models.task.KeystoneApprovalChain;
import com.keystone.workflow.integration.models.task.KeystoneDelegationRequest;
import com.keystone.workflow.integration.models.task.KeystoneEscalationRequest;
import com.keystone.workflow.integration.models.task.KeystoneTaskRequest;
import com.keystone.workflow.integration.models.task.KeystoneWorkflowTask;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Service for human tasks attached to workflow instances.
 *
 * <p>A task moves from PENDING to COMPLETED or REJECTED exactly once. While pending it can be
 * delegated and escalated any number of times; both keep the task PENDING and record their own
 * audit fields. The service never runs a clock of its own: overdue tasks are escalated only when
 * {@link #checkAutoEscalation(Instant)} is called.</p>
 *
 * <p>Errors are signalled as {@link TaskNotFoundException}, {@link InvalidTaskStateException} and
 * {@link TaskRequestValidationException}.</p>
 */
public interface IKeystoneApprovalService {

    Mono<KeystoneWorkflowTask> createTask(KeystoneTaskRequest request);

    /**
     * @return the task, or empty if no task has this id
     */
    Mono<KeystoneWorkflowTask> getTask(String taskId);

    Flux<KeystoneWorkflowTask> getInstanceTasks(String instanceId);

    Mono<KeystoneWorkflowTask> completeTask(String taskId, Map<String, Object> result);

    Mono<KeystoneWorkflowTask> rejectTask(String taskId, Map<String, Object> result);

    Mono<KeystoneWorkflowTask> delegateTask(KeystoneDelegationRequest request);

    Mono<KeystoneWorkflowTask> escalateTask(KeystoneEscalationRequest request);

    /**
     * The user who should act on the task now: escalation target, else delegate, else assignee.
     */
    Mono<String> effectiveAssignee(String taskId);

    // ========================================================================
    // APPROVAL CHAINS
    // ========================================================================

    /**
     * Creates one pending task per level, in level order.
     */
    Mono<List<KeystoneWorkflowTask>> createApprovalChain(String instanceId, KeystoneApprovalChain chain, String workflowName);

    /**
     * True when every task of the instance not flagged {@code required = false} is completed.
     */
    Mono<Boolean> isApprovalChainComplete(String instanceId);

    Mono<Boolean> hasRejectedApproval(String instanceId);

    /**
     * Tasks of the instance ordered by completion time; unresolved tasks come last.
     */
    Flux<KeystoneWorkflowTask> getApprovalHistory(String instanceId);

    /**
     * Escalates every pending task that is overdue at {@code now}, has auto-escalation enabled,
     * names an escalation target and was not escalated before.
     *
     * @return the escalated tasks
     */
    Flux<KeystoneWorkflowTask> checkAutoEscalation(Instant now);
}
