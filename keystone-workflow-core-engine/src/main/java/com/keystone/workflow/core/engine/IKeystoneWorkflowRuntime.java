package com.keystone.workflow.core.engine;

import com.keystone.workflow.core.engine.approval.IKeystoneApprovalService;
import com.keystone.workflow.core.engine.flow.IKeystoneFlowEngine;
import com.keystone.workflow.core.engine.fsm.IKeystoneStateMachineEngine;
import com.keystone.workflow.integration.contract.storage.IKeystoneWorkflowStorage;
import com.keystone.workflow.integration.models.definition.IKeystoneDefinition;
import com.keystone.workflow.integration.models.definition.flow.KeystoneFlowDefinition;
import com.keystone.workflow.integration.models.definition.fsm.KeystoneWorkflowDefinition;
import com.keystone.workflow.integration.models.flow.KeystoneFlowExecutionResult;
import com.keystone.workflow.integration.models.instance.KeystoneWorkflowInstance;
import com.keystone.workflow.integration.models.query.KeystoneInstanceQuery;
import com.keystone.workflow.integration.models.task.KeystoneTaskRequest;
import com.keystone.workflow.integration.models.task.KeystoneWorkflowTask;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Storage-backed entry point combining the engines, the approval service and per-instance locking.
 *
 * <p>Every operation that mutates an instance loads it from storage, runs under the instance lock
 * and writes the result back, also when the engine call fails part way.</p>
 */
public interface IKeystoneWorkflowRuntime {

    IKeystoneStateMachineEngine getStateMachineEngine();

    IKeystoneFlowEngine getFlowEngine();

    IKeystoneApprovalService getApprovalService();

    IKeystoneWorkflowStorage getStorage();

    // ========================================================================
    // DEFINITIONS
    // ========================================================================

    /**
     * Validates and stores a state-machine definition.
     */
    Mono<KeystoneWorkflowDefinition> registerWorkflow(KeystoneWorkflowDefinition definition);

    /**
     * Validates and stores a flow definition.
     */
    Mono<KeystoneFlowDefinition> registerFlow(KeystoneFlowDefinition flow);

    Mono<IKeystoneDefinition> getWorkflow(String workflowId, String version);

    Flux<IKeystoneDefinition> listWorkflows();

    // ========================================================================
    // STATE MACHINE INSTANCES
    // ========================================================================

    Mono<KeystoneWorkflowInstance> startWorkflow(String workflowId, Map<String, Object> data, String startedBy, String version);

    default Mono<KeystoneWorkflowInstance> startWorkflow(String workflowId, Map<String, Object> data, String startedBy) {
        return startWorkflow(workflowId, data, startedBy, null);
    }

    Mono<KeystoneWorkflowInstance> executeTransition(String instanceId, String transitionName,
                                                     String triggeredBy, Map<String, Object> data);

    Mono<KeystoneWorkflowInstance> abortWorkflow(String instanceId, String abortedBy);

    /**
     * @return the stored instance, or empty if none has this id
     */
    Mono<KeystoneWorkflowInstance> getWorkflowStatus(String instanceId);

    Flux<KeystoneWorkflowInstance> queryWorkflows(KeystoneInstanceQuery query);

    Mono<List<String>> getAvailableTransitions(String instanceId);

    /**
     * Emits {@code false} for unknown instances and definitions instead of an error.
     */
    Mono<Boolean> canExecuteTransition(String instanceId, String transitionName);

    // ========================================================================
    // FLOWS
    // ========================================================================

    Mono<KeystoneFlowExecutionResult> runFlow(String flowId, Map<String, Object> variables, String startedBy, String version);

    default Mono<KeystoneFlowExecutionResult> runFlow(String flowId, Map<String, Object> variables, String startedBy) {
        return runFlow(flowId, variables, startedBy, null);
    }

    // ========================================================================
    // TASKS
    // ========================================================================

    Mono<KeystoneWorkflowTask> createTask(KeystoneTaskRequest request);

    Mono<KeystoneWorkflowTask> getTask(String taskId);

    Flux<KeystoneWorkflowTask> getInstanceTasks(String instanceId);

    Mono<KeystoneWorkflowTask> completeTask(String taskId, Map<String, Object> result);

    Mono<KeystoneWorkflowTask> rejectTask(String taskId, Map<String, Object> result);

    Mono<KeystoneWorkflowTask> delegateTask(String taskId, String delegateTo, String delegatedBy, String reason);

    Mono<KeystoneWorkflowTask> escalateTask(String taskId, String escalateTo, String reason, String escalatedBy);
}
