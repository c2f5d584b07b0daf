package com.keystone.workflow.integration.contract.storage;

import com.keystone.workflow.integration.models.definition.IKeystoneDefinition;
import com.keystone.workflow.integration.models.instance.KeystoneWorkflowInstance;
import com.keystone.workflow.integration.models.query.KeystoneInstanceQuery;
import com.keystone.workflow.integration.models.task.KeystoneWorkflowTask;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.function.Consumer;

/**
 * Persistence port for definitions, instances and tasks.
 * Implementations can use any persistence mechanism; the engines only read, mutate and write back.
 *
 * <p>Lookups of absent entities complete empty rather than signalling an error, except for
 * the update operations, which signal {@link IllegalStateException} when nothing is stored under the id.
 */
public interface IKeystoneWorkflowStorage {

    // ========================================================================
    // DEFINITIONS
    // ========================================================================

    Mono<Void> saveDefinition(IKeystoneDefinition definition);

    /**
     * Finds a definition by id and version.
     *
     * @param id      definition id
     * @param version version tag, or {@code null} for the most recently registered version
     */
    Mono<IKeystoneDefinition> getDefinition(String id, String version);

    default Mono<IKeystoneDefinition> getDefinition(String id) {
        return getDefinition(id, null);
    }

    /**
     * Latest registered version of every definition.
     */
    Flux<IKeystoneDefinition> listDefinitions();

    // ========================================================================
    // INSTANCES
    // ========================================================================

    Mono<Void> saveInstance(KeystoneWorkflowInstance instance);

    Mono<KeystoneWorkflowInstance> getInstance(String id);

    /**
     * Applies {@code updates} to the stored instance.
     */
    Mono<KeystoneWorkflowInstance> updateInstance(String id, Consumer<KeystoneWorkflowInstance> updates);

    Flux<KeystoneWorkflowInstance> queryInstances(KeystoneInstanceQuery query);

    // ========================================================================
    // TASKS
    // ========================================================================

    Mono<Void> saveTask(KeystoneWorkflowTask task);

    Mono<KeystoneWorkflowTask> getTask(String id);

    Mono<KeystoneWorkflowTask> updateTask(String id, Consumer<KeystoneWorkflowTask> updates);

    Flux<KeystoneWorkflowTask> getInstanceTasks(String instanceId);

    Flux<KeystoneWorkflowTask> listPendingTasks();
}
