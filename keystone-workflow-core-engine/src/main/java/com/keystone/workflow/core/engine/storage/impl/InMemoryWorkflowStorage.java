package com.keystone.workflow.core.engine.storage.impl;

import com.keystone.workflow.integration.contract.storage.IKeystoneWorkflowStorage;
import com.keystone.workflow.integration.enumerations.KeystoneWorkflowTaskStatus;
import com.keystone.workflow.integration.models.definition.IKeystoneDefinition;
import com.keystone.workflow.integration.models.instance.KeystoneWorkflowInstance;
import com.keystone.workflow.integration.models.query.KeystoneInstanceQuery;
import com.keystone.workflow.integration.models.task.KeystoneWorkflowTask;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * In-memory implementation of the workflow storage port.
 * Suitable for testing and single-process deployments where
 * persistence across restarts is not required.
 *
 * <h2>Characteristics</h2>
 * <ul>
 *   <li>Instances and tasks are copied on the way in and on the way out, so callers never
 *       share mutable state with the store</li>
 *   <li>Definitions are kept per id and version; the most recently saved version is the latest</li>
 *   <li>State is lost on application restart</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * All maps are synchronized. Read-modify-write of a single instance or task is atomic through
 * {@link #updateInstance} and {@link #updateTask}.
 */
@Slf4j
public class InMemoryWorkflowStorage implements IKeystoneWorkflowStorage {

    private final Map<String, Map<String, IKeystoneDefinition>> definitions = new ConcurrentHashMap<>();
    // insertion order is creation order
    private final Map<String, KeystoneWorkflowInstance> instances = Collections.synchronizedMap(new LinkedHashMap<>());
    private final Map<String, KeystoneWorkflowTask> tasks = Collections.synchronizedMap(new LinkedHashMap<>());

    public static InMemoryWorkflowStorage create() {
        return new InMemoryWorkflowStorage();
    }

    // ========================================================================
    // DEFINITIONS
    // ========================================================================

    @Override
    public Mono<Void> saveDefinition(IKeystoneDefinition definition) {
        return Mono.fromRunnable(() -> {
            definitions.compute(definition.getId(), (id, versions) -> {
                // re-inserting moves the version to the end, making it the latest
                Map<String, IKeystoneDefinition> updated = versions == null ? new LinkedHashMap<>() : new LinkedHashMap<>(versions);
                updated.remove(definition.getVersion());
                updated.put(definition.getVersion(), definition);
                return updated;
            });
            log.debug("Saved definition: {} (version: {}, kind: {})",
                    definition.getId(), definition.getVersion(), definition.getKind());
        });
    }

    @Override
    public Mono<IKeystoneDefinition> getDefinition(String id, String version) {
        return Mono.fromCallable(() -> {
            Map<String, IKeystoneDefinition> versions = definitions.get(id);
            if (versions == null || versions.isEmpty()) {
                return null;
            }
            return version == null ? latest(versions) : versions.get(version);
        });
    }

    @Override
    public Flux<IKeystoneDefinition> listDefinitions() {
        return Flux.defer(() -> Flux.fromIterable(definitions.values().stream()
                .filter(versions -> !versions.isEmpty())
                .map(InMemoryWorkflowStorage::latest)
                .toList()));
    }

    private static IKeystoneDefinition latest(Map<String, IKeystoneDefinition> versions) {
        IKeystoneDefinition last = null;
        for (IKeystoneDefinition definition : versions.values()) {
            last = definition;
        }
        return last;
    }

    // ========================================================================
    // INSTANCES
    // ========================================================================

    @Override
    public Mono<Void> saveInstance(KeystoneWorkflowInstance instance) {
        return Mono.fromRunnable(() -> {
            instances.put(instance.getId(), instance.copy());
            log.debug("Saved instance: {} (status: {})", instance.getId(), instance.getStatus());
        });
    }

    @Override
    public Mono<KeystoneWorkflowInstance> getInstance(String id) {
        return Mono.fromCallable(() -> {
            KeystoneWorkflowInstance stored = instances.get(id);
            return stored == null ? null : stored.copy();
        });
    }

    @Override
    public Mono<KeystoneWorkflowInstance> updateInstance(String id, Consumer<KeystoneWorkflowInstance> updates) {
        return Mono.fromCallable(() -> instances.compute(id, (key, existing) -> {
            if (existing == null) {
                throw new IllegalStateException("Workflow instance not found: " + id);
            }
            KeystoneWorkflowInstance updated = existing.copy();
            updates.accept(updated);
            log.debug("Updated instance: {} (status: {})", id, updated.getStatus());
            return updated;
        }).copy());
    }

    @Override
    public Flux<KeystoneWorkflowInstance> queryInstances(KeystoneInstanceQuery query) {
        return Flux.defer(() -> {
            List<KeystoneWorkflowInstance> snapshot;
            synchronized (instances) {
                snapshot = new ArrayList<>(instances.values());
            }
            Stream<KeystoneWorkflowInstance> matching = snapshot.stream()
                    .filter(instance -> query.getWorkflowId() == null || query.getWorkflowId().equals(instance.getWorkflowId()))
                    .filter(instance -> query.getStatuses().isEmpty() || query.getStatuses().contains(instance.getStatus()))
                    .filter(instance -> query.getStartedBy() == null || query.getStartedBy().equals(instance.getStartedBy()));

            if (query.getSortBy() != null) {
                matching = matching.sorted(comparator(query.getSortBy(), query.getSortOrder()));
            }
            matching = matching.skip(Math.max(query.getSkip(), 0));
            if (query.getLimit() > 0) {
                matching = matching.limit(query.getLimit());
            }
            List<KeystoneWorkflowInstance> result = matching.map(KeystoneWorkflowInstance::copy).toList();
            return Flux.fromIterable(result);
        });
    }

    private static Comparator<KeystoneWorkflowInstance> comparator(KeystoneInstanceQuery.SortField field,
                                                                   KeystoneInstanceQuery.SortOrder order) {
        Function<KeystoneWorkflowInstance, Instant> key = switch (field) {
            case CREATED_AT -> KeystoneWorkflowInstance::getCreatedAt;
            case STARTED_AT -> KeystoneWorkflowInstance::getStartedAt;
            case COMPLETED_AT -> KeystoneWorkflowInstance::getCompletedAt;
        };
        Comparator<Instant> direction = order == KeystoneInstanceQuery.SortOrder.DESC
                ? Comparator.reverseOrder()
                : Comparator.naturalOrder();
        return Comparator.comparing(key, Comparator.nullsLast(direction));
    }

    // ========================================================================
    // TASKS
    // ========================================================================

    @Override
    public Mono<Void> saveTask(KeystoneWorkflowTask task) {
        return Mono.fromRunnable(() -> {
            tasks.put(task.getId(), task.copy());
            log.debug("Saved task: {} (instance: {}, status: {})", task.getId(), task.getInstanceId(), task.getStatus());
        });
    }

    @Override
    public Mono<KeystoneWorkflowTask> getTask(String id) {
        return Mono.fromCallable(() -> {
            KeystoneWorkflowTask stored = tasks.get(id);
            return stored == null ? null : stored.copy();
        });
    }

    @Override
    public Mono<KeystoneWorkflowTask> updateTask(String id, Consumer<KeystoneWorkflowTask> updates) {
        return Mono.fromCallable(() -> tasks.compute(id, (key, existing) -> {
            if (existing == null) {
                throw new IllegalStateException("Task not found: " + id);
            }
            KeystoneWorkflowTask updated = existing.copy();
            updates.accept(updated);
            log.debug("Updated task: {} (status: {})", id, updated.getStatus());
            return updated;
        }).copy());
    }

    @Override
    public Flux<KeystoneWorkflowTask> getInstanceTasks(String instanceId) {
        return Flux.defer(() -> Flux.fromIterable(taskSnapshot().stream()
                .filter(task -> instanceId.equals(task.getInstanceId()))
                .map(KeystoneWorkflowTask::copy)
                .toList()));
    }

    @Override
    public Flux<KeystoneWorkflowTask> listPendingTasks() {
        return Flux.defer(() -> Flux.fromIterable(taskSnapshot().stream()
                .filter(task -> task.getStatus() == KeystoneWorkflowTaskStatus.PENDING)
                .map(KeystoneWorkflowTask::copy)
                .toList()));
    }

    private List<KeystoneWorkflowTask> taskSnapshot() {
        synchronized (tasks) {
            return new ArrayList<>(tasks.values());
        }
    }

    /**
     * Clears all stored data (for testing).
     */
    public void reset() {
        definitions.clear();
        instances.clear();
        tasks.clear();
    }
}
