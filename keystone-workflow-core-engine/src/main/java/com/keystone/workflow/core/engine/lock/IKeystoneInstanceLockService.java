package com.keystone.workflow.core.engine.lock;

import com.keystone.workflow.core.exception.lock.WorkflowLockedException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Optional;

/**
 * Serializes operations on a single workflow instance.
 *
 * <p>Locks expire after their duration so that a crashed holder cannot block an instance
 * forever. A holder re-acquiring its own lock refreshes it.</p>
 */
public interface IKeystoneInstanceLockService {

    /**
     * Attempts to take the lock without waiting.
     *
     * @return true if the caller now holds the lock
     */
    Mono<Boolean> tryAcquire(String instanceId, String ownerId, Duration duration, String operation);

    /**
     * Retries {@link #tryAcquire} until it succeeds or {@code waitTimeout} elapses.
     */
    Mono<Boolean> acquireWithWait(String instanceId, String ownerId, Duration duration,
                                  Duration waitTimeout, String operation);

    Mono<Boolean> release(String instanceId, String ownerId);

    Mono<Boolean> isLocked(String instanceId);

    Mono<Optional<KeystoneInstanceLock>> getLockInfo(String instanceId);

    /**
     * Runs {@code action} while holding the lock and releases it on every terminal signal.
     *
     * @throws WorkflowLockedException as an error signal when the lock could not be obtained in time
     */
    default <T> Mono<T> executeWithLock(String instanceId, String ownerId, Duration duration,
                                        Duration waitTimeout, String operation, Mono<T> action) {
        return acquireWithWait(instanceId, ownerId, duration, waitTimeout, operation)
                .flatMap(acquired -> {
                    if (!acquired) {
                        return Mono.error(new WorkflowLockedException(instanceId));
                    }
                    return action.doFinally(signal -> release(instanceId, ownerId).subscribe());
                });
    }
}
