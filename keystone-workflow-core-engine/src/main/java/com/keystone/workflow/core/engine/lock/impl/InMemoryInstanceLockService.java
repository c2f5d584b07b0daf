package com.keystone.workflow.core.engine.lock.impl;

import com.keystone.workflow.core.engine.lock.IKeystoneInstanceLockService;
import com.keystone.workflow.core.engine.lock.KeystoneInstanceLock;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of the instance lock service, for single-process deployments.
 */
@Slf4j
public class InMemoryInstanceLockService implements IKeystoneInstanceLockService {

    private static final Duration DEFAULT_RETRY_INTERVAL = Duration.ofMillis(20);

    private final Map<String, KeystoneInstanceLock> locks = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration retryInterval;

    public InMemoryInstanceLockService() {
        this(Clock.systemUTC(), DEFAULT_RETRY_INTERVAL);
    }

    public InMemoryInstanceLockService(Clock clock, Duration retryInterval) {
        this.clock = clock;
        this.retryInterval = retryInterval;
    }

    public static InMemoryInstanceLockService create() {
        return new InMemoryInstanceLockService();
    }

    @Override
    public Mono<Boolean> tryAcquire(String instanceId, String ownerId, Duration duration, String operation) {
        return Mono.fromCallable(() -> tryAcquireSync(instanceId, ownerId, duration, operation));
    }

    /**
     * Synchronous lock acquisition for internal use.
     */
    public boolean tryAcquireSync(String instanceId, String ownerId, Duration duration, String operation) {
        if (instanceId == null || ownerId == null) {
            throw new IllegalArgumentException("instanceId and ownerId cannot be null");
        }
        Instant now = clock.instant();

        return locks.compute(instanceId, (key, existingLock) -> {
            if (existingLock == null) {
                log.debug("Acquiring lock: instanceId={}, owner={}, operation={}", instanceId, ownerId, operation);
                return KeystoneInstanceLock.create(instanceId, ownerId, now, duration, operation);
            }
            if (existingLock.getOwnerId().equals(ownerId)) {
                log.debug("Refreshing lock: instanceId={}, owner={}", instanceId, ownerId);
                return existingLock.extendTo(now.plus(duration));
            }
            if (existingLock.isExpired(now)) {
                log.debug("Taking over expired lock: instanceId={}, previousOwner={}, newOwner={}",
                        instanceId, existingLock.getOwnerId(), ownerId);
                return KeystoneInstanceLock.create(instanceId, ownerId, now, duration, operation);
            }
            log.debug("Lock held by another owner: instanceId={}, holder={}, operation={}",
                    instanceId, existingLock.getOwnerId(), existingLock.getOperation());
            return existingLock;
        }).getOwnerId().equals(ownerId);
    }

    @Override
    public Mono<Boolean> acquireWithWait(String instanceId, String ownerId, Duration duration,
                                         Duration waitTimeout, String operation) {
        return Mono.fromCallable(() -> tryAcquireSync(instanceId, ownerId, duration, operation))
                .filter(Boolean::booleanValue)
                .repeatWhenEmpty(attempts -> attempts.delayElements(retryInterval))
                .timeout(waitTimeout, Mono.fromSupplier(() -> onWaitTimeout(instanceId, ownerId, operation)));
    }

    /**
     * Resolves a timed-out wait. An attempt that completed while the timeout fired still holds the lock,
     * so that case is reported as acquired.
     */
    boolean onWaitTimeout(String instanceId, String ownerId, String operation) {
        KeystoneInstanceLock lock = locks.get(instanceId);
        if (lock != null && lock.getOwnerId().equals(ownerId) && !lock.isExpired(clock.instant())) {
            log.debug("Lock acquired as wait timed out: instanceId={}, owner={}", instanceId, ownerId);
            return true;
        }
        log.warn("Timed out waiting for lock: instanceId={}, owner={}, operation={}",
                instanceId, ownerId, operation);
        return false;
    }

    @Override
    public Mono<Boolean> release(String instanceId, String ownerId) {
        return Mono.fromCallable(() -> {
            if (instanceId == null || ownerId == null) {
                return false;
            }
            boolean[] released = {false};
            locks.computeIfPresent(instanceId, (key, existingLock) -> {
                if (existingLock.getOwnerId().equals(ownerId)) {
                    log.debug("Releasing lock: instanceId={}, owner={}", instanceId, ownerId);
                    released[0] = true;
                    return null;
                }
                log.warn("Cannot release lock - not owner: instanceId={}, holder={}, requester={}",
                        instanceId, existingLock.getOwnerId(), ownerId);
                return existingLock;
            });
            return released[0];
        });
    }

    @Override
    public Mono<Boolean> isLocked(String instanceId) {
        return Mono.fromCallable(() -> {
            KeystoneInstanceLock lock = locks.get(instanceId);
            return lock != null && !lock.isExpired(clock.instant());
        });
    }

    @Override
    public Mono<Optional<KeystoneInstanceLock>> getLockInfo(String instanceId) {
        return Mono.fromCallable(() -> Optional.ofNullable(locks.get(instanceId))
                .filter(lock -> !lock.isExpired(clock.instant())));
    }

    /**
     * Clears all locks (for testing).
     */
    public void reset() {
        locks.clear();
    }
}
