package com.keystone.workflow.core.engine.lock;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.time.Instant;

/**
 * Lock held on a workflow instance while an operation mutates it.
 */
@Data
@Builder(toBuilder = true)
public class KeystoneInstanceLock {

    private final String instanceId;
    private final String ownerId;
    private final Instant acquiredAt;
    private final Instant expiresAt;

    /**
     * The operation that acquired the lock, for diagnostics.
     */
    private final String operation;

    public boolean isExpired(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    public KeystoneInstanceLock extendTo(Instant newExpiry) {
        return toBuilder().expiresAt(newExpiry).build();
    }

    public static KeystoneInstanceLock create(String instanceId, String ownerId, Instant now,
                                              Duration duration, String operation) {
        return KeystoneInstanceLock.builder()
                .instanceId(instanceId)
                .ownerId(ownerId)
                .acquiredAt(now)
                .expiresAt(now.plus(duration))
                .operation(operation)
                .build();
    }
}
