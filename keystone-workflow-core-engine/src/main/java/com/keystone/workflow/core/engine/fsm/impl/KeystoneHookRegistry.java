package com.keystone.workflow.core.engine.fsm.impl;

import com.keystone.workflow.integration.models.definition.fsm.KeystoneHookReference;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name-keyed registry of guards or actions. Named and inline references resolve the same way.
 */
@Slf4j
public class KeystoneHookRegistry<H> {

    private final String hookKind;
    private final Map<String, H> hooks = new ConcurrentHashMap<>();

    public KeystoneHookRegistry(String hookKind) {
        this.hookKind = hookKind;
    }

    public void register(String name, H hook) {
        Objects.requireNonNull(name, hookKind + " name must not be null");
        Objects.requireNonNull(hook, hookKind + " must not be null");
        H previous = hooks.put(name, hook);
        if (previous != null) {
            log.warn("Replaced registered {}: [{}]", hookKind, name);
        } else {
            log.debug("Registered {}: [{}]", hookKind, name);
        }
    }

    public Optional<H> find(KeystoneHookReference reference) {
        if (reference == null || reference.getName() == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(hooks.get(reference.getName()));
    }

    public boolean contains(String name) {
        return name != null && hooks.containsKey(name);
    }

    public String getHookKind() {
        return hookKind;
    }
}
