package com.keystone.workflow.integration.contract.fsm;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Predicate gating a transition. Registered under a name on the state machine engine.
 */
@FunctionalInterface
public interface IKeystoneGuard {

    /**
     * @param context transition being evaluated
     * @param params  parameters of an inline reference, empty for named references
     * @return {@code true} when the transition may proceed
     */
    Mono<Boolean> evaluate(IKeystoneWorkflowContext context, Map<String, Object> params);
}
