package com.keystone.workflow.integration.contract.fsm;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Side effect attached to a state (entry or exit) or to a transition.
 */
@FunctionalInterface
public interface IKeystoneAction {

    Mono<Void> execute(IKeystoneWorkflowContext context, Map<String, Object> params);
}
