package com.keystone.workflow.integration.contract.flow;

import com.keystone.workflow.integration.models.definition.flow.KeystoneFlowNode;
import com.keystone.workflow.integration.models.flow.KeystoneFlowNodeResult;
import reactor.core.publisher.Mono;

/**
 * Executes nodes of one type. Registered on the flow engine under the node type name.
 */
@FunctionalInterface
public interface IKeystoneFlowNodeHandler {

    Mono<KeystoneFlowNodeResult> handle(KeystoneFlowNode node, IKeystoneFlowExecutionContext context);
}
