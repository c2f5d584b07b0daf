package com.keystone.workflow.integration.contract.flow;

import com.keystone.workflow.integration.models.definition.flow.KeystoneFlowDefinition;
import com.keystone.workflow.integration.models.instance.KeystoneWorkflowInstance;
import org.slf4j.Logger;

import java.util.Map;

/**
 * State shared by the node handlers of one flow execution.
 */
public interface IKeystoneFlowExecutionContext {

    KeystoneFlowDefinition getFlow();

    KeystoneWorkflowInstance getInstance();

    /**
     * Variables of this execution. Handlers should prefer returning output over writing here.
     */
    Map<String, Object> getVariables();

    Object getVariable(String key);

    void setVariable(String key, Object value);

    Logger getLogger();
}
