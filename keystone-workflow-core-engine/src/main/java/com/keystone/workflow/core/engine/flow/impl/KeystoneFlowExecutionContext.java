package com.keystone.workflow.core.engine.flow.impl;

import com.keystone.workflow.integration.contract.flow.IKeystoneFlowExecutionContext;
import com.keystone.workflow.integration.models.definition.flow.KeystoneFlowDefinition;
import com.keystone.workflow.integration.models.instance.KeystoneWorkflowInstance;
import lombok.Getter;
import org.slf4j.Logger;

import java.util.LinkedHashMap;
import java.util.Map;

@Getter
public class KeystoneFlowExecutionContext implements IKeystoneFlowExecutionContext {

    private final KeystoneFlowDefinition flow;
    private final KeystoneWorkflowInstance instance;
    private final Map<String, Object> variables;
    private final Logger logger;

    public KeystoneFlowExecutionContext(
            KeystoneFlowDefinition flow,
            KeystoneWorkflowInstance instance,
            Map<String, Object> initialVariables,
            Logger logger) {

        this.flow = flow;
        this.instance = instance;
        this.variables = initialVariables == null ? new LinkedHashMap<>() : new LinkedHashMap<>(initialVariables);
        this.logger = logger;
    }

    @Override
    public Object getVariable(String key) {
        return variables.get(key);
    }

    @Override
    public void setVariable(String key, Object value) {
        variables.put(key, value);
    }

    public void mergeOutput(Map<String, Object> output) {
        if (output != null) {
            variables.putAll(output);
        }
    }
}
