package com.keystone.workflow.integration.models.definition;

import com.keystone.workflow.integration.enumerations.KeystoneDefinitionKind;

/**
 * Common identity of every registered workflow template, state machine or flow graph.
 */
public interface IKeystoneDefinition {

    String getId();

    String getName();

    String getVersion();

    KeystoneDefinitionKind getKind();
}
