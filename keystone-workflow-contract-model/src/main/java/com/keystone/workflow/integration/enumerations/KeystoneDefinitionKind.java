package com.keystone.workflow.integration.enumerations;

public enum KeystoneDefinitionKind {
    STATE_MACHINE,
    FLOW
}
