package com.keystone.workflow.integration.enumerations;

/**
 * How a guard or action is referenced from a definition.
 */
public enum KeystoneHookKind {

    /**
     * Plain registered name, e.g. {@code "isManager"}.
     */
    NAMED,

    /**
     * Inline configuration object {@code {type, params}}; {@code type} is the registered name.
     */
    INLINE
}
