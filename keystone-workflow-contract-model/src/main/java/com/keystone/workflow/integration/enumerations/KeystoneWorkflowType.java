package com.keystone.workflow.integration.enumerations;

import java.util.Locale;

public enum KeystoneWorkflowType {
    APPROVAL,
    SEQUENTIAL,
    PARALLEL,
    CONDITIONAL;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a type tag, falling back to {@link #SEQUENTIAL} for absent values.
     *
     * @throws IllegalArgumentException for unknown tags
     */
    public static KeystoneWorkflowType fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return SEQUENTIAL;
        }
        return KeystoneWorkflowType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
