package com.keystone.workflow.integration.enumerations;

import java.util.Arrays;
import java.util.Locale;

/**
 * Built-in node types of a flow graph, keyed by their wire name.
 * Node types outside this list are carried as {@link #CUSTOM} with their raw type string.
 */
public enum KeystoneFlowNodeType {
    START("start"),
    END("end"),
    DECISION("decision"),
    ASSIGNMENT("assignment"),
    LOOP("loop"),
    CREATE_RECORD("create_record"),
    UPDATE_RECORD("update_record"),
    DELETE_RECORD("delete_record"),
    GET_RECORD("get_record"),
    HTTP_REQUEST("http_request"),
    SCRIPT("script"),
    WAIT("wait"),
    SUBFLOW("subflow"),
    CONNECTOR_ACTION("connector_action"),
    CUSTOM("custom");

    private final String wireName;

    KeystoneFlowNodeType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static KeystoneFlowNodeType fromWireName(String value) {
        if (value == null) {
            return CUSTOM;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.wireName.equals(normalized))
                .findFirst()
                .orElse(CUSTOM);
    }
}
