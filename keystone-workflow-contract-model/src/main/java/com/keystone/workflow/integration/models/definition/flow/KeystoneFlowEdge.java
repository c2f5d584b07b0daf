package com.keystone.workflow.integration.models.definition.flow;

import lombok.Builder;
import lombok.Data;

import java.io.Serializable;

@Data
@Builder(toBuilder = true)
public class KeystoneFlowEdge implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;
    private final String source;
    private final String target;
    private final String condition;
    private final String label;

    public static KeystoneFlowEdge of(String source, String target) {
        return KeystoneFlowEdge.builder().source(source).target(target).build();
    }

    public boolean hasCondition() {
        return condition != null && !condition.isBlank();
    }
}
