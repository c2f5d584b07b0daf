package com.keystone.workflow.integration.models.task;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;

/**
 * Input for creating a human task.
 */
@Data
@Builder(toBuilder = true)
public class KeystoneTaskRequest {

    @NotBlank(message = "{task.request.instanceId.null}")
    private final String instanceId;

    @NotBlank(message = "{task.request.name.null}")
    @Size(max = 255, message = "{task.request.name.invalid.length}")
    private final String name;

    @Size(max = 2000, message = "{task.request.description.invalid.length}")
    private final String description;

    private final String assignedTo;

    @Builder.Default
    private final Map<String, Object> data = Collections.emptyMap();

    private final Instant dueDate;
    private final boolean autoEscalate;
    private final String escalationTarget;
}
