package com.keystone.workflow.integration.models.query;

import com.keystone.workflow.integration.enumerations.KeystoneWorkflowStatus;
import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.Set;

/**
 * Filter, sort and paging options for instance queries. Unset fields do not filter.
 */
@Data
@Builder(toBuilder = true)
public class KeystoneInstanceQuery {

    private final String workflowId;

    @Singular
    private final Set<KeystoneWorkflowStatus> statuses;

    private final String startedBy;

    private final SortField sortBy;

    @Builder.Default
    private final SortOrder sortOrder = SortOrder.ASC;

    private final int skip;

    /**
     * Maximum number of results; zero or negative means unlimited.
     */
    private final int limit;

    public static KeystoneInstanceQuery all() {
        return KeystoneInstanceQuery.builder().build();
    }

    public enum SortField {
        CREATED_AT,
        STARTED_AT,
        COMPLETED_AT
    }

    public enum SortOrder {
        ASC,
        DESC
    }
}
