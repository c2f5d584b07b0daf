package com.keystone.workflow.integration.constant;

public interface KeystoneWorkflowConstants {

    String STATE_MACHINE_INSTANCE_ID_PREFIX = "wf_";
    String FLOW_INSTANCE_ID_PREFIX = "flow_";
    String TASK_ID_PREFIX = "task_";

    String DEFAULT_DEFINITION_VERSION = "1.0.0";
    String DEFAULT_FLOW_VERSION = "1";

    int DEFAULT_MAX_NODES = 500;

    /**
     * Suffix of the transition label recorded for a flow hop, appended to the node type.
     */
    String FLOW_TRANSITION_SUFFIX = "→";

    // Approval chain task data keys
    String APPROVAL_LEVEL_KEY = "approvalLevel";
    String APPROVAL_REQUIRED_KEY = "required";
    String APPROVAL_TASK_NAME_INFIX = "_approval_level_";

    String AUTO_ESCALATION_REASON_PREFIX = "Automatic escalation - task overdue since ";
    String AUTO_ESCALATION_DEFAULT_REASON = "Automatic escalation due to timeout";
}
