package me.golemcore.agentkernel.domain.model;

public enum KernelEventType {
    RUN_STARTED, REQUEST_ISSUED, RESPONSE_RECEIVED, TOOL_CALL_ISSUED, TOOL_RESULT_RECEIVED, TURN_COMPLETE, RUN_ENDED, ERROR
}
