package me.golemcore.agentkernel.domain.kernel;

import me.golemcore.agentkernel.domain.model.Message;

import java.util.HashSet;
import java.util.Set;

/**
 * Keeps tool call ids unique within one run. Servers sometimes omit ids or
 * reuse them across turns (e.g. {@code call_0}); such calls get a fresh id.
 */
final class ToolCallIds {

    private final Set<String> seen = new HashSet<>();

    Message.ToolCall ensureUnique(Message.ToolCall call) {
        String id = call.getId();
        if (id != null && !id.isBlank() && seen.add(id)) {
            return call;
        }
        String fresh = Message.ToolCall.newId();
        while (!seen.add(fresh)) {
            fresh = Message.ToolCall.newId();
        }
        return new Message.ToolCall(fresh, call.getName(), call.getArguments());
    }
}
