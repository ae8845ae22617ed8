package me.golemcore.agentkernel.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Wire-ready request to the model server. Messages and tool descriptors are
 * already rendered by the family codec; the constraint payload is merged into
 * the request body as extra top-level fields.
 */
@Value
@Builder(toBuilder = true)
public class ModelRequest {

    String model;
    List<Map<String, Object>> messages;
    List<Map<String, Object>> tools; // null when tools are rendered inline or absent
    String toolChoice;
    Map<String, Object> constraintPayload;
    Integer maxTokens;
    Double temperature;
    Duration timeout;

    public boolean hasTools() {
        return tools != null && !tools.isEmpty();
    }

    public boolean hasConstraint() {
        return constraintPayload != null && !constraintPayload.isEmpty();
    }
}
