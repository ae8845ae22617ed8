package me.golemcore.agentkernel.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Raw response of the model server: free text plus any tool calls that the
 * server already extracted in its own structured form.
 */
@Value
@Builder
public class ModelResponse {

    String content;
    List<NativeToolCall> nativeToolCalls;
    TokenUsage usage;
    String model;
    String finishReason;

    public List<NativeToolCall> getNativeToolCalls() {
        return nativeToolCalls != null ? nativeToolCalls : List.of();
    }

    public boolean hasNativeToolCalls() {
        return nativeToolCalls != null && !nativeToolCalls.isEmpty();
    }

    /**
     * A tool call in the server's structured form; arguments are a JSON
     * document that still has to be decoded.
     */
    @Value
    @Builder
    public static class NativeToolCall {
        String id;
        String name;
        String arguments;
    }
}
