package me.golemcore.agentkernel.domain.dispatch;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentkernel.domain.exception.ExceptionMessages;
import me.golemcore.agentkernel.domain.kernel.CancellationToken;
import me.golemcore.agentkernel.domain.model.Message;
import me.golemcore.agentkernel.domain.model.ToolFailureKind;
import me.golemcore.agentkernel.domain.model.ToolResult;
import me.golemcore.agentkernel.domain.model.ToolSchema;
import me.golemcore.agentkernel.port.outbound.ToolSource;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes the tool calls of one turn concurrently, with at most
 * {@code concurrencyLimit} calls in flight.
 *
 * <p>
 * Every call yields exactly one result and results are returned in input
 * order regardless of completion order. Unknown tools are answered without
 * calling {@link ToolSource#execute}. Failures of one call never affect the
 * others.
 */
@Slf4j
public class ToolDispatcher {

    public static final Duration DEFAULT_TOOL_TIMEOUT = Duration.ofSeconds(30);
    private static final long POLL_INTERVAL_MS = 20;
    private static final String CANCELLED_OUTPUT = "cancelled";

    private final ToolSource toolSource;
    private final ExecutorService executor;
    private final Duration toolTimeout;

    public ToolDispatcher(ToolSource toolSource) {
        this(toolSource, Executors.newCachedThreadPool(new ToolThreadFactory()), DEFAULT_TOOL_TIMEOUT);
    }

    public ToolDispatcher(ToolSource toolSource, ExecutorService executor, Duration toolTimeout) {
        this.toolSource = toolSource;
        this.executor = executor;
        this.toolTimeout = toolTimeout != null ? toolTimeout : DEFAULT_TOOL_TIMEOUT;
    }

    public List<ToolResult> dispatch(List<Message.ToolCall> calls, int concurrencyLimit,
            CancellationToken token, DispatchListener listener) {
        return dispatch(calls, concurrencyLimit, token, listener, Map.of());
    }

    /**
     * Dispatches the calls of one turn, passing {@code context} to every
     * {@link ToolSource#execute(Message.ToolCall, Map)} invocation.
     */
    public List<ToolResult> dispatch(List<Message.ToolCall> calls, int concurrencyLimit,
            CancellationToken token, DispatchListener listener, Map<String, Object> context) {
        if (concurrencyLimit < 1) {
            throw new IllegalArgumentException("Concurrency limit must be at least 1, got " + concurrencyLimit);
        }
        DispatchListener events = listener != null ? listener : DispatchListener.NOOP;
        CancellationToken cancellation = token != null ? token : CancellationToken.create();
        ToolResult[] results = new ToolResult[calls.size()];

        Deque<Integer> pending = new ArrayDeque<>();
        for (int i = 0; i < calls.size(); i++) {
            Message.ToolCall call = calls.get(i);
            Optional<ToolSchema> schema;
            try {
                schema = toolSource.resolve(call.getName());
            } catch (RuntimeException e) {
                log.warn("[Dispatch] Failed to resolve tool '{}': {}", call.getName(),
                        ExceptionMessages.safeCauseMessage(e));
                results[i] = executionFailure(call, e, Duration.ZERO);
                notifyResult(events, call, results[i]);
                continue;
            }
            if (schema.isEmpty()) {
                log.warn("[Dispatch] Unknown tool requested: {}", call.getName());
                results[i] = ToolResult.failure(call, ToolFailureKind.UNKNOWN_TOOL,
                        "Unknown tool: " + call.getName(), Duration.ZERO);
                notifyResult(events, call, results[i]);
            } else {
                pending.add(i);
            }
        }

        if (!pending.isEmpty()) {
            Map<String, Object> turnContext = context != null ? context : Map.of();
            runWindow(calls, pending, concurrencyLimit, cancellation, events, results, turnContext);
        }
        return Arrays.asList(results);
    }

    private void runWindow(List<Message.ToolCall> calls, Deque<Integer> pending, int limit,
            CancellationToken token, DispatchListener events, ToolResult[] results, Map<String, Object> context) {
        CompletionService<Completion> completions = new ExecutorCompletionService<>(executor);
        Map<Future<Completion>, InFlight> inFlight = new LinkedHashMap<>();

        while (!pending.isEmpty() && inFlight.size() < limit) {
            submit(calls, pending.poll(), completions, inFlight, events, context);
        }

        while (!inFlight.isEmpty()) {
            if (token.isCancelled()) {
                cancelRemaining(calls, pending, inFlight, events, results);
                return;
            }
            Future<Completion> done;
            try {
                done = completions.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancelRemaining(calls, pending, inFlight, events, results);
                return;
            }

            if (done != null) {
                InFlight entry = inFlight.remove(done);
                if (entry == null) {
                    continue; // already settled by timeout
                }
                results[entry.index()] = collect(calls.get(entry.index()), done, entry);
                notifyResult(events, calls.get(entry.index()), results[entry.index()]);
            }
            expireOverdue(calls, inFlight, events, results);

            while (!pending.isEmpty() && inFlight.size() < limit && !token.isCancelled()) {
                submit(calls, pending.poll(), completions, inFlight, events, context);
            }
        }
        if (!pending.isEmpty()) {
            cancelRemaining(calls, pending, inFlight, events, results);
        }
    }

    private void submit(List<Message.ToolCall> calls, int index, CompletionService<Completion> completions,
            Map<Future<Completion>, InFlight> inFlight, DispatchListener events, Map<String, Object> context) {
        Message.ToolCall call = calls.get(index);
        notifyCall(events, call);
        long startNanos = System.nanoTime();
        Future<Completion> future = completions.submit(() -> execute(call, context));
        inFlight.put(future, new InFlight(index, startNanos));
    }

    private Completion execute(Message.ToolCall call, Map<String, Object> context) {
        long start = System.nanoTime();
        try {
            Object output = toolSource.execute(call, context);
            return new Completion(output, null, Duration.ofNanos(System.nanoTime() - start));
        } catch (Exception e) {
            return new Completion(null, e, Duration.ofNanos(System.nanoTime() - start));
        }
    }

    private ToolResult collect(Message.ToolCall call, Future<Completion> future, InFlight entry) {
        try {
            Completion completion = future.get();
            if (completion.error() == null) {
                log.debug("[Dispatch] Tool '{}' completed in {} ms", call.getName(), completion.duration().toMillis());
                return ToolResult.success(call, completion.output(), completion.duration());
            }
            log.warn("[Dispatch] Tool '{}' failed: {}", call.getName(),
                    ExceptionMessages.safeCauseMessage(completion.error()));
            return executionFailure(call, completion.error(), completion.duration());
        } catch (ExecutionException e) {
            log.warn("[Dispatch] Tool '{}' failed: {}", call.getName(), ExceptionMessages.safeCauseMessage(e));
            return executionFailure(call, e, entry.elapsed());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResult.failure(call, ToolFailureKind.CANCELLED, CANCELLED_OUTPUT, entry.elapsed());
        }
    }

    private void expireOverdue(List<Message.ToolCall> calls, Map<Future<Completion>, InFlight> inFlight,
            DispatchListener events, ToolResult[] results) {
        long timeoutNanos = toolTimeout.toNanos();
        Iterator<Map.Entry<Future<Completion>, InFlight>> iterator = inFlight.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<Future<Completion>, InFlight> entry = iterator.next();
            InFlight state = entry.getValue();
            if (System.nanoTime() - state.startNanos() < timeoutNanos) {
                continue;
            }
            entry.getKey().cancel(true);
            iterator.remove();
            Message.ToolCall call = calls.get(state.index());
            log.warn("[Dispatch] Tool '{}' timed out after {} s", call.getName(), toolTimeout.toSeconds());
            results[state.index()] = ToolResult.failure(call, ToolFailureKind.EXECUTION_FAILED,
                    "Tool execution failed: timed out after " + toolTimeout.toSeconds() + " s", state.elapsed());
            notifyResult(events, call, results[state.index()]);
        }
    }

    private void cancelRemaining(List<Message.ToolCall> calls, Deque<Integer> pending,
            Map<Future<Completion>, InFlight> inFlight, DispatchListener events, ToolResult[] results) {
        log.info("[Dispatch] Cancelling {} in-flight and {} pending call(s)", inFlight.size(), pending.size());
        for (Map.Entry<Future<Completion>, InFlight> entry : inFlight.entrySet()) {
            entry.getKey().cancel(true);
            int index = entry.getValue().index();
            results[index] = ToolResult.failure(calls.get(index), ToolFailureKind.CANCELLED, CANCELLED_OUTPUT,
                    entry.getValue().elapsed());
            notifyResult(events, calls.get(index), results[index]);
        }
        inFlight.clear();
        while (!pending.isEmpty()) {
            int index = pending.poll();
            results[index] = ToolResult.failure(calls.get(index), ToolFailureKind.CANCELLED, CANCELLED_OUTPUT,
                    Duration.ZERO);
            notifyResult(events, calls.get(index), results[index]);
        }
    }

    private static ToolResult executionFailure(Message.ToolCall call, Throwable error, Duration duration) {
        return ToolResult.failure(call, ToolFailureKind.EXECUTION_FAILED,
                "Tool execution failed: " + ExceptionMessages.safeCauseMessage(error), duration);
    }

    private static void notifyCall(DispatchListener events, Message.ToolCall call) {
        try {
            events.onCallIssued(call);
        } catch (RuntimeException e) {
            log.warn("[Dispatch] Listener failed on call '{}': {}", call.getName(), e.getMessage());
        }
    }

    private static void notifyResult(DispatchListener events, Message.ToolCall call, ToolResult result) {
        try {
            events.onResultReceived(call, result);
        } catch (RuntimeException e) {
            log.warn("[Dispatch] Listener failed on result of '{}': {}", call.getName(), e.getMessage());
        }
    }

    private record InFlight(int index, long startNanos) {

        Duration elapsed() {
            return Duration.ofNanos(System.nanoTime() - startNanos);
        }
    }

    private record Completion(Object output, Exception error, Duration duration) {
    }

    /**
     * Daemon worker threads named {@code kernel-tool-N}.
     */
    public static final class ToolThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "kernel-tool-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
