package me.golemcore.agentkernel.domain.kernel;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentkernel.domain.codec.MessageCodec;
import me.golemcore.agentkernel.domain.codec.ParsedResponse;
import me.golemcore.agentkernel.domain.dispatch.DispatchListener;
import me.golemcore.agentkernel.domain.dispatch.ToolDispatcher;
import me.golemcore.agentkernel.domain.exception.ExceptionMessages;
import me.golemcore.agentkernel.domain.exception.GrammarSchemaException;
import me.golemcore.agentkernel.domain.exception.KernelCancelledException;
import me.golemcore.agentkernel.domain.exception.KernelConfigurationException;
import me.golemcore.agentkernel.domain.exception.KernelException;
import me.golemcore.agentkernel.domain.exception.MalformedResponseException;
import me.golemcore.agentkernel.domain.exception.ModelTransportException;
import me.golemcore.agentkernel.domain.grammar.GrammarArtifact;
import me.golemcore.agentkernel.domain.grammar.GrammarPipeline;
import me.golemcore.agentkernel.domain.grammar.GrammarStrategy;
import me.golemcore.agentkernel.domain.grammar.ParsedCall;
import me.golemcore.agentkernel.domain.history.KeepAllHistoryStrategy;
import me.golemcore.agentkernel.domain.model.KernelErrorKind;
import me.golemcore.agentkernel.domain.model.KernelEvent;
import me.golemcore.agentkernel.domain.model.KernelEventType;
import me.golemcore.agentkernel.domain.model.Message;
import me.golemcore.agentkernel.domain.model.ModelRequest;
import me.golemcore.agentkernel.domain.model.ModelResponse;
import me.golemcore.agentkernel.domain.model.RunResult;
import me.golemcore.agentkernel.domain.model.StepResult;
import me.golemcore.agentkernel.domain.model.TokenUsage;
import me.golemcore.agentkernel.domain.model.ToolFailureKind;
import me.golemcore.agentkernel.domain.model.ToolResult;
import me.golemcore.agentkernel.domain.model.ToolSchema;
import me.golemcore.agentkernel.domain.observer.NullKernelObserver;
import me.golemcore.agentkernel.port.outbound.ContextProvider;
import me.golemcore.agentkernel.port.outbound.HistoryStrategy;
import me.golemcore.agentkernel.port.outbound.KernelObserver;
import me.golemcore.agentkernel.port.outbound.ModelClient;
import me.golemcore.agentkernel.port.outbound.ToolSource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Turn-loop orchestrator.
 *
 * <p>
 * Each turn builds the grammar constraint for the current tool set, sends the
 * formatted history to the model, parses the calls out of the response,
 * dispatches them concurrently and appends one tool message per call in the
 * order the calls were issued. The run ends when the model makes no
 * well-formed call, the turn limit is reached, a termination condition
 * matches a result, or a fatal error occurs. {@link #run} reports fatal
 * errors in the result instead of throwing them; {@link #step} executes one
 * turn and throws them.
 */
@Slf4j
public class AgentKernel {

    private static final long POLL_INTERVAL_MS = 20;
    private static final String INVALID_CALL_NAME = "invalid_tool_call";

    private final ModelClient modelClient;
    private final ToolSource toolSource;
    private final MessageCodec codec;
    private final GrammarPipeline grammarPipeline;
    private final ToolDispatcher toolDispatcher;
    private final HistoryStrategy historyStrategy;
    private final KernelObserver observer;
    private final KernelSettings settings;
    private final Predicate<ToolResult> terminationCondition;
    private final ContextProvider contextProvider;
    private final Clock clock;
    private final List<ToolSchema> initialTools;

    @Builder
    public AgentKernel(ModelClient modelClient, ToolSource toolSource, MessageCodec codec,
            GrammarPipeline grammarPipeline, ToolDispatcher toolDispatcher, HistoryStrategy historyStrategy,
            KernelObserver observer, KernelSettings settings, Predicate<ToolResult> terminationCondition,
            ContextProvider contextProvider, Clock clock) {
        if (modelClient == null || toolSource == null || codec == null) {
            throw new KernelConfigurationException("modelClient, toolSource and codec are required");
        }
        this.modelClient = modelClient;
        this.toolSource = toolSource;
        this.codec = codec;
        this.grammarPipeline = grammarPipeline != null ? grammarPipeline : GrammarPipeline.standard(new ObjectMapper());
        this.toolDispatcher = toolDispatcher != null ? toolDispatcher : new ToolDispatcher(toolSource);
        this.historyStrategy = historyStrategy != null ? historyStrategy : new KeepAllHistoryStrategy();
        this.observer = observer != null ? observer : NullKernelObserver.INSTANCE;
        this.settings = settings != null ? settings : KernelSettings.defaults();
        this.terminationCondition = terminationCondition;
        this.contextProvider = contextProvider;
        this.clock = clock != null ? clock : Clock.systemUTC();
        validate(this.settings);
        this.initialTools = List.copyOf(toolSource.listTools());
    }

    private void validate(KernelSettings config) {
        if (config.getMaxTurns() < 1) {
            throw new KernelConfigurationException("max-turns must be at least 1, got " + config.getMaxTurns());
        }
        if (config.getToolConcurrencyLimit() < 1) {
            throw new KernelConfigurationException(
                    "tool-concurrency-limit must be at least 1, got " + config.getToolConcurrencyLimit());
        }
        if (config.getEmptyResponseRetries() < 0) {
            throw new KernelConfigurationException("empty-response-retries must not be negative");
        }
        if (!isPositive(config.getRunTimeout()) || !isPositive(config.getModelCallTimeout())) {
            throw new KernelConfigurationException("run-timeout and model-call-timeout must be positive");
        }
        if (config.getGrammarStrategy() == null) {
            throw new KernelConfigurationException("grammar-strategy is required");
        }
        requireSupported(config.getGrammarStrategy());
        if (config.getGrammarFallbackStrategy() != null) {
            requireSupported(config.getGrammarFallbackStrategy());
        }
    }

    private void requireSupported(GrammarStrategy strategy) {
        if (!codec.supports(strategy)) {
            throw new KernelConfigurationException("Model family " + codec.family()
                    + " does not support grammar strategy '" + strategy.getValue() + "'");
        }
        if (!grammarPipeline.supports(strategy)) {
            throw new KernelConfigurationException("No grammar codec for strategy '" + strategy.getValue() + "'");
        }
    }

    private static boolean isPositive(Duration duration) {
        return duration != null && !duration.isNegative() && !duration.isZero();
    }

    public RunResult run(List<Message> initialMessages) {
        return run(initialMessages, RunOptions.defaults());
    }

    public RunResult run(List<Message> initialMessages, CancellationToken cancellation) {
        return run(initialMessages, RunOptions.builder().cancellation(cancellation).build());
    }

    /**
     * Runs with only the named tools on offer. Calls to any other tool are
     * answered with an unknown-tool result.
     */
    public RunResult run(List<Message> initialMessages, Collection<String> toolNames,
            CancellationToken cancellation) {
        return run(initialMessages, RunOptions.builder()
                .toolNames(toolNames != null ? List.copyOf(toolNames) : null)
                .cancellation(cancellation)
                .build());
    }

    public RunResult run(List<Message> initialMessages, RunOptions options) {
        RunOptions opts = options != null ? options : RunOptions.defaults();
        int maxTurns = opts.getMaxTurns() != null ? opts.getMaxTurns() : settings.getMaxTurns();
        if (maxTurns < 1) {
            throw new KernelConfigurationException("max-turns must be at least 1, got " + maxTurns);
        }
        Instant startedAt = clock.instant();
        RunState run = new RunState(UUID.randomUUID().toString());
        CancellationToken token = (opts.getCancellation() != null ? opts.getCancellation() : CancellationToken.create())
                .withDeadline(startedAt.plus(settings.getRunTimeout()), clock);
        HistoryWriter history = new DefaultHistoryWriter(clock, initialMessages);
        Predicate<ToolResult> termination = opts.getTerminationCondition() != null
                ? opts.getTerminationCondition()
                : terminationCondition;
        ContextProvider context = opts.getContextProvider() != null ? opts.getContextProvider() : contextProvider;

        try {
            ToolSelection selection = new ToolSelection(opts.getToolNames());
            log.info("[Kernel] Run {} started: family={}, strategy={}, tools={}, maxTurns={}", run.runId,
                    codec.family(), settings.getGrammarStrategy().getValue(), selection.initial().size(), maxTurns);
            emit(run, KernelEventType.RUN_STARTED, payload(
                    "messages", history.messages().size(),
                    "tools", selection.initial().size(),
                    "strategy", settings.getGrammarStrategy().getValue()));
            loop(run, history, token, new RunLimits(maxTurns, termination, context, selection));
        } catch (KernelException e) {
            fail(run, e.getKind(), e.getMessage(), e);
        } catch (RuntimeException e) {
            fail(run, KernelErrorKind.INTERNAL, ExceptionMessages.safeCauseMessage(e), e);
        }

        List<Message> messages = history.messages();
        RunResult result = RunResult.builder()
                .runId(run.runId)
                .finalMessage(messages.isEmpty() ? null : messages.get(messages.size() - 1))
                .history(messages)
                .turns(run.turn)
                .terminationReason(run.state.getTerminationReason())
                .usage(run.usage)
                .duration(Duration.between(startedAt, clock.instant()))
                .finalToolResult(run.finalToolResult)
                .errorKind(run.errorKind)
                .error(run.error)
                .build();

        log.info("[Kernel] Run {} ended: reason={}, turns={}, tokens={}", run.runId,
                result.getTerminationReason(), result.getTurns(), run.usage.getTotalTokens());
        emit(run, KernelEventType.RUN_ENDED, payload(
                "reason", result.getTerminationReason().name(),
                "turns", result.getTurns(),
                "errorKind", run.errorKind != null ? run.errorKind.name() : null));
        return result;
    }

    public StepResult step(List<Message> messages, List<ToolSchema> tools) {
        return step(messages, tools, Map.of(), CancellationToken.create());
    }

    /**
     * Executes one turn against {@code messages}: one model call, then the
     * calls it made, restricted to {@code tools}. Nothing is retained between
     * steps and failures are thrown as {@link KernelException}.
     *
     * @param context
     *            passed to every tool of this turn; a string under
     *            {@link ContextProvider#MODEL_OVERRIDE} replaces the model
     */
    public StepResult step(List<Message> messages, List<ToolSchema> tools, Map<String, Object> context,
            CancellationToken cancellation) {
        RunState run = new RunState(UUID.randomUUID().toString());
        run.turn = 1;
        List<ToolSchema> offered = tools != null ? List.copyOf(tools) : List.of();
        return executeStep(run, messages != null ? messages : List.of(), offered, true,
                context != null ? context : Map.of(),
                cancellation != null ? cancellation : CancellationToken.create());
    }

    private void loop(RunState run, HistoryWriter history, CancellationToken token, RunLimits limits) {
        List<ToolSchema> tools = limits.selection().initial();
        while (run.state == KernelState.RUNNING) {
            checkCancelled(token);
            run.turn++;
            if (settings.isRefreshToolsEachTurn()) {
                tools = limits.selection().current();
            }

            Map<String, Object> context = buildContext(limits.contextProvider());
            StepResult step = executeStep(run, history.messages(), tools, limits.selection().isSubset(), context,
                    token);
            history.appendAssistant(step.getResponseMessage().getContent(), step.getToolCalls());
            if (!step.hasToolCalls()) {
                run.state = KernelState.DONE_NO_CALLS;
                return;
            }
            step.getToolResults().forEach(history::appendToolResult);

            checkCancelled(token);
            ToolResult terminal = findTerminal(limits.terminationCondition(), step.getToolResults());
            if (terminal != null) {
                log.info("[Kernel] Termination condition matched result of '{}'", terminal.getToolName());
                run.finalToolResult = terminal;
                run.state = KernelState.DONE_TERMINATION_TOOL;
                return;
            }

            history.replaceWith(historyStrategy.trim(history.messages()));
            if (run.turn >= limits.maxTurns()) {
                log.info("[Kernel] Turn limit reached ({})", limits.maxTurns());
                run.state = KernelState.DONE_MAX_TURNS;
            }
        }
    }

    private StepResult executeStep(RunState run, List<Message> messages, List<ToolSchema> tools,
            boolean restrictToOffered, Map<String, Object> context, CancellationToken token) {
        GrammarArtifact artifact = buildArtifact(tools);
        ModelRequest request = buildRequest(messages, tools, artifact, modelOverride(context));
        log.debug("[Kernel] Turn {}: requesting model {} with {} messages, {} tools", run.turn,
                request.getModel(), request.getMessages().size(), tools.size());
        emit(run, KernelEventType.REQUEST_ISSUED, payload(
                "messages", request.getMessages().size(),
                "tools", tools.size(),
                "strategy", artifact != null ? artifact.getStrategy().getValue() : GrammarStrategy.NONE.getValue(),
                "model", request.getModel()));

        ModelResponse response = complete(request, token);
        TokenUsage usage = response.getUsage() != null ? response.getUsage() : TokenUsage.ZERO;
        run.usage = run.usage.plus(usage);
        ParsedResponse parsed = codec.parse(response, artifact);
        TurnCalls turnCalls = parsed.hasWellFormedCalls()
                ? assignCalls(parsed.calls(), run.callIds, restrictToOffered ? tools : null)
                : TurnCalls.NONE;

        Message responseMessage = Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .content(parsed.content())
                .toolCalls(turnCalls.calls().isEmpty() ? null : turnCalls.calls())
                .timestamp(clock.instant())
                .build();
        emit(run, KernelEventType.RESPONSE_RECEIVED, payload(
                "calls", turnCalls.calls().size(),
                "parseErrors", turnCalls.presetResults().size(),
                "finishReason", response.getFinishReason()));

        if (turnCalls.calls().isEmpty()) {
            return StepResult.builder()
                    .responseMessage(responseMessage)
                    .toolCalls(List.of())
                    .toolResults(List.of())
                    .usage(usage)
                    .build();
        }

        List<ToolResult> results = executeCalls(run, turnCalls, context, token);
        long errors = results.stream().filter(ToolResult::isError).count();
        log.debug("[Kernel] Turn {}: {} call(s) completed, {} error(s)", run.turn, results.size(), errors);
        emit(run, KernelEventType.TURN_COMPLETE, payload(
                "calls", turnCalls.calls().size(),
                "results", results.size(),
                "errors", errors));
        return StepResult.builder()
                .responseMessage(responseMessage)
                .toolCalls(turnCalls.calls())
                .toolResults(List.copyOf(results))
                .usage(usage)
                .build();
    }

    private Map<String, Object> buildContext(ContextProvider provider) {
        Map<String, Object> context = new LinkedHashMap<>();
        if (provider != null) {
            putAll(context, provider.provide());
        }
        for (ContextProvider sourceProvider : toolSource.contextProviders()) {
            putAll(context, sourceProvider.provide());
        }
        return Collections.unmodifiableMap(context);
    }

    private static void putAll(Map<String, Object> target, Map<String, Object> values) {
        if (values != null) {
            values.forEach((key, value) -> {
                if (key != null && value != null) {
                    target.put(key, value);
                }
            });
        }
    }

    private static String modelOverride(Map<String, Object> context) {
        Object override = context.get(ContextProvider.MODEL_OVERRIDE);
        return override instanceof String model && !model.isBlank() ? model : null;
    }

    private GrammarArtifact buildArtifact(List<ToolSchema> tools) {
        try {
            return grammarPipeline.build(tools, settings.getGrammarStrategy());
        } catch (GrammarSchemaException e) {
            GrammarStrategy fallback = settings.getGrammarFallbackStrategy();
            if (fallback == null) {
                throw e;
            }
            log.warn("[Kernel] {} strategy rejected tool '{}', falling back to {}: {}",
                    settings.getGrammarStrategy().getValue(), e.getToolName(), fallback.getValue(), e.getMessage());
            return grammarPipeline.build(tools, fallback);
        }
    }

    private ModelRequest buildRequest(List<Message> messages, List<ToolSchema> tools, GrammarArtifact artifact,
            String modelOverride) {
        return codec.format(messages, tools, artifact).toBuilder()
                .model(modelOverride != null ? modelOverride : settings.getModel())
                .maxTokens(settings.getMaxTokens())
                .temperature(settings.getTemperature())
                .toolChoice(tools.isEmpty() ? null : settings.getToolChoice())
                .timeout(settings.getModelCallTimeout())
                .build();
    }

    private ModelResponse complete(ModelRequest request, CancellationToken token) {
        TransportRetryPolicy retryPolicy = settings.getRetryPolicy();
        int failures = 0;
        int emptyResponses = 0;
        while (true) {
            try {
                ModelResponse response = awaitResponse(request, token);
                if (response != null) {
                    return response;
                }
                emptyResponses++;
                if (emptyResponses > settings.getEmptyResponseRetries()) {
                    throw new MalformedResponseException(
                            "Model returned no response after " + emptyResponses + " attempt(s)");
                }
                log.warn("[Kernel] Empty model response, retrying ({}/{})", emptyResponses,
                        settings.getEmptyResponseRetries());
            } catch (ModelTransportException e) {
                failures++;
                if (!e.isRetryable() || !retryPolicy.allowsRetryAfter(failures)) {
                    throw e;
                }
                Duration backoff = retryPolicy.backoffAfter(failures);
                log.warn("[Kernel] Model call failed (attempt {}/{}), retrying in {} ms: {}", failures,
                        retryPolicy.getMaxAttempts(), backoff.toMillis(), e.getMessage());
                sleep(backoff, token);
            }
        }
    }

    private ModelResponse awaitResponse(ModelRequest request, CancellationToken token) {
        CompletableFuture<ModelResponse> future;
        try {
            future = modelClient.complete(request);
        } catch (KernelException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ModelTransportException("Model call failed: " + ExceptionMessages.safeCauseMessage(e), e,
                    false);
        }
        if (future == null) {
            return null;
        }

        long deadlineNanos = System.nanoTime() + settings.getModelCallTimeout().toNanos();
        while (true) {
            if (token.isCancelled()) {
                future.cancel(true);
                throw new KernelCancelledException("Run cancelled while waiting for the model: " + token.getReason());
            }
            try {
                return future.get(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                if (System.nanoTime() - deadlineNanos >= 0) {
                    future.cancel(true);
                    throw new ModelTransportException("Model call timed out after "
                            + settings.getModelCallTimeout().toSeconds() + " s", e, true);
                }
            } catch (ExecutionException e) {
                throw toKernelException(e.getCause());
            } catch (CancellationException e) {
                throw new KernelCancelledException("Model call was cancelled");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                throw new KernelCancelledException("Interrupted while waiting for the model");
            }
        }
    }

    private static KernelException toKernelException(Throwable cause) {
        if (cause instanceof KernelException kernelException) {
            return kernelException;
        }
        boolean retryable = cause instanceof IOException || cause instanceof UncheckedIOException;
        return new ModelTransportException("Model call failed: " + ExceptionMessages.safeCauseMessage(cause), cause,
                retryable);
    }

    private static void sleep(Duration backoff, CancellationToken token) {
        long deadlineNanos = System.nanoTime() + backoff.toNanos();
        while (System.nanoTime() - deadlineNanos < 0) {
            checkCancelled(token);
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime());
            try {
                Thread.sleep(Math.max(1, Math.min(POLL_INTERVAL_MS, remainingMs)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new KernelCancelledException("Interrupted during retry backoff");
            }
        }
    }

    /**
     * Assigns run-unique ids to parsed calls and turns parse errors into
     * synthetic calls answered by a PARSE_FAILED result, keeping their
     * position among the valid calls. Only called when at least one call is
     * well formed. With {@code offered} set, calls to any other tool are
     * answered with UNKNOWN_TOOL.
     */
    private static TurnCalls assignCalls(List<ParsedCall> parsedCalls, ToolCallIds callIds,
            List<ToolSchema> offered) {
        Set<String> offeredNames = offered != null
                ? offered.stream().map(ToolSchema::getName).collect(Collectors.toSet())
                : null;
        List<Message.ToolCall> calls = new ArrayList<>();
        Map<Integer, ToolResult> presetResults = new LinkedHashMap<>();
        for (ParsedCall parsed : parsedCalls) {
            if (parsed.isError()) {
                String name = parsed.error().toolName() != null ? parsed.error().toolName() : INVALID_CALL_NAME;
                Message.ToolCall synthetic = callIds.ensureUnique(Message.ToolCall.create(name, Map.of()));
                log.warn("[Kernel] Unparseable tool call ({}): {}", name, parsed.error().reason());
                presetResults.put(calls.size(), ToolResult.failure(synthetic, ToolFailureKind.PARSE_FAILED,
                        "Failed to parse tool call: " + parsed.error().reason(), Duration.ZERO));
                calls.add(synthetic);
                continue;
            }
            Message.ToolCall call = callIds.ensureUnique(parsed.call());
            if (offeredNames != null && !offeredNames.contains(call.getName())) {
                log.warn("[Kernel] Call to tool outside the offered set: {}", call.getName());
                presetResults.put(calls.size(), ToolResult.failure(call, ToolFailureKind.UNKNOWN_TOOL,
                        "Unknown tool: " + call.getName(), Duration.ZERO));
            }
            calls.add(call);
        }
        return new TurnCalls(List.copyOf(calls), presetResults);
    }

    private List<ToolResult> executeCalls(RunState run, TurnCalls turnCalls, Map<String, Object> context,
            CancellationToken token) {
        List<Message.ToolCall> dispatchable = new ArrayList<>();
        for (int i = 0; i < turnCalls.calls().size(); i++) {
            ToolResult preset = turnCalls.presetResults().get(i);
            if (preset == null) {
                dispatchable.add(turnCalls.calls().get(i));
            } else {
                emit(run, KernelEventType.TOOL_RESULT_RECEIVED, resultPayload(preset));
            }
        }

        List<ToolResult> dispatched = dispatchable.isEmpty()
                ? List.of()
                : toolDispatcher.dispatch(dispatchable, settings.getToolConcurrencyLimit(), token,
                        new ObserverDispatchListener(run), context);

        List<ToolResult> results = new ArrayList<>();
        int next = 0;
        for (int i = 0; i < turnCalls.calls().size(); i++) {
            ToolResult preset = turnCalls.presetResults().get(i);
            results.add(preset != null ? preset : dispatched.get(next++));
        }
        return results;
    }

    private static ToolResult findTerminal(Predicate<ToolResult> condition, List<ToolResult> results) {
        if (condition == null) {
            return null;
        }
        for (ToolResult result : results) {
            if (condition.test(result)) {
                return result;
            }
        }
        return null;
    }

    private static void checkCancelled(CancellationToken token) {
        if (token.isCancelled()) {
            throw new KernelCancelledException("Run cancelled: " + token.getReason());
        }
    }

    private void fail(RunState run, KernelErrorKind kind, String message, Exception cause) {
        run.state = KernelState.DONE_FATAL;
        run.errorKind = kind;
        run.error = message;
        if (kind == KernelErrorKind.INTERNAL) {
            log.error("[Kernel] Run {} failed at turn {}", run.runId, run.turn, cause);
        } else {
            log.error("[Kernel] Run {} failed at turn {}: {} ({})", run.runId, run.turn, message, kind);
        }
        emit(run, KernelEventType.ERROR, payload("kind", kind.name(), "message", message));
    }

    private void emit(RunState run, KernelEventType type, Map<String, Object> payload) {
        KernelEvent event = KernelEvent.builder()
                .type(type)
                .timestamp(clock.instant())
                .runId(run.runId)
                .turn(run.turn)
                .payload(payload)
                .build();
        try {
            observer.onEvent(event);
        } catch (RuntimeException e) {
            log.warn("[Kernel] Observer failed on {}: {}", type, e.getMessage());
        }
    }

    private static Map<String, Object> resultPayload(ToolResult result) {
        return payload(
                "callId", result.getCallId(),
                "tool", result.getToolName(),
                "error", result.isError(),
                "failureKind", result.getFailureKind() != null ? result.getFailureKind().name() : null,
                "durationMs", result.getDuration().toMillis());
    }

    private static Map<String, Object> payload(Object... keyValues) {
        Map<String, Object> payload = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                payload.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
            }
        }
        return payload;
    }

    private final class ObserverDispatchListener implements DispatchListener {

        private final RunState run;

        private ObserverDispatchListener(RunState run) {
            this.run = run;
        }

        @Override
        public void onCallIssued(Message.ToolCall call) {
            emit(run, KernelEventType.TOOL_CALL_ISSUED, payload(
                    "callId", call.getId(),
                    "tool", call.getName(),
                    "arguments", call.getArguments()));
        }

        @Override
        public void onResultReceived(Message.ToolCall call, ToolResult result) {
            emit(run, KernelEventType.TOOL_RESULT_RECEIVED, resultPayload(result));
        }
    }

    private record TurnCalls(List<Message.ToolCall> calls, Map<Integer, ToolResult> presetResults) {

        static final TurnCalls NONE = new TurnCalls(List.of(), Map.of());
    }

    private record RunLimits(int maxTurns, Predicate<ToolResult> terminationCondition,
            ContextProvider contextProvider, ToolSelection selection) {
    }

    /**
     * Tools offered to the model: every tool of the source, or the named
     * subset resolved through it.
     */
    private final class ToolSelection {

        private final List<String> names;
        private final List<ToolSchema> initial;

        private ToolSelection(List<String> names) {
            this.names = names;
            this.initial = names == null ? initialTools : current();
        }

        boolean isSubset() {
            return names != null;
        }

        List<ToolSchema> initial() {
            return initial;
        }

        List<ToolSchema> current() {
            return List.copyOf(names == null ? toolSource.listTools() : toolSource.resolveAll(names));
        }
    }

    private static final class RunState {

        private final String runId;
        private final ToolCallIds callIds = new ToolCallIds();
        private int turn;
        private TokenUsage usage = TokenUsage.ZERO;
        private KernelState state = KernelState.RUNNING;
        private ToolResult finalToolResult;
        private KernelErrorKind errorKind;
        private String error;

        private RunState(String runId) {
            this.runId = runId;
        }
    }
}
