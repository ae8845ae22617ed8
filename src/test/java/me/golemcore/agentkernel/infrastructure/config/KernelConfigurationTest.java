package me.golemcore.agentkernel.infrastructure.config;

import me.golemcore.agentkernel.adapter.outbound.model.Langchain4jModelClient;
import me.golemcore.agentkernel.adapter.outbound.model.OpenAiCompatibleModelClient;
import me.golemcore.agentkernel.adapter.outbound.tools.Tool;
import me.golemcore.agentkernel.domain.codec.MessageCodec;
import me.golemcore.agentkernel.domain.codec.ModelFamily;
import me.golemcore.agentkernel.domain.exception.KernelConfigurationException;
import me.golemcore.agentkernel.domain.grammar.GrammarStrategy;
import me.golemcore.agentkernel.domain.history.KeepAllHistoryStrategy;
import me.golemcore.agentkernel.domain.history.SlidingWindowHistoryStrategy;
import me.golemcore.agentkernel.domain.kernel.AgentKernel;
import me.golemcore.agentkernel.domain.model.ToolSchema;
import me.golemcore.agentkernel.port.outbound.HistoryStrategy;
import me.golemcore.agentkernel.port.outbound.ModelClient;
import me.golemcore.agentkernel.port.outbound.ToolSource;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.core.NestedExceptionUtils;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class KernelConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(KernelConfiguration.class));

    @Test
    void shouldBindKebabCaseProperties() {
        contextRunner
                .withPropertyValues(
                        "kernel.max-turns=5",
                        "kernel.tool-concurrency-limit=3",
                        "kernel.grammar-strategy=tagged-text",
                        "kernel.grammar-fallback-strategy=json-schema",
                        "kernel.model-family=function-gemma",
                        "kernel.history-strategy=keep-all",
                        "kernel.tool-timeout=5s",
                        "kernel.retry.max-attempts=4",
                        "kernel.http.read-timeout=30000")
                .run(context -> {
                    KernelProperties properties = context.getBean(KernelProperties.class);
                    assertEquals(5, properties.getMaxTurns());
                    assertEquals(3, properties.getToolConcurrencyLimit());
                    assertEquals(GrammarStrategy.TAGGED_TEXT, properties.getGrammarStrategy());
                    assertEquals(GrammarStrategy.JSON_SCHEMA, properties.getGrammarFallbackStrategy());
                    assertEquals(ModelFamily.FUNCTION_GEMMA, properties.getModelFamily());
                    assertEquals(Duration.ofSeconds(5), properties.getToolTimeout());
                    assertEquals(4, properties.toSettings().getRetryPolicy().getMaxAttempts());

                    assertEquals(ModelFamily.FUNCTION_GEMMA, context.getBean(MessageCodec.class).family());
                    assertInstanceOf(KeepAllHistoryStrategy.class, context.getBean(HistoryStrategy.class));
                    assertEquals(30000, context.getBean(OkHttpClient.class).readTimeoutMillis());
                });
    }

    @Test
    void shouldNotCreateKernelWithoutModelClient() {
        contextRunner.run(context -> {
            assertNull(context.getStartupFailure());
            assertTrue(context.getBeansOfType(ModelClient.class).isEmpty());
            assertTrue(context.getBeansOfType(AgentKernel.class).isEmpty());
            assertInstanceOf(SlidingWindowHistoryStrategy.class, context.getBean(HistoryStrategy.class));
        });
    }

    @Test
    void shouldCreateOpenAiCompatibleClientAndKernelWhenBaseUrlSet() {
        contextRunner
                .withPropertyValues("kernel.model.base-url=http://localhost:8000/v1", "kernel.model.name=qwen3")
                .run(context -> {
                    assertInstanceOf(OpenAiCompatibleModelClient.class, context.getBean(ModelClient.class));
                    assertNotNull(context.getBean(AgentKernel.class));
                });
    }

    @Test
    void shouldCreateLangchain4jClientWhenRequested() {
        contextRunner
                .withPropertyValues(
                        "kernel.model.base-url=http://localhost:8000/v1",
                        "kernel.model.provider=langchain4j",
                        "kernel.model.name=gpt-4o-mini")
                .run(context -> assertInstanceOf(Langchain4jModelClient.class, context.getBean(ModelClient.class)));
    }

    @Test
    void shouldRejectNameResponseConventionWithLangchain4j() {
        contextRunner
                .withPropertyValues(
                        "kernel.model.base-url=http://localhost:8000/v1",
                        "kernel.model.provider=langchain4j",
                        "kernel.tool-result-convention=name-response")
                .run(context -> {
                    Throwable cause = NestedExceptionUtils.getMostSpecificCause(context.getStartupFailure());
                    assertInstanceOf(KernelConfigurationException.class, cause);
                    assertTrue(cause.getMessage().contains("NAME_RESPONSE"));
                });
    }

    @Test
    void shouldRunModelCallsOnDedicatedExecutor() {
        contextRunner
                .withPropertyValues("kernel.model.base-url=http://localhost:8000/v1")
                .run(context -> {
                    assertNull(context.getStartupFailure());
                    assertTrue(context.containsBean("kernelModelExecutor"));
                    assertTrue(context.containsBean("kernelToolExecutor"));
                    assertNotSame(context.getBean("kernelModelExecutor"), context.getBean("kernelToolExecutor"));
                });
    }

    @Test
    void shouldFailOnUnknownProvider() {
        contextRunner
                .withPropertyValues("kernel.model.base-url=http://localhost", "kernel.model.provider=carrier-pigeon")
                .run(context -> {
                    Throwable failure = context.getStartupFailure();
                    assertNotNull(failure);
                    assertInstanceOf(KernelConfigurationException.class,
                            NestedExceptionUtils.getMostSpecificCause(failure));
                });
    }

    @Test
    void shouldRejectStrategyUnsupportedByFamily() {
        contextRunner
                .withBean(ModelClient.class, () -> mock(ModelClient.class))
                .withPropertyValues("kernel.model-family=openai", "kernel.grammar-strategy=tagged-text")
                .run(context -> {
                    Throwable cause = NestedExceptionUtils.getMostSpecificCause(context.getStartupFailure());
                    assertInstanceOf(KernelConfigurationException.class, cause);
                    assertTrue(cause.getMessage().contains("tagged-text"));
                });
    }

    @Test
    void shouldRegisterToolBeans() {
        contextRunner
                .withBean("echoTool", Tool.class,
                        () -> Tool.of(ToolSchema.simple("echo", "Echoes input"), args -> args.get("text")))
                .withBean(ModelClient.class, () -> mock(ModelClient.class))
                .run(context -> {
                    ToolSource toolSource = context.getBean(ToolSource.class);
                    assertEquals(1, toolSource.listTools().size());
                    assertTrue(toolSource.resolve("echo").isPresent());
                    assertNotNull(context.getBean(AgentKernel.class));
                });
    }
}
