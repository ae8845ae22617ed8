package me.golemcore.agentkernel.infrastructure.config;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentkernel.adapter.outbound.model.Langchain4jModelClient;
import me.golemcore.agentkernel.adapter.outbound.model.ModelCallThreadFactory;
import me.golemcore.agentkernel.adapter.outbound.model.OpenAiCompatibleModelClient;
import me.golemcore.agentkernel.adapter.outbound.tools.RegistryToolSource;
import me.golemcore.agentkernel.adapter.outbound.tools.Tool;
import me.golemcore.agentkernel.domain.codec.MessageCodec;
import me.golemcore.agentkernel.domain.codec.MessageCodecFactory;
import me.golemcore.agentkernel.domain.codec.ToolResultConvention;
import me.golemcore.agentkernel.domain.dispatch.ToolDispatcher;
import me.golemcore.agentkernel.domain.exception.KernelConfigurationException;
import me.golemcore.agentkernel.domain.grammar.GrammarPipeline;
import me.golemcore.agentkernel.domain.history.KeepAllHistoryStrategy;
import me.golemcore.agentkernel.domain.history.SlidingWindowHistoryStrategy;
import me.golemcore.agentkernel.domain.kernel.AgentKernel;
import me.golemcore.agentkernel.domain.observer.CompositeKernelObserver;
import me.golemcore.agentkernel.domain.observer.LoggingKernelObserver;
import me.golemcore.agentkernel.infrastructure.http.FeignClientFactory;
import me.golemcore.agentkernel.infrastructure.http.OkHttpConfig;
import me.golemcore.agentkernel.port.outbound.ContextProvider;
import me.golemcore.agentkernel.port.outbound.HistoryStrategy;
import me.golemcore.agentkernel.port.outbound.KernelObserver;
import me.golemcore.agentkernel.port.outbound.ModelClient;
import me.golemcore.agentkernel.port.outbound.ToolSource;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Spring Boot auto-configuration wiring the agent kernel from
 * {@code kernel.*} properties.
 *
 * <p>
 * Every bean backs off when the application defines its own. The model client
 * is only created when {@code kernel.model.base-url} is set, and the kernel
 * only when some {@link ModelClient} bean exists. Applications contribute
 * tools as {@link Tool} beans, observers as {@link KernelObserver} beans and
 * per-turn context through a {@link ContextProvider} bean.
 */
@AutoConfiguration(after = JacksonAutoConfiguration.class)
@EnableConfigurationProperties(KernelProperties.class)
@Import(OkHttpConfig.class)
@Slf4j
public class KernelConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    @Bean
    @ConditionalOnMissingBean
    public FeignClientFactory feignClientFactory(OkHttpClient okHttpClient, ObjectMapper objectMapper) {
        return new FeignClientFactory(okHttpClient, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public GrammarPipeline grammarPipeline(ObjectMapper objectMapper) {
        return GrammarPipeline.standard(objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public MessageCodec messageCodec(KernelProperties properties, ObjectMapper objectMapper,
            GrammarPipeline grammarPipeline) {
        return MessageCodecFactory.create(properties.getModelFamily(), objectMapper, grammarPipeline,
                properties.getToolResultConvention(), properties.getToolDescriptorMode());
    }

    @Bean
    @ConditionalOnMissingBean
    public HistoryStrategy historyStrategy(KernelProperties properties) {
        return switch (properties.getHistoryStrategy()) {
        case KEEP_ALL -> new KeepAllHistoryStrategy();
        case SLIDING_WINDOW -> new SlidingWindowHistoryStrategy(properties.getMaxHistoryMessages());
        };
    }

    @Bean
    @ConditionalOnMissingBean(ToolSource.class)
    public RegistryToolSource toolSource(ObjectProvider<Tool> tools) {
        RegistryToolSource source = new RegistryToolSource(tools.orderedStream().toList());
        log.info("[Tools] Registered {} tools", source.listTools().size());
        return source;
    }

    @Bean(name = "kernelToolExecutor", destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = "kernelToolExecutor")
    public ExecutorService kernelToolExecutor() {
        return Executors.newCachedThreadPool(new ToolDispatcher.ToolThreadFactory());
    }

    @Bean
    @ConditionalOnMissingBean
    public ToolDispatcher toolDispatcher(ToolSource toolSource,
            @Qualifier("kernelToolExecutor") ExecutorService kernelToolExecutor,
            KernelProperties properties) {
        return new ToolDispatcher(toolSource, kernelToolExecutor, properties.getToolTimeout());
    }

    @Bean(name = "kernelModelExecutor", destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = "kernelModelExecutor")
    public ExecutorService kernelModelExecutor() {
        return ModelCallThreadFactory.newExecutor();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "kernel.model", name = "base-url")
    public ModelClient modelClient(KernelProperties properties, FeignClientFactory feignClientFactory,
            @Qualifier("kernelModelExecutor") ExecutorService kernelModelExecutor) {
        KernelProperties.ModelProperties model = properties.getModel();
        String provider = model.getProvider() != null ? model.getProvider() : OpenAiCompatibleModelClient.PROVIDER_ID;
        log.info("[Model] Using provider '{}' at {}", provider, model.getBaseUrl());
        return switch (provider) {
        case OpenAiCompatibleModelClient.PROVIDER_ID -> new OpenAiCompatibleModelClient(feignClientFactory,
                model.getBaseUrl(), model.getApiKey(), model.getName(), kernelModelExecutor);
        case Langchain4jModelClient.PROVIDER_ID -> new Langchain4jModelClient(
                createChatModel(model, properties.getModelCallTimeout()), kernelModelExecutor);
        default -> throw new KernelConfigurationException("Unknown model provider: " + provider);
        };
    }

    private ChatModel createChatModel(KernelProperties.ModelProperties model, Duration timeout) {
        OpenAiChatModel.OpenAiChatModelBuilder builder = OpenAiChatModel.builder()
                .apiKey(model.getApiKey() != null ? model.getApiKey() : "none")
                .modelName(model.getName())
                .baseUrl(model.getBaseUrl())
                .maxRetries(0) // retries are owned by the kernel's transport policy
                .timeout(timeout);
        if (model.getTemperature() != null) {
            builder.temperature(model.getTemperature());
        }
        if (model.getMaxTokens() != null) {
            builder.maxTokens(model.getMaxTokens());
        }
        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(ModelClient.class)
    public AgentKernel agentKernel(KernelProperties properties, ModelClient modelClient, ToolSource toolSource,
            MessageCodec messageCodec, GrammarPipeline grammarPipeline, ToolDispatcher toolDispatcher,
            HistoryStrategy historyStrategy, ObjectProvider<KernelObserver> observers,
            ObjectProvider<ContextProvider> contextProvider, Clock clock) {
        if (Langchain4jModelClient.PROVIDER_ID.equals(modelClient.getProviderId())
                && messageCodec.resultConvention() == ToolResultConvention.NAME_RESPONSE) {
            throw new KernelConfigurationException("Provider '" + Langchain4jModelClient.PROVIDER_ID
                    + "' needs call-id tool results; tool-result-convention NAME_RESPONSE is not supported");
        }
        List<KernelObserver> all = new ArrayList<>(observers.orderedStream().toList());
        if (properties.getObserver().isLogging()) {
            all.add(new LoggingKernelObserver());
        }
        log.info("[Kernel] Configured: family={}, strategy={}, maxTurns={}",
                messageCodec.family(), properties.getGrammarStrategy().getValue(), properties.getMaxTurns());
        return AgentKernel.builder()
                .modelClient(modelClient)
                .toolSource(toolSource)
                .codec(messageCodec)
                .grammarPipeline(grammarPipeline)
                .toolDispatcher(toolDispatcher)
                .historyStrategy(historyStrategy)
                .observer(new CompositeKernelObserver(all))
                .settings(properties.toSettings())
                .contextProvider(contextProvider.getIfAvailable())
                .clock(clock)
                .build();
    }
}
