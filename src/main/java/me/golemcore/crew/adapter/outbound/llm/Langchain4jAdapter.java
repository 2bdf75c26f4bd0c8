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

package me.golemcore.crew.adapter.outbound.llm;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.crew.domain.model.LlmProviderException;
import me.golemcore.crew.domain.model.LlmRequest;
import me.golemcore.crew.domain.model.LlmResponse;
import me.golemcore.crew.domain.model.LlmUsage;
import me.golemcore.crew.domain.model.Message;
import me.golemcore.crew.domain.model.ToolDefinition;
import me.golemcore.crew.domain.model.ToolParameter;
import me.golemcore.crew.infrastructure.config.CrewProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Model adapter backed by langchain4j.
 *
 * <p>
 * The model is configured as {@code provider/model} in {@code crew.llm.model}
 * (for example {@code anthropic/claude-sonnet-4-20250514} or
 * {@code openai/gpt-4o}). Anthropic models use the native Anthropic client;
 * every other provider is reached through the OpenAI-compatible client with
 * the provider's base URL.
 *
 * <p>
 * Rate-limit failures are retried with exponential backoff; any other failure
 * completes the future with {@link LlmProviderException}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jAdapter implements LlmProviderAdapter {

    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final String PROVIDER_OPENAI = "openai";
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final CrewProperties properties;
    private final ObjectMapper objectMapper;

    private ChatModel chatModel;
    private String currentModel;
    private volatile boolean initialized = false;

    @Override
    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        String model = properties.getLlm().getModel();
        this.currentModel = model;
        try {
            this.chatModel = createModel(model);
            initialized = true;
            log.info("[LLM] Langchain4j adapter initialized with model: {}", model);
        } catch (RuntimeException e) {
            log.warn("[LLM] Failed to initialize Langchain4j adapter: {}", e.getMessage());
        }
    }

    private void ensureInitialized() {
        if (!initialized) {
            initialize();
        }
    }

    static String providerOf(String model) {
        return model != null && model.contains("/") ? model.substring(0, model.indexOf('/')) : PROVIDER_OPENAI;
    }

    static String stripProviderPrefix(String model) {
        return model.contains("/") ? model.substring(model.indexOf('/') + 1) : model;
    }

    private CrewProperties.ProviderProperties getProviderConfig(String providerName) {
        CrewProperties.ProviderProperties config = properties.getLlm().getProviders().get(providerName);
        if (config == null) {
            throw new IllegalStateException("Provider not configured: " + providerName
                    + ". Add crew.llm.providers." + providerName + ".api-key");
        }
        return config;
    }

    private ChatModel createModel(String model) {
        String provider = providerOf(model);
        CrewProperties.ProviderProperties config = getProviderConfig(provider);
        String modelName = stripProviderPrefix(model);

        if (PROVIDER_ANTHROPIC.equals(provider)) {
            return createAnthropicModel(modelName, config);
        }
        return createOpenAiModel(modelName, config);
    }

    private ChatModel createAnthropicModel(String modelName, CrewProperties.ProviderProperties config) {
        var builder = AnthropicChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .maxRetries(0) // Retry handled by our backoff logic
                .maxTokens(4096)
                .temperature(properties.getLlm().getTemperature())
                .timeout(Duration.ofMillis(properties.getLlm().getTimeoutMs()));
        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    private ChatModel createOpenAiModel(String modelName, CrewProperties.ProviderProperties config) {
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .maxRetries(0) // Retry handled by our backoff logic
                .temperature(properties.getLlm().getTemperature())
                .timeout(Duration.ofMillis(properties.getLlm().getTimeoutMs()));
        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    @Override
    public String getProviderId() {
        return "langchain4j";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();
            if (chatModel == null) {
                throw new LlmProviderException("Langchain4j adapter not available");
            }

            ChatModel modelToUse = getModelForRequest(request);
            String modelUsed = request.getModel() != null ? request.getModel() : currentModel;
            List<ChatMessage> messages = convertMessages(request);
            List<ToolSpecification> tools = convertTools(request);

            int maxRetries = properties.getLlm().getMaxRetries();
            for (int attempt = 0; attempt <= maxRetries; attempt++) {
                try {
                    ChatResponse response;
                    if (!tools.isEmpty()) {
                        log.trace("[LLM] Calling model with {} tools", tools.size());
                        response = modelToUse.chat(ChatRequest.builder()
                                .messages(messages)
                                .toolSpecifications(tools)
                                .build());
                    } else {
                        response = modelToUse.chat(messages);
                    }
                    return convertResponse(response, modelUsed);
                } catch (RuntimeException e) {
                    if (isRateLimitError(e) && attempt < maxRetries) {
                        long backoffMs = (long) (properties.getLlm().getInitialBackoffMs()
                                * Math.pow(BACKOFF_MULTIPLIER, attempt));
                        log.warn("[LLM] Rate limit hit (attempt {}/{}), retrying in {}ms...",
                                attempt + 1, maxRetries, backoffMs);
                        sleep(backoffMs);
                    } else {
                        log.error("[LLM] Chat failed", e);
                        throw new LlmProviderException("LLM chat failed: " + e.getMessage(), e);
                    }
                }
            }
            throw new LlmProviderException("LLM chat failed: max retries exhausted");
        });
    }

    private static void sleep(long backoffMs) {
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new LlmProviderException("LLM chat interrupted during retry backoff", ie);
        }
    }

    static boolean isRateLimitError(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if ("RateLimitException".equals(current.getClass().getSimpleName())) {
                return true;
            }
            String msg = current.getMessage();
            if (msg != null && (msg.contains("rate_limit") || msg.contains("Too Many Requests")
                    || msg.contains("429") || msg.contains("overloaded"))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private ChatModel getModelForRequest(LlmRequest request) {
        String requestModel = request.getModel();
        if (requestModel != null && !requestModel.equals(currentModel)) {
            log.trace("[LLM] Creating one-off model for request: {}", requestModel);
            return createModel(requestModel);
        }
        return chatModel;
    }

    @Override
    public String getCurrentModel() {
        return currentModel != null ? currentModel : properties.getLlm().getModel();
    }

    @Override
    public boolean isAvailable() {
        String provider = providerOf(properties.getLlm().getModel());
        CrewProperties.ProviderProperties config = properties.getLlm().getProviders().get(provider);
        return config != null && config.getApiKey() != null && !config.getApiKey().isBlank();
    }

    private List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        for (Message msg : request.getMessages()) {
            String content = msg.getContent() != null ? msg.getContent() : "";
            switch (msg.getRole()) {
            case Message.ROLE_USER -> messages.add(UserMessage.from(content));
            case Message.ROLE_ASSISTANT -> {
                if (msg.hasToolCalls()) {
                    List<ToolExecutionRequest> toolRequests = msg.getToolCalls().stream()
                            .map(tc -> ToolExecutionRequest.builder()
                                    .id(tc.getId())
                                    .name(tc.getName())
                                    .arguments(convertArgsToJson(tc.getArguments()))
                                    .build())
                            .toList();
                    messages.add(content.isBlank()
                            ? AiMessage.from(toolRequests)
                            : AiMessage.from(content, toolRequests));
                } else {
                    messages.add(AiMessage.from(content));
                }
            }
            case Message.ROLE_TOOL -> messages.add(ToolExecutionResultMessage.from(
                    msg.getToolCallId(), msg.getToolName(), content));
            case Message.ROLE_SYSTEM -> messages.add(SystemMessage.from(content));
            default -> {
                log.warn("[LLM] Unknown message role: {}, treating as user message", msg.getRole());
                messages.add(UserMessage.from(content));
            }
            }
        }
        return messages;
    }

    private List<ToolSpecification> convertTools(LlmRequest request) {
        if (request.getTools() == null || request.getTools().isEmpty()) {
            return Collections.emptyList();
        }
        return request.getTools().stream()
                .map(this::convertToolDefinition)
                .toList();
    }

    private ToolSpecification convertToolDefinition(ToolDefinition tool) {
        JsonObjectSchema.Builder schemaBuilder = JsonObjectSchema.builder();
        for (ToolParameter parameter : tool.getParameters()) {
            schemaBuilder.addProperty(parameter.getName(), toJsonSchemaElement(parameter));
        }
        List<String> required = tool.requiredParameterNames();
        if (!required.isEmpty()) {
            schemaBuilder.required(required);
        }
        return ToolSpecification.builder()
                .name(tool.getName())
                .description(tool.getDescription())
                .parameters(schemaBuilder.build())
                .build();
    }

    private JsonSchemaElement toJsonSchemaElement(ToolParameter parameter) {
        String description = parameter.getDescription();
        if (parameter.getEnumValues() != null && !parameter.getEnumValues().isEmpty()) {
            return JsonEnumSchema.builder()
                    .enumValues(parameter.getEnumValues())
                    .description(description)
                    .build();
        }
        String type = parameter.getType() != null ? parameter.getType() : "string";
        return switch (type) {
        case "integer" -> JsonIntegerSchema.builder().description(description).build();
        case "number" -> JsonNumberSchema.builder().description(description).build();
        case "boolean" -> JsonBooleanSchema.builder().description(description).build();
        case "array" -> JsonArraySchema.builder()
                .description(description)
                .items(itemSchema(parameter.getItemsType()))
                .build();
        case "object" -> JsonObjectSchema.builder().description(description).build();
        default -> JsonStringSchema.builder().description(description).build();
        };
    }

    private static JsonSchemaElement itemSchema(String itemsType) {
        if (itemsType == null) {
            return JsonStringSchema.builder().build();
        }
        return switch (itemsType) {
        case "integer" -> JsonIntegerSchema.builder().build();
        case "number" -> JsonNumberSchema.builder().build();
        case "boolean" -> JsonBooleanSchema.builder().build();
        default -> JsonStringSchema.builder().build();
        };
    }

    private LlmResponse convertResponse(ChatResponse response, String modelUsed) {
        AiMessage aiMessage = response.aiMessage();

        List<Message.ToolCall> toolCalls = null;
        if (aiMessage.hasToolExecutionRequests()) {
            toolCalls = aiMessage.toolExecutionRequests().stream()
                    .map(ter -> Message.ToolCall.builder()
                            .id(ter.id())
                            .name(ter.name())
                            .arguments(parseJsonArgs(ter.arguments()))
                            .build())
                    .toList();
            log.trace("[LLM] Parsed {} native tool calls from response", toolCalls.size());
        }

        LlmUsage usage = null;
        if (response.tokenUsage() != null) {
            usage = LlmUsage.builder()
                    .inputTokens(nullToZero(response.tokenUsage().inputTokenCount()))
                    .outputTokens(nullToZero(response.tokenUsage().outputTokenCount()))
                    .totalTokens(nullToZero(response.tokenUsage().totalTokenCount()))
                    .build();
        }

        return LlmResponse.builder()
                .content(aiMessage.text())
                .toolCalls(toolCalls)
                .usage(usage)
                .model(modelUsed)
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "stop")
                .build();
    }

    private static int nullToZero(Integer value) {
        return value != null ? value : 0;
    }

    private String convertArgsToJson(Map<String, Object> args) {
        if (args == null || args.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(args);
        } catch (Exception e) {
            log.warn("[LLM] Failed to serialize tool arguments: {}", e.getMessage());
            return "{}";
        }
    }

    private Map<String, Object> parseJsonArgs(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE_REF);
        } catch (Exception e) {
            log.warn("[LLM] Failed to parse tool arguments: {}", e.getMessage());
            return Collections.emptyMap();
        }
    }
}
