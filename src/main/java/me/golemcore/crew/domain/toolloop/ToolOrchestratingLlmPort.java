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

package me.golemcore.crew.domain.toolloop;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.crew.domain.model.LlmRequest;
import me.golemcore.crew.domain.model.LlmResponse;
import me.golemcore.crew.domain.model.LlmUsage;
import me.golemcore.crew.domain.model.Message;
import me.golemcore.crew.domain.model.ToolExecutionContext;
import me.golemcore.crew.domain.model.ToolResult;
import me.golemcore.crew.domain.tool.ToolCallExecutor;
import me.golemcore.crew.domain.tool.ToolCallParser;
import me.golemcore.crew.domain.tool.ToolCatalog;
import me.golemcore.crew.domain.tool.ToolSchemaExporter;
import me.golemcore.crew.port.outbound.LlmPort;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * {@link LlmPort} decorator that gives one agent's model access to its tool
 * catalog.
 *
 * <ol>
 * <li>The catalog's instructions block is appended to the system message (one
 * is created when absent) and the native tool schema is attached.</li>
 * <li>The wrapped model is asked once. Without tool calls the answer is
 * returned as is.</li>
 * <li>Otherwise all calls are executed, the assistant turn and one tool message
 * per result are appended, and the model is asked a second time with an
 * instruction not to call tools again.</li>
 * <li>Usage from both calls is summed.</li>
 * </ol>
 *
 * <p>
 * Exactly one extra round trip is made. Tool calls that appear in the second
 * answer are stripped from the text but not executed; multi-step tool chains
 * need a different control loop.
 */
@Slf4j
public class ToolOrchestratingLlmPort implements LlmPort {

    static final String EMPTY_REMAINDER_PLACEHOLDER = "Let me use the available tools for this.";
    static final String FOLLOW_UP_INSTRUCTION = "IMPORTANT: The tools have been executed and their results are "
            + "provided above. Respond to the user based on the tool results. Do not call tools again.";

    private final LlmPort delegate;
    private final ToolCatalog catalog;
    private final ToolCallParser parser;
    private final ToolCallExecutor executor;
    private final MessageSequenceNormalizer normalizer;
    private final String projectId;
    private final boolean appendToolResults;

    public ToolOrchestratingLlmPort(LlmPort delegate, ToolCatalog catalog, ToolCallParser parser,
            ToolCallExecutor executor, MessageSequenceNormalizer normalizer, String projectId,
            boolean appendToolResults) {
        this.delegate = delegate;
        this.catalog = catalog;
        this.parser = parser;
        this.executor = executor;
        this.normalizer = normalizer;
        this.projectId = projectId;
        this.appendToolResults = appendToolResults;
    }

    @Override
    public String getProviderId() {
        return delegate.getProviderId();
    }

    @Override
    public String getCurrentModel() {
        return delegate.getCurrentModel();
    }

    @Override
    public boolean isAvailable() {
        return delegate.isAvailable();
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        if (catalog.isEmpty()) {
            return delegate.chat(request);
        }

        List<Message> messages = withSystemInstructions(request.getMessages(),
                ToolSchemaExporter.instructionsPrompt(catalog));
        LlmRequest firstRequest = request.toBuilder()
                .messages(messages)
                .tools(catalog.definitions())
                .build();

        return delegate.chat(firstRequest)
                .thenCompose(first -> handleFirstResponse(request, messages, first));
    }

    private CompletableFuture<LlmResponse> handleFirstResponse(LlmRequest request, List<Message> messages,
            LlmResponse first) {
        List<Message.ToolCall> toolCalls = parser.parse(first.getContent());
        if (toolCalls.isEmpty() && first.hasToolCalls()) {
            toolCalls = first.getToolCalls();
            log.debug("[ToolLoop] Using {} native tool calls", toolCalls.size());
        }
        if (toolCalls.isEmpty()) {
            return CompletableFuture.completedFuture(first);
        }

        List<Message.ToolCall> calls = toolCalls;
        log.info("[ToolLoop] Agent {} requested {} tool call(s): {}", request.getAgentId(), calls.size(),
                calls.stream().map(Message.ToolCall::getName).toList());

        ToolExecutionContext context = new ToolExecutionContext(request.getAgentId(),
                request.getProjectId() != null ? request.getProjectId() : projectId,
                request.getConversationId(), request.getProgress());

        return executor.executeAll(calls, catalog, context)
                .thenCompose(results -> secondPass(request, messages, first, calls, results));
    }

    private CompletableFuture<LlmResponse> secondPass(LlmRequest request, List<Message> messages, LlmResponse first,
            List<Message.ToolCall> calls, List<ToolResult> results) {
        String remainder = parser.removeToolCalls(first.getContent());
        if (remainder.isEmpty()) {
            remainder = EMPTY_REMAINDER_PLACEHOLDER;
        }

        List<Message> extended = new ArrayList<>(messages);
        extended.add(Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_ASSISTANT)
                .content(remainder)
                .toolCalls(calls)
                .timestamp(Instant.now())
                .build());
        for (ToolResult result : results) {
            extended.add(Message.builder()
                    .id(UUID.randomUUID().toString())
                    .role(Message.ROLE_TOOL)
                    .toolCallId(result.getToolCallId())
                    .toolName(result.getToolName())
                    .content(toolMessageContent(result))
                    .timestamp(Instant.now())
                    .build());
        }

        List<Message> followUp = normalizer.normalize(withSystemInstructions(extended, FOLLOW_UP_INSTRUCTION));
        LlmRequest secondRequest = request.toBuilder()
                .messages(followUp)
                .tools(catalog.definitions())
                .build();

        return delegate.chat(secondRequest)
                .thenApply(second -> mergeResponses(first, second, results));
    }

    private LlmResponse mergeResponses(LlmResponse first, LlmResponse second, List<ToolResult> results) {
        if (parser.hasToolCalls(second.getContent()) || second.hasToolCalls()) {
            log.warn("[ToolLoop] Final answer requested more tools; they are not executed");
        }
        String content = parser.removeToolCalls(second.getContent());
        if (appendToolResults) {
            String digest = toolResultsDigest(results);
            content = content.isEmpty() ? digest : content + "\n\n" + digest;
        }
        return LlmResponse.builder()
                .content(content)
                .model(second.getModel() != null ? second.getModel() : first.getModel())
                .finishReason(second.getFinishReason())
                .usage(LlmUsage.merge(first.getUsage(), second.getUsage()))
                .build();
    }

    static String toolMessageContent(ToolResult result) {
        if (result.getOutput() != null && !result.getOutput().isBlank()) {
            return result.getOutput();
        }
        if (result.isSuccess()) {
            return "(no output)";
        }
        return "Error: " + result.getError();
    }

    private static String toolResultsDigest(List<ToolResult> results) {
        StringBuilder sb = new StringBuilder();
        for (ToolResult result : results) {
            if (sb.length() > 0) {
                sb.append("\n\n");
            }
            sb.append("**Tool: ").append(result.getToolName()).append("**\n")
                    .append(toolMessageContent(result));
        }
        return sb.toString();
    }

    /**
     * Appends text to the first system message, or prepends a new system message
     * when the list has none. The input list is not modified.
     */
    static List<Message> withSystemInstructions(List<Message> messages, String instructions) {
        List<Message> result = new ArrayList<>(messages);
        for (int i = 0; i < result.size(); i++) {
            Message message = result.get(i);
            if (message.isSystemMessage()) {
                String existing = message.getContent() != null ? message.getContent() : "";
                String content = existing.isBlank() ? instructions : existing + "\n\n" + instructions;
                result.set(i, message.toBuilder().content(content).build());
                return result;
            }
        }
        result.add(0, Message.system(instructions));
        return result;
    }
}
