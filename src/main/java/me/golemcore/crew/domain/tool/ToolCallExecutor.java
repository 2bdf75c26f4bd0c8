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

package me.golemcore.crew.domain.tool;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.crew.domain.component.ToolComponent;
import me.golemcore.crew.domain.model.Message;
import me.golemcore.crew.domain.model.ToolExecutionContext;
import me.golemcore.crew.domain.model.ToolFailureKind;
import me.golemcore.crew.domain.model.ToolResult;
import me.golemcore.crew.infrastructure.config.CrewProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs parsed tool calls against an agent's catalog.
 *
 * <p>
 * Each call is looked up, validated for required parameters and executed with
 * a per-call time limit. Every outcome, including unknown tools, missing
 * parameters, exceptions and timeouts, becomes a {@link ToolResult}; nothing is
 * thrown to the caller. A batch runs concurrently and its results come back in
 * the order of the input calls.
 */
@Component
@Slf4j
public class ToolCallExecutor {

    private final CrewProperties properties;
    private final ExecutorService workers;

    public ToolCallExecutor(CrewProperties properties) {
        this.properties = properties;
        AtomicInteger counter = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "tool-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdownNow();
    }

    /**
     * Executes all calls concurrently. The returned list has the same size and
     * order as {@code toolCalls}.
     */
    public CompletableFuture<List<ToolResult>> executeAll(List<Message.ToolCall> toolCalls, ToolCatalog catalog,
            ToolExecutionContext context) {
        if (toolCalls == null || toolCalls.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        List<CompletableFuture<ToolResult>> futures = new ArrayList<>(toolCalls.size());
        for (Message.ToolCall toolCall : toolCalls) {
            futures.add(execute(toolCall, catalog, context));
        }
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> futures.stream().map(CompletableFuture::join).toList());
    }

    /**
     * Executes one call on a worker thread. The future always completes normally.
     */
    public CompletableFuture<ToolResult> execute(Message.ToolCall toolCall, ToolCatalog catalog,
            ToolExecutionContext context) {
        Optional<ToolComponent> tool = catalog.find(toolCall.getName());
        if (tool.isEmpty()) {
            log.warn("[Tools] Unknown tool requested: {}", toolCall.getName());
            String available = catalog.isEmpty() ? "none" : String.join(", ", catalog.names());
            return CompletableFuture.completedFuture(attach(toolCall, ToolResult.failure(ToolFailureKind.UNKNOWN_TOOL,
                    "Tool '" + toolCall.getName() + "' not found. Available tools: " + available)));
        }

        Map<String, Object> arguments = toolCall.getArguments() != null ? toolCall.getArguments() : Map.of();
        List<String> missing = tool.get().getDefinition().requiredParameterNames().stream()
                .filter(name -> arguments.get(name) == null)
                .toList();
        if (!missing.isEmpty()) {
            log.warn("[Tools] Call to {} is missing required parameters: {}", toolCall.getName(), missing);
            return CompletableFuture.completedFuture(attach(toolCall, ToolResult.failure(
                    ToolFailureKind.MISSING_PARAMETER,
                    "Missing required parameters: " + String.join(", ", missing))));
        }

        return CompletableFuture
                .supplyAsync(() -> invoke(tool.get(), toolCall, arguments, context), workers)
                .exceptionally(e -> ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                        "Tool execution failed: " + safeCauseMessage(e)))
                .thenApply(result -> attach(toolCall, result));
    }

    private ToolResult invoke(ToolComponent tool, Message.ToolCall toolCall, Map<String, Object> arguments,
            ToolExecutionContext context) {
        long timeoutSeconds = properties.getTools().getTimeoutSeconds();
        log.debug("[Tools] Executing {} for agent {}", toolCall.getName(), context.agentId());
        try {
            CompletableFuture<ToolResult> future = tool.execute(arguments, context);
            if (future == null) {
                return ToolResult.failure("Tool returned no result");
            }
            ToolResult result = future.get(timeoutSeconds, TimeUnit.SECONDS);
            return result != null ? result : ToolResult.failure("Tool returned no result");
        } catch (TimeoutException e) {
            log.warn("[Tools] Tool {} timed out after {}s", toolCall.getName(), timeoutSeconds);
            return ToolResult.failure(ToolFailureKind.TIMEOUT,
                    "Tool timed out after " + timeoutSeconds + " seconds");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResult.failure("Tool execution interrupted");
        } catch (ExecutionException | RuntimeException e) {
            log.error("[Tools] Tool execution failed: {}", toolCall.getName(), e);
            return ToolResult.failure("Tool execution failed: " + safeCauseMessage(e));
        }
    }

    private static ToolResult attach(Message.ToolCall toolCall, ToolResult result) {
        return result.toBuilder()
                .toolCallId(toolCall.getId())
                .toolName(toolCall.getName())
                .build();
    }

    static String safeCauseMessage(Throwable error) {
        if (error == null) {
            return "unknown";
        }
        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null && !cause.equals(cursor)) {
            cursor = cause;
            cause = cursor.getCause();
        }
        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }
}
