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

package me.golemcore.crew.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.crew.domain.model.LlmRequest;
import me.golemcore.crew.domain.model.LlmResponse;
import me.golemcore.crew.domain.model.Message;
import me.golemcore.crew.infrastructure.config.CrewProperties;
import me.golemcore.crew.port.outbound.LlmPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Replaces the older part of a conversation with one model-written summary so
 * the remaining prompt stays coherent when plain windowing would drop too much.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CompactionService {

    static final String SUMMARY_PREFIX = "[Conversation summary]\n";

    private static final int MAX_SUMMARY_TOKENS = 500;
    private static final int MESSAGE_PREVIEW_CHARS = 300;

    private static final String SUMMARY_INSTRUCTIONS = """
            Summarize the conversation below so that work can continue from the summary alone.

            Include, when applicable:
            - what has been accomplished
            - what is in progress
            - decisions made
            - referenced files, commands and identifiers
            - open questions and next steps

            Keep it factual and write in the language the conversation uses.
            Output only the summary.""";

    private final LlmPort llmPort;
    private final CrewProperties properties;
    private final Clock clock;

    /**
     * Summarizes the given messages.
     *
     * @return the summary text, or empty when the model is unavailable, fails, or
     *         answers with nothing
     */
    public Optional<String> summarize(List<Message> messages) {
        if (messages == null || messages.isEmpty()) {
            return Optional.empty();
        }
        if (!llmPort.isAvailable()) {
            log.warn("[Context] LLM not available, cannot summarize");
            return Optional.empty();
        }

        LlmRequest request = LlmRequest.builder()
                .messages(List.of(
                        Message.system(SUMMARY_INSTRUCTIONS),
                        Message.user(formatConversation(messages))))
                .maxTokens(MAX_SUMMARY_TOKENS)
                .temperature(0.3)
                .build();

        long timeoutSeconds = properties.getContext().getSummaryTimeoutSeconds();
        try {
            long start = clock.millis();
            LlmResponse response = llmPort.chat(request).get(timeoutSeconds, TimeUnit.SECONDS);
            String summary = response.getContent();
            if (summary == null || summary.isBlank()) {
                log.warn("[Context] LLM returned empty summary");
                return Optional.empty();
            }
            log.info("[Context] Summarized {} messages in {}ms ({} chars)",
                    messages.size(), clock.millis() - start, summary.length());
            return Optional.of(summary.trim());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Context] Summarization interrupted: {}", e.getMessage());
            return Optional.empty();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("[Context] Summarization failed: {}", FanOutSupport.rootMessage(e));
            return Optional.empty();
        }
    }

    /**
     * Keeps a leading system message and the last {@code keepLast} messages and
     * replaces everything in between with one synthetic assistant summary. Returns
     * the input unchanged when there is nothing to fold or summarization fails.
     */
    public List<Message> compact(List<Message> messages, int keepLast) {
        boolean hasSystem = !messages.isEmpty() && messages.get(0).isSystemMessage();
        int firstFoldable = hasSystem ? 1 : 0;
        int firstKept = Math.max(firstFoldable, messages.size() - keepLast);
        if (firstKept <= firstFoldable) {
            return messages;
        }

        List<Message> folded = messages.subList(firstFoldable, firstKept);
        Optional<String> summary = summarize(folded);
        if (summary.isEmpty()) {
            return messages;
        }

        List<Message> result = new ArrayList<>();
        if (hasSystem) {
            result.add(messages.get(0));
        }
        result.add(createSummaryMessage(summary.get()));
        result.addAll(messages.subList(firstKept, messages.size()));
        return result;
    }

    public Message createSummaryMessage(String summary) {
        return Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_ASSISTANT)
                .content(SUMMARY_PREFIX + summary)
                .timestamp(clock.instant())
                .build();
    }

    private String formatConversation(List<Message> messages) {
        return messages.stream()
                .filter(m -> m.getContent() != null && !m.getContent().isBlank())
                .filter(m -> !m.isToolMessage())
                .map(m -> m.getRole() + ": " + truncate(m.getContent(), MESSAGE_PREVIEW_CHARS))
                .collect(Collectors.joining("\n"));
    }

    static String truncate(String text, int maxLen) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLen) {
            return text;
        }
        return text.substring(0, maxLen) + "...";
    }
}
