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

package me.golemcore.crew.domain.reflection;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.crew.domain.model.AgentLesson;
import me.golemcore.crew.domain.model.AgentProfile;
import me.golemcore.crew.domain.model.LessonContext;
import me.golemcore.crew.domain.model.LlmRequest;
import me.golemcore.crew.domain.model.LlmResponse;
import me.golemcore.crew.domain.model.Message;
import me.golemcore.crew.domain.model.ReflectionTrigger;
import me.golemcore.crew.domain.service.FanOutSupport;
import me.golemcore.crew.domain.service.StructuredResponseDecoder;
import me.golemcore.crew.port.outbound.LlmPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Turns a confirmed correction into lessons, one model call per candidate
 * agent, and removes near-duplicates among the results.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LessonGenerator {

    private static final int MAX_TITLE_CHARS = 80;
    private static final int MAX_KEYWORDS = 8;

    private final LlmPort llmPort;
    private final StructuredResponseDecoder decoder;
    private final Clock clock;

    /**
     * Asks, for each agent in parallel, whether the correction teaches that agent
     * something. Agents whose call fails or who get no applicable lesson are left
     * out; the future itself never fails.
     */
    public CompletableFuture<List<AgentLesson>> generateLessons(ReflectionTrigger trigger, List<AgentProfile> agents) {
        if (agents == null || agents.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        List<CompletableFuture<AgentLesson>> tasks = new ArrayList<>(agents.size());
        for (AgentProfile agent : agents) {
            tasks.add(generateFor(trigger, agent));
        }
        return FanOutSupport.settleAll(tasks, "Reflection")
                .thenApply(lessons -> {
                    log.info("[Reflection] Generated {} lesson(s) for {} agent(s)", lessons.size(), agents.size());
                    return lessons;
                });
    }

    private CompletableFuture<AgentLesson> generateFor(ReflectionTrigger trigger, AgentProfile agent) {
        LlmRequest request = LlmRequest.builder()
                .model(agent.getModel())
                .agentId(agent.getId())
                .conversationId(trigger.getConversationId())
                .messages(List.of(
                        Message.system("You extract durable lessons from corrections so the same mistake "
                                + "is not repeated. Respond with JSON only."),
                        Message.user(buildLessonPrompt(trigger, agent))))
                .temperature(0.3)
                .build();

        return safeChat(request)
                .thenApply(response -> parseLesson(response.getContent(), trigger, agent).orElse(null));
    }

    private String buildLessonPrompt(ReflectionTrigger trigger, AgentProfile agent) {
        StringBuilder sb = new StringBuilder();
        sb.append("Agent: ").append(agent.displayName());
        if (agent.getRole() != null) {
            sb.append(" (").append(agent.getRole()).append(')');
        }
        sb.append("\n\n## Conversation before the correction\n");
        for (Message message : trigger.getRecentMessages()) {
            sb.append('[').append(message.getSenderId() != null ? message.getSenderId() : message.getRole())
                    .append("]: ").append(message.getContent()).append('\n');
        }
        if (trigger.getCorrectionMessage() != null) {
            sb.append("\n## Correction\n").append(trigger.getCorrectionMessage().getContent()).append('\n');
        }
        if (trigger.getAnalysis() != null && !trigger.getAnalysis().getIssues().isEmpty()) {
            sb.append("\n## Identified issues\n");
            trigger.getAnalysis().getIssues().forEach(issue -> sb.append("- ").append(issue).append('\n'));
        }
        sb.append("""

                Is there a lesson this agent should remember to avoid the mistake in the future?
                Respond with JSON:
                {
                  "applicable": true | false,
                  "title": "short title",
                  "lesson": "what to do differently next time",
                  "confidence": 0.0-1.0,
                  "keywords": ["keyword"],
                  "context": {
                    "errorType": "kind of mistake",
                    "preventionStrategy": "how to avoid it",
                    "relatedCapabilities": ["capability"]
                  }
                }""");
        return sb.toString();
    }

    Optional<AgentLesson> parseLesson(String content, ReflectionTrigger trigger, AgentProfile agent) {
        Optional<JsonNode> decoded = decoder.decodeObject(content);
        if (decoded.isEmpty()) {
            log.warn("[Reflection] Unusable lesson for {}", agent.getId());
            return Optional.empty();
        }
        JsonNode json = decoded.get();
        String lesson = text(json, "lesson");
        if (!json.path("applicable").asBoolean(false) || lesson == null) {
            log.debug("[Reflection] No applicable lesson for {}", agent.getId());
            return Optional.empty();
        }

        JsonNode context = json.path("context");
        String title = text(json, "title");
        return Optional.of(AgentLesson.builder()
                .agentId(agent.getId())
                .taskId(trigger.getTaskId())
                .title(title != null ? title : titleFrom(lesson))
                .content(lesson)
                .confidence(Math.max(0, Math.min(1, json.path("confidence").asDouble(0.5))))
                .keywords(textList(json.path("keywords"), MAX_KEYWORDS))
                .context(LessonContext.builder()
                        .triggerEventId(trigger.getTriggerEventId())
                        .conversationId(trigger.getConversationId())
                        .teamId(trigger.getTeamId())
                        .errorType(text(context, "errorType"))
                        .preventionStrategy(text(context, "preventionStrategy"))
                        .relatedCapabilities(textList(context.path("relatedCapabilities"), Integer.MAX_VALUE))
                        .build())
                .timestamp(clock.instant())
                .build());
    }

    /**
     * Asks the model which lessons are distinct. Zero or one lesson is returned
     * as-is without a model call. When the answer is unusable or selects nothing,
     * every lesson is kept.
     */
    public CompletableFuture<List<AgentLesson>> deduplicateLessons(List<AgentLesson> lessons) {
        if (lessons.size() < 2) {
            return CompletableFuture.completedFuture(lessons);
        }
        LlmRequest request = LlmRequest.builder()
                .messages(List.of(
                        Message.system("You merge duplicate lessons. Respond with JSON only."),
                        Message.user(buildDeduplicationPrompt(lessons))))
                .temperature(0.1)
                .build();

        return safeChat(request)
                .thenApply(response -> selectDistinct(response.getContent(), lessons))
                .exceptionally(e -> {
                    log.warn("[Reflection] Lesson deduplication failed, keeping all: {}",
                            FanOutSupport.rootMessage(e));
                    return lessons;
                });
    }

    private String buildDeduplicationPrompt(List<AgentLesson> lessons) {
        StringBuilder sb = new StringBuilder("Lessons:\n");
        for (int i = 0; i < lessons.size(); i++) {
            AgentLesson lesson = lessons.get(i);
            sb.append('[').append(i).append("] ").append(lesson.getAgentId()).append(": ")
                    .append(lesson.getTitle()).append(" - ").append(lesson.getContent()).append('\n');
        }
        sb.append("\nLessons for different agents are distinct even when similar.\n")
                .append("Respond with a JSON array of the indices to keep, for example [0, 2].");
        return sb.toString();
    }

    private List<AgentLesson> selectDistinct(String content, List<AgentLesson> lessons) {
        Optional<JsonNode> array = decoder.decodeArray(content);
        if (array.isEmpty()) {
            log.warn("[Reflection] Deduplication answer is not a JSON array, keeping all lessons");
            return lessons;
        }
        Set<Integer> indices = new LinkedHashSet<>();
        for (JsonNode item : array.get()) {
            if (item.canConvertToInt()) {
                int index = item.asInt();
                if (index >= 0 && index < lessons.size()) {
                    indices.add(index);
                }
            }
        }
        if (indices.isEmpty()) {
            log.warn("[Reflection] Deduplication selected no lessons, keeping all");
            return lessons;
        }
        List<AgentLesson> kept = indices.stream().sorted().map(lessons::get).toList();
        log.debug("[Reflection] Deduplicated {} lessons to {}", lessons.size(), kept.size());
        return kept;
    }

    private CompletableFuture<LlmResponse> safeChat(LlmRequest request) {
        try {
            return llmPort.chat(request);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static String titleFrom(String lesson) {
        String firstLine = lesson.strip().split("\\R", 2)[0];
        return firstLine.length() <= MAX_TITLE_CHARS ? firstLine : firstLine.substring(0, MAX_TITLE_CHARS) + "...";
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isTextual() && !value.asText().isBlank() ? value.asText().trim() : null;
    }

    private static List<String> textList(JsonNode array, int limit) {
        List<String> values = new ArrayList<>();
        for (JsonNode item : array) {
            if (values.size() >= limit) {
                break;
            }
            if (item.isTextual() && !item.asText().isBlank()) {
                values.add(item.asText().trim().toLowerCase(Locale.ROOT));
            }
        }
        return values;
    }
}
