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
import me.golemcore.crew.domain.model.CorrectionAnalysis;
import me.golemcore.crew.domain.model.CorrectionPattern;
import me.golemcore.crew.domain.model.CorrectionType;
import me.golemcore.crew.domain.model.LlmRequest;
import me.golemcore.crew.domain.model.Message;
import me.golemcore.crew.domain.service.FanOutSupport;
import me.golemcore.crew.domain.service.StructuredResponseDecoder;
import me.golemcore.crew.infrastructure.config.CrewProperties;
import me.golemcore.crew.port.outbound.LlmPort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;

/**
 * Decides whether a message corrects earlier work.
 *
 * <p>
 * {@link #detectPattern(List)} is a cheap keyword pass over the conversation
 * tail. {@link #isCorrection(Message, List)} asks a model and treats any
 * unusable answer as "not a correction".
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CorrectionDetector {

    static final List<String> CORRECTION_KEYWORDS = List.of(
            "wrong", "incorrect", "mistake", "error", "fix", "actually", "correction", "revise", "update",
            "should be", "meant to say", "let me correct", "that's not right", "my bad");

    static final List<String> REVISION_KEYWORDS = List.of(
            "revise", "update", "change", "modify", "improve", "enhance", "refactor", "redo", "rework", "adjust");

    private static final List<Pattern> CORRECTION_PATTERNS = compile(CORRECTION_KEYWORDS);
    private static final List<Pattern> REVISION_PATTERNS = compile(REVISION_KEYWORDS);

    private final LlmPort llmPort;
    private final StructuredResponseDecoder decoder;
    private final CrewProperties properties;

    /**
     * Looks for, in priority order: a user message correcting the assistant
     * message before it, an assistant message correcting its own previous
     * message, and a trailing user message asking for a revision. Only the first
     * match is returned. Confidence grows with the number of matched keywords and
     * is capped at 1.
     */
    public Optional<CorrectionPattern> detectPattern(List<Message> messages) {
        return detect(messages, 1);
    }

    /**
     * Like {@link #detectPattern(List)}, but only pairs ending at the last message
     * are considered, so a correction further back does not match again on every
     * later message.
     */
    public Optional<CorrectionPattern> detectTrailingPattern(List<Message> messages) {
        return messages == null ? Optional.empty() : detect(messages, messages.size() - 1);
    }

    private Optional<CorrectionPattern> detect(List<Message> messages, int firstIndex) {
        if (messages == null || messages.size() < 2) {
            return Optional.empty();
        }
        return detectUserCorrection(messages, firstIndex)
                .or(() -> detectSelfCorrection(messages, firstIndex))
                .or(() -> detectRevisionRequest(messages));
    }

    private Optional<CorrectionPattern> detectUserCorrection(List<Message> messages, int firstIndex) {
        for (int i = messages.size() - 1; i >= firstIndex; i--) {
            Message current = messages.get(i);
            if (current.isUserMessage() && messages.get(i - 1).isAssistantMessage()) {
                List<String> matched = matchKeywords(current.getContent(), CORRECTION_KEYWORDS, CORRECTION_PATTERNS);
                if (!matched.isEmpty()) {
                    return Optional.of(new CorrectionPattern(CorrectionType.USER_CORRECTION, matched,
                            Math.min(0.7 + matched.size() * 0.1, 1.0), List.of(i - 1, i)));
                }
            }
        }
        return Optional.empty();
    }

    private Optional<CorrectionPattern> detectSelfCorrection(List<Message> messages, int firstIndex) {
        for (int i = messages.size() - 1; i >= firstIndex; i--) {
            Message current = messages.get(i);
            if (current.isAssistantMessage() && messages.get(i - 1).isAssistantMessage()) {
                List<String> matched = matchKeywords(current.getContent(), CORRECTION_KEYWORDS, CORRECTION_PATTERNS);
                if (!matched.isEmpty()) {
                    return Optional.of(new CorrectionPattern(CorrectionType.SELF_CORRECTION, matched,
                            Math.min(0.8 + matched.size() * 0.05, 1.0), List.of(i - 1, i)));
                }
            }
        }
        return Optional.empty();
    }

    private Optional<CorrectionPattern> detectRevisionRequest(List<Message> messages) {
        int last = messages.size() - 1;
        Message message = messages.get(last);
        if (!message.isUserMessage()) {
            return Optional.empty();
        }
        List<String> matched = matchKeywords(message.getContent(), REVISION_KEYWORDS, REVISION_PATTERNS);
        if (matched.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new CorrectionPattern(CorrectionType.REVISION_REQUEST, matched,
                Math.min(0.6 + matched.size() * 0.15, 1.0), List.of(last)));
    }

    /**
     * Asks the model whether {@code message} corrects earlier work. The returned
     * future never fails; any problem yields {@link CorrectionAnalysis#none()}.
     */
    public CompletableFuture<CorrectionAnalysis> isCorrection(Message message, List<Message> history) {
        LlmRequest request = LlmRequest.builder()
                .messages(List.of(
                        Message.system("You analyze team conversations for corrections of earlier work. "
                                + "Respond with JSON only."),
                        Message.user(buildAnalysisPrompt(message, history))))
                .temperature(0.1)
                .build();

        CompletableFuture<CorrectionAnalysis> analysis;
        try {
            analysis = llmPort.chat(request).thenApply(response -> parseAnalysis(response.getContent()));
        } catch (RuntimeException e) {
            analysis = CompletableFuture.failedFuture(e);
        }
        return analysis.exceptionally(e -> {
            log.warn("[Reflection] Correction analysis failed: {}", FanOutSupport.rootMessage(e));
            return CorrectionAnalysis.none();
        });
    }

    private String buildAnalysisPrompt(Message message, List<Message> history) {
        int historySize = properties.getReflection().getHistoryMessages();
        List<Message> recent = history.size() <= historySize
                ? history
                : history.subList(history.size() - historySize, history.size());

        StringBuilder sb = new StringBuilder("## Recent conversation\n");
        for (Message m : recent) {
            sb.append('[').append(m.getSenderId() != null ? m.getSenderId() : m.getRole()).append("]: ")
                    .append(m.getContent()).append('\n');
        }
        sb.append("\n## New message\n")
                .append('[').append(message.getSenderId() != null ? message.getSenderId() : message.getRole())
                .append("]: ").append(message.getContent()).append("\n\n");
        sb.append("""
                Does the new message correct a mistake, point out an error, or ask to redo earlier work?
                Respond with JSON:
                {
                  "isCorrection": true | false,
                  "confidence": 0.0-1.0,
                  "issues": ["what was wrong"],
                  "affectedAgents": ["agents whose work was corrected"]
                }""");
        return sb.toString();
    }

    CorrectionAnalysis parseAnalysis(String content) {
        Optional<JsonNode> node = decoder.decodeObject(content);
        if (node.isEmpty() || !node.get().path("isCorrection").isBoolean()) {
            log.debug("[Reflection] Unusable correction analysis, treating as no correction");
            return CorrectionAnalysis.none();
        }
        JsonNode json = node.get();
        if (!json.get("isCorrection").asBoolean()) {
            return CorrectionAnalysis.none();
        }
        return CorrectionAnalysis.builder()
                .correction(true)
                .confidence(Math.max(0, Math.min(1, json.path("confidence").asDouble(0.5))))
                .issues(textList(json.path("issues")))
                .affectedAgents(textList(json.path("affectedAgents")))
                .build();
    }

    private static List<String> textList(JsonNode array) {
        List<String> values = new ArrayList<>();
        for (JsonNode item : array) {
            if (item.isTextual() && !item.asText().isBlank()) {
                values.add(item.asText().trim());
            }
        }
        return values;
    }

    private static List<String> matchKeywords(String content, List<String> keywords, List<Pattern> patterns) {
        if (content == null || content.isBlank()) {
            return List.of();
        }
        String normalized = content.toLowerCase(Locale.ROOT).replace('’', '\'');
        List<String> matched = new ArrayList<>();
        for (int i = 0; i < keywords.size(); i++) {
            if (patterns.get(i).matcher(normalized).find()) {
                matched.add(keywords.get(i));
            }
        }
        return matched;
    }

    private static List<Pattern> compile(List<String> keywords) {
        return keywords.stream()
                .map(keyword -> Pattern.compile("\\b" + Pattern.quote(keyword) + "\\b"))
                .toList();
    }
}
