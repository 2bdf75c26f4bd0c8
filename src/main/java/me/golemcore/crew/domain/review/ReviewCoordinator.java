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

package me.golemcore.crew.domain.review;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.crew.domain.model.AgentProfile;
import me.golemcore.crew.domain.model.Conversation;
import me.golemcore.crew.domain.model.LlmRequest;
import me.golemcore.crew.domain.model.LlmResponse;
import me.golemcore.crew.domain.model.Message;
import me.golemcore.crew.domain.model.ReviewDecision;
import me.golemcore.crew.domain.model.ReviewRequest;
import me.golemcore.crew.domain.model.ReviewVerdict;
import me.golemcore.crew.domain.model.Team;
import me.golemcore.crew.domain.model.WorkSummary;
import me.golemcore.crew.domain.service.FanOutSupport;
import me.golemcore.crew.domain.service.StructuredResponseDecoder;
import me.golemcore.crew.infrastructure.config.CrewProperties;
import me.golemcore.crew.port.outbound.AgentDirectoryPort;
import me.golemcore.crew.port.outbound.LlmPort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Picks peer reviewers for a team's work and gathers their verdicts.
 *
 * <p>
 * Reviewer selection is delegated to a model and falls back to a random pick
 * from the eligible pool whenever the model's answer is unusable, so it never
 * fails. Reviews run in parallel against one global deadline; a reviewer that
 * fails or answers with garbage simply contributes no decision, and passing the
 * deadline discards the whole round.
 */
@Service
@Slf4j
public class ReviewCoordinator {

    private static final double DEFAULT_CONFIDENCE = 0.5;

    private final LlmPort llmPort;
    private final AgentDirectoryPort agentDirectory;
    private final StructuredResponseDecoder decoder;
    private final CrewProperties properties;
    private final Clock clock;
    private final Random random;

    @Autowired
    public ReviewCoordinator(LlmPort llmPort, AgentDirectoryPort agentDirectory, StructuredResponseDecoder decoder,
            CrewProperties properties, Clock clock) {
        this(llmPort, agentDirectory, decoder, properties, clock, new Random());
    }

    ReviewCoordinator(LlmPort llmPort, AgentDirectoryPort agentDirectory, StructuredResponseDecoder decoder,
            CrewProperties properties, Clock clock, Random random) {
        this.llmPort = llmPort;
        this.agentDirectory = agentDirectory;
        this.decoder = decoder;
        this.properties = properties;
        this.clock = clock;
        this.random = random;
    }

    /**
     * Chooses up to the configured number of reviewers from every known agent
     * that is neither a team member, the team lead, nor explicitly excluded. An
     * empty pool yields an empty list. The returned future never fails.
     */
    public CompletableFuture<List<AgentProfile>> selectReviewers(Team team, Collection<String> excludeMembers) {
        List<AgentProfile> pool = candidatePool(team, excludeMembers);
        if (pool.isEmpty()) {
            log.info("[Review] No eligible reviewers for team {}", team.getId());
            return CompletableFuture.completedFuture(List.of());
        }

        LlmRequest request = LlmRequest.builder()
                .messages(List.of(
                        Message.system("You select peer reviewers for completed work. Respond with JSON only."),
                        Message.user(buildSelectionPrompt(team, pool))))
                .temperature(0.2)
                .build();

        return safeChat(request)
                .thenApply(response -> parseSelection(response.getContent(), pool))
                .exceptionally(e -> {
                    log.warn("[Review] Reviewer selection call failed: {}", FanOutSupport.rootMessage(e));
                    return Optional.empty();
                })
                .thenApply(selected -> selected.orElseGet(() -> randomSelection(pool)));
    }

    /**
     * Asks every reviewer for a decision in parallel. Completes with the decisions
     * that arrived in time, or with an empty list when the global deadline passes
     * first.
     */
    public CompletableFuture<List<ReviewDecision>> collectReviews(List<AgentProfile> reviewers,
            Conversation conversation, ReviewRequest request) {
        if (reviewers.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        List<CompletableFuture<ReviewDecision>> tasks = new ArrayList<>(reviewers.size());
        for (AgentProfile reviewer : reviewers) {
            tasks.add(reviewOne(reviewer, conversation, request));
        }

        Duration timeout = Duration.ofMillis(properties.getReview().getTimeoutMs());
        return FanOutSupport.settleAllWithin(tasks, timeout, "Review")
                .thenApply(decisions -> decisions.orElseGet(() -> {
                    log.warn("[Review] Review collection for team {} timed out after {}ms",
                            request.getTeamId(), timeout.toMillis());
                    return List.of();
                }));
    }

    List<AgentProfile> candidatePool(Team team, Collection<String> excludeMembers) {
        Set<String> excluded = new HashSet<>();
        if (team.getMembers() != null) {
            excluded.addAll(team.getMembers());
        }
        if (team.getLead() != null) {
            excluded.add(team.getLead());
        }
        if (excludeMembers != null) {
            excluded.addAll(excludeMembers);
        }
        return agentDirectory.listAgents().stream()
                .filter(agent -> !excluded.contains(agent.getId()) && !excluded.contains(agent.displayName()))
                .toList();
    }

    private CompletableFuture<ReviewDecision> reviewOne(AgentProfile reviewer, Conversation conversation,
            ReviewRequest request) {
        LlmRequest llmRequest = LlmRequest.builder()
                .model(reviewer.getModel())
                .agentId(reviewer.getId())
                .conversationId(request.getConversationId())
                .messages(List.of(
                        Message.system(reviewerSystemPrompt(reviewer)),
                        Message.user(buildReviewPrompt(conversation, request))))
                .temperature(0.3)
                .build();

        return safeChat(llmRequest).thenApply(response -> {
            Optional<ReviewDecision> decision = parseDecision(reviewer, response.getContent());
            if (decision.isEmpty()) {
                log.warn("[Review] Unusable review from {}", reviewer.getId());
            }
            return decision.orElse(null);
        });
    }

    private CompletableFuture<LlmResponse> safeChat(LlmRequest request) {
        try {
            return llmPort.chat(request);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private String buildSelectionPrompt(Team team, List<AgentProfile> pool) {
        int maxReviewers = properties.getReview().getMaxReviewers();
        StringBuilder sb = new StringBuilder();
        sb.append("Task: ").append(taskDescription(team)).append("\n\n");
        sb.append("Available reviewers:\n");
        for (AgentProfile agent : pool) {
            sb.append("- ").append(agent.displayName());
            if (agent.getRole() != null) {
                sb.append(" (").append(agent.getRole()).append(')');
            }
            if (agent.getDescription() != null) {
                sb.append(": ").append(agent.getDescription());
            }
            sb.append('\n');
        }
        sb.append("\nSelect up to ").append(maxReviewers)
                .append(" reviewers whose expertise is most relevant to this task.\n")
                .append("Respond with a JSON array of reviewer names, for example [\"name1\", \"name2\"].");
        return sb.toString();
    }

    private Optional<List<AgentProfile>> parseSelection(String content, List<AgentProfile> pool) {
        Optional<JsonNode> array = decoder.decodeArray(content);
        if (array.isEmpty()) {
            log.warn("[Review] Reviewer selection is not a JSON array, selecting randomly");
            return Optional.empty();
        }

        Map<String, AgentProfile> byName = new LinkedHashMap<>();
        for (AgentProfile agent : pool) {
            byName.put(agent.getId().toLowerCase(Locale.ROOT), agent);
            byName.put(agent.displayName().toLowerCase(Locale.ROOT), agent);
        }

        int maxReviewers = properties.getReview().getMaxReviewers();
        List<AgentProfile> selected = new ArrayList<>();
        for (JsonNode entry : array.get()) {
            if (!entry.isTextual()) {
                continue;
            }
            AgentProfile agent = byName.get(entry.asText().trim().toLowerCase(Locale.ROOT));
            if (agent != null && !selected.contains(agent) && selected.size() < maxReviewers) {
                selected.add(agent);
            }
        }
        if (selected.isEmpty()) {
            log.warn("[Review] Reviewer selection named no eligible agents, selecting randomly");
            return Optional.empty();
        }
        log.info("[Review] Selected reviewers: {}", selected.stream().map(AgentProfile::getId).toList());
        return Optional.of(selected);
    }

    private List<AgentProfile> randomSelection(List<AgentProfile> pool) {
        List<AgentProfile> shuffled = new ArrayList<>(pool);
        Collections.shuffle(shuffled, random);
        List<AgentProfile> selected = List.copyOf(
                shuffled.subList(0, Math.min(properties.getReview().getMaxReviewers(), shuffled.size())));
        log.info("[Review] Randomly selected reviewers: {}", selected.stream().map(AgentProfile::getId).toList());
        return selected;
    }

    private static String reviewerSystemPrompt(AgentProfile reviewer) {
        StringBuilder sb = new StringBuilder("You are ").append(reviewer.displayName());
        if (reviewer.getRole() != null) {
            sb.append(", ").append(reviewer.getRole());
        }
        sb.append(". You are reviewing work completed by another team. Be specific and constructive.");
        return sb.toString();
    }

    String buildReviewPrompt(Conversation conversation, ReviewRequest request) {
        int previewChars = properties.getReview().getMessagePreviewChars();
        StringBuilder sb = new StringBuilder();
        sb.append("## Task\n").append(request.getTaskDescription()).append("\n\n");

        WorkSummary summary = request.getWorkSummary();
        if (summary != null) {
            sb.append("## Work summary\n");
            sb.append("- Lines of code: ").append(summary.getLinesOfCode()).append('\n');
            sb.append("- Files modified: ").append(joinOrNone(summary.getFilesModified())).append('\n');
            sb.append("- Tests added: ").append(joinOrNone(summary.getTestsAdded())).append('\n');
            sb.append("- Key changes: ").append(joinOrNone(summary.getKeyChanges())).append("\n\n");
        }

        if (conversation != null) {
            sb.append("## Recent conversation\n");
            for (Message message : conversation.lastMessages(properties.getReview().getHistoryMessages())) {
                String who = message.getSenderId() != null ? message.getSenderId() : message.getRole();
                sb.append('[').append(who).append("]: ")
                        .append(truncate(message.getContent(), previewChars)).append('\n');
            }
            sb.append('\n');
        }

        sb.append("""
                Review the work and respond with JSON only:
                {
                  "decision": "approve" | "reject" | "revise",
                  "feedback": "your assessment",
                  "confidence": 0.0-1.0,
                  "suggestedChanges": ["change 1", "change 2"]
                }""");
        return sb.toString();
    }

    Optional<ReviewDecision> parseDecision(AgentProfile reviewer, String content) {
        Optional<JsonNode> node = decoder.decodeObject(content);
        if (node.isEmpty()) {
            return Optional.empty();
        }
        JsonNode json = node.get();
        Optional<ReviewVerdict> verdict = ReviewVerdict.parse(json.path("decision").asText(null));
        if (verdict.isEmpty()) {
            return Optional.empty();
        }

        List<String> suggestedChanges = new ArrayList<>();
        for (JsonNode change : json.path("suggestedChanges")) {
            if (change.isTextual() && !change.asText().isBlank()) {
                suggestedChanges.add(change.asText());
            }
        }
        double confidence = json.path("confidence").isNumber()
                ? Math.max(0, Math.min(1, json.get("confidence").asDouble()))
                : DEFAULT_CONFIDENCE;

        return Optional.of(ReviewDecision.builder()
                .reviewerId(reviewer.getId())
                .reviewerName(reviewer.displayName())
                .decision(verdict.get())
                .feedback(json.path("feedback").asText(""))
                .confidence(confidence)
                .suggestedChanges(suggestedChanges)
                .timestamp(clock.instant())
                .build());
    }

    private static String taskDescription(Team team) {
        return team.getTaskDefinition() != null && team.getTaskDefinition().getDescription() != null
                ? team.getTaskDefinition().getDescription()
                : "(no description)";
    }

    private static String joinOrNone(List<String> values) {
        return values == null || values.isEmpty() ? "none" : String.join(", ", values);
    }

    private static String truncate(String text, int maxLen) {
        if (text == null) {
            return "";
        }
        return text.length() <= maxLen ? text : text.substring(0, maxLen) + "...";
    }
}
