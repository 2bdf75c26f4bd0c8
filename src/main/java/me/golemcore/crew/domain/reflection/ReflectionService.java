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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.crew.domain.model.AgentLesson;
import me.golemcore.crew.domain.model.AgentProfile;
import me.golemcore.crew.domain.model.Conversation;
import me.golemcore.crew.domain.model.CorrectionPattern;
import me.golemcore.crew.domain.model.Message;
import me.golemcore.crew.domain.model.ReflectionTrigger;
import me.golemcore.crew.domain.service.FanOutSupport;
import me.golemcore.crew.infrastructure.config.CrewProperties;
import me.golemcore.crew.port.outbound.AgentDirectoryPort;
import me.golemcore.crew.port.outbound.LessonPublisherPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Learns from corrections.
 *
 * <p>
 * A message first has to match a correction pattern, then be confirmed by the
 * model. Lessons are generated for the agents the model blames, falling back to
 * the agents taking part in the conversation. They are deduplicated and handed
 * to the lesson publisher without waiting for storage.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReflectionService {

    private final CorrectionDetector correctionDetector;
    private final LessonGenerator lessonGenerator;
    private final LessonPublisherPort lessonPublisher;
    private final AgentDirectoryPort agentDirectory;
    private final CrewProperties properties;
    private final Clock clock;

    /**
     * Checks whether the last message of the conversation is a correction worth
     * reflecting on. The conversation must already contain {@code event}.
     */
    public CompletableFuture<Optional<ReflectionTrigger>> checkForReflection(Conversation conversation,
            Message event) {
        return checkForReflection(conversation, event, null);
    }

    /**
     * Same as {@link #checkForReflection(Conversation, Message)}, tagging the
     * trigger with the team whose work is being discussed.
     */
    public CompletableFuture<Optional<ReflectionTrigger>> checkForReflection(Conversation conversation,
            Message event, String teamId) {
        if (!properties.getReflection().isEnabled()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        List<Message> messages = conversation.getMessages();
        Optional<CorrectionPattern> pattern = correctionDetector.detectTrailingPattern(messages);
        if (pattern.isEmpty()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        double minConfidence = properties.getReflection().getMinPatternConfidence();
        if (pattern.get().confidence() < minConfidence) {
            log.debug("[Reflection] Pattern {} below threshold ({} < {})", pattern.get().type(),
                    pattern.get().confidence(), minConfidence);
            return CompletableFuture.completedFuture(Optional.empty());
        }

        List<Message> history = historyBefore(messages, event);
        return correctionDetector.isCorrection(event, history)
                .thenApply(analysis -> {
                    if (!analysis.isCorrection()) {
                        log.debug("[Reflection] Pattern {} not confirmed", pattern.get().type());
                        return Optional.empty();
                    }
                    log.info("[Reflection] Correction confirmed in conversation {} ({})", conversation.getId(),
                            pattern.get().type());
                    return Optional.of(ReflectionTrigger.builder()
                            .triggerEventId(event.getId())
                            .conversationId(conversation.getId())
                            .teamId(teamId)
                            .correctionMessage(event)
                            .recentMessages(history)
                            .pattern(pattern.get())
                            .analysis(analysis)
                            .detectedAt(clock.instant())
                            .build());
                });
    }

    /**
     * Generates, deduplicates and publishes lessons for a confirmed trigger.
     *
     * @return the lessons handed to the publisher
     */
    public CompletableFuture<List<AgentLesson>> reflect(ReflectionTrigger trigger, Conversation conversation) {
        List<AgentProfile> agents = candidateAgents(trigger, conversation);
        if (agents.isEmpty()) {
            log.info("[Reflection] No agents to learn from trigger {}", trigger.getTriggerEventId());
            return CompletableFuture.completedFuture(List.of());
        }
        return lessonGenerator.generateLessons(trigger, agents)
                .thenCompose(lessonGenerator::deduplicateLessons)
                .thenApply(lessons -> {
                    lessons.forEach(this::publish);
                    return lessons;
                });
    }

    /**
     * Runs detection and, when confirmed, lesson generation. The returned future
     * never fails.
     */
    public CompletableFuture<List<AgentLesson>> process(Conversation conversation, Message event) {
        return process(conversation, event, null);
    }

    /**
     * Same as {@link #process(Conversation, Message)} for a correction raised
     * while a team's work is under discussion; every known agent is then a
     * lesson candidate.
     */
    public CompletableFuture<List<AgentLesson>> process(Conversation conversation, Message event, String teamId) {
        CompletableFuture<List<AgentLesson>> result;
        try {
            result = checkForReflection(conversation, event, teamId)
                    .thenCompose(trigger -> trigger
                            .map(t -> reflect(t, conversation))
                            .orElseGet(() -> CompletableFuture.completedFuture(List.of())));
        } catch (RuntimeException e) {
            result = CompletableFuture.failedFuture(e);
        }
        return result.exceptionally(e -> {
            log.warn("[Reflection] Reflection failed for conversation {}: {}", conversation.getId(),
                    FanOutSupport.rootMessage(e));
            return List.of();
        });
    }

    /**
     * Agents named by the analysis when any of them is known. Otherwise every
     * known agent for a team trigger, or the conversation's owner and
     * participants.
     */
    List<AgentProfile> candidateAgents(ReflectionTrigger trigger, Conversation conversation) {
        List<AgentProfile> known = agentDirectory.listAgents();
        List<AgentProfile> agents = new ArrayList<>();
        if (trigger.getAnalysis() != null) {
            for (String reference : trigger.getAnalysis().getAffectedAgents()) {
                resolve(known, reference).ifPresent(agent -> addDistinct(agents, agent));
            }
        }
        if (!agents.isEmpty()) {
            return agents;
        }
        if (trigger.getTeamId() != null) {
            known.forEach(agent -> addDistinct(agents, agent));
            return agents;
        }
        String owner = conversation.getOwnerAgentId();
        if (owner != null) {
            addDistinct(agents, agentDirectory.findAgent(owner)
                    .orElseGet(() -> AgentProfile.builder().id(owner).build()));
        }
        for (String participant : conversation.getParticipants()) {
            known.stream()
                    .filter(agent -> agent.getId().equals(participant))
                    .findFirst()
                    .ifPresent(agent -> addDistinct(agents, agent));
        }
        return agents;
    }

    private static void addDistinct(List<AgentProfile> agents, AgentProfile agent) {
        if (agents.stream().noneMatch(a -> a.getId().equals(agent.getId()))) {
            agents.add(agent);
        }
    }

    private static Optional<AgentProfile> resolve(List<AgentProfile> known, String reference) {
        String normalized = reference.trim().toLowerCase(Locale.ROOT);
        return known.stream()
                .filter(agent -> agent.getId().toLowerCase(Locale.ROOT).equals(normalized)
                        || agent.displayName().toLowerCase(Locale.ROOT).equals(normalized))
                .findFirst();
    }

    private void publish(AgentLesson lesson) {
        lessonPublisher.publish(lesson)
                .thenAccept(id -> log.debug("[Reflection] Published lesson {} for {}", id, lesson.getAgentId()))
                .exceptionally(e -> {
                    log.warn("[Reflection] Failed to publish lesson for {}: {}", lesson.getAgentId(),
                            FanOutSupport.rootMessage(e));
                    return null;
                });
    }

    private List<Message> historyBefore(List<Message> messages, Message event) {
        int end = messages.size();
        if (end > 0 && event.getId() != null && event.getId().equals(messages.get(end - 1).getId())) {
            end--;
        }
        int start = Math.max(0, end - properties.getReflection().getHistoryMessages());
        return new ArrayList<>(messages.subList(start, end));
    }
}
