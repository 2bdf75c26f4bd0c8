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

package me.golemcore.crew.domain.loop;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.crew.domain.model.AgentProfile;
import me.golemcore.crew.domain.model.InboundEvent;
import me.golemcore.crew.domain.model.LlmRequest;
import me.golemcore.crew.domain.model.Message;
import me.golemcore.crew.domain.model.Team;
import me.golemcore.crew.domain.reflection.ReflectionService;
import me.golemcore.crew.domain.review.ReviewService;
import me.golemcore.crew.domain.service.ContextWindowService;
import me.golemcore.crew.domain.service.ConversationStore;
import me.golemcore.crew.domain.service.FanOutSupport;
import me.golemcore.crew.domain.toolloop.ToolOrchestratorFactory;
import me.golemcore.crew.infrastructure.config.CrewProperties;
import me.golemcore.crew.port.outbound.AgentDirectoryPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Single entry point for messages arriving at the crew.
 *
 * <p>
 * An inbound event is appended to the conversation copy of every recipient,
 * then checked for corrections. A completed task triggers a review round, and
 * when a responding agent is named it answers through its tool-enabled model
 * port with a windowed view of its own history. Reflection and review run in
 * the background; only the reply is awaited.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CrewCoordinator {

    private final ConversationStore conversationStore;
    private final AgentDirectoryPort agentDirectory;
    private final ContextWindowService contextWindowService;
    private final ToolOrchestratorFactory orchestratorFactory;
    private final ReflectionService reflectionService;
    private final ReviewService reviewService;
    private final CrewProperties properties;
    private final Clock clock;

    /**
     * @return the responding agent's reply, or empty when no reply was requested
     */
    public CompletableFuture<Optional<Message>> handle(InboundEvent event) {
        if (event.getConversationId() == null || event.getContent() == null) {
            log.warn("[Crew] Ignoring event {} without conversation or content", event.getId());
            return CompletableFuture.completedFuture(Optional.empty());
        }

        List<String> recipients = resolveRecipients(event);
        Message incoming = Message.builder()
                .id(event.getId() != null ? event.getId() : UUID.randomUUID().toString())
                .content(event.getContent())
                .senderId(event.getSenderId())
                .timestamp(event.getTimestamp() != null ? event.getTimestamp() : clock.instant())
                .build();
        for (String agentId : recipients) {
            conversationStore.append(agentId, event.getConversationId(), asSeenBy(agentId, incoming));
        }
        log.debug("[Crew] Event {} delivered to {} agent(s)", incoming.getId(), recipients.size());

        reflect(event, recipients, incoming);
        if (event.getCompletedTeam() != null) {
            review(event.getCompletedTeam(), event);
        }
        if (event.getRespondingAgentId() == null) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return respond(event.getRespondingAgentId(), event.getConversationId(), recipients).thenApply(Optional::of);
    }

    /**
     * Produces a reply from {@code agentId}, appends it to the agent's own copy
     * as an assistant message and to every other recipient's copy as a user
     * message.
     */
    public CompletableFuture<Message> respond(String agentId, String conversationId, List<String> recipients) {
        AgentProfile agent = agentDirectory.findAgent(agentId)
                .orElseGet(() -> AgentProfile.builder().id(agentId).build());

        List<Message> prompt = new ArrayList<>();
        prompt.add(Message.system(systemPrompt(agent)));
        prompt.addAll(conversationStore.messages(agentId, conversationId));

        LlmRequest request = LlmRequest.builder()
                .model(agent.getModel())
                .messages(contextWindowService.prepare(prompt))
                .agentId(agentId)
                .projectId(properties.getProjectId())
                .conversationId(conversationId)
                .build();

        return orchestratorFactory.forAgent(agent).chat(request)
                .thenApply(response -> {
                    Message reply = Message.builder()
                            .id(UUID.randomUUID().toString())
                            .role(Message.ROLE_ASSISTANT)
                            .content(response.getContent())
                            .senderId(agentId)
                            .timestamp(clock.instant())
                            .build();
                    conversationStore.append(agentId, conversationId, reply);
                    for (String recipient : recipients) {
                        if (!recipient.equals(agentId)) {
                            conversationStore.append(recipient, conversationId, asSeenBy(recipient, reply));
                        }
                    }
                    log.info("[Crew] {} replied in conversation {}", agentId, conversationId);
                    return reply;
                });
    }

    private List<String> resolveRecipients(InboundEvent event) {
        Set<String> recipients = new LinkedHashSet<>();
        if (event.getRecipients() != null && !event.getRecipients().isEmpty()) {
            recipients.addAll(event.getRecipients());
        } else {
            agentDirectory.listAgents().forEach(agent -> recipients.add(agent.getId()));
        }
        if (event.getRespondingAgentId() != null) {
            recipients.add(event.getRespondingAgentId());
        }
        return new ArrayList<>(recipients);
    }

    private static Message asSeenBy(String agentId, Message message) {
        String role = agentId.equals(message.getSenderId()) ? Message.ROLE_ASSISTANT : Message.ROLE_USER;
        return message.toBuilder().role(role).build();
    }

    private void reflect(InboundEvent event, List<String> recipients, Message incoming) {
        Optional<String> owner = Optional.ofNullable(event.getRespondingAgentId())
                .or(() -> recipients.stream().filter(id -> !id.equals(event.getSenderId())).findFirst())
                .or(() -> recipients.stream().findFirst());
        if (owner.isEmpty()) {
            return;
        }
        conversationStore.find(owner.get(), event.getConversationId())
                .ifPresent(conversation -> reflectionService
                        .process(conversation, asSeenBy(owner.get(), incoming), teamId(event))
                        .thenAccept(lessons -> {
                            if (!lessons.isEmpty()) {
                                log.info("[Crew] Reflection on event {} produced {} lesson(s)", incoming.getId(),
                                        lessons.size());
                            }
                        }));
    }

    private static String teamId(InboundEvent event) {
        return event.getCompletedTeam() != null ? event.getCompletedTeam().getId() : null;
    }

    private void review(Team team, InboundEvent event) {
        String owner = team.getLead() != null ? team.getLead() : event.getSenderId();
        List<String> exclude = event.getSenderId() != null ? List.of(event.getSenderId()) : List.of();
        reviewService.requestReview(team, owner, event.getConversationId(), exclude)
                .exceptionally(e -> {
                    log.warn("[Crew] Review for team {} failed: {}", team.getId(), FanOutSupport.rootMessage(e));
                    return null;
                });
    }

    private static String systemPrompt(AgentProfile agent) {
        StringBuilder sb = new StringBuilder("You are ").append(agent.displayName());
        if (agent.getRole() != null && !agent.getRole().isBlank()) {
            sb.append(", ").append(agent.getRole());
        }
        sb.append(", working with other agents in a shared conversation.");
        if (agent.getDescription() != null && !agent.getDescription().isBlank()) {
            sb.append('\n').append(agent.getDescription());
        }
        return sb.toString();
    }
}
