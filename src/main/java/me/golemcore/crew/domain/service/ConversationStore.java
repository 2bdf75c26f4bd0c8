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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.crew.domain.model.Conversation;
import me.golemcore.crew.domain.model.Message;
import me.golemcore.crew.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-agent conversation logs.
 *
 * <p>
 * Every agent owns a separate {@link Conversation} per thread, keyed by
 * {@code (agentId, conversationId)}. Messages are only ever appended. Callers
 * receive snapshots, never the live object. Each append is also written to
 * local storage as a JSON snapshot on a best-effort basis; a failed write is
 * logged and does not affect the in-memory log.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationStore {

    private static final String DIRECTORY = "conversations";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, Conversation> conversations = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<Void>> pendingWrites = new ConcurrentHashMap<>();

    /**
     * Appends a message to the agent's copy of the conversation, creating it on
     * first use. Missing ids and timestamps are filled in.
     *
     * @return the message as stored
     */
    public Message append(String agentId, String conversationId, Message message) {
        Conversation conversation = live(agentId, conversationId);
        Message stored = message.toBuilder()
                .id(message.getId() != null ? message.getId() : UUID.randomUUID().toString())
                .timestamp(message.getTimestamp() != null ? message.getTimestamp() : clock.instant())
                .build();

        synchronized (conversation) {
            conversation.getMessages().add(stored);
            if (stored.getSenderId() != null) {
                conversation.getParticipants().add(stored.getSenderId());
            }
            conversation.setLastActivityAt(clock.instant());
            persist(copyOf(conversation));
        }
        return stored;
    }

    public Optional<Conversation> find(String agentId, String conversationId) {
        Conversation conversation = conversations.get(key(agentId, conversationId));
        if (conversation == null) {
            Optional<Conversation> loaded = load(agentId, conversationId);
            if (loaded.isEmpty()) {
                return Optional.empty();
            }
            conversation = conversations.computeIfAbsent(key(agentId, conversationId), k -> loaded.get());
        }
        synchronized (conversation) {
            return Optional.of(copyOf(conversation));
        }
    }

    public List<Message> messages(String agentId, String conversationId) {
        return find(agentId, conversationId)
                .map(Conversation::getMessages)
                .orElseGet(List::of);
    }

    private Conversation live(String agentId, String conversationId) {
        return conversations.computeIfAbsent(key(agentId, conversationId),
                k -> loadedOrNew(agentId, conversationId));
    }

    private Conversation loadedOrNew(String agentId, String conversationId) {
        return load(agentId, conversationId).orElseGet(() -> {
            Instant now = clock.instant();
            return Conversation.builder()
                    .id(conversationId)
                    .ownerAgentId(agentId)
                    .createdAt(now)
                    .lastActivityAt(now)
                    .build();
        });
    }

    private Optional<Conversation> load(String agentId, String conversationId) {
        try {
            String json = storagePort.getText(DIRECTORY, path(agentId, conversationId)).join();
            if (json == null || json.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, Conversation.class));
        } catch (CompletionException | JsonProcessingException e) {
            log.warn("Failed to load conversation {} for agent {}: {}", conversationId, agentId,
                    FanOutSupport.rootMessage(e));
            return Optional.empty();
        }
    }

    /**
     * Queues the snapshot behind any earlier write of the same conversation, so
     * snapshots reach storage in the order they were taken. Must be called while
     * holding the conversation's lock.
     */
    private void persist(Conversation snapshot) {
        String json;
        try {
            json = objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize conversation {}: {}", snapshot.getId(), e.getMessage());
            return;
        }
        String key = key(snapshot.getOwnerAgentId(), snapshot.getId());
        String path = path(snapshot.getOwnerAgentId(), snapshot.getId());
        CompletableFuture<Void> write = pendingWrites.compute(key, (k, previous) -> {
            CompletableFuture<Void> after = previous != null ? previous : CompletableFuture.completedFuture(null);
            return after.thenCompose(ignored -> storagePort.putTextAtomic(DIRECTORY, path, json))
                    .exceptionally(e -> {
                        log.warn("Failed to persist conversation {}: {}", snapshot.getId(),
                                FanOutSupport.rootMessage(e));
                        return null;
                    });
        });
        write.whenComplete((ignored, e) -> pendingWrites.remove(key, write));
    }

    private static Conversation copyOf(Conversation conversation) {
        return Conversation.builder()
                .id(conversation.getId())
                .ownerAgentId(conversation.getOwnerAgentId())
                .messages(new ArrayList<>(conversation.getMessages()))
                .participants(new LinkedHashSet<>(conversation.getParticipants()))
                .createdAt(conversation.getCreatedAt())
                .lastActivityAt(conversation.getLastActivityAt())
                .build();
    }

    private static String key(String agentId, String conversationId) {
        return agentId + "\u0000" + conversationId;
    }

    static String path(String agentId, String conversationId) {
        return sanitize(agentId) + "/" + sanitize(conversationId) + ".json";
    }

    private static String sanitize(String value) {
        return value.replaceAll("[^a-zA-Z0-9._-]", "_").replaceAll("^\\.+", "_");
    }
}
