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

package me.golemcore.crew.adapter.outbound.lesson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.crew.domain.model.AgentLesson;
import me.golemcore.crew.domain.model.LessonPublishedEvent;
import me.golemcore.crew.infrastructure.event.SpringEventBus;
import me.golemcore.crew.port.outbound.LessonPublisherPort;
import me.golemcore.crew.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Appends lessons to {@code lessons/<agentId>.jsonl}, one JSON object per line,
 * and announces each one with a {@link LessonPublishedEvent}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EventLogLessonPublisher implements LessonPublisherPort {

    private static final String DIRECTORY = "lessons";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final SpringEventBus eventBus;

    @Override
    public CompletableFuture<String> publish(AgentLesson lesson) {
        String lessonId = UUID.randomUUID().toString();
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("id", lessonId);
        entry.put("lesson", lesson);

        String line;
        try {
            line = objectMapper.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Failed to serialize lesson for " + lesson.getAgentId(), e));
        }

        return storagePort.appendText(DIRECTORY, fileName(lesson.getAgentId()), line + "\n")
                .thenApply(ignored -> {
                    log.info("[Reflection] Lesson {} stored for {}: {}", lessonId, lesson.getAgentId(),
                            lesson.getTitle());
                    eventBus.publish(new LessonPublishedEvent(lessonId, lesson));
                    return lessonId;
                });
    }

    static String fileName(String agentId) {
        String safe = agentId == null ? "unknown" : agentId.replaceAll("[^a-zA-Z0-9._-]", "_");
        return safe.replaceAll("^\\.+", "_") + ".jsonl";
    }
}
