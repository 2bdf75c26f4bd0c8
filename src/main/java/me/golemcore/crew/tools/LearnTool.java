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

package me.golemcore.crew.tools;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.crew.domain.component.ToolComponent;
import me.golemcore.crew.domain.model.AgentLesson;
import me.golemcore.crew.domain.model.LessonContext;
import me.golemcore.crew.domain.model.ToolDefinition;
import me.golemcore.crew.domain.model.ToolExecutionContext;
import me.golemcore.crew.domain.model.ToolFailureKind;
import me.golemcore.crew.domain.model.ToolParameter;
import me.golemcore.crew.domain.model.ToolResult;
import me.golemcore.crew.domain.service.FanOutSupport;
import me.golemcore.crew.port.outbound.LessonPublisherPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Lets an agent record a lesson on its own initiative. The lesson goes to the
 * same publisher the reflection pipeline uses.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LearnTool implements ToolComponent {

    static final String NAME = "learn";
    private static final double SELF_REPORTED_CONFIDENCE = 1.0;

    private final LessonPublisherPort lessonPublisher;
    private final Clock clock;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Record a lesson learned so it is remembered in future work.")
                .parameters(List.of(
                        ToolParameter.builder()
                                .name("title")
                                .description("Short title of the lesson")
                                .required(true)
                                .build(),
                        ToolParameter.builder()
                                .name("lesson")
                                .description("What to do differently next time")
                                .required(true)
                                .build(),
                        ToolParameter.builder()
                                .name("keywords")
                                .type("array")
                                .itemsType("string")
                                .description("Keywords for finding the lesson later")
                                .build()))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolExecutionContext context) {
        String title = text(parameters.get("title"));
        String content = text(parameters.get("lesson"));
        if (title.isEmpty() || content.isEmpty()) {
            return CompletableFuture.completedFuture(
                    ToolResult.failure(ToolFailureKind.MISSING_PARAMETER, "title and lesson must not be blank"));
        }
        String agentId = context.agentId() != null ? context.agentId() : "unknown";

        AgentLesson lesson = AgentLesson.builder()
                .agentId(agentId)
                .title(title)
                .content(content)
                .confidence(SELF_REPORTED_CONFIDENCE)
                .keywords(keywords(parameters.get("keywords")))
                .context(LessonContext.builder()
                        .conversationId(context.conversationId())
                        .errorType("self_reported")
                        .build())
                .timestamp(clock.instant())
                .build();

        return lessonPublisher.publish(lesson)
                .thenApply(id -> {
                    log.info("[Tools] {} recorded lesson '{}'", agentId, title);
                    return ToolResult.success("Lesson recorded: " + title, Map.of("lessonId", id));
                })
                .exceptionally(e -> ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                        "Failed to record lesson: " + FanOutSupport.rootMessage(e)));
    }

    private static String text(Object raw) {
        return raw != null ? raw.toString().trim() : "";
    }

    private static List<String> keywords(Object raw) {
        List<String> keywords = new ArrayList<>();
        if (raw instanceof Collection<?> values) {
            for (Object value : values) {
                if (value != null && !value.toString().isBlank()) {
                    keywords.add(value.toString().trim().toLowerCase(Locale.ROOT));
                }
            }
        } else if (raw instanceof String text && !text.isBlank()) {
            for (String part : text.split(",")) {
                if (!part.isBlank()) {
                    keywords.add(part.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        return keywords;
    }
}
