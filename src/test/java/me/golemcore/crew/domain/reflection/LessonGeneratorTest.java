package me.golemcore.crew.domain.reflection;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.crew.domain.model.AgentLesson;
import me.golemcore.crew.domain.model.AgentProfile;
import me.golemcore.crew.domain.model.CorrectionAnalysis;
import me.golemcore.crew.domain.model.LlmRequest;
import me.golemcore.crew.domain.model.LlmResponse;
import me.golemcore.crew.domain.model.Message;
import me.golemcore.crew.domain.model.ReflectionTrigger;
import me.golemcore.crew.domain.service.StructuredResponseDecoder;
import me.golemcore.crew.port.outbound.LlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class LessonGeneratorTest {

    private static final String LESSON_JSON = """
            {"applicable": true, "title": "Check nullability", "lesson": "Verify column nullability before migrating",
             "confidence": 0.8, "keywords": ["Migration", "nullability"],
             "context": {"errorType": "schema_mismatch", "preventionStrategy": "Inspect the schema first",
                         "relatedCapabilities": ["sql"]}}
            """;

    private LlmPort llmPort;
    private Clock clock;
    private LessonGenerator generator;
    private ReflectionTrigger trigger;

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        clock = Clock.fixed(Instant.parse("2026-01-01T12:00:00Z"), ZoneOffset.UTC);
        generator = new LessonGenerator(llmPort, new StructuredResponseDecoder(new ObjectMapper()), clock);
        trigger = ReflectionTrigger.builder()
                .triggerEventId("evt-9")
                .conversationId("conv-1")
                .teamId("team-1")
                .taskId("task-1")
                .correctionMessage(Message.user("That's wrong, the column is nullable"))
                .recentMessages(List.of(Message.assistant("Added NOT NULL column")))
                .analysis(CorrectionAnalysis.builder().correction(true).confidence(0.9)
                        .issues(List.of("nullable column")).build())
                .build();
    }

    @Test
    void generateLessonsBuildsLessonFromModelAnswer() {
        when(llmPort.chat(any())).thenReturn(respond(LESSON_JSON));

        List<AgentLesson> lessons = generator.generateLessons(trigger, List.of(agent("developer"))).join();

        assertEquals(1, lessons.size());
        AgentLesson lesson = lessons.get(0);
        assertEquals("developer", lesson.getAgentId());
        assertEquals("task-1", lesson.getTaskId());
        assertEquals("Check nullability", lesson.getTitle());
        assertEquals(0.8, lesson.getConfidence());
        assertEquals(List.of("migration", "nullability"), lesson.getKeywords());
        assertEquals("schema_mismatch", lesson.getContext().getErrorType());
        assertEquals("evt-9", lesson.getContext().getTriggerEventId());
        assertEquals(clock.instant(), lesson.getTimestamp());
    }

    @Test
    void generateLessonsSkipsInapplicableAndFailedAgents() {
        when(llmPort.chat(any())).thenAnswer(invocation -> {
            LlmRequest request = invocation.getArgument(0);
            return switch (request.getAgentId()) {
                case "developer" -> respond(LESSON_JSON);
                case "architect" -> respond("{\"applicable\": false}");
                default -> CompletableFuture.failedFuture(new RuntimeException("overloaded"));
            };
        });

        List<AgentLesson> lessons = generator.generateLessons(trigger,
                List.of(agent("architect"), agent("developer"), agent("security"))).join();

        assertEquals(List.of("developer"), lessons.stream().map(AgentLesson::getAgentId).toList());
    }

    @Test
    void generateLessonsDerivesTitleWhenMissing() {
        when(llmPort.chat(any())).thenReturn(respond(
                "{\"applicable\": true, \"lesson\": \"Always check nullability\\nDetails follow\"}"));

        AgentLesson lesson = generator.generateLessons(trigger, List.of(agent("developer"))).join().get(0);

        assertEquals("Always check nullability", lesson.getTitle());
        assertEquals(0.5, lesson.getConfidence());
    }

    @Test
    void deduplicateLessonsSkipsModelForSingleLesson() {
        List<AgentLesson> single = List.of(lesson("developer", "a"));

        assertSame(single, generator.deduplicateLessons(single).join());
        assertTrue(generator.deduplicateLessons(List.of()).join().isEmpty());
        verify(llmPort, never()).chat(any());
    }

    @Test
    void deduplicateLessonsKeepsSelectedIndices() {
        when(llmPort.chat(any())).thenReturn(respond("Keep these: [2, 0, 0, 9]"));
        List<AgentLesson> lessons = List.of(lesson("dev", "a"), lesson("dev", "a again"), lesson("qa", "b"));

        List<AgentLesson> kept = generator.deduplicateLessons(lessons).join();

        assertEquals(List.of(lessons.get(0), lessons.get(2)), kept);
    }

    @Test
    void deduplicateLessonsKeepsAllOnUnusableAnswer() {
        List<AgentLesson> lessons = List.of(lesson("dev", "a"), lesson("qa", "b"));

        when(llmPort.chat(any())).thenReturn(respond("they are all unique"));
        assertEquals(lessons, generator.deduplicateLessons(lessons).join());

        when(llmPort.chat(any())).thenReturn(respond("[]"));
        assertEquals(lessons, generator.deduplicateLessons(lessons).join());

        when(llmPort.chat(any())).thenReturn(CompletableFuture.failedFuture(new RuntimeException("down")));
        assertEquals(lessons, generator.deduplicateLessons(lessons).join());
    }

    private static AgentProfile agent(String id) {
        return AgentProfile.builder().id(id).name(id).build();
    }

    private AgentLesson lesson(String agentId, String title) {
        return AgentLesson.builder().agentId(agentId).title(title).content(title + " content").confidence(0.7)
                .timestamp(clock.instant()).build();
    }

    private static CompletableFuture<LlmResponse> respond(String content) {
        return CompletableFuture.completedFuture(LlmResponse.builder().content(content).build());
    }
}
