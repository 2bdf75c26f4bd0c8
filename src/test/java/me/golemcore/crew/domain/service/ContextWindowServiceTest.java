package me.golemcore.crew.domain.service;

import me.golemcore.crew.domain.model.Message;
import me.golemcore.crew.infrastructure.config.CrewProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ContextWindowServiceTest {

    // 40 chars = 10 tokens, plus 4 overhead
    private static final String FORTY_CHARS = "0123456789012345678901234567890123456789";
    private static final int MESSAGE_TOKENS = 14;
    private static final int SYSTEM_TOKENS = 5;

    private CrewProperties properties;
    private CompactionService compactionService;
    private ContextWindowService service;

    @BeforeEach
    void setUp() {
        properties = new CrewProperties();
        compactionService = mock(CompactionService.class);
        service = new ContextWindowService(new TokenEstimator(properties), compactionService, properties);
    }

    @Test
    void defaultBudgetSubtractsResponseReserve() {
        properties.getContext().setMaxContextTokens(1000);
        properties.getContext().setResponseReserveTokens(200);

        assertEquals(800, service.defaultBudget());

        properties.getContext().setResponseReserveTokens(2000);
        assertEquals(0, service.defaultBudget());
    }

    @Test
    void windowKeepsSystemMessageAndNewestSuffix() {
        List<Message> messages = conversation(6);

        List<Message> windowed = service.window(messages, SYSTEM_TOKENS + 3 * MESSAGE_TOKENS);

        assertEquals(4, windowed.size());
        assertSame(messages.get(0), windowed.get(0));
        assertEquals(messages.subList(4, 7), windowed.subList(1, 4));
    }

    @Test
    void windowStopsAtFirstMessageThatDoesNotFit() {
        List<Message> messages = new ArrayList<>();
        messages.add(Message.user("short"));
        messages.add(Message.user(FORTY_CHARS + FORTY_CHARS));
        messages.add(Message.user("tiny"));

        List<Message> windowed = service.window(messages, MESSAGE_TOKENS);

        assertEquals(1, windowed.size());
        assertEquals("tiny", windowed.get(0).getContent());
    }

    @Test
    void windowReturnsEverythingWhenWithinBudget() {
        List<Message> messages = conversation(3);

        assertEquals(messages, service.window(messages, 10_000));
        assertTrue(service.window(List.of(), 100).isEmpty());
    }

    @Test
    void windowDropsLeadingOrphanToolMessages() {
        Message.ToolCall call = Message.ToolCall.builder().id("c1").name("get_time").arguments(Map.of()).build();
        List<Message> messages = List.of(
                Message.system("sys"),
                Message.user(FORTY_CHARS),
                Message.builder().role(Message.ROLE_ASSISTANT).content(FORTY_CHARS).toolCalls(List.of(call)).build(),
                Message.builder().role(Message.ROLE_TOOL).toolCallId("c1").content(FORTY_CHARS).build(),
                Message.assistant(FORTY_CHARS));

        List<Message> windowed = service.window(messages, SYSTEM_TOKENS + 2 * MESSAGE_TOKENS);

        assertEquals(2, windowed.size());
        assertTrue(windowed.get(0).isSystemMessage());
        assertTrue(windowed.get(1).isAssistantMessage());
        assertFalse(windowed.get(1).hasToolCalls());
    }

    @Test
    void prepareSummarizesWhenWindowingDropsTooMuch() {
        List<Message> messages = conversation(20);
        List<Message> compacted = List.of(messages.get(0), Message.assistant("[Conversation summary]\nearlier"),
                messages.get(20));
        when(compactionService.compact(messages, 10)).thenReturn(compacted);

        List<Message> prepared = service.prepare(messages, SYSTEM_TOKENS + 3 * MESSAGE_TOKENS);

        assertEquals(compacted, prepared);
        verify(compactionService).compact(messages, 10);
    }

    @Test
    void prepareFallsBackToWindowWhenSummarizationFails() {
        List<Message> messages = conversation(20);
        when(compactionService.compact(eq(messages), anyInt())).thenReturn(messages);

        List<Message> prepared = service.prepare(messages, SYSTEM_TOKENS + 3 * MESSAGE_TOKENS);

        assertEquals(4, prepared.size());
        assertSame(messages.get(20), prepared.get(3));
    }

    @Test
    void prepareSkipsSummarizationForSmallDrops() {
        List<Message> messages = conversation(6);

        List<Message> prepared = service.prepare(messages, SYSTEM_TOKENS + 5 * MESSAGE_TOKENS);

        assertEquals(6, prepared.size());
        verify(compactionService, never()).compact(any(), anyInt());
    }

    private static List<Message> conversation(int turns) {
        List<Message> messages = new ArrayList<>();
        messages.add(Message.system("sys"));
        for (int i = 0; i < turns; i++) {
            messages.add(i % 2 == 0 ? Message.user(FORTY_CHARS) : Message.assistant(FORTY_CHARS));
        }
        return messages;
    }
}
