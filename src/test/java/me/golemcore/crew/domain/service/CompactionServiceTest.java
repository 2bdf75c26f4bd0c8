package me.golemcore.crew.domain.service;

import me.golemcore.crew.domain.model.LlmRequest;
import me.golemcore.crew.domain.model.LlmResponse;
import me.golemcore.crew.domain.model.Message;
import me.golemcore.crew.infrastructure.config.CrewProperties;
import me.golemcore.crew.port.outbound.LlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class CompactionServiceTest {

    private static final String SUMMARY = "User asked about Java and Spring.";

    private LlmPort llmPort;
    private Clock clock;
    private CompactionService service;

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        when(llmPort.isAvailable()).thenReturn(true);
        clock = Clock.fixed(Instant.parse("2026-01-01T12:00:00Z"), ZoneOffset.UTC);
        service = new CompactionService(llmPort, new CrewProperties(), clock);
    }

    @Test
    void summarizeReturnsModelSummary() {
        when(llmPort.chat(any())).thenReturn(completed(SUMMARY));

        Optional<String> summary = service.summarize(List.of(
                Message.user("What is Java?"), Message.assistant("Java is a programming language.")));

        assertEquals(Optional.of(SUMMARY), summary);
    }

    @Test
    void summarizeIsEmptyWhenModelUnavailable() {
        when(llmPort.isAvailable()).thenReturn(false);

        assertTrue(service.summarize(List.of(Message.user("Hello"))).isEmpty());
        verify(llmPort, never()).chat(any());
    }

    @Test
    void summarizeIsEmptyOnFailureOrBlankAnswer() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.failedFuture(new RuntimeException("LLM error")));
        assertTrue(service.summarize(List.of(Message.user("Hello"))).isEmpty());

        when(llmPort.chat(any())).thenReturn(completed("  "));
        assertTrue(service.summarize(List.of(Message.user("Hello"))).isEmpty());

        assertTrue(service.summarize(List.of()).isEmpty());
    }

    @Test
    void summarizeLeavesToolMessagesOutOfPrompt() {
        when(llmPort.chat(any())).thenReturn(completed(SUMMARY));

        service.summarize(List.of(
                Message.user("Run a command"),
                Message.builder().role(Message.ROLE_TOOL).content("{\"secret\": \"tool-output\"}").build(),
                Message.assistant("Done!")));

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chat(captor.capture());
        String prompt = captor.getValue().getMessages().get(1).getContent();
        assertTrue(prompt.contains("user: Run a command"));
        assertFalse(prompt.contains("tool-output"));
    }

    @Test
    void compactFoldsMiddleIntoSummary() {
        when(llmPort.chat(any())).thenReturn(completed(SUMMARY));
        List<Message> messages = new ArrayList<>();
        messages.add(Message.system("You are Developer."));
        for (int i = 0; i < 8; i++) {
            messages.add(Message.user("message " + i));
        }

        List<Message> compacted = service.compact(messages, 3);

        assertEquals(5, compacted.size());
        assertSame(messages.get(0), compacted.get(0));
        assertTrue(compacted.get(1).isAssistantMessage());
        assertEquals(CompactionService.SUMMARY_PREFIX + SUMMARY, compacted.get(1).getContent());
        assertEquals(messages.subList(6, 9), compacted.subList(2, 5));
    }

    @Test
    void compactReturnsSameListWhenSummarizationFails() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.failedFuture(new RuntimeException("down")));
        List<Message> messages = List.of(Message.user("a1"), Message.user("a2"), Message.user("a3"));

        assertSame(messages, service.compact(messages, 1));
    }

    @Test
    void compactReturnsSameListWhenNothingToFold() {
        List<Message> messages = List.of(Message.system("sys"), Message.user("only"));

        assertSame(messages, service.compact(messages, 5));
        verify(llmPort, never()).chat(any());
    }

    @Test
    void createSummaryMessageUsesClock() {
        Message message = service.createSummaryMessage("User discussed Java.");

        assertEquals(Message.ROLE_ASSISTANT, message.getRole());
        assertEquals(clock.instant(), message.getTimestamp());
        assertTrue(message.getContent().startsWith("[Conversation summary]"));
    }

    @Test
    void truncateAppendsEllipsis() {
        assertEquals("abc...", CompactionService.truncate("abcdef", 3));
        assertEquals("abc", CompactionService.truncate("abc", 3));
        assertEquals("", CompactionService.truncate(null, 3));
    }

    private static CompletableFuture<LlmResponse> completed(String content) {
        return CompletableFuture.completedFuture(LlmResponse.builder().content(content).build());
    }
}
