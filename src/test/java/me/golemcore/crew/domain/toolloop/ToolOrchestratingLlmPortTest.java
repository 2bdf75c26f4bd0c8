package me.golemcore.crew.domain.toolloop;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.crew.domain.model.LlmRequest;
import me.golemcore.crew.domain.model.LlmResponse;
import me.golemcore.crew.domain.model.LlmUsage;
import me.golemcore.crew.domain.model.Message;
import me.golemcore.crew.domain.tool.ToolCallExecutor;
import me.golemcore.crew.domain.tool.ToolCallParser;
import me.golemcore.crew.domain.tool.ToolCatalog;
import me.golemcore.crew.infrastructure.config.CrewProperties;
import me.golemcore.crew.port.outbound.LlmPort;
import me.golemcore.crew.testsupport.StubTool;
import me.golemcore.crew.tools.DateTimeTool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ToolOrchestratingLlmPortTest {

    private static final String QUESTION = "What time is it in UTC?";
    private static final String TIME_CALL = "Let me check.\n<tool_use>\n"
            + "{\"tool\": \"get_time\", \"arguments\": {\"timezone\": \"UTC\"}}\n</tool_use>";
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-01T12:00:00Z"), ZoneOffset.UTC);

    private LlmPort delegate;
    private ToolCallParser parser;
    private ToolCallExecutor executor;
    private MessageSequenceNormalizer normalizer;
    private ToolCatalog catalog;

    @BeforeEach
    void setUp() {
        delegate = mock(LlmPort.class);
        parser = new ToolCallParser(new ObjectMapper());
        executor = new ToolCallExecutor(new CrewProperties());
        normalizer = new MessageSequenceNormalizer();
        catalog = ToolCatalog.of(List.of(new DateTimeTool(CLOCK)));
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void chatExecutesTextualCallAndAsksAgain() {
        when(delegate.chat(any())).thenReturn(
                respond(TIME_CALL),
                respond("It is 12:00 UTC."));

        LlmResponse response = port(catalog, true).chat(request(List.of(Message.user(QUESTION)))).join();

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(delegate, times(2)).chat(captor.capture());
        assertTrue(response.getContent().startsWith("It is 12:00 UTC."));
        assertTrue(response.getContent().contains("**Tool: get_time**"));
        assertTrue(response.getContent().contains("2026-01-01T12:00:00Z"));
        assertFalse(response.getContent().contains(ToolCallParser.OPEN_TAG));

        List<Message> second = captor.getAllValues().get(1).getMessages();
        Message assistant = second.get(second.size() - 2);
        Message tool = second.get(second.size() - 1);
        assertTrue(assistant.isAssistantMessage());
        assertEquals("Let me check.", assistant.getContent());
        assertEquals("get_time", assistant.getToolCalls().get(0).getName());
        assertTrue(tool.isToolMessage());
        assertEquals(assistant.getToolCalls().get(0).getId(), tool.getToolCallId());
        assertEquals("2026-01-01T12:00:00Z", tool.getContent());
        assertTrue(second.get(0).getContent().contains(ToolOrchestratingLlmPort.FOLLOW_UP_INSTRUCTION));
        assertEquals(1, captor.getAllValues().get(1).getTools().size());
    }

    @Test
    void chatOmitsToolDigestWhenDisabled() {
        when(delegate.chat(any())).thenReturn(respond(TIME_CALL), respond("It is noon."));

        LlmResponse response = port(catalog, false).chat(request(List.of(Message.user(QUESTION)))).join();

        assertEquals("It is noon.", response.getContent());
    }

    @Test
    void chatAppendsInstructionsToExistingSystemMessage() {
        when(delegate.chat(any())).thenReturn(respond("No tools needed."));

        port(catalog, true).chat(request(List.of(Message.system("You are Developer."), Message.user(QUESTION))))
                .join();

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(delegate).chat(captor.capture());
        List<Message> sent = captor.getValue().getMessages();
        assertEquals(2, sent.size());
        assertTrue(sent.get(0).getContent().startsWith("You are Developer."));
        assertTrue(sent.get(0).getContent().contains("You have access to the following tools:"));
    }

    @Test
    void chatPrependsSystemMessageWhenMissing() {
        when(delegate.chat(any())).thenReturn(respond("No tools needed."));

        port(catalog, true).chat(request(List.of(Message.user(QUESTION)))).join();

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(delegate).chat(captor.capture());
        List<Message> sent = captor.getValue().getMessages();
        assertEquals(2, sent.size());
        assertTrue(sent.get(0).isSystemMessage());
        assertTrue(sent.get(0).getContent().contains("Tool: get_time"));
    }

    @Test
    void chatReturnsFirstResponseWhenNoToolsRequested() {
        LlmResponse first = LlmResponse.builder().content("Plain answer").usage(LlmUsage.of(10, 5)).build();
        when(delegate.chat(any())).thenReturn(CompletableFuture.completedFuture(first));

        LlmResponse response = port(catalog, true).chat(request(List.of(Message.user("hi there")))).join();

        assertSame(first, response);
        verify(delegate, times(1)).chat(any());
    }

    @Test
    void chatPassesThroughWithEmptyCatalog() {
        LlmRequest request = request(List.of(Message.user(QUESTION)));
        when(delegate.chat(request)).thenReturn(respond(TIME_CALL));

        LlmResponse response = port(ToolCatalog.empty(), true).chat(request).join();

        assertEquals(TIME_CALL, response.getContent());
        verify(delegate).chat(request);
    }

    @Test
    void chatMergesUsageOfBothCalls() {
        when(delegate.chat(any())).thenReturn(
                CompletableFuture.completedFuture(
                        LlmResponse.builder().content(TIME_CALL).usage(LlmUsage.of(100, 20)).build()),
                CompletableFuture.completedFuture(
                        LlmResponse.builder().content("Done").usage(LlmUsage.of(150, 30)).build()));

        LlmResponse response = port(catalog, true).chat(request(List.of(Message.user(QUESTION)))).join();

        assertEquals(250, response.getUsage().getInputTokens());
        assertEquals(50, response.getUsage().getOutputTokens());
        assertEquals(300, response.getUsage().getTotalTokens());
    }

    @Test
    void chatFeedsUnknownToolErrorBackToModel() {
        when(delegate.chat(any())).thenReturn(
                respond("<tool_use>{\"tool\": \"launch_rocket\", \"arguments\": {}}</tool_use>"),
                respond("I cannot do that."));

        port(catalog, true).chat(request(List.of(Message.user("launch")))).join();

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(delegate, times(2)).chat(captor.capture());
        List<Message> second = captor.getAllValues().get(1).getMessages();
        Message tool = second.get(second.size() - 1);
        assertTrue(tool.getContent().contains("not found"));
        assertEquals(ToolOrchestratingLlmPort.EMPTY_REMAINDER_PLACEHOLDER, second.get(second.size() - 2).getContent());
    }

    @Test
    void chatExecutesNativeToolCalls() {
        StubTool learn = StubTool.returning("learn", "Lesson recorded", "title", "lesson");
        Message.ToolCall nativeCall = Message.ToolCall.builder()
                .id("toolu_01").name("learn").arguments(Map.of("title", "t", "lesson", "l")).build();
        when(delegate.chat(any())).thenReturn(
                CompletableFuture.completedFuture(LlmResponse.builder().content("").toolCalls(List.of(nativeCall))
                        .build()),
                respond("Saved."));

        LlmResponse response = port(ToolCatalog.of(List.of(learn)), false)
                .chat(request(List.of(Message.user("remember this")))).join();

        assertEquals("Saved.", response.getContent());
        assertEquals(1, learn.getInvocations().size());
        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(delegate, times(2)).chat(captor.capture());
        List<Message> second = captor.getAllValues().get(1).getMessages();
        assertEquals("toolu_01", second.get(second.size() - 1).getToolCallId());
    }

    @Test
    void chatStripsToolCallsFromFinalAnswer() {
        when(delegate.chat(any())).thenReturn(respond(TIME_CALL), respond("Answer. " + TIME_CALL));

        LlmResponse response = port(catalog, false).chat(request(List.of(Message.user(QUESTION)))).join();

        assertEquals("Answer. Let me check.", response.getContent());
        verify(delegate, times(2)).chat(any());
    }

    private ToolOrchestratingLlmPort port(ToolCatalog tools, boolean appendToolResults) {
        return new ToolOrchestratingLlmPort(delegate, tools, parser, executor, normalizer, "default",
                appendToolResults);
    }

    private static LlmRequest request(List<Message> messages) {
        return LlmRequest.builder()
                .messages(messages)
                .agentId("developer")
                .conversationId("conv-1")
                .build();
    }

    private static CompletableFuture<LlmResponse> respond(String content) {
        return CompletableFuture.completedFuture(LlmResponse.builder().content(content).build());
    }
}
