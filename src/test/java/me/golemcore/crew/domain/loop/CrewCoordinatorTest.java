package me.golemcore.crew.domain.loop;

import me.golemcore.crew.domain.model.AgentProfile;
import me.golemcore.crew.domain.model.InboundEvent;
import me.golemcore.crew.domain.model.LlmRequest;
import me.golemcore.crew.domain.model.LlmResponse;
import me.golemcore.crew.domain.model.Message;
import me.golemcore.crew.domain.model.ReviewResult;
import me.golemcore.crew.domain.model.TaskDefinition;
import me.golemcore.crew.domain.model.Team;
import me.golemcore.crew.domain.reflection.ReflectionService;
import me.golemcore.crew.domain.review.ReviewService;
import me.golemcore.crew.domain.service.ContextWindowService;
import me.golemcore.crew.domain.service.ConversationStore;
import me.golemcore.crew.domain.toolloop.ToolOrchestratingLlmPort;
import me.golemcore.crew.domain.toolloop.ToolOrchestratorFactory;
import me.golemcore.crew.infrastructure.config.AutoConfiguration;
import me.golemcore.crew.infrastructure.config.CrewProperties;
import me.golemcore.crew.port.outbound.AgentDirectoryPort;
import me.golemcore.crew.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class CrewCoordinatorTest {

    private static final String CONVERSATION_ID = "conv-1";

    private ConversationStore store;
    private AgentDirectoryPort directory;
    private ContextWindowService contextWindowService;
    private ToolOrchestratorFactory orchestratorFactory;
    private ToolOrchestratingLlmPort developerPort;
    private ReflectionService reflectionService;
    private ReviewService reviewService;
    private CrewCoordinator coordinator;

    @BeforeEach
    void setUp() {
        StoragePort storagePort = mock(StoragePort.class);
        when(storagePort.getText(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(null));
        when(storagePort.putTextAtomic(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.completedFuture(null));
        Clock clock = Clock.fixed(Instant.parse("2026-01-01T12:00:00Z"), ZoneOffset.UTC);
        store = new ConversationStore(storagePort, AutoConfiguration.objectMapper(), clock);

        directory = mock(AgentDirectoryPort.class);
        AgentProfile developer = AgentProfile.builder().id("developer").name("Developer").role("Backend developer")
                .build();
        when(directory.listAgents()).thenReturn(List.of(developer,
                AgentProfile.builder().id("architect").name("Architect").build()));
        when(directory.findAgent("developer")).thenReturn(Optional.of(developer));

        contextWindowService = mock(ContextWindowService.class);
        when(contextWindowService.prepare(anyList())).thenAnswer(invocation -> invocation.getArgument(0));

        orchestratorFactory = mock(ToolOrchestratorFactory.class);
        developerPort = mock(ToolOrchestratingLlmPort.class);
        when(orchestratorFactory.forAgent(developer)).thenReturn(developerPort);

        reflectionService = mock(ReflectionService.class);
        when(reflectionService.process(any(), any(), any())).thenReturn(CompletableFuture.completedFuture(List.of()));
        reviewService = mock(ReviewService.class);

        coordinator = new CrewCoordinator(store, directory, contextWindowService, orchestratorFactory,
                reflectionService, reviewService, new CrewProperties(), clock);
    }

    @Test
    void handleDeliversToEveryAgentWhenNoRecipientsGiven() {
        coordinator.handle(event("user-1", "Kickoff", null, null)).join();

        assertEquals(1, store.messages("developer", CONVERSATION_ID).size());
        assertEquals(1, store.messages("architect", CONVERSATION_ID).size());
        assertTrue(store.messages("developer", CONVERSATION_ID).get(0).isUserMessage());
        verifyNoInteractions(orchestratorFactory, reviewService);
    }

    @Test
    void handleStoresOwnMessagesAsAssistant() {
        InboundEvent event = event("architect", "I will design it", null, null);
        event.setRecipients(List.of("architect", "developer"));

        coordinator.handle(event).join();

        assertTrue(store.messages("architect", CONVERSATION_ID).get(0).isAssistantMessage());
        assertTrue(store.messages("developer", CONVERSATION_ID).get(0).isUserMessage());
        assertEquals("architect", store.messages("developer", CONVERSATION_ID).get(0).getSenderId());
    }

    @Test
    void handleRespondingAgentAnswersAndReplyIsShared() {
        when(developerPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().content("It is noon.").build()));

        Optional<Message> reply = coordinator.handle(event("user-1", "What time is it?", "developer", null)).join();

        assertEquals("It is noon.", reply.orElseThrow().getContent());
        List<Message> developerView = store.messages("developer", CONVERSATION_ID);
        assertEquals(2, developerView.size());
        assertTrue(developerView.get(1).isAssistantMessage());
        List<Message> architectView = store.messages("architect", CONVERSATION_ID);
        assertEquals(2, architectView.size());
        assertTrue(architectView.get(1).isUserMessage());
        assertEquals("developer", architectView.get(1).getSenderId());

        ArgumentCaptor<LlmRequest> request = ArgumentCaptor.forClass(LlmRequest.class);
        verify(developerPort).chat(request.capture());
        assertEquals("developer", request.getValue().getAgentId());
        assertEquals(CONVERSATION_ID, request.getValue().getConversationId());
        Message system = request.getValue().getMessages().get(0);
        assertTrue(system.isSystemMessage());
        assertTrue(system.getContent().contains("Developer, Backend developer"));
        assertEquals("What time is it?", request.getValue().getMessages().get(1).getContent());
    }

    @Test
    void handleRunsReflectionOnRespondersCopy() {
        when(developerPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().content("Fixed.").build()));

        coordinator.handle(event("user-1", "That's wrong", "developer", null)).join();

        ArgumentCaptor<Message> message = ArgumentCaptor.forClass(Message.class);
        verify(reflectionService).process(argThat(c -> "developer".equals(c.getOwnerAgentId())), message.capture(),
                isNull());
        assertEquals("evt-1", message.getValue().getId());
    }

    @Test
    void handleRequestsReviewForCompletedTeam() {
        Team team = Team.builder().id("team-1").lead("architect").members(List.of("developer"))
                .taskDefinition(TaskDefinition.builder().type("feature").build()).build();
        when(reviewService.requestReview(eq(team), eq("architect"), eq(CONVERSATION_ID), anyList()))
                .thenReturn(CompletableFuture.completedFuture(ReviewResult.notRequired()));

        coordinator.handle(event("developer", "Done with the feature", null, team)).join();

        verify(reviewService).requestReview(team, "architect", CONVERSATION_ID, List.of("developer"));
        verify(reflectionService).process(any(), any(), eq("team-1"));
    }

    @Test
    void handleIgnoresEventsWithoutConversation() {
        InboundEvent event = event("user-1", "hello", "developer", null);
        event.setConversationId(null);

        assertTrue(coordinator.handle(event).join().isEmpty());
        verifyNoInteractions(reflectionService, orchestratorFactory);
    }

    private static InboundEvent event(String sender, String content, String responder, Team completedTeam) {
        return InboundEvent.builder()
                .id("evt-1")
                .conversationId(CONVERSATION_ID)
                .senderId(sender)
                .content(content)
                .respondingAgentId(responder)
                .completedTeam(completedTeam)
                .build();
    }
}
