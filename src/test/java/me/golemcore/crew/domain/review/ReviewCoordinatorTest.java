package me.golemcore.crew.domain.review;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.crew.domain.model.AgentProfile;
import me.golemcore.crew.domain.model.Conversation;
import me.golemcore.crew.domain.model.LlmRequest;
import me.golemcore.crew.domain.model.LlmResponse;
import me.golemcore.crew.domain.model.Message;
import me.golemcore.crew.domain.model.ReviewDecision;
import me.golemcore.crew.domain.model.ReviewRequest;
import me.golemcore.crew.domain.model.ReviewVerdict;
import me.golemcore.crew.domain.model.TaskDefinition;
import me.golemcore.crew.domain.model.Team;
import me.golemcore.crew.domain.model.WorkSummary;
import me.golemcore.crew.domain.service.StructuredResponseDecoder;
import me.golemcore.crew.infrastructure.config.CrewProperties;
import me.golemcore.crew.port.outbound.AgentDirectoryPort;
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
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ReviewCoordinatorTest {

    private static final String APPROVE_JSON = "{\"decision\": \"approve\", \"feedback\": \"Solid\", "
            + "\"confidence\": 0.9, \"suggestedChanges\": []}";

    private LlmPort llmPort;
    private AgentDirectoryPort directory;
    private CrewProperties properties;
    private ReviewCoordinator coordinator;
    private Team team;

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        directory = mock(AgentDirectoryPort.class);
        when(directory.listAgents()).thenReturn(List.of(
                agent("lead", "Lead"),
                agent("dev", "Developer"),
                agent("architect", "Architect"),
                agent("security", "Security"),
                agent("qa", "QA"),
                agent("ops", "Ops")));
        properties = new CrewProperties();
        properties.getReview().setMaxReviewers(2);
        Clock clock = Clock.fixed(Instant.parse("2026-01-01T12:00:00Z"), ZoneOffset.UTC);
        coordinator = new ReviewCoordinator(llmPort, directory, new StructuredResponseDecoder(new ObjectMapper()),
                properties, clock, new Random(42));
        team = Team.builder()
                .id("team-1")
                .lead("lead")
                .members(List.of("dev"))
                .taskDefinition(TaskDefinition.builder().description("Add OAuth login").build())
                .build();
    }

    @Test
    void selectReviewersUsesModelChoiceAndNeverExcludedAgents() {
        when(llmPort.chat(any())).thenReturn(respond("[\"Developer\", \"security\", \"Architect\", \"QA\"]"));

        List<AgentProfile> reviewers = coordinator.selectReviewers(team, List.of("Ops")).join();

        assertEquals(List.of("security", "architect"), ids(reviewers));
        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chat(captor.capture());
        String prompt = captor.getValue().getMessages().get(1).getContent();
        assertFalse(prompt.contains("Developer"));
        assertFalse(prompt.contains("Ops"));
        assertTrue(prompt.contains("Select up to 2 reviewers"));
    }

    @Test
    void selectReviewersFallsBackToRandomOnUnparsableAnswer() {
        when(llmPort.chat(any())).thenReturn(respond("I would pick the architect"));

        List<AgentProfile> reviewers = coordinator.selectReviewers(team, List.of("qa")).join();

        assertEquals(2, reviewers.size());
        assertTrue(Set.of("architect", "security", "ops").containsAll(ids(reviewers)));
    }

    @Test
    void selectReviewersFallsBackToRandomWhenModelFails() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.failedFuture(new RuntimeException("rate limited")));

        List<AgentProfile> reviewers = coordinator.selectReviewers(team, List.of()).join();

        assertEquals(2, reviewers.size());
        assertTrue(Set.of("architect", "security", "qa", "ops").containsAll(ids(reviewers)));
    }

    @Test
    void selectReviewersFallsBackWhenModelNamesNobodyEligible() {
        when(llmPort.chat(any())).thenReturn(respond("[\"Lead\", \"Nobody\"]"));

        List<AgentProfile> reviewers = coordinator.selectReviewers(team, List.of()).join();

        assertEquals(2, reviewers.size());
        assertFalse(ids(reviewers).contains("lead"));
    }

    @Test
    void selectReviewersReturnsEmptyForEmptyPool() {
        List<AgentProfile> reviewers = coordinator
                .selectReviewers(team, List.of("architect", "security", "qa", "ops")).join();

        assertTrue(reviewers.isEmpty());
        verify(llmPort, never()).chat(any());
    }

    @Test
    void collectReviewsDropsFailedAndUnusableReviews() {
        when(llmPort.chat(any())).thenAnswer(invocation -> {
            LlmRequest request = invocation.getArgument(0);
            return switch (request.getAgentId()) {
                case "architect" -> respond(APPROVE_JSON);
                case "security" -> CompletableFuture.failedFuture(new RuntimeException("timeout"));
                default -> respond("{\"decision\": \"maybe\"}");
            };
        });

        List<ReviewDecision> decisions = coordinator.collectReviews(
                List.of(agent("architect", "Architect"), agent("security", "Security"), agent("qa", "QA")),
                conversation(), request()).join();

        assertEquals(1, decisions.size());
        assertEquals("architect", decisions.get(0).getReviewerId());
        assertEquals(ReviewVerdict.APPROVE, decisions.get(0).getDecision());
        assertEquals(0.9, decisions.get(0).getConfidence());
    }

    @Test
    void collectReviewsReturnsEmptyWhenDeadlinePasses() throws Exception {
        properties.getReview().setTimeoutMs(200);
        when(llmPort.chat(any())).thenAnswer(invocation -> {
            LlmRequest request = invocation.getArgument(0);
            return "architect".equals(request.getAgentId()) ? respond(APPROVE_JSON) : new CompletableFuture<>();
        });

        long start = System.nanoTime();
        List<ReviewDecision> decisions = coordinator.collectReviews(
                List.of(agent("architect", "Architect"), agent("security", "Security")),
                conversation(), request())
                .get(5, TimeUnit.SECONDS);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue(decisions.isEmpty());
        assertTrue(elapsedMs < 5000);
    }

    @Test
    void parseDecisionClampsAndDefaultsConfidence() {
        AgentProfile reviewer = agent("qa", "QA");

        Optional<ReviewDecision> high = coordinator.parseDecision(reviewer,
                "{\"decision\": \"REVISE\", \"confidence\": 7, \"suggestedChanges\": [\"Add tests\", \"\"]}");
        Optional<ReviewDecision> missing = coordinator.parseDecision(reviewer, "{\"decision\": \"reject\"}");

        assertEquals(1.0, high.orElseThrow().getConfidence());
        assertEquals(List.of("Add tests"), high.orElseThrow().getSuggestedChanges());
        assertEquals(0.5, missing.orElseThrow().getConfidence());
        assertTrue(coordinator.parseDecision(reviewer, "looks good to me").isEmpty());
    }

    @Test
    void buildReviewPromptIncludesSummaryAndTruncatedHistory() {
        properties.getReview().setMessagePreviewChars(10);

        String prompt = coordinator.buildReviewPrompt(conversation(), request());

        assertTrue(prompt.contains("Add OAuth login"));
        assertTrue(prompt.contains("Files modified: Login.java"));
        assertTrue(prompt.contains("[dev]: Implemente..."));
        assertTrue(prompt.contains("\"decision\""));
    }

    private static Conversation conversation() {
        return Conversation.builder()
                .id("conv-1")
                .ownerAgentId("lead")
                .messages(new ArrayList<>(List.of(Message.builder().role(Message.ROLE_USER)
                        .senderId("dev").content("Implemented OAuth login in Login.java").build())))
                .build();
    }

    private static ReviewRequest request() {
        return ReviewRequest.builder()
                .teamId("team-1")
                .conversationId("conv-1")
                .taskDescription("Add OAuth login")
                .workSummary(WorkSummary.builder().linesOfCode(42).filesModified(List.of("Login.java")).build())
                .build();
    }

    private static AgentProfile agent(String id, String name) {
        return AgentProfile.builder().id(id).name(name).role(name + " role").build();
    }

    private static List<String> ids(List<AgentProfile> agents) {
        return agents.stream().map(AgentProfile::getId).toList();
    }

    private static CompletableFuture<LlmResponse> respond(String content) {
        return CompletableFuture.completedFuture(LlmResponse.builder().content(content).build());
    }
}
