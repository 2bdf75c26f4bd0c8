package me.golemcore.crew.domain.reflection;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.crew.domain.model.CorrectionAnalysis;
import me.golemcore.crew.domain.model.CorrectionPattern;
import me.golemcore.crew.domain.model.CorrectionType;
import me.golemcore.crew.domain.model.LlmRequest;
import me.golemcore.crew.domain.model.LlmResponse;
import me.golemcore.crew.domain.model.Message;
import me.golemcore.crew.domain.service.StructuredResponseDecoder;
import me.golemcore.crew.infrastructure.config.CrewProperties;
import me.golemcore.crew.port.outbound.LlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class CorrectionDetectorTest {

    private LlmPort llmPort;
    private CorrectionDetector detector;

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        detector = new CorrectionDetector(llmPort, new StructuredResponseDecoder(new ObjectMapper()),
                new CrewProperties());
    }

    @Test
    void detectPatternUserCorrectionAfterAssistant() {
        Optional<CorrectionPattern> pattern = detector.detectPattern(List.of(
                Message.user("Write the migration"),
                Message.assistant("Here is the migration script."),
                Message.user("That's wrong, the column is nullable.")));

        assertTrue(pattern.isPresent());
        assertEquals(CorrectionType.USER_CORRECTION, pattern.get().type());
        assertTrue(pattern.get().confidence() > 0.7);
        assertEquals(List.of("wrong"), pattern.get().indicators());
        assertEquals(List.of(1, 2), pattern.get().messageIndices());
    }

    @Test
    void detectPatternConfidenceGrowsWithIndicatorsAndCaps() {
        Optional<CorrectionPattern> pattern = detector.detectPattern(List.of(
                Message.assistant("Done."),
                Message.user("Actually that's wrong, an incorrect fix with a mistake and an error")));

        assertEquals(1.0, pattern.orElseThrow().confidence(), 1e-9);
    }

    @Test
    void detectPatternSelfCorrectionBetweenAssistantMessages() {
        Optional<CorrectionPattern> pattern = detector.detectPattern(List.of(
                Message.assistant("The limit is 10."),
                Message.assistant("My bad, the limit is 20.")));

        assertEquals(CorrectionType.SELF_CORRECTION, pattern.orElseThrow().type());
        assertEquals(0.85, pattern.orElseThrow().confidence(), 1e-9);
    }

    @Test
    void detectPatternRevisionRequestInLastUserMessage() {
        Optional<CorrectionPattern> pattern = detector.detectPattern(List.of(
                Message.user("Build the page"),
                Message.user("Please improve and adjust the layout")));

        assertEquals(CorrectionType.REVISION_REQUEST, pattern.orElseThrow().type());
        assertEquals(0.9, pattern.orElseThrow().confidence(), 1e-9);
        assertEquals(List.of(1), pattern.orElseThrow().messageIndices());
    }

    @Test
    void detectPatternMatchesWholeWordsOnly() {
        assertTrue(detector.detectPattern(List.of(
                Message.assistant("Added a prefix option."),
                Message.user("Thanks, the terrorism filter and prefix look great"))).isEmpty());
    }

    @Test
    void detectPatternNeedsTwoMessages() {
        assertTrue(detector.detectPattern(List.of(Message.user("that's wrong"))).isEmpty());
        assertTrue(detector.detectPattern(null).isEmpty());
    }

    @Test
    void detectTrailingPatternIgnoresEarlierCorrections() {
        List<Message> messages = List.of(
                Message.assistant("Here is the migration script."),
                Message.user("That's wrong, the column is nullable."),
                Message.assistant("Fixed."),
                Message.user("Thanks, now write the docs"));

        assertEquals(CorrectionType.USER_CORRECTION, detector.detectPattern(messages).orElseThrow().type());
        assertTrue(detector.detectTrailingPattern(messages).isEmpty());
    }

    @Test
    void detectTrailingPatternFindsRevisionBehindAnEarlierCorrection() {
        List<Message> messages = List.of(
                Message.assistant("Here is the migration script."),
                Message.user("That's wrong, the column is nullable."),
                Message.user("Also please refactor the rollback"));

        Optional<CorrectionPattern> pattern = detector.detectTrailingPattern(messages);

        assertEquals(CorrectionType.REVISION_REQUEST, pattern.orElseThrow().type());
        assertEquals(List.of(2), pattern.orElseThrow().messageIndices());
    }

    @Test
    void isCorrectionParsesModelAnalysis() {
        when(llmPort.chat(any())).thenReturn(respond("```json\n{\"isCorrection\": true, \"confidence\": 0.9, "
                + "\"issues\": [\"nullable column\"], \"affectedAgents\": [\"Developer\"]}\n```"));

        CorrectionAnalysis analysis = detector.isCorrection(Message.user("That's wrong"), history(8)).join();

        assertTrue(analysis.isCorrection());
        assertEquals(0.9, analysis.getConfidence());
        assertEquals(List.of("nullable column"), analysis.getIssues());
        assertEquals(List.of("Developer"), analysis.getAffectedAgents());

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chat(captor.capture());
        String prompt = captor.getValue().getMessages().get(1).getContent();
        assertFalse(prompt.contains("message 2"));
        assertTrue(prompt.contains("message 3"));
        assertTrue(prompt.contains("message 7"));
    }

    @Test
    void isCorrectionFailsClosed() {
        when(llmPort.chat(any())).thenReturn(respond("I think so"));
        assertFalse(detector.isCorrection(Message.user("x"), List.of()).join().isCorrection());

        when(llmPort.chat(any())).thenReturn(CompletableFuture.failedFuture(new RuntimeException("down")));
        assertFalse(detector.isCorrection(Message.user("x"), List.of()).join().isCorrection());

        when(llmPort.chat(any())).thenThrow(new IllegalStateException("sync failure"));
        assertFalse(detector.isCorrection(Message.user("x"), List.of()).join().isCorrection());
    }

    private static List<Message> history(int size) {
        List<Message> messages = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            messages.add(Message.user("message " + i));
        }
        return messages;
    }

    private static CompletableFuture<LlmResponse> respond(String content) {
        return CompletableFuture.completedFuture(LlmResponse.builder().content(content).build());
    }
}
