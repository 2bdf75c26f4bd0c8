package me.golemcore.crew.domain.service;

import me.golemcore.crew.domain.model.Message;
import me.golemcore.crew.infrastructure.config.CrewProperties;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TokenEstimatorTest {

    private final TokenEstimator estimator = new TokenEstimator(new CrewProperties());

    @Test
    void estimateRoundsCharactersUp() {
        assertEquals(0, estimator.estimate((String) null));
        assertEquals(1, estimator.estimate("abc"));
        assertEquals(2, estimator.estimate("abcde"));
    }

    @Test
    void estimateAddsPerMessageOverhead() {
        Message message = Message.user("abcdefgh");

        assertEquals(2 + TokenEstimator.MESSAGE_OVERHEAD_TOKENS, estimator.estimate(message));
        assertEquals(2 * (2 + TokenEstimator.MESSAGE_OVERHEAD_TOKENS), estimator.estimate(List.of(message, message)));
    }
}
