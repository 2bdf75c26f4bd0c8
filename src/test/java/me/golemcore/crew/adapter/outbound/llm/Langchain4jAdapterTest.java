package me.golemcore.crew.adapter.outbound.llm;

import me.golemcore.crew.domain.model.LlmProviderException;
import me.golemcore.crew.domain.model.LlmRequest;
import me.golemcore.crew.domain.model.Message;
import me.golemcore.crew.infrastructure.config.AutoConfiguration;
import me.golemcore.crew.infrastructure.config.CrewProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class Langchain4jAdapterTest {

    private CrewProperties properties;
    private Langchain4jAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new CrewProperties();
        adapter = new Langchain4jAdapter(properties, AutoConfiguration.objectMapper());
    }

    @Test
    void providerOfReadsPrefixOrDefaultsToOpenAi() {
        assertEquals("anthropic", Langchain4jAdapter.providerOf("anthropic/claude-sonnet-4-20250514"));
        assertEquals("openai", Langchain4jAdapter.providerOf("gpt-4o"));
        assertEquals("openai", Langchain4jAdapter.providerOf(null));
    }

    @Test
    void stripProviderPrefixRemovesFirstSegmentOnly() {
        assertEquals("gpt-4o", Langchain4jAdapter.stripProviderPrefix("openai/gpt-4o"));
        assertEquals("org/model", Langchain4jAdapter.stripProviderPrefix("custom/org/model"));
        assertEquals("gpt-4o", Langchain4jAdapter.stripProviderPrefix("gpt-4o"));
    }

    @Test
    void isRateLimitErrorWalksCauseChain() {
        assertTrue(Langchain4jAdapter.isRateLimitError(
                new IllegalStateException("wrapped", new RuntimeException("HTTP 429 Too Many Requests"))));
        assertTrue(Langchain4jAdapter.isRateLimitError(new RuntimeException("model overloaded")));
        assertFalse(Langchain4jAdapter.isRateLimitError(new RuntimeException("invalid api key")));
    }

    @Test
    void isAvailableRequiresApiKeyForModelProvider() {
        properties.getLlm().setModel("anthropic/claude-sonnet-4-20250514");
        assertFalse(adapter.isAvailable());

        CrewProperties.ProviderProperties anthropic = new CrewProperties.ProviderProperties();
        anthropic.setApiKey("sk-test");
        properties.getLlm().getProviders().put("anthropic", anthropic);
        assertTrue(adapter.isAvailable());
    }

    @Test
    void chatFailsWhenProviderIsNotConfigured() {
        LlmRequest request = LlmRequest.builder().messages(List.of(Message.user("hello"))).build();

        CompletionException error = assertThrows(CompletionException.class, () -> adapter.chat(request).join());

        assertInstanceOf(LlmProviderException.class, error.getCause());
        assertEquals("langchain4j", adapter.getProviderId());
    }
}
