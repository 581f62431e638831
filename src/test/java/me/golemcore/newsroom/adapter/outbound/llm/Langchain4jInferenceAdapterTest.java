package me.golemcore.newsroom.adapter.outbound.llm;

import me.golemcore.newsroom.infrastructure.config.NewsroomProperties;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class Langchain4jInferenceAdapterTest {

    @Test
    void shouldBeUnavailableWithoutApiKey() {
        NewsroomProperties properties = new NewsroomProperties();
        properties.getLlm().setApiKey(" ");
        Langchain4jInferenceAdapter adapter = new Langchain4jInferenceAdapter(properties);

        assertFalse(adapter.isAvailable());
        assertEquals("gpt-4o", adapter.getModel());

        CompletionException error = assertThrows(CompletionException.class,
                () -> adapter.complete("system", "context").join());
        assertInstanceOf(IllegalStateException.class, error.getCause());
    }

    @Test
    void shouldInitializeOpenAiAndAnthropicModels() {
        NewsroomProperties openAi = new NewsroomProperties();
        openAi.getLlm().setApiKey("sk-test");
        openAi.getLlm().setBaseUrl("http://localhost:9/v1");
        assertTrue(new Langchain4jInferenceAdapter(openAi).isAvailable());

        NewsroomProperties anthropic = new NewsroomProperties();
        anthropic.getLlm().setProvider("anthropic");
        anthropic.getLlm().setChatModel("claude-sonnet-4-20250514");
        anthropic.getLlm().setApiKey("sk-ant-test");
        Langchain4jInferenceAdapter adapter = new Langchain4jInferenceAdapter(anthropic);
        assertTrue(adapter.isAvailable());
        assertEquals("claude-sonnet-4-20250514", adapter.getModel());
    }
}
