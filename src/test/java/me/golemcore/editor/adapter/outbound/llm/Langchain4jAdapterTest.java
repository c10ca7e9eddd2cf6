package me.golemcore.editor.adapter.outbound.llm;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import me.golemcore.editor.domain.model.LlmRequest;
import me.golemcore.editor.domain.model.Message;
import me.golemcore.editor.infrastructure.config.EditorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class Langchain4jAdapterTest {

    private EditorProperties properties;
    private Langchain4jAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new EditorProperties();
        properties.getLlm().setModel("anthropic/claude-sonnet");
        adapter = new Langchain4jAdapter(properties);
    }

    // --- conversion ---

    @Test
    void shouldConvertRolesToLangchainMessages() {
        List<ChatMessage> messages = Langchain4jAdapter.convertMessages(List.of(
                Message.system("rules"),
                Message.user("edit it"),
                Message.assistant("<read_file></read_file>"),
                Message.builder().role("tool").content("result").build()));

        assertEquals(4, messages.size());
        assertEquals("rules", assertInstanceOf(SystemMessage.class, messages.get(0)).text());
        assertEquals("edit it", assertInstanceOf(UserMessage.class, messages.get(1)).singleText());
        assertEquals("<read_file></read_file>", assertInstanceOf(AiMessage.class, messages.get(2)).text());
        assertEquals("result", assertInstanceOf(UserMessage.class, messages.get(3)).singleText());
    }

    @Test
    void shouldReplaceNullContentWithEmptyText() {
        List<ChatMessage> messages = Langchain4jAdapter.convertMessages(List.of(
                Message.builder().role("assistant").build()));

        assertEquals("", ((AiMessage) messages.get(0)).text());
    }

    // --- availability ---

    @Test
    void shouldBeUnavailableWithoutApiKey() {
        assertFalse(adapter.isAvailable());
        assertEquals("anthropic/claude-sonnet", adapter.getCurrentModel());
        assertTrue(adapter.supportsStreaming());
    }

    @Test
    void shouldBeAvailableOnceProviderHasKey() {
        EditorProperties.ProviderProperties provider = new EditorProperties.ProviderProperties();
        provider.setApiKey("sk-test");
        properties.getLlm().getProviders().put("anthropic", provider);

        assertTrue(adapter.isAvailable());
    }

    @Test
    void shouldFailChatForUnconfiguredProvider() {
        LlmRequest request = LlmRequest.builder().messages(List.of(Message.user("hi"))).build();

        ExecutionException error = assertThrows(ExecutionException.class, () -> adapter.chat(request).get());

        IllegalStateException cause = assertInstanceOf(IllegalStateException.class, error.getCause());
        assertTrue(cause.getMessage().startsWith("Provider not configured: anthropic"));
    }
}
