package com.eainde.extraction.capability;

import com.eainde.extraction.exception.TransientCapabilityException;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;

/**
 * {@link ExtractionCapability} backed by a langchain4j {@link ChatModel}.
 *
 * <p>Every call carries the same system instruction (JSON only, escaped
 * newlines). Provider failures are translated into
 * {@link TransientCapabilityException}, flagged as rate-limited when the
 * provider signals throttling.</p>
 */
@Slf4j
public class ChatModelExtractionCapability implements ExtractionCapability {

    static final String SYSTEM_PROMPT = "You are a tender analyst. Output valid JSON only. "
            + "Escape all newlines and quotes within string values.";

    private final ChatModel delegate;

    public ChatModelExtractionCapability(ChatModel delegate) {
        this.delegate = delegate;
    }

    @Override
    public String call(String prompt) {
        ChatRequest request = ChatRequest.builder()
                .messages(SystemMessage.from(SYSTEM_PROMPT), UserMessage.from(prompt))
                .build();
        try {
            ChatResponse response = delegate.chat(request);
            if (response == null || response.aiMessage() == null || response.aiMessage().text() == null) {
                throw new TransientCapabilityException("Extraction capability returned no content", false);
            }
            return response.aiMessage().text();
        } catch (TransientCapabilityException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Extraction capability call failed: {}", e.getMessage());
            throw new TransientCapabilityException(e.getMessage(), isRateLimit(e), e);
        }
    }

    static boolean isRateLimit(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            String message = t.getMessage();
            if (message == null) continue;
            String lower = message.toLowerCase(Locale.ROOT);
            if (lower.contains("429") || lower.contains("rate limit") || lower.contains("too many requests")) {
                return true;
            }
        }
        return false;
    }
}
