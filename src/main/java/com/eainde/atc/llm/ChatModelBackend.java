package com.eainde.atc.llm;

import com.eainde.atc.exception.BackendException;
import com.eainde.atc.exception.BackendTimeoutException;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.TimeoutException;

/**
 * Adapts a LangChain4j {@link ChatModel} to {@link LanguageModelBackend}: one user message in,
 * the assistant text out.
 */
public class ChatModelBackend implements LanguageModelBackend {

    private final ChatModel chatModel;

    public ChatModelBackend(ChatModel chatModel) {
        this.chatModel = chatModel;
    }

    @Override
    public String complete(String prompt, int maxTokens) {
        ChatRequest request = ChatRequest.builder()
                .messages(UserMessage.from(prompt))
                .maxOutputTokens(maxTokens)
                .build();
        try {
            ChatResponse response = chatModel.chat(request);
            AiMessage message = response != null ? response.aiMessage() : null;
            String text = message != null ? message.text() : null;
            return text != null ? text.strip() : "";
        } catch (RuntimeException e) {
            if (isTimeout(e)) {
                throw new BackendTimeoutException("Language model provider timed out: " + e.getMessage(), e);
            }
            throw new BackendException("Language model call failed: " + e.getMessage(), e);
        }
    }

    static boolean isTimeout(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof TimeoutException
                    || t instanceof SocketTimeoutException
                    || t instanceof HttpTimeoutException
                    || t.getClass().getSimpleName().contains("Timeout")) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }
}
