package com.purchasingpower.compliancekb.client;

import com.purchasingpower.compliancekb.exception.ChatCompletionException;
import com.purchasingpower.compliancekb.model.CallContext;
import com.purchasingpower.compliancekb.model.ServiceType;
import com.purchasingpower.compliancekb.util.ExternalCallLogger;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.output.Response;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

@Slf4j
@RequiredArgsConstructor
public class LangChain4jChatCompletionClient implements ChatCompletionClient {

    private final ChatLanguageModel chatModel;

    @Override
    public String complete(String systemPrompt, String userPrompt) {
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.OPENAI, "chat", log);
        ctx.logRequest(ExternalCallLogger.truncate(userPrompt, 200),
                "systemChars", systemPrompt.length(), "userChars", userPrompt.length());

        List<ChatMessage> messages = List.of(SystemMessage.from(systemPrompt), UserMessage.from(userPrompt));
        try {
            Response<AiMessage> response = chatModel.generate(messages);
            String text = response != null && response.content() != null ? response.content().text() : null;
            ctx.logResponse(ExternalCallLogger.truncate(text, 200),
                    "tokens", response != null ? response.tokenUsage() : null);
            return text != null ? text : "";
        } catch (RuntimeException e) {
            ctx.logError("Chat completion failed", e);
            throw new ChatCompletionException("Chat completion failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isConfigured() {
        return true;
    }
}
