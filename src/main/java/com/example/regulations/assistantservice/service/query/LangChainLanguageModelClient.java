package com.example.regulations.assistantservice.service.query;

import com.example.regulations.assistantservice.service.support.AsyncCalls;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

@Slf4j
@Component
public class LangChainLanguageModelClient implements LanguageModelClient {

    private final ChatLanguageModel chatModel;
    private final ExecutorService executor;
    private final String modelName;

    public LangChainLanguageModelClient(ChatLanguageModel chatModel,
                                        @Qualifier("llmExecutor") ExecutorService executor,
                                        @Value("${app.llm.model:llama3.1}") String modelName) {
        this.chatModel = chatModel;
        this.executor = executor;
        this.modelName = modelName;
    }

    @Override
    public CompletableFuture<GenerationResponse> generate(GenerationRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.systemPrompt() != null) {
            messages.add(SystemMessage.from(request.systemPrompt()));
        }
        for (ConversationTurn turn : request.history()) {
            messages.add(turn.role() == ConversationTurn.Role.USER
                    ? UserMessage.from(turn.content())
                    : AiMessage.from(turn.content()));
        }
        messages.add(UserMessage.from(request.userMessage()));
        return AsyncCalls.submit(executor, () -> {
            Response<AiMessage> response = chatModel.generate(messages);
            AiMessage message = response == null ? null : response.content();
            log.debug("Generated answer with {} ({} messages in)", modelName, messages.size());
            return new GenerationResponse(message == null ? null : message.text(), modelName);
        });
    }
}
