package com.example.regulations.assistantservice.service.query;

import java.util.List;

public record GenerationRequest(String systemPrompt, List<ConversationTurn> history, String userMessage) {}
