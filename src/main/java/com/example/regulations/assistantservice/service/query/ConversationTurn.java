package com.example.regulations.assistantservice.service.query;

public record ConversationTurn(Role role, String content) {

    public enum Role {
        USER,
        ASSISTANT
    }

    public static ConversationTurn user(String content) {
        return new ConversationTurn(Role.USER, content);
    }

    public static ConversationTurn assistant(String content) {
        return new ConversationTurn(Role.ASSISTANT, content);
    }
}
