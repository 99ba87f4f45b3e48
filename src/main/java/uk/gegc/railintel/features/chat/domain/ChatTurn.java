package uk.gegc.railintel.features.chat.domain;

/**
 * One earlier message in a conversation.
 */
public record ChatTurn(Role role, String content) {

    public enum Role {
        USER,
        ASSISTANT
    }

    public ChatTurn {
        role = role == null ? Role.USER : role;
        content = content == null ? "" : content;
    }

    public String speaker() {
        return role == Role.USER ? "User" : "Assistant";
    }
}
