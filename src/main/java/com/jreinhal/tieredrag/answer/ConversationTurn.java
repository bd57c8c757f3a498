package com.jreinhal.tieredrag.answer;

/**
 * One prior exchange line supplied by the client. The service does not store history.
 */
public record ConversationTurn(String role, String content) {

    public boolean fromUser() {
        return role == null || !"assistant".equalsIgnoreCase(role.trim());
    }
}
