package com.sharedsolve.component.model;

import java.time.OffsetDateTime;

public record HistoryMessage(String role, String content, OffsetDateTime createdAt) {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";

    public boolean fromUser() {
        return ROLE_USER.equals(role);
    }
}
