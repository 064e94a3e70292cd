package com.sharedsolve.component.model;

import java.time.OffsetDateTime;

public record ConversationSummary(String cid, Long messageCount, OffsetDateTime firstMessageAt,
                                  OffsetDateTime lastMessageAt) {
}
