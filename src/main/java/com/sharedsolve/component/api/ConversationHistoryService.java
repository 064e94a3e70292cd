package com.sharedsolve.component.api;

import com.sharedsolve.component.model.ConversationSummary;
import com.sharedsolve.component.model.HistoryMessage;

import java.util.List;

/**
 * Service interface for per-conversation message history: append, read back the most recent
 * messages, trim to a fixed size and expire old messages.
 */
public interface ConversationHistoryService {

    /**
     * Appends a message to a conversation. Blank content is skipped. The conversation is
     * trimmed to its maximum size and expired messages are purged afterwards.
     *
     * @param cid The conversation id.
     * @param role The speaker, {@link HistoryMessage#ROLE_USER} or {@link HistoryMessage#ROLE_ASSISTANT}.
     * @param content The message text.
     */
    void append(String cid, String role, String content);

    /**
     * Appends a user message followed by the assistant's answer.
     *
     * @param cid The conversation id.
     * @param userContent What was asked.
     * @param assistantContent What was answered.
     */
    default void appendExchange(String cid, String userContent, String assistantContent) {
        append(cid, HistoryMessage.ROLE_USER, userContent);
        append(cid, HistoryMessage.ROLE_ASSISTANT, assistantContent);
    }

    /**
     * Returns the most recent messages of a conversation, oldest first.
     *
     * @param cid The conversation id.
     * @param count The maximum number of messages.
     * @return Up to {@code count} messages in chronological order.
     */
    List<HistoryMessage> recent(String cid, int count);

    /**
     * Lists the stored conversations, most recently active first.
     *
     * @return One summary per conversation id.
     */
    List<ConversationSummary> conversations();

    /**
     * Deletes a conversation.
     *
     * @param cid The conversation id.
     * @return The number of messages removed, 0 when the conversation does not exist.
     */
    long clear(String cid);

    /**
     * Deletes every message older than the configured retention.
     *
     * @return The number of messages removed.
     */
    long purgeExpired();
}
