package com.sharedsolve.api;

import com.sharedsolve.component.api.ConversationHistoryService;
import com.sharedsolve.component.model.ConversationSummary;
import com.sharedsolve.component.model.HistoryMessage;
import com.sharedsolve.config.SharedSolveProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/conversations")
@Slf4j
public class ConversationController {

    private final ConversationHistoryService historyService;
    private final SharedSolveProperties properties;

    public ConversationController(ConversationHistoryService historyService, SharedSolveProperties properties) {
        this.historyService = historyService;
        this.properties = properties;
    }

    @GetMapping
    public ConversationListResponse list() {
        List<ConversationSummary> conversations = historyService.conversations();
        return new ConversationListResponse(conversations.size(), conversations);
    }

    @GetMapping("/{cid}")
    public ConversationResponse get(@PathVariable String cid) {
        List<HistoryMessage> messages = historyService.recent(cid, properties.getConversation().getMaxMessages());
        return new ConversationResponse(cid, messages.size(), messages);
    }

    @DeleteMapping("/{cid}")
    public ResponseEntity<DeleteResponse> delete(@PathVariable String cid) {
        long removed = historyService.clear(cid);
        if (removed == 0) {
            log.warn("DELETE /api/conversations/{} - Conversation not found", cid);
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(new DeleteResponse(cid, removed));
    }

    public record ConversationListResponse(int totalConversations, List<ConversationSummary> conversations) {}

    public record ConversationResponse(String cid, int messageCount, List<HistoryMessage> messages) {}

    public record DeleteResponse(String cid, long removedMessages) {}
}
