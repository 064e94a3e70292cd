package com.sharedsolve.component.service;

import com.sharedsolve.component.api.ConversationHistoryService;
import com.sharedsolve.component.model.ConversationSummary;
import com.sharedsolve.component.model.HistoryMessage;
import com.sharedsolve.config.SharedSolveProperties;
import com.sharedsolve.entity.ConversationMessage;
import com.sharedsolve.repository.ConversationMessageRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationHistoryServiceImpl implements ConversationHistoryService {

    private final ConversationMessageRepository repository;
    private final SharedSolveProperties properties;

    @Override
    @Transactional
    public void append(String cid, String role, String content) {
        if (!StringUtils.hasText(content)) {
            log.warn("Skipping empty message for conversation {}", cid);
            return;
        }
        repository.save(ConversationMessage.builder()
                .cid(cid)
                .role(role)
                .content(content)
                .build());
        trim(cid);
        purgeExpired();
    }

    @Override
    @Transactional(readOnly = true)
    public List<HistoryMessage> recent(String cid, int count) {
        if (count <= 0 || !StringUtils.hasText(cid)) {
            return List.of();
        }
        OffsetDateTime cutoff = retentionCutoff();
        List<HistoryMessage> messages = new ArrayList<>();
        for (ConversationMessage message : repository.findByCidOrderByIdDesc(cid, PageRequest.of(0, count))) {
            if (message.getCreatedAt() == null || message.getCreatedAt().isAfter(cutoff)) {
                messages.add(new HistoryMessage(message.getRole(), message.getContent(), message.getCreatedAt()));
            }
        }
        Collections.reverse(messages);
        return messages;
    }

    @Override
    @Transactional(readOnly = true)
    public List<ConversationSummary> conversations() {
        return repository.summarizeConversations();
    }

    @Override
    @Transactional
    public long clear(String cid) {
        if (repository.countByCid(cid) == 0) {
            return 0;
        }
        long removed = repository.deleteByCid(cid);
        log.info("Cleared {} messages for conversation {}.", removed, cid);
        return removed;
    }

    @Override
    @Transactional
    public long purgeExpired() {
        long removed = repository.deleteByCreatedAtBefore(retentionCutoff());
        if (removed > 0) {
            log.info("Purged {} expired conversation messages.", removed);
        }
        return removed;
    }

    private void trim(String cid) {
        int maxMessages = Math.max(properties.getConversation().getMaxMessages(), 1);
        List<ConversationMessage> newestFirst = repository.findByCidOrderByIdDesc(cid);
        if (newestFirst.size() > maxMessages) {
            List<ConversationMessage> overflow = newestFirst.subList(maxMessages, newestFirst.size());
            repository.deleteAllInBatch(overflow);
            log.debug("Trimmed {} old messages from conversation {}", overflow.size(), cid);
        }
    }

    private OffsetDateTime retentionCutoff() {
        return OffsetDateTime.now().minus(properties.getConversation().getRetention());
    }
}
