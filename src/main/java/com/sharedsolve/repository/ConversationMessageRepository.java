package com.sharedsolve.repository;

import com.sharedsolve.component.model.ConversationSummary;
import com.sharedsolve.entity.ConversationMessage;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Repository interface for managing {@link ConversationMessage} entities.
 */
public interface ConversationMessageRepository extends JpaRepository<ConversationMessage, Long> {

    List<ConversationMessage> findByCidOrderByIdDesc(String cid, Pageable pageable);

    List<ConversationMessage> findByCidOrderByIdDesc(String cid);

    long countByCid(String cid);

    @Query("""
            select new com.sharedsolve.component.model.ConversationSummary(
                m.cid, count(m), min(m.createdAt), max(m.createdAt))
            from ConversationMessage m
            group by m.cid
            order by max(m.createdAt) desc
            """)
    List<ConversationSummary> summarizeConversations();

    long deleteByCid(String cid);

    long deleteByCreatedAtBefore(OffsetDateTime cutoff);
}
