package com.sharedsolve.repository;

import com.sharedsolve.component.model.ConversationSummary;
import com.sharedsolve.entity.ConversationMessage;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.data.domain.PageRequest;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Testcontainers(disabledWithoutDocker = true)
class ConversationMessageRepositoryTest {

    @Container
    @ServiceConnection
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine");

    @Autowired
    private ConversationMessageRepository repository;

    private ConversationMessage save(String cid, String content) {
        return repository.save(ConversationMessage.builder().cid(cid).role("user").content(content).build());
    }

    @Test
    void testSaveAndFind() {
        ConversationMessage saved = save("c1", "hello");
        assertNotNull(saved.getId());
        assertNotNull(saved.getCreatedAt());
        assertEquals("hello", repository.findById(saved.getId()).orElseThrow().getContent());
    }

    @Test
    void testNewestFirstPaging() {
        save("c1", "one");
        save("c1", "two");
        save("c1", "three");
        save("c2", "other");

        List<ConversationMessage> latest = repository.findByCidOrderByIdDesc("c1", PageRequest.of(0, 2));

        assertEquals(List.of("three", "two"), latest.stream().map(ConversationMessage::getContent).toList());
        assertEquals(3, repository.countByCid("c1"));
    }

    @Test
    void testDeletes() {
        save("c1", "one");
        save("c2", "two");

        assertEquals(1, repository.deleteByCid("c1"));
        assertEquals(0, repository.countByCid("c1"));
        assertEquals(0, repository.deleteByCreatedAtBefore(OffsetDateTime.now().minusDays(1)));
        assertEquals(1, repository.deleteByCreatedAtBefore(OffsetDateTime.now().plusMinutes(1)));
    }

    @Test
    void testSummarizeConversations() {
        save("c1", "one");
        save("c1", "two");
        save("c2", "other");

        List<ConversationSummary> summaries = repository.summarizeConversations();

        Map<String, Long> counts = summaries.stream()
                .collect(Collectors.toMap(ConversationSummary::cid, ConversationSummary::messageCount));
        assertEquals(Map.of("c1", 2L, "c2", 1L), counts);
        ConversationSummary c1 = summaries.stream().filter(s -> s.cid().equals("c1")).findFirst().orElseThrow();
        assertNotNull(c1.firstMessageAt());
        assertFalse(c1.lastMessageAt().isBefore(c1.firstMessageAt()));
    }
}
