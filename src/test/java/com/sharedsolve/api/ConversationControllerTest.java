package com.sharedsolve.api;

import com.sharedsolve.component.api.ConversationHistoryService;
import com.sharedsolve.component.model.ConversationSummary;
import com.sharedsolve.component.model.HistoryMessage;
import com.sharedsolve.config.SharedSolveProperties;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.OffsetDateTime;
import java.util.List;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ConversationController.class)
class ConversationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ConversationHistoryService historyService;

    @MockitoBean
    private SharedSolveProperties properties;

    @Test
    void testGetConversation() throws Exception {
        when(properties.getConversation()).thenReturn(new SharedSolveProperties.Conversation());
        when(historyService.recent("c1", 10)).thenReturn(List.of(
                new HistoryMessage(HistoryMessage.ROLE_USER, "Task: math", null),
                new HistoryMessage(HistoryMessage.ROLE_ASSISTANT, "4", null)));

        mockMvc.perform(get("/api/conversations/c1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.messageCount").value(2))
                .andExpect(jsonPath("$.messages[1].content").value("4"));
    }

    @Test
    void testListConversations() throws Exception {
        OffsetDateTime now = OffsetDateTime.now();
        when(historyService.conversations()).thenReturn(List.of(
                new ConversationSummary("c2", 4L, now.minusMinutes(5), now),
                new ConversationSummary("c1", 2L, now.minusHours(1), now.minusMinutes(30))));

        mockMvc.perform(get("/api/conversations"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalConversations").value(2))
                .andExpect(jsonPath("$.conversations[0].cid").value("c2"))
                .andExpect(jsonPath("$.conversations[0].messageCount").value(4))
                .andExpect(jsonPath("$.conversations[1].cid").value("c1"));
        verify(historyService, never()).recent(anyString(), anyInt());
    }

    @Test
    void testDeleteConversation() throws Exception {
        when(historyService.clear("c1")).thenReturn(2L);

        mockMvc.perform(delete("/api/conversations/c1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.removedMessages").value(2));
    }

    @Test
    void testDeleteUnknownConversation() throws Exception {
        when(historyService.clear("missing")).thenReturn(0L);

        mockMvc.perform(delete("/api/conversations/missing"))
                .andExpect(status().isNotFound());
    }
}
