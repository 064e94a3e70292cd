package com.sharedsolve.api;

import com.sharedsolve.config.SharedSolveProperties;
import com.sharedsolve.coordination.CoordinationMetricsService;
import com.sharedsolve.coordination.NodeRole;
import com.sharedsolve.store.SharedSolutionStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(NodeController.class)
class NodeControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private SharedSolveProperties properties;

    @MockitoBean
    private SharedSolutionStore store;

    @MockitoBean
    private CoordinationMetricsService metricsService;

    private void configureRole(NodeRole role) {
        SharedSolveProperties.Coordination coordination = new SharedSolveProperties.Coordination();
        coordination.setRole(role);
        when(properties.getCoordination()).thenReturn(coordination);
        when(properties.getConversation()).thenReturn(new SharedSolveProperties.Conversation());
        when(properties.getNodeName()).thenReturn("node-a");
        when(metricsService.snapshot()).thenReturn(new CoordinationMetricsService.Snapshot(3, 2, 1, 0, 0, 0));
    }

    @Test
    void testHealthOfWaiterWithStore() throws Exception {
        configureRole(NodeRole.WAITER);
        when(store.isAvailable()).thenReturn(true);

        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.nodeName").value("node-a"))
                .andExpect(jsonPath("$.role").value("WAITER"))
                .andExpect(jsonPath("$.storeAvailable").value(true))
                .andExpect(jsonPath("$.coordination.sharedHits").value(2));
    }

    @Test
    void testHealthDegradedWhenStoreDown() throws Exception {
        configureRole(NodeRole.PRODUCER);
        when(store.isAvailable()).thenReturn(false);

        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("degraded"));
    }

    @Test
    void testCapabilities() throws Exception {
        configureRole(NodeRole.SOLO);

        mockMvc.perform(get("/api/capabilities"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.components").isArray())
                .andExpect(jsonPath("$.components[4]").value("aggregate"))
                .andExpect(jsonPath("$.maxConversationMessages").value(10));
    }
}
