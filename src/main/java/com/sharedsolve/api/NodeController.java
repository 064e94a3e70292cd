package com.sharedsolve.api;

import com.sharedsolve.component.model.ComponentType;
import com.sharedsolve.config.SharedSolveProperties;
import com.sharedsolve.coordination.CoordinationMetricsService;
import com.sharedsolve.coordination.NodeRole;
import com.sharedsolve.store.SharedSolutionStore;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

@RestController
@RequestMapping("/api")
public class NodeController {

    private final SharedSolveProperties properties;
    private final SharedSolutionStore store;
    private final CoordinationMetricsService metricsService;

    public NodeController(SharedSolveProperties properties,
                          SharedSolutionStore store,
                          CoordinationMetricsService metricsService) {
        this.properties = properties;
        this.store = store;
        this.metricsService = metricsService;
    }

    @GetMapping("/health")
    public HealthResponse health() {
        NodeRole role = properties.getCoordination().getRole();
        // Solo nodes never touch the store, so its state does not affect their health.
        boolean storeAvailable = store.isAvailable();
        String status = role == NodeRole.SOLO || storeAvailable ? "healthy" : "degraded";
        return new HealthResponse(status, properties.getNodeName(), role, storeAvailable, metricsService.snapshot());
    }

    @GetMapping("/capabilities")
    public CapabilitiesResponse capabilities() {
        SharedSolveProperties.Coordination coordination = properties.getCoordination();
        SharedSolveProperties.Conversation conversation = properties.getConversation();
        List<String> components = Arrays.stream(ComponentType.values()).map(ComponentType::key).toList();
        return new CapabilitiesResponse(
                properties.getNodeName(),
                coordination.getRole(),
                components,
                conversation.getMaxMessages(),
                conversation.getRetention(),
                coordination.getSolutionTtl(),
                coordination.getWaitTimeout()
        );
    }

    public record HealthResponse(
            String status,
            String nodeName,
            NodeRole role,
            boolean storeAvailable,
            CoordinationMetricsService.Snapshot coordination
    ) {}

    public record CapabilitiesResponse(
            String nodeName,
            NodeRole role,
            List<String> components,
            int maxConversationMessages,
            Duration messageRetention,
            Duration solutionTtl,
            Duration waitTimeout
    ) {}
}
