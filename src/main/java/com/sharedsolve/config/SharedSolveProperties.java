package com.sharedsolve.config;

import com.sharedsolve.coordination.NodeRole;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "sharedsolve")
public class SharedSolveProperties {

    private String nodeName = "shared-solve-node";
    private Coordination coordination = new Coordination();
    private Store store = new Store();
    private Generation generation = new Generation();
    private Conversation conversation = new Conversation();

    public static class Coordination {
        private NodeRole role = NodeRole.SOLO;
        private Duration solutionTtl = Duration.ofSeconds(120);
        // Keep below the producer's expected generation time plus margin.
        private Duration waitTimeout = Duration.ofSeconds(55);
        private Duration pollInterval = Duration.ofMillis(500);

        public NodeRole getRole() { return role; }
        public void setRole(NodeRole role) {
            if (role == null) {
                return;
            }
            this.role = role;
        }
        public Duration getSolutionTtl() { return solutionTtl; }
        public void setSolutionTtl(Duration solutionTtl) { this.solutionTtl = solutionTtl; }
        public Duration getWaitTimeout() { return waitTimeout; }
        public void setWaitTimeout(Duration waitTimeout) { this.waitTimeout = waitTimeout; }
        public Duration getPollInterval() { return pollInterval; }
        public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
    }

    public static class Store {
        private String namespace = "solution";

        public String getNamespace() { return namespace; }
        public void setNamespace(String namespace) { this.namespace = namespace; }
    }

    public static class Generation {
        private Integer maxTokens = 4000;
        private boolean stripReasoningTags = true;
        // Servers without JSON mode reject response_format; turn off for those.
        private boolean jsonResponseFormat = true;

        public Integer getMaxTokens() { return maxTokens; }
        public void setMaxTokens(Integer maxTokens) { this.maxTokens = maxTokens; }
        public boolean isStripReasoningTags() { return stripReasoningTags; }
        public void setStripReasoningTags(boolean stripReasoningTags) { this.stripReasoningTags = stripReasoningTags; }
        public boolean isJsonResponseFormat() { return jsonResponseFormat; }
        public void setJsonResponseFormat(boolean jsonResponseFormat) { this.jsonResponseFormat = jsonResponseFormat; }
    }

    public static class Conversation {
        private int maxMessages = 10;
        private int historyCount = 5;
        private Duration retention = Duration.ofDays(7);

        public int getMaxMessages() { return maxMessages; }
        public void setMaxMessages(int maxMessages) { this.maxMessages = maxMessages; }
        public int getHistoryCount() { return historyCount; }
        public void setHistoryCount(int historyCount) { this.historyCount = historyCount; }
        public Duration getRetention() { return retention; }
        public void setRetention(Duration retention) { this.retention = retention; }
    }

    public String getNodeName() {
        return nodeName;
    }

    public void setNodeName(String nodeName) {
        this.nodeName = nodeName;
    }

    public Coordination getCoordination() {
        return coordination;
    }

    public void setCoordination(Coordination coordination) {
        this.coordination = coordination != null ? coordination : new Coordination();
    }

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store != null ? store : new Store();
    }

    public Generation getGeneration() {
        return generation;
    }

    public void setGeneration(Generation generation) {
        this.generation = generation != null ? generation : new Generation();
    }

    public Conversation getConversation() {
        return conversation;
    }

    public void setConversation(Conversation conversation) {
        this.conversation = conversation != null ? conversation : new Conversation();
    }
}
