package com.williamcallahan.agentbridge.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Component
@Validated
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    @Valid
    private Upstream upstream = new Upstream();
    @Valid
    private Security security = new Security();
    @Valid
    private Models models = new Models();
    @Valid
    private Conversations conversations = new Conversations();
    private String serviceName = "agent-bridge";
    private String serviceVersion = "1.1.0";

    public Upstream getUpstream() {
        return upstream;
    }

    public void setUpstream(Upstream upstream) {
        this.upstream = upstream;
    }

    public Security getSecurity() {
        return security;
    }

    public void setSecurity(Security security) {
        this.security = security;
    }

    public Models getModels() {
        return models;
    }

    public void setModels(Models models) {
        this.models = models;
    }

    public Conversations getConversations() {
        return conversations;
    }

    public void setConversations(Conversations conversations) {
        this.conversations = conversations;
    }

    public String getServiceName() {
        return serviceName;
    }

    public void setServiceName(String serviceName) {
        this.serviceName = serviceName;
    }

    public String getServiceVersion() {
        return serviceVersion;
    }

    public void setServiceVersion(String serviceVersion) {
        this.serviceVersion = serviceVersion;
    }

    /**
     * Agent backend endpoints and transport limits.
     */
    public static class Upstream {
        @NotBlank
        private String apiBaseUrl = "https://api.enginelabs.ai";
        @NotBlank
        private String socketBaseUrl = "wss://api.enginelabs.ai";
        @NotBlank
        private String origin = "https://cto.new";
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(15);
        @NotNull
        private Duration triggerTimeout = Duration.ofSeconds(60);
        /** Backend credential used when callers authenticate with the admin key. */
        private String credential = "";

        public String getApiBaseUrl() { return apiBaseUrl; }
        public void setApiBaseUrl(String apiBaseUrl) { this.apiBaseUrl = apiBaseUrl; }

        public String getSocketBaseUrl() { return socketBaseUrl; }
        public void setSocketBaseUrl(String socketBaseUrl) { this.socketBaseUrl = socketBaseUrl; }

        public String getOrigin() { return origin; }
        public void setOrigin(String origin) { this.origin = origin; }

        public Duration getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

        public Duration getTriggerTimeout() { return triggerTimeout; }
        public void setTriggerTimeout(Duration triggerTimeout) { this.triggerTimeout = triggerTimeout; }

        public String getCredential() { return credential; }
        public void setCredential(String credential) { this.credential = credential; }
    }

    public static class Security {
        @NotBlank
        private String adminKey = "your-secret-key-change-me";

        public String getAdminKey() { return adminKey; }
        public void setAdminKey(String adminKey) { this.adminKey = adminKey; }
    }

    public static class Models {
        @NotBlank
        private String defaultModel = "ClaudeSonnet4_5";
        @NotEmpty
        private List<String> available = new ArrayList<>(List.of("ClaudeSonnet4_5", "GPT5"));
        @NotBlank
        private String ownedBy = "enginelabs";
        private long created = 1234567890L;

        public String getDefaultModel() { return defaultModel; }
        public void setDefaultModel(String defaultModel) { this.defaultModel = defaultModel; }

        public List<String> getAvailable() { return available; }
        public void setAvailable(List<String> available) { this.available = available; }

        public String getOwnedBy() { return ownedBy; }
        public void setOwnedBy(String ownedBy) { this.ownedBy = ownedBy; }

        public long getCreated() { return created; }
        public void setCreated(long created) { this.created = created; }
    }

    public static class Conversations {
        @NotNull
        private Duration ttl = Duration.ofHours(24);
        @Positive
        private long maxEntries = 10_000;

        public Duration getTtl() { return ttl; }
        public void setTtl(Duration ttl) { this.ttl = ttl; }

        public long getMaxEntries() { return maxEntries; }
        public void setMaxEntries(long maxEntries) { this.maxEntries = maxEntries; }
    }
}
