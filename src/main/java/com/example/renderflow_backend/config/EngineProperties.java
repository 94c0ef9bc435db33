package com.example.renderflow_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Provider endpoints and credentials. Credential keys match the catalog's required credential names
 * (e.g. {@code KLING_ACCESS_KEY}); blank values count as missing.
 */
@ConfigurationProperties(prefix = "engines")
public class EngineProperties {
    private Map<String, String> credentials = new HashMap<>();
    private Map<String, ProviderEndpoint> providers = new LinkedHashMap<>();
    private String edgeBaseUrl = "http://127.0.0.1:54321/functions/v1";
    private long edgeTimeoutSeconds = 60;
    private BigDecimal fallbackUnitCost = new BigDecimal("0.01");
    /** Public URL of the completion webhook handed to async engines; omitted when blank. */
    private String callbackUrl;

    public Map<String, String> getCredentials() {
        return credentials;
    }

    public void setCredentials(Map<String, String> credentials) {
        this.credentials = credentials;
    }

    public Map<String, ProviderEndpoint> getProviders() {
        return providers;
    }

    public void setProviders(Map<String, ProviderEndpoint> providers) {
        this.providers = providers;
    }

    public String getEdgeBaseUrl() {
        return edgeBaseUrl;
    }

    public void setEdgeBaseUrl(String edgeBaseUrl) {
        this.edgeBaseUrl = edgeBaseUrl;
    }

    public long getEdgeTimeoutSeconds() {
        return edgeTimeoutSeconds;
    }

    public void setEdgeTimeoutSeconds(long edgeTimeoutSeconds) {
        this.edgeTimeoutSeconds = edgeTimeoutSeconds;
    }

    public BigDecimal getFallbackUnitCost() {
        return fallbackUnitCost;
    }

    public void setFallbackUnitCost(BigDecimal fallbackUnitCost) {
        this.fallbackUnitCost = fallbackUnitCost;
    }

    public String getCallbackUrl() {
        return callbackUrl;
    }

    public void setCallbackUrl(String callbackUrl) {
        this.callbackUrl = callbackUrl;
    }

    /** Names of the credentials that carry a non-blank value. */
    public Set<String> availableCredentialKeys() {
        return credentials.entrySet().stream()
                .filter(e -> e.getValue() != null && !e.getValue().isBlank())
                .map(Map.Entry::getKey)
                .collect(Collectors.toUnmodifiableSet());
    }

    public static class ProviderEndpoint {
        private String baseUrl;
        private long timeoutSeconds = 60;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public long getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(long timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }
    }
}
