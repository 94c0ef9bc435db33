package com.example.renderflow_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "storage")
public class StorageProperties {
    private String baseUrl = "http://127.0.0.1:54321/storage/v1";
    private String bucket = "renderflow-outputs";
    private String publicPrefix = "http://127.0.0.1:54321/storage/v1/object/public/renderflow-outputs/";
    private long timeoutSeconds = 120;

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

    public String getBucket() { return bucket; }
    public void setBucket(String bucket) { this.bucket = bucket; }

    public String getPublicPrefix() { return publicPrefix; }
    public void setPublicPrefix(String publicPrefix) { this.publicPrefix = publicPrefix; }

    public long getTimeoutSeconds() { return timeoutSeconds; }
    public void setTimeoutSeconds(long timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
}
