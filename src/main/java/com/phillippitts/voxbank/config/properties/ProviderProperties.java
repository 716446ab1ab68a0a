package com.phillippitts.voxbank.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Connection settings of the HTTP synthesis provider.
 */
@Validated
@ConfigurationProperties(prefix = "vox.provider")
public class ProviderProperties {

    @NotBlank
    private String baseUrl = "http://localhost:5002";

    @NotBlank
    private String synthesizePath = "/v1/synthesize";

    /** Optional bearer token; blank disables the Authorization header. */
    private String apiKey = "";

    @Positive
    private int connectTimeoutMs = 3_000;

    @Positive
    private int readTimeoutMs = 10_000;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getSynthesizePath() {
        return synthesizePath;
    }

    public void setSynthesizePath(String synthesizePath) {
        this.synthesizePath = synthesizePath;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(int connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public int getReadTimeoutMs() {
        return readTimeoutMs;
    }

    public void setReadTimeoutMs(int readTimeoutMs) {
        this.readTimeoutMs = readTimeoutMs;
    }
}
