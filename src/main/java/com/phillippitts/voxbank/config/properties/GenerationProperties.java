package com.phillippitts.voxbank.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Provider concurrency cap and retry policy for on-demand word generation.
 *
 * <p>The concurrency cap is shared by every request in the process: it is the single
 * point that bounds load on the rate-limited provider.
 *
 * <p>Properties:
 * <ul>
 *   <li>vox.generation.max-concurrency - parallel provider calls (default: 3)</li>
 *   <li>vox.generation.acquire-timeout-ms - wait for a permit before failing the word (default: 30000)</li>
 *   <li>vox.generation.max-attempts - attempts per word, 1 = no retry (default: 1)</li>
 *   <li>vox.generation.retry-backoff-ms - pause between attempts (default: 250)</li>
 *   <li>vox.generation.call-timeout-ms - overall budget for one request's generation stage (default: 15000)</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "vox.generation")
public class GenerationProperties {

    @Positive(message = "Max concurrency must be positive")
    private int maxConcurrency = 3;

    @Positive(message = "Acquire timeout must be positive")
    private long acquireTimeoutMs = 30_000;

    @Min(1)
    @Max(5)
    private int maxAttempts = 1;

    @Min(0)
    private long retryBackoffMs = 250;

    @Positive
    private long callTimeoutMs = 15_000;

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public long getAcquireTimeoutMs() {
        return acquireTimeoutMs;
    }

    public void setAcquireTimeoutMs(long acquireTimeoutMs) {
        this.acquireTimeoutMs = acquireTimeoutMs;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public long getRetryBackoffMs() {
        return retryBackoffMs;
    }

    public void setRetryBackoffMs(long retryBackoffMs) {
        this.retryBackoffMs = retryBackoffMs;
    }

    public long getCallTimeoutMs() {
        return callTimeoutMs;
    }

    public void setCallTimeoutMs(long callTimeoutMs) {
        this.callTimeoutMs = callTimeoutMs;
    }
}
