package com.phillippitts.voxbank.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the generation worker pool.
 *
 * <p>The pool only runs provider calls, and the provider concurrency cap
 * ({@code vox.generation.max-concurrency}) gates them, so the pool may be larger than
 * the cap to let several requests queue on the semaphore instead of on the executor.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    @Valid
    private GenerationPoolProperties generation = new GenerationPoolProperties();

    public GenerationPoolProperties getGeneration() {
        return generation;
    }

    public void setGeneration(GenerationPoolProperties generation) {
        this.generation = generation;
    }

    /**
     * Generation executor pool configuration.
     */
    public static class GenerationPoolProperties {
        @Min(1)
        private int corePoolSize = 4;
        @Min(1)
        private int maxPoolSize = 8;
        @Min(0)
        private int queueCapacity = 100;
        @Min(0)
        private int keepAliveSeconds = 60;
        @NotBlank
        private String threadNamePrefix = "vox-gen-";

        @AssertTrue(message = "threadpool.generation.max-pool-size must be >= core-pool-size")
        public boolean isPoolSizeConsistent() {
            return maxPoolSize >= corePoolSize;
        }

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
