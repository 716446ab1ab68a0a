package com.phillippitts.voxbank.config;

import com.phillippitts.voxbank.config.properties.GenerationProperties;
import com.phillippitts.voxbank.config.properties.ProviderProperties;
import com.phillippitts.voxbank.service.cache.WordBankCache;
import com.phillippitts.voxbank.service.generation.ClipAudioValidator;
import com.phillippitts.voxbank.service.generation.ConcurrencyGuard;
import com.phillippitts.voxbank.service.generation.ConcurrentWordGenerator;
import com.phillippitts.voxbank.service.generation.HttpSynthesisProvider;
import com.phillippitts.voxbank.service.generation.SynthesisProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

/**
 * Wires the synthesis provider and the concurrent generator.
 *
 * <p>The provider concurrency cap is one {@link ConcurrencyGuard} shared by every request,
 * so {@code vox.generation.max-concurrency} bounds in-flight provider calls per process.
 */
@Configuration
public class GenerationConfig {

    @Bean
    public RestClient synthesisRestClient(ProviderProperties properties) {
        return RestClient.builder()
                .baseUrl(properties.getBaseUrl())
                .requestFactory(providerRequestFactory(properties))
                .build();
    }

    /**
     * JDK {@link HttpClient} based factory: a blocked call returns as soon as the worker
     * thread is interrupted, so cancelling a generation future frees its provider permit.
     */
    static ClientHttpRequestFactory providerRequestFactory(ProviderProperties properties) {
        HttpClient httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofMillis(properties.getConnectTimeoutMs()))
                .build();
        JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(httpClient);
        factory.setReadTimeout(Duration.ofMillis(properties.getReadTimeoutMs()));
        return factory;
    }

    @Bean
    public SynthesisProvider synthesisProvider(RestClient synthesisRestClient, ProviderProperties properties) {
        return new HttpSynthesisProvider(synthesisRestClient, properties);
    }

    @Bean
    public ConcurrencyGuard providerConcurrencyGuard(GenerationProperties properties,
                                                     SynthesisProvider synthesisProvider,
                                                     ApplicationEventPublisher publisher) {
        return new ConcurrencyGuard(properties.getMaxConcurrency(), properties.getAcquireTimeoutMs(),
                synthesisProvider.name(), publisher);
    }

    @Bean
    public ConcurrentWordGenerator concurrentWordGenerator(WordBankCache wordBankCache,
                                                           SynthesisProvider synthesisProvider,
                                                           ClipAudioValidator clipAudioValidator,
                                                           ConcurrencyGuard providerConcurrencyGuard,
                                                           @Qualifier("generationExecutor")
                                                           ThreadPoolTaskExecutor generationExecutor,
                                                           GenerationProperties properties,
                                                           ApplicationEventPublisher publisher,
                                                           Clock clock) {
        return new ConcurrentWordGenerator(wordBankCache, synthesisProvider, clipAudioValidator,
                providerConcurrencyGuard, generationExecutor, properties, publisher, clock);
    }
}
