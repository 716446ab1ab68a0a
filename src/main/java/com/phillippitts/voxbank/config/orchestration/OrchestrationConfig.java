package com.phillippitts.voxbank.config.orchestration;

import com.phillippitts.voxbank.config.properties.RequestProperties;
import com.phillippitts.voxbank.service.audio.PcmConcatenator;
import com.phillippitts.voxbank.service.cache.WordBankCache;
import com.phillippitts.voxbank.service.filter.FilterEngine;
import com.phillippitts.voxbank.service.generation.ConcurrentWordGenerator;
import com.phillippitts.voxbank.service.metrics.VoxMetrics;
import com.phillippitts.voxbank.service.orchestration.DefaultVoxOrchestrator;
import com.phillippitts.voxbank.service.orchestration.VoxOrchestrator;
import com.phillippitts.voxbank.service.tokenize.VoxTokenizer;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the synthesis pipeline explicitly.
 */
@Configuration
public class OrchestrationConfig {

    @Bean
    public VoxOrchestrator voxOrchestrator(VoxTokenizer tokenizer,
                                           WordBankCache wordBankCache,
                                           ConcurrentWordGenerator generator,
                                           PcmConcatenator concatenator,
                                           FilterEngine filterEngine,
                                           RequestProperties requestProperties,
                                           ApplicationEventPublisher publisher,
                                           VoxMetrics metrics) {
        return new DefaultVoxOrchestrator(tokenizer, wordBankCache, generator, concatenator, filterEngine,
                requestProperties, publisher, metrics);
    }
}
