package com.phillippitts.voxbank.config;

import com.phillippitts.voxbank.config.properties.WordBankProperties;
import com.phillippitts.voxbank.service.cache.FileSystemWordBankCache;
import com.phillippitts.voxbank.service.cache.WordBankCache;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Persistent word bank wiring.
 */
@Configuration
public class WordBankConfig {

    private static final Logger LOG = LogManager.getLogger(WordBankConfig.class);

    @Bean
    public WordBankCache wordBankCache(WordBankProperties properties) {
        Path baseDir = Path.of(properties.getBaseDir()).toAbsolutePath().normalize();
        LOG.info("Word bank base directory: {}", baseDir);
        return new FileSystemWordBankCache(baseDir);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
