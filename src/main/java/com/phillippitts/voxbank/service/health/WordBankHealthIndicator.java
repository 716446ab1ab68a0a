package com.phillippitts.voxbank.service.health;

import com.phillippitts.voxbank.config.properties.WordBankProperties;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Health indicator for the persistent word bank.
 *
 * <p>UP when the base directory exists and is writable. Exposed via /actuator/health.
 */
@Component
public class WordBankHealthIndicator implements HealthIndicator {

    private final WordBankProperties properties;

    public WordBankHealthIndicator(WordBankProperties properties) {
        this.properties = properties;
    }

    @Override
    public Health health() {
        Path baseDir = Path.of(properties.getBaseDir()).toAbsolutePath().normalize();
        boolean exists = Files.isDirectory(baseDir);
        boolean writable = exists && Files.isWritable(baseDir);

        Health.Builder builder = writable ? Health.up() : Health.down();
        return builder
                .withDetail("baseDir", baseDir.toString())
                .withDetail("status", formatStatus(exists, writable))
                .build();
    }

    private static String formatStatus(boolean exists, boolean writable) {
        if (!exists) {
            return "NOT FOUND";
        }
        return writable ? "writable" : "not writable";
    }
}
