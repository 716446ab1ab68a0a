package com.phillippitts.voxbank;

import com.phillippitts.voxbank.config.properties.GenerationProperties;
import com.phillippitts.voxbank.config.properties.ProviderProperties;
import com.phillippitts.voxbank.config.properties.RequestProperties;
import com.phillippitts.voxbank.config.properties.TokenizerProperties;
import com.phillippitts.voxbank.config.properties.WordBankProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        TokenizerProperties.class,
        RequestProperties.class,
        WordBankProperties.class,
        GenerationProperties.class,
        ProviderProperties.class
})
public class VoxBankApplication {

    public static void main(String[] args) {
        SpringApplication.run(VoxBankApplication.class, args);
    }

}
