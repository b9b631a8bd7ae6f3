package com.sommerph.zkinbox.config;

import com.sommerph.zkinbox.repository.nullifier.InMemoryNullifierRegistry;
import com.sommerph.zkinbox.repository.nullifier.JsonFileNullifierRegistry;
import com.sommerph.zkinbox.repository.nullifier.NullifierRegistry;
import com.sommerph.zkinbox.repository.submission.InMemorySubmissionRegistry;
import com.sommerph.zkinbox.repository.submission.SubmissionRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;

@Configuration
public class RegistryConfig {

    @Value("${inbox.nullifier.registry.type:memory}")
    private String registryType;

    @Value("${inbox.nullifier.storage.path:./data/nullifiers}")
    private String storagePath;

    @Bean
    public NullifierRegistry nullifierRegistry() throws IOException {
        return switch (registryType.toLowerCase()) {
            case "json" -> new JsonFileNullifierRegistry(storagePath);
            case "memory" -> new InMemoryNullifierRegistry();
            default -> throw new IllegalArgumentException("Unsupported registry type: " + registryType);
        };
    }

    @Bean
    public SubmissionRegistry submissionRegistry() {
        return new InMemorySubmissionRegistry();
    }

}
