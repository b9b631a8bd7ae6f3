package com.sommerph.zkinbox.config;

import com.sommerph.zkinbox.exception.EntropySourceUnavailableException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.security.Security;
import java.time.Clock;

@Slf4j
@Configuration
public class BouncyCastleConfig {

    @PostConstruct
    public void registerProvider() {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    @Bean
    public SecureRandom secureRandom() {
        try {
            return SecureRandom.getInstance("DRBG");
        } catch (NoSuchAlgorithmException e) {
            log.error("DRBG SecureRandom not available on this platform", e);
            throw new EntropySourceUnavailableException("No DRBG entropy source available", e);
        }
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

}
