package com.phiguard.config;

import com.phiguard.domain.repository.RetiredKeyRepository;
import com.phiguard.domain.repository.RotationJobRepository;
import com.phiguard.infrastructure.keys.CachingKeySupply;
import com.phiguard.infrastructure.keys.ConfiguredKeySupply;
import com.phiguard.infrastructure.keys.KeyRegistry;
import com.phiguard.infrastructure.keys.KeyRegistryLoader;
import com.phiguard.infrastructure.keys.KeyStrengthValidator;
import com.phiguard.infrastructure.keys.KeySupply;
import com.phiguard.infrastructure.keys.RetirementGuard;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Key material wiring.
 *
 * The registry is loaded while the context starts: a missing, weak or malformed key fails the
 * startup with a {@code KeyConfigurationException}.
 */
@Configuration
@Slf4j
public class EncryptionConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(KeySupply.class)
    public KeySupply keySupply(PhiGuardProperties properties) {
        log.info("Using configuration-backed key supply");
        return new CachingKeySupply(new ConfiguredKeySupply(properties),
            properties.getEncryption().getKeyCacheTtl());
    }

    @Bean
    public KeyRegistry keyRegistry(
            KeyStrengthValidator validator,
            RetirementGuard retirementGuard,
            KeySupply keySupply,
            RotationJobRepository jobRepository,
            RetiredKeyRepository retiredKeyRepository,
            PhiGuardProperties properties,
            Clock clock) {

        KeyRegistry registry = new KeyRegistry(validator, retirementGuard, clock);
        new KeyRegistryLoader(keySupply, jobRepository, retiredKeyRepository).load(registry, properties.getEncryption().getCurrentVersion());
        return registry;
    }
}
