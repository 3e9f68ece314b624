package com.phiguard.infrastructure.keys;

import com.phiguard.config.PhiGuardProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Warns when the write-current key is older than the rotation policy allows.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class KeyRotationPolicyMonitor {

    private final KeyRegistry keyRegistry;
    private final PhiGuardProperties properties;

    @Scheduled(fixedDelayString = "${phiguard.encryption.policy-check-interval:PT1H}")
    public void checkKeyAge() {
        Duration maxAge = properties.getEncryption().getMaxKeyAge();
        if (keyRegistry.isRotationDue(maxAge)) {
            log.warn("Key {} is older than {} days, rotation is due (next version {})",
                keyRegistry.currentWriteLabel(), maxAge.toDays(), keyRegistry.nextVersionLabel());
        }
    }
}
