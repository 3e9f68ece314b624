package com.phiguard;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.EnableAspectJAutoProxy;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * PHI field encryption service with live key rotation.
 *
 * <ul>
 *   <li><strong>Field-Level Encryption</strong>: AES-256-GCM, version-tagged ciphertext</li>
 *   <li><strong>Key Registry</strong>: one write-current key, older keys kept for reads</li>
 *   <li><strong>Rotation</strong>: checkpointed, leased, resumable batch re-encryption</li>
 *   <li><strong>Audit</strong>: every rotation step emitted to the audit sink</li>
 * </ul>
 *
 * @author Security Team
 * @since 1.0.0
 */
@SpringBootApplication
@EnableTransactionManagement
@EnableAspectJAutoProxy
@ConfigurationPropertiesScan
@Slf4j
public class PhiGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(PhiGuardApplication.class, args);
        log.info("PHI Guard started: AES-256-GCM field encryption, key rotation enabled");
    }
}
