package com.phiguard.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * phiguard.* configuration.
 */
@Data
@ConfigurationProperties(prefix = "phiguard")
public class PhiGuardProperties {

    private Encryption encryption = new Encryption();

    private Rotation rotation = new Rotation();

    @Data
    public static class Encryption {

        /**
         * Base64 encoded 32-byte keys by version label, e.g. {@code v1: <44 chars>}.
         */
        private Map<String, String> keys = new LinkedHashMap<>();

        /**
         * Write-current version at startup. Empty means: derive from rotation history,
         * then fall back to the highest configured version.
         */
        private String currentVersion;

        /**
         * Minimum share of distinct byte values in a key (10 of 32 by default).
         */
        private double minDistinctByteRatio = 10.0 / 32.0;

        /**
         * Minimum Shannon entropy of a key, bits per byte.
         */
        private double minShannonEntropy = 4.0;

        /**
         * Maximum occurrences of any single byte value in a key.
         */
        private int maxByteOccurrences = 4;

        /**
         * Age after which the write-current key is reported as due for rotation.
         */
        private Duration maxKeyAge = Duration.ofDays(90);

        /**
         * How long key material fetched from the key supply stays cached.
         */
        private Duration keyCacheTtl = Duration.ofMinutes(10);

        private Duration policyCheckInterval = Duration.ofHours(1);
    }

    @Data
    public static class Rotation {

        private int batchSize = 500;

        /**
         * Row workers per batch.
         */
        private int parallelism = 4;

        private boolean abortOnFirstFailure = false;

        private Duration leaseTtl = Duration.ofSeconds(60);

        /**
         * Lease owner name for this process. Generated when empty.
         */
        private String instanceId;

        /**
         * Step active jobs from a background task.
         */
        private boolean runnerEnabled = true;

        /**
         * Complete a job automatically once its cursor is exhausted with nothing left behind.
         */
        private boolean autoComplete = false;

        private Duration pollInterval = Duration.ofSeconds(5);
    }
}
