package com.phiguard.infrastructure.keys;

import com.phiguard.domain.model.KeyRole;
import com.phiguard.infrastructure.crypto.KeyConfigurationException;
import com.phiguard.infrastructure.crypto.KeyNotFoundException;
import com.phiguard.support.MutableClock;
import com.phiguard.support.TestKeys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class KeyRegistryTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T00:00:00Z"));
    private final AtomicReference<Optional<String>> guardAnswer = new AtomicReference<>(Optional.empty());

    private KeyRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new KeyRegistry(KeyStrengthValidator.withDefaults(), label -> guardAnswer.get(), clock);
        registry.register("v1", TestKeys.V1);
        registry.setCurrentWrite("v1");
    }

    @Test
    void exactly_one_write_key_after_promotion() {
        registry.register("v2", TestKeys.V2);
        registry.setCurrentWrite("v2");

        assertEquals("v2", registry.resolveForEncrypt().label());
        assertArrayEquals(TestKeys.V2, registry.resolveForEncrypt().keyBytes());
        assertEquals(1, registry.snapshot().stream().filter(k -> k.getRole() == KeyRole.WRITE_CURRENT).count());
        assertEquals(KeyRole.READ_ONLY, registry.find("v1").orElseThrow().getRole());
        assertArrayEquals(TestKeys.V1, registry.resolveForDecrypt("v1"));
    }

    @Test
    void promotion_must_move_forward() {
        registry.register("v2", TestKeys.V2);
        registry.setCurrentWrite("v2");

        assertThrows(IllegalStateException.class, () -> registry.setCurrentWrite("v1"));

        registry.reinstate("v1");
        assertEquals("v1", registry.currentWriteLabel());
        assertEquals(KeyRole.READ_ONLY, registry.find("v2").orElseThrow().getRole());
    }

    @Test
    void weak_keys_are_not_registered() {
        assertThrows(KeyConfigurationException.class, () -> registry.register("v2", new byte[32]));
        assertThrows(KeyConfigurationException.class, () -> registry.register("v2", new byte[16]));
        assertTrue(registry.find("v2").isEmpty());
    }

    @Test
    void label_cannot_be_rebound_to_other_material() {
        assertSame(registry.find("v1").orElseThrow(), registry.register("v1", TestKeys.V1));
        assertThrows(KeyConfigurationException.class, () -> registry.register("v1", TestKeys.V2));
    }

    @Test
    void unknown_label_is_not_found() {
        KeyNotFoundException ex = assertThrows(KeyNotFoundException.class, () -> registry.resolveForDecrypt("v7"));
        assertEquals("v7", ex.getKeyVersion());
        assertTrue(registry.lookup().find("v7").isEmpty());
    }

    @Test
    void write_current_key_cannot_be_retired() {
        assertThrows(KeyRetirementException.class, () -> registry.retire("v1"));
    }

    @Test
    void retirement_follows_the_guard_and_drops_material() {
        registry.register("v2", TestKeys.V2);
        registry.setCurrentWrite("v2");

        guardAnswer.set(Optional.of("rows remain"));
        KeyRetirementException refused = assertThrows(KeyRetirementException.class, () -> registry.retire("v1"));
        assertTrue(refused.getMessage().contains("rows remain"));
        assertArrayEquals(TestKeys.V1, registry.resolveForDecrypt("v1"));

        guardAnswer.set(Optional.empty());
        registry.retire("v1");

        assertEquals(KeyRole.RETIRED, registry.find("v1").orElseThrow().getRole());
        assertEquals(0, registry.find("v1").orElseThrow().getKeyBytes().length);
        assertThrows(KeyNotFoundException.class, () -> registry.resolveForDecrypt("v1"));
        assertTrue(registry.lookup().find("v1").isEmpty());
        assertThrows(KeyNotFoundException.class, () -> registry.reinstate("v1"));
        assertThrows(KeyConfigurationException.class, () -> registry.register("v1", TestKeys.V1));
    }

    @Test
    void next_label_counts_retired_versions() {
        registry.register("v2", TestKeys.V2);
        registry.setCurrentWrite("v2");
        registry.retire("v1");

        assertEquals("v3", registry.nextVersionLabel());
    }

    @Test
    void rotation_is_due_once_the_write_key_ages_out() {
        assertFalse(registry.isRotationDue(Duration.ofDays(90)));

        clock.advance(Duration.ofDays(91));

        assertTrue(registry.isRotationDue(Duration.ofDays(90)));
    }

    @Test
    void empty_registry_has_no_write_key() {
        KeyRegistry empty = new KeyRegistry(KeyStrengthValidator.withDefaults(), label -> Optional.empty(), clock);

        assertThrows(KeyNotFoundException.class, empty::resolveForEncrypt);
        assertEquals("v1", empty.nextVersionLabel());
        assertFalse(empty.isRotationDue(Duration.ofDays(1)));
    }

    @Test
    void key_bytes_never_appear_in_to_string() {
        String rendered = registry.find("v1").orElseThrow().toString() + registry.resolveForEncrypt();

        assertFalse(rendered.contains(TestKeys.base64(TestKeys.V1)));
        assertTrue(rendered.contains("label=v1"));
    }
}
