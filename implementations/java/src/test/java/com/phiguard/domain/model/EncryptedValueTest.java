package com.phiguard.domain.model;

import org.junit.jupiter.api.Test;

import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

class EncryptedValueTest {

    private static final String NONCE = Base64.getEncoder().encodeToString(new byte[12]);
    private static final String BODY = Base64.getEncoder().encodeToString(new byte[20]);

    @Test
    void parses_what_serialize_produces() {
        EncryptedValue value = new EncryptedValue("v7", new byte[12], new byte[20]);

        String wire = value.serialize();
        EncryptedValue parsed = EncryptedValue.parse(wire);

        assertEquals("v7:" + NONCE + ":" + BODY, wire);
        assertEquals(value, parsed);
        assertEquals("v7", EncryptedValue.versionOf(wire));
    }

    @Test
    void rejects_wrong_part_count() {
        assertThrows(EncryptedValue.MalformedEncryptedValueException.class,
            () -> EncryptedValue.parse("v1:" + NONCE));
        assertThrows(EncryptedValue.MalformedEncryptedValueException.class,
            () -> EncryptedValue.parse("v1:" + NONCE + ":" + BODY + ":extra"));
        assertThrows(EncryptedValue.MalformedEncryptedValueException.class,
            () -> EncryptedValue.parse(""));
        assertThrows(EncryptedValue.MalformedEncryptedValueException.class,
            () -> EncryptedValue.parse(null));
    }

    @Test
    void rejects_bad_labels() {
        assertThrows(EncryptedValue.MalformedEncryptedValueException.class,
            () -> EncryptedValue.parse("V1:" + NONCE + ":" + BODY));
        assertThrows(EncryptedValue.MalformedEncryptedValueException.class,
            () -> EncryptedValue.parse("v:" + NONCE + ":" + BODY));
        assertThrows(EncryptedValue.MalformedEncryptedValueException.class,
            () -> EncryptedValue.parse("key1:" + NONCE + ":" + BODY));
    }

    @Test
    void rejects_non_canonical_or_non_ascii_base64() {
        // "AB==" decodes to one byte whose canonical encoding is "AA=="
        assertThrows(EncryptedValue.MalformedEncryptedValueException.class,
            () -> EncryptedValue.parse("v1:" + NONCE + ":AB=="));
        assertThrows(EncryptedValue.MalformedEncryptedValueException.class,
            () -> EncryptedValue.parse("v1:" + NONCE + ":" + BODY.replace('A', '*')));
        assertThrows(EncryptedValue.MalformedEncryptedValueException.class,
            () -> EncryptedValue.parse("v1:" + NONCE + ":" + BODY + "é"));
    }

    @Test
    void rejects_short_nonce_and_truncated_tag() {
        String shortNonce = Base64.getEncoder().encodeToString(new byte[8]);
        String shortBody = Base64.getEncoder().encodeToString(new byte[15]);

        assertThrows(EncryptedValue.MalformedEncryptedValueException.class,
            () -> EncryptedValue.parse("v1:" + shortNonce + ":" + BODY));
        assertThrows(EncryptedValue.MalformedEncryptedValueException.class,
            () -> EncryptedValue.parse("v1:" + NONCE + ":" + shortBody));
    }

    @Test
    void to_string_does_not_expose_bytes() {
        EncryptedValue value = new EncryptedValue("v2", new byte[12], new byte[32]);

        assertEquals("EncryptedValue[version=v2, bytes=32]", value.toString());
    }
}
