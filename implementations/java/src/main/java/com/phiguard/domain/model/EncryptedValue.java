package com.phiguard.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Encrypted field value tagged with the key version that produced it.
 *
 * <p>Wire format (ASCII, single opaque string):
 * <pre>
 *   v&lt;digits&gt;:&lt;base64 nonce&gt;:&lt;base64 ciphertext||tag&gt;
 * </pre>
 *
 * <p><strong>Security Guarantees:</strong>
 * <ul>
 *   <li>Immutable - byte arrays are copied in and out</li>
 *   <li>No plaintext exposure in this class</li>
 *   <li>Version label only (never the actual key)</li>
 *   <li>{@link #parse(String)} is the only way a stored string becomes a value</li>
 * </ul>
 *
 * @author Security Team
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode
public final class EncryptedValue {

    public static final int NONCE_LENGTH = 12;
    public static final int TAG_LENGTH = 16;

    private static final Pattern LABEL_PATTERN = Pattern.compile("^v[0-9]{1,9}$");
    private static final char SEPARATOR = ':';

    /**
     * Key version label, e.g. {@code v2}.
     */
    private final String version;

    /**
     * 96-bit GCM nonce. MUST be unique per encryption under a given key.
     */
    private final byte[] nonce;

    /**
     * Ciphertext with the 128-bit GCM authentication tag appended.
     */
    private final byte[] ciphertextWithTag;

    public EncryptedValue(String version, byte[] nonce, byte[] ciphertextWithTag) {
        this.version = validateLabel(version);
        Objects.requireNonNull(nonce, "Nonce must not be null");
        Objects.requireNonNull(ciphertextWithTag, "Ciphertext must not be null");

        if (nonce.length != NONCE_LENGTH) {
            throw new IllegalArgumentException("AES-256-GCM requires 12-byte nonce");
        }
        if (ciphertextWithTag.length < TAG_LENGTH) {
            throw new IllegalArgumentException("Ciphertext shorter than the 16-byte auth tag");
        }

        this.nonce = nonce.clone();
        this.ciphertextWithTag = ciphertextWithTag.clone();
    }

    public byte[] getNonce() {
        return nonce.clone();
    }

    public byte[] getCiphertextWithTag() {
        return ciphertextWithTag.clone();
    }

    /**
     * Serializes to the canonical wire format.
     */
    public String serialize() {
        Base64.Encoder encoder = Base64.getEncoder();
        return version + SEPARATOR + encoder.encodeToString(nonce) + SEPARATOR
            + encoder.encodeToString(ciphertextWithTag);
    }

    /**
     * Parses the wire format.
     *
     * <p>Rejects anything that is not exactly what {@link #serialize()} would have produced:
     * non-ASCII input, a label outside {@code v<digits>}, missing parts, and base64 that does
     * not re-encode to the same text.
     *
     * @param serialized stored value
     * @return parsed value
     * @throws MalformedEncryptedValueException if the input is not a well-formed value
     */
    public static EncryptedValue parse(String serialized) {
        if (serialized == null || serialized.isEmpty()) {
            throw new MalformedEncryptedValueException("Encrypted value is empty");
        }
        if (!StandardCharsets.US_ASCII.newEncoder().canEncode(serialized)) {
            throw new MalformedEncryptedValueException("Encrypted value is not ASCII");
        }

        int first = serialized.indexOf(SEPARATOR);
        int second = first < 0 ? -1 : serialized.indexOf(SEPARATOR, first + 1);
        if (first < 0 || second < 0 || serialized.indexOf(SEPARATOR, second + 1) >= 0) {
            throw new MalformedEncryptedValueException("Encrypted value must have exactly three parts");
        }

        String label = serialized.substring(0, first);
        if (!isValidLabel(label)) {
            throw new MalformedEncryptedValueException("Encrypted value has an invalid version label");
        }

        byte[] nonce = decodeCanonical(serialized.substring(first + 1, second), "nonce");
        byte[] body = decodeCanonical(serialized.substring(second + 1), "ciphertext");

        if (nonce.length != NONCE_LENGTH) {
            throw new MalformedEncryptedValueException("Nonce must be 12 bytes, got " + nonce.length);
        }
        if (body.length < TAG_LENGTH) {
            throw new MalformedEncryptedValueException("Ciphertext shorter than the auth tag");
        }

        return new EncryptedValue(label, nonce, body);
    }

    /**
     * Extracts the version label without decoding the rest.
     */
    public static String versionOf(String serialized) {
        return parse(serialized).getVersion();
    }

    public static boolean isValidLabel(String label) {
        return label != null && LABEL_PATTERN.matcher(label).matches();
    }

    /**
     * Numeric part of a label ({@code v12} -> 12).
     */
    public static int versionNumber(String label) {
        return Integer.parseInt(validateLabel(label).substring(1));
    }

    private static String validateLabel(String label) {
        if (!isValidLabel(label)) {
            throw new IllegalArgumentException("Key version label must match v<digits>: " + label);
        }
        return label;
    }

    private static byte[] decodeCanonical(String part, String name) {
        if (part.isEmpty()) {
            throw new MalformedEncryptedValueException("Encrypted value has an empty " + name);
        }
        byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(part);
        } catch (IllegalArgumentException e) {
            throw new MalformedEncryptedValueException("Encrypted value has invalid base64 " + name, e);
        }
        // Unused trailing bits must be zero or two strings could decode to the same bytes
        if (!Base64.getEncoder().encodeToString(decoded).equals(part)) {
            throw new MalformedEncryptedValueException("Encrypted value has non-canonical base64 " + name);
        }
        return decoded;
    }

    /**
     * Safe representation for logs: label and size only.
     */
    @Override
    public String toString() {
        return String.format("EncryptedValue[version=%s, bytes=%d]", version, ciphertextWithTag.length);
    }

    /**
     * Thrown when a stored string is not a well-formed encrypted value.
     */
    public static class MalformedEncryptedValueException extends IllegalArgumentException {
        public MalformedEncryptedValueException(String message) {
            super(message);
        }

        public MalformedEncryptedValueException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
