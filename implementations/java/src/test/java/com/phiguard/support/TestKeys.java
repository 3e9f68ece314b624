package com.phiguard.support;

import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Deterministic 32-byte keys that pass strength validation: every byte distinct,
 * arithmetic step other than plus or minus one.
 */
public final class TestKeys {

    public static final byte[] V1 = key(37, 11);
    public static final byte[] V2 = key(53, 7);
    public static final byte[] V3 = key(29, 101);

    private TestKeys() {
    }

    public static byte[] key(int step, int offset) {
        byte[] key = new byte[32];
        for (int i = 0; i < key.length; i++) {
            key[i] = (byte) ((i * step + offset) % 256);
        }
        return key;
    }

    public static String base64(byte[] key) {
        return Base64.getEncoder().encodeToString(key);
    }

    /**
     * v1, v2 and v3 as configuration would hold them.
     */
    public static Map<String, String> encodedKeys() {
        Map<String, String> keys = new LinkedHashMap<>();
        keys.put("v1", base64(V1));
        keys.put("v2", base64(V2));
        keys.put("v3", base64(V3));
        return keys;
    }
}
