package org.neuralchilli.actionflow.state;

import org.neuralchilli.actionflow.util.Jsons;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;

/**
 * Stable hashes of an action name plus canonicalized parameters.
 */
public final class Fingerprints {

    private Fingerprints() {
    }

    /**
     * Fingerprint an invocation. Parameter key order does not matter.
     */
    public static String of(String action, Map<String, Object> params) {
        String canonical = action + "|" + Jsons.canonical(params == null ? Map.of() : params);
        return sha256(canonical);
    }

    static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
