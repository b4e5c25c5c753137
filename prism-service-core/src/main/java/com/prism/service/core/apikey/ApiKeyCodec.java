package com.prism.service.core.apikey;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.HexFormat;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * Ingest key format {@code prk_<prefix>_<secret>}: an 8-hex-digit lookup prefix and a 48-hex-digit secret. The
 * secret is stored only as its HMAC-SHA256 under a deployment salt.
 */
public final class ApiKeyCodec {

    public static final String KEY_PREFIX = "prk";

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final HexFormat HEX = HexFormat.of();

    private final String salt;

    public ApiKeyCodec(String salt) {
        if (salt == null || salt.isEmpty()) {
            throw new IllegalArgumentException("API key salt must not be empty");
        }
        this.salt = salt;
    }

    public record ParsedKey(String prefix, String secret) {}

    public record GeneratedKey(String plaintext, String prefix, String secretHash) {}

    public GeneratedKey generate() {
        String prefix = randomHex(4);
        String secret = randomHex(24);
        return new GeneratedKey(KEY_PREFIX + "_" + prefix + "_" + secret, prefix, hashSecret(secret));
    }

    /** Splits a presented key, or returns {@code null} when it is not in the expected format. */
    public static ParsedKey parse(String raw) {
        if (raw == null) return null;
        String[] parts = raw.trim().split("_", -1);
        if (parts.length != 3 || !KEY_PREFIX.equals(parts[0]) || parts[1].isEmpty() || parts[2].isEmpty()) {
            return null;
        }
        return new ParsedKey(parts[1], parts[2]);
    }

    public String hashSecret(String secret) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(salt.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            return HEX.formatHex(mac.doFinal(secret.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 not available", e);
        }
    }

    /** Constant-time comparison of the presented key's secret against a stored hash. */
    public boolean verify(String raw, String secretHash) {
        ParsedKey parsed = parse(raw);
        if (parsed == null || secretHash == null) {
            return false;
        }
        byte[] computed = hashSecret(parsed.secret()).getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(computed, secretHash.getBytes(StandardCharsets.UTF_8));
    }

    private static String randomHex(int bytes) {
        byte[] buffer = new byte[bytes];
        RANDOM.nextBytes(buffer);
        return HEX.formatHex(buffer);
    }
}
