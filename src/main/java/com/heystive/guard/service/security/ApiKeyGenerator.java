package com.heystive.guard.service.security;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Generates API keys of the form {@code sk_live_<32 hex chars>}.
 *
 * <p>The hex body is an HMAC-SHA256 over the tier, the current time and 16 random bytes,
 * keyed with a per-process random secret. Hex digits cannot spell any of the blacklisted
 * key patterns, so generated keys always pass the credential pre-checks.
 */
final class ApiKeyGenerator {

    private static final String PREFIX = "sk_live_";
    private static final int BODY_HEX_CHARS = 32;

    private final SecureRandom random;
    private final byte[] hmacSecret;

    ApiKeyGenerator(SecureRandom random) {
        this.random = random;
        this.hmacSecret = new byte[32];
        random.nextBytes(hmacSecret);
    }

    String generate(String tier) {
        byte[] nonce = new byte[16];
        random.nextBytes(nonce);
        String keyData = tier + "_" + System.currentTimeMillis() + "_" + HexFormat.of().formatHex(nonce);
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(hmacSecret, "HmacSHA256"));
            byte[] digest = mac.doFinal(keyData.getBytes(StandardCharsets.UTF_8));
            return PREFIX + HexFormat.of().formatHex(digest).substring(0, BODY_HEX_CHARS);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }
}
