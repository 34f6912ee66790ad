package com.heystive.guard.service.security;

import com.heystive.guard.domain.SecurityEventType;
import com.heystive.guard.domain.SessionClaims;
import com.heystive.guard.exception.ExpiredSignatureException;
import com.heystive.guard.exception.InvalidSignatureException;
import com.heystive.guard.util.LogSanitizer;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Issues and validates HMAC-SHA256 signed session tokens in compact JWS form:
 * <pre>
 * base64url(header) . base64url(claims) . base64url(HMAC-SHA256(header.claims))
 * </pre>
 * Claims: {@code sub}, {@code tier}, {@code permissions}, {@code iat}, {@code exp}
 * (epoch seconds).
 *
 * <p>Tokens are stateless. There is no server-side store and no revocation list, so a
 * token stays valid until it expires.
 *
 * <p>Validation verifies the signature before decoding anything, then checks expiry.
 * The two failure kinds surface as distinct exceptions: {@link ExpiredSignatureException}
 * (re-authenticate) and {@link InvalidSignatureException} (treat as attack).
 */
public final class SessionTokenIssuer {

    private static final String ALGORITHM = "HmacSHA256";
    private static final String HEADER_JSON = new JSONObject()
            .put("alg", "HS256")
            .put("typ", "JWT")
            .toString();

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final Clock clock;
    private final SecretKeySpec key;
    private final Duration expiry;
    private final SecurityEventLog events;

    public SessionTokenIssuer(Clock clock, byte[] secret, Duration expiry, SecurityEventLog events) {
        this.clock = Objects.requireNonNull(clock, "clock");
        if (secret == null || secret.length < 16) {
            throw new IllegalArgumentException("secret must be at least 16 bytes");
        }
        if (expiry == null || expiry.isNegative() || expiry.isZero()) {
            throw new IllegalArgumentException("expiry must be positive");
        }
        this.key = new SecretKeySpec(secret.clone(), ALGORITHM);
        this.expiry = expiry;
        this.events = Objects.requireNonNull(events, "events");
    }

    /**
     * Issues a token for a subject, valid from now until now + expiry.
     *
     * @param subject token subject (credential name)
     * @param tier credential tier
     * @param permissions permissions to embed
     * @return compact signed token
     */
    public String issue(String subject, String tier, Collection<String> permissions) {
        Objects.requireNonNull(subject, "subject");
        Instant issuedAt = Instant.ofEpochSecond(clock.instant().getEpochSecond());
        Instant expiresAt = issuedAt.plus(expiry);

        JSONObject claims = new JSONObject()
                .put("sub", subject)
                .put("tier", tier == null ? JSONObject.NULL : tier)
                .put("permissions", new JSONArray(permissions == null ? List.of() : permissions))
                .put("iat", issuedAt.getEpochSecond())
                .put("exp", expiresAt.getEpochSecond());

        String signingInput = encode(HEADER_JSON) + "." + encode(claims.toString());
        String token = signingInput + "." + sign(signingInput);

        events.record(SecurityEventType.TOKEN_ISSUED, Map.of(
                "user_id", subject,
                "key_type", String.valueOf(tier),
                "expires", expiresAt.toString()));
        return token;
    }

    /**
     * Validates a token and returns its claims.
     *
     * @param token compact token
     * @return verified claims
     * @throws InvalidSignatureException if the token is malformed or its signature does not verify
     * @throws ExpiredSignatureException if the signature verifies but the token has expired
     */
    public SessionClaims validate(String token) {
        try {
            SessionClaims claims = verify(token);
            if (!clock.instant().isBefore(claims.expiresAt())) {
                throw new ExpiredSignatureException(claims.expiresAt());
            }
            events.record(SecurityEventType.TOKEN_VALIDATED, Map.of(
                    "user_id", claims.subject(),
                    "key_type", String.valueOf(claims.tier())));
            return claims;
        } catch (ExpiredSignatureException e) {
            events.record(SecurityEventType.TOKEN_EXPIRED, Map.of("token", preview(token)));
            throw e;
        } catch (InvalidSignatureException e) {
            events.record(SecurityEventType.TOKEN_INVALID, Map.of(
                    "error", e.getMessage(),
                    "token", preview(token)));
            throw e;
        }
    }

    /**
     * Returns whether a string has the three-segment shape of a session token.
     * Says nothing about validity.
     */
    public static boolean looksLikeToken(String candidate) {
        if (candidate == null) {
            return false;
        }
        String[] parts = candidate.split("\\.", -1);
        return parts.length == 3 && !parts[0].isEmpty() && !parts[1].isEmpty();
    }

    public Duration expiry() {
        return expiry;
    }

    private SessionClaims verify(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidSignatureException("Token is empty");
        }
        String[] parts = token.split("\\.", -1);
        if (parts.length != 3) {
            throw new InvalidSignatureException("Token must have three segments");
        }

        String signingInput = parts[0] + "." + parts[1];
        byte[] expected = sign(signingInput).getBytes(StandardCharsets.US_ASCII);
        byte[] presented = parts[2].getBytes(StandardCharsets.US_ASCII);
        if (!MessageDigest.isEqual(expected, presented)) {
            throw new InvalidSignatureException("Signature verification failed");
        }

        try {
            JSONObject header = new JSONObject(decode(parts[0]));
            if (!"HS256".equals(header.optString("alg"))) {
                throw new InvalidSignatureException("Unsupported algorithm: " + header.optString("alg"));
            }
            JSONObject claims = new JSONObject(decode(parts[1]));
            List<String> permissions = new ArrayList<>();
            JSONArray array = claims.optJSONArray("permissions");
            if (array != null) {
                for (int i = 0; i < array.length(); i++) {
                    permissions.add(array.getString(i));
                }
            }
            return new SessionClaims(
                    claims.getString("sub"),
                    claims.isNull("tier") ? null : claims.optString("tier", null),
                    permissions,
                    Instant.ofEpochSecond(claims.getLong("iat")),
                    Instant.ofEpochSecond(claims.getLong("exp")));
        } catch (JSONException | IllegalArgumentException e) {
            throw new InvalidSignatureException("Malformed token claims", e);
        }
    }

    private String sign(String signingInput) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            return ENCODER.encodeToString(mac.doFinal(signingInput.getBytes(StandardCharsets.US_ASCII)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }

    private static String encode(String json) {
        return ENCODER.encodeToString(json.getBytes(StandardCharsets.UTF_8));
    }

    private static String decode(String segment) {
        return new String(DECODER.decode(segment), StandardCharsets.UTF_8);
    }

    private static String preview(String token) {
        return LogSanitizer.truncate(token, 20) + "...";
    }
}
