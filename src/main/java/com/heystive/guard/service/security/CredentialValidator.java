package com.heystive.guard.service.security;

import com.heystive.guard.domain.Credential;
import com.heystive.guard.domain.CredentialCheck;
import com.heystive.guard.domain.SecurityEventType;
import com.heystive.guard.util.LogSanitizer;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Validates presented API keys against the immutable credential table. Fail-closed:
 * anything that is not an exact match of a known key is invalid.
 *
 * <p>Checks, in order:
 * <ol>
 *   <li>null or shorter than the minimum length: rejected</li>
 *   <li>contains a blacklisted pattern (case-insensitive): rejected without table lookup</li>
 *   <li>constant-time comparison against every known key</li>
 * </ol>
 *
 * <p>Every outcome is recorded as a {@link com.heystive.guard.domain.SecurityEvent}. Keys are
 * only ever recorded as a truncated prefix.
 *
 * <p><b>Thread Safety:</b> stateless apart from the immutable table; no locking required.
 */
public final class CredentialValidator {

    private final List<Credential> credentials;
    private final int minKeyLength;
    private final List<String> blacklistedPatterns;
    private final SecurityEventLog events;

    public CredentialValidator(List<Credential> credentials,
                               int minKeyLength,
                               List<String> blacklistedPatterns,
                               SecurityEventLog events) {
        this.credentials = List.copyOf(credentials);
        this.minKeyLength = minKeyLength;
        this.blacklistedPatterns = blacklistedPatterns.stream()
                .map(p -> p.toLowerCase(Locale.ROOT))
                .toList();
        this.events = Objects.requireNonNull(events, "events");
    }

    /**
     * Validates a presented key.
     *
     * @param key presented key (nullable)
     * @return the matched tier and permissions, or {@link CredentialCheck#invalid()}
     */
    public CredentialCheck validate(String key) {
        if (key == null || key.length() < minKeyLength) {
            events.record(SecurityEventType.INVALID_KEY_FORMAT,
                    Map.of("key_length", String.valueOf(key == null ? 0 : key.length())));
            return CredentialCheck.invalid();
        }

        String lower = key.toLowerCase(Locale.ROOT);
        for (String pattern : blacklistedPatterns) {
            if (lower.contains(pattern)) {
                events.record(SecurityEventType.BLACKLISTED_KEY_PATTERN,
                        Map.of("api_key", LogSanitizer.maskSecret(key)));
                return CredentialCheck.invalid();
            }
        }

        byte[] presented = key.getBytes(StandardCharsets.UTF_8);
        Credential match = null;
        // Compare against every entry so timing does not reveal the table position
        for (Credential credential : credentials) {
            if (MessageDigest.isEqual(presented, credential.key().getBytes(StandardCharsets.UTF_8))
                    && match == null) {
                match = credential;
            }
        }

        if (match != null) {
            events.record(SecurityEventType.VALID_API_KEY,
                    Map.of("key_name", match.name(), "key_type", match.tier()));
            return CredentialCheck.of(match);
        }

        events.record(SecurityEventType.INVALID_API_KEY, Map.of("api_key", LogSanitizer.maskSecret(key)));
        return CredentialCheck.invalid();
    }

    /** Number of known credentials. */
    public int size() {
        return credentials.size();
    }
}
