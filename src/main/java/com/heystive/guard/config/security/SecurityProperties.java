package com.heystive.guard.config.security;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the authentication chain and audit log.
 * Binds to properties prefixed with "security".
 *
 * <p>Example application.properties:
 * <pre>
 * security.auth.min-key-length=10
 * security.auth.credentials[0].name=heystive_user
 * security.auth.credentials[0].key=sk_live_...
 * security.auth.credentials[0].tier=user
 * security.auth.tiers.user.limit=100
 * security.auth.tiers.user.window-seconds=3600
 * security.auth.tiers.user.permissions=read,write,voice,chat
 * security.ip.soft-threshold=5
 * security.token.expiry-hours=24
 * security.events.capacity=1000
 * </pre>
 *
 * <p>Defaults mirror the production profile so that {@code new SecurityProperties()}
 * is usable in tests.
 */
@ConfigurationProperties(prefix = "security")
@Validated
public class SecurityProperties {

    @Valid
    private Auth auth = new Auth();

    @Valid
    private Ip ip = new Ip();

    @Valid
    private Token token = new Token();

    @Valid
    private Events events = new Events();

    /** Number of lock stripes guarding per-client and per-address state. */
    @Positive(message = "Lock stripes must be positive")
    private int lockStripes = 64;

    public Auth getAuth() {
        return auth;
    }

    public void setAuth(Auth auth) {
        this.auth = auth;
    }

    public Ip getIp() {
        return ip;
    }

    public void setIp(Ip ip) {
        this.ip = ip;
    }

    public Token getToken() {
        return token;
    }

    public void setToken(Token token) {
        this.token = token;
    }

    public Events getEvents() {
        return events;
    }

    public void setEvents(Events events) {
        this.events = events;
    }

    public int getLockStripes() {
        return lockStripes;
    }

    public void setLockStripes(int lockStripes) {
        this.lockStripes = lockStripes;
    }

    /**
     * Credential table, tier profiles and key hygiene rules.
     */
    public static class Auth {

        @Positive(message = "Minimum key length must be positive")
        private int minKeyLength = 10;

        /** Case-insensitive substrings that make a presented key invalid outright. */
        @NotNull
        private List<String> blacklistedPatterns = new ArrayList<>(List.of(
                "admin", "root", "test", "hack", "exploit",
                "sql", "injection", "xss", "script"));

        /** Tier applied when a credential names a tier without a profile. */
        @NotBlank
        private String defaultTier = "user";

        @Valid
        private List<CredentialEntry> credentials = new ArrayList<>(List.of(
                new CredentialEntry("heystive_admin", "", "admin"),
                new CredentialEntry("heystive_user", "", "user"),
                new CredentialEntry("heystive_local", "", "local"),
                new CredentialEntry("heystive_demo", "sk_demo_safe123heystive456demo", "demo")));

        @Valid
        private Map<String, TierProfile> tiers = defaultTiers();

        private static Map<String, TierProfile> defaultTiers() {
            Map<String, TierProfile> tiers = new LinkedHashMap<>();
            tiers.put("admin", new TierProfile(1000, 3600,
                    List.of("read", "write", "delete", "admin", "system", "control")));
            tiers.put("user", new TierProfile(100, 3600, List.of("read", "write", "voice", "chat")));
            tiers.put("local", new TierProfile(500, 3600, List.of("read", "write", "voice", "chat", "test")));
            tiers.put("demo", new TierProfile(50, 3600, List.of("read", "voice")));
            return tiers;
        }

        public int getMinKeyLength() {
            return minKeyLength;
        }

        public void setMinKeyLength(int minKeyLength) {
            this.minKeyLength = minKeyLength;
        }

        public List<String> getBlacklistedPatterns() {
            return blacklistedPatterns;
        }

        public void setBlacklistedPatterns(List<String> blacklistedPatterns) {
            this.blacklistedPatterns = blacklistedPatterns;
        }

        public String getDefaultTier() {
            return defaultTier;
        }

        public void setDefaultTier(String defaultTier) {
            this.defaultTier = defaultTier;
        }

        public List<CredentialEntry> getCredentials() {
            return credentials;
        }

        public void setCredentials(List<CredentialEntry> credentials) {
            this.credentials = credentials;
        }

        public Map<String, TierProfile> getTiers() {
            return tiers;
        }

        public void setTiers(Map<String, TierProfile> tiers) {
            this.tiers = tiers;
        }
    }

    /**
     * One configured credential. A blank key is replaced by a generated one at startup.
     */
    public static class CredentialEntry {

        @NotBlank(message = "Credential name must not be blank")
        private String name;

        private String key = "";

        @NotBlank(message = "Credential tier must not be blank")
        private String tier;

        public CredentialEntry() {
        }

        public CredentialEntry(String name, String key, String tier) {
            this.name = name;
            this.key = key;
            this.tier = tier;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getKey() {
            return key;
        }

        public void setKey(String key) {
            this.key = key;
        }

        public String getTier() {
            return tier;
        }

        public void setTier(String tier) {
            this.tier = tier;
        }
    }

    /**
     * Rate-limit budget and endpoint permissions of a tier.
     */
    public static class TierProfile {

        @Positive(message = "Tier limit must be positive")
        private int limit = 100;

        @Positive(message = "Tier window must be positive")
        private long windowSeconds = 3600;

        private List<String> permissions = new ArrayList<>();

        public TierProfile() {
        }

        public TierProfile(int limit, long windowSeconds, List<String> permissions) {
            this.limit = limit;
            this.windowSeconds = windowSeconds;
            this.permissions = new ArrayList<>(permissions);
        }

        public int getLimit() {
            return limit;
        }

        public void setLimit(int limit) {
            this.limit = limit;
        }

        public long getWindowSeconds() {
            return windowSeconds;
        }

        public void setWindowSeconds(long windowSeconds) {
            this.windowSeconds = windowSeconds;
        }

        public List<String> getPermissions() {
            return permissions;
        }

        public void setPermissions(List<String> permissions) {
            this.permissions = permissions;
        }
    }

    /**
     * IP reputation thresholds. Failures are counted over a trailing window; the hard
     * threshold is checked before the soft one.
     */
    public static class Ip {

        @Positive(message = "Failure window must be positive")
        private int failureWindowMinutes = 60;

        @Positive(message = "Soft threshold must be positive")
        private int softThreshold = 5;

        @Positive(message = "Soft block duration must be positive")
        private int softBlockMinutes = 15;

        @Positive(message = "Hard threshold must be positive")
        private int hardThreshold = 10;

        @Positive(message = "Hard block duration must be positive")
        private int hardBlockMinutes = 30;

        public int getFailureWindowMinutes() {
            return failureWindowMinutes;
        }

        public void setFailureWindowMinutes(int failureWindowMinutes) {
            this.failureWindowMinutes = failureWindowMinutes;
        }

        public int getSoftThreshold() {
            return softThreshold;
        }

        public void setSoftThreshold(int softThreshold) {
            this.softThreshold = softThreshold;
        }

        public int getSoftBlockMinutes() {
            return softBlockMinutes;
        }

        public void setSoftBlockMinutes(int softBlockMinutes) {
            this.softBlockMinutes = softBlockMinutes;
        }

        public int getHardThreshold() {
            return hardThreshold;
        }

        public void setHardThreshold(int hardThreshold) {
            this.hardThreshold = hardThreshold;
        }

        public int getHardBlockMinutes() {
            return hardBlockMinutes;
        }

        public void setHardBlockMinutes(int hardBlockMinutes) {
            this.hardBlockMinutes = hardBlockMinutes;
        }
    }

    /**
     * Session token signing. A blank secret is replaced by a random one at startup,
     * which invalidates outstanding tokens on restart.
     */
    public static class Token {

        private String secret = "";

        @Positive(message = "Token expiry must be positive")
        private long expiryHours = 24;

        public String getSecret() {
            return secret;
        }

        public void setSecret(String secret) {
            this.secret = secret;
        }

        public long getExpiryHours() {
            return expiryHours;
        }

        public void setExpiryHours(long expiryHours) {
            this.expiryHours = expiryHours;
        }
    }

    /**
     * Bounded audit log.
     */
    public static class Events {

        @Positive(message = "Event capacity must be positive")
        private int capacity = 1000;

        /** Window used by the stats endpoint for "recent" counts. */
        @Min(value = 1, message = "Recent window must be at least one minute")
        private int recentWindowMinutes = 60;

        public int getCapacity() {
            return capacity;
        }

        public void setCapacity(int capacity) {
            this.capacity = capacity;
        }

        public int getRecentWindowMinutes() {
            return recentWindowMinutes;
        }

        public void setRecentWindowMinutes(int recentWindowMinutes) {
            this.recentWindowMinutes = recentWindowMinutes;
        }
    }
}
