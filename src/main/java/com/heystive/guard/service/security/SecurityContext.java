package com.heystive.guard.service.security;

import com.heystive.guard.config.security.SecurityProperties;
import com.heystive.guard.domain.Credential;
import com.heystive.guard.domain.RateLimitProfile;
import com.heystive.guard.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Holds all mutable security state of the process: the credential table, rate-limit
 * windows, IP block table, token signing key and audit log.
 *
 * <p>Constructed once per process (a Spring singleton) and passed by reference into every
 * component that needs it. Tests build their own instance with a controllable clock, so
 * no state leaks between tests.
 */
public final class SecurityContext {

    private static final Logger LOG = LogManager.getLogger(SecurityContext.class);

    private static final RateLimitProfile FALLBACK_PROFILE = new RateLimitProfile(100, 3600);

    private final Clock clock;
    private final SecurityEventLog events;
    private final CredentialValidator credentialValidator;
    private final RateLimiter rateLimiter;
    private final IpReputationTracker ipReputationTracker;
    private final SessionTokenIssuer sessionTokenIssuer;

    public SecurityContext(Clock clock,
                           SecurityEventLog events,
                           CredentialValidator credentialValidator,
                           RateLimiter rateLimiter,
                           IpReputationTracker ipReputationTracker,
                           SessionTokenIssuer sessionTokenIssuer) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.events = Objects.requireNonNull(events, "events");
        this.credentialValidator = Objects.requireNonNull(credentialValidator, "credentialValidator");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.ipReputationTracker = Objects.requireNonNull(ipReputationTracker, "ipReputationTracker");
        this.sessionTokenIssuer = Objects.requireNonNull(sessionTokenIssuer, "sessionTokenIssuer");
    }

    /**
     * Builds a context from configuration. Credentials with a blank key get a generated
     * key, and a blank token secret is replaced with 32 random bytes.
     *
     * @param props security configuration
     * @param clock time source shared by all components
     * @param publisher Spring event publisher for security events (nullable)
     * @return a fully wired context
     */
    public static SecurityContext create(SecurityProperties props, Clock clock, ApplicationEventPublisher publisher) {
        SecureRandom random = new SecureRandom();
        SecurityProperties.Auth auth = props.getAuth();

        Map<String, RateLimitProfile> profiles = new LinkedHashMap<>();
        auth.getTiers().forEach((tier, profile) ->
                profiles.put(tier, new RateLimitProfile(profile.getLimit(), profile.getWindowSeconds())));
        RateLimitProfile defaultProfile = profiles.getOrDefault(auth.getDefaultTier(), FALLBACK_PROFILE);

        SecurityEventLog events = new SecurityEventLog(props.getEvents().getCapacity(), clock, publisher);
        List<Credential> credentials = buildCredentials(auth, profiles, defaultProfile, new ApiKeyGenerator(random));

        CredentialValidator validator = new CredentialValidator(
                credentials, auth.getMinKeyLength(), auth.getBlacklistedPatterns(), events);
        RateLimiter limiter = new RateLimiter(clock, profiles, defaultProfile, props.getLockStripes(), events);

        SecurityProperties.Ip ip = props.getIp();
        IpReputationTracker tracker = new IpReputationTracker(clock, new IpReputationTracker.Policy(
                Duration.ofMinutes(ip.getFailureWindowMinutes()),
                ip.getSoftThreshold(), Duration.ofMinutes(ip.getSoftBlockMinutes()),
                ip.getHardThreshold(), Duration.ofMinutes(ip.getHardBlockMinutes())),
                props.getLockStripes(), events);

        SessionTokenIssuer issuer = new SessionTokenIssuer(clock,
                tokenSecret(props.getToken().getSecret(), random),
                Duration.ofHours(props.getToken().getExpiryHours()), events);

        LOG.info("Security context initialized: credentials={}, rateLimitProfiles={}, tokenExpiry={}h",
                credentials.size(), profiles.keySet(), props.getToken().getExpiryHours());
        return new SecurityContext(clock, events, validator, limiter, tracker, issuer);
    }

    private static List<Credential> buildCredentials(SecurityProperties.Auth auth,
                                                     Map<String, RateLimitProfile> profiles,
                                                     RateLimitProfile defaultProfile,
                                                     ApiKeyGenerator generator) {
        List<Credential> credentials = new ArrayList<>();
        for (SecurityProperties.CredentialEntry entry : auth.getCredentials()) {
            String key = entry.getKey();
            if (key == null || key.isBlank()) {
                key = generator.generate(entry.getTier());
                LOG.info("Generated API key for credential {}: {}", entry.getName(), LogSanitizer.maskSecret(key));
            }
            SecurityProperties.TierProfile tier = auth.getTiers().get(entry.getTier());
            List<String> permissions = tier != null ? tier.getPermissions() : List.of("read");
            credentials.add(new Credential(entry.getName(), key, entry.getTier(),
                    new LinkedHashSet<>(permissions),
                    profiles.getOrDefault(entry.getTier(), defaultProfile)));
        }
        return credentials;
    }

    private static byte[] tokenSecret(String configured, SecureRandom random) {
        if (configured != null && !configured.isBlank()) {
            return configured.getBytes(StandardCharsets.UTF_8);
        }
        byte[] secret = new byte[32];
        random.nextBytes(secret);
        LOG.info("No session token secret configured; generated an ephemeral one");
        return secret;
    }

    public Clock clock() {
        return clock;
    }

    public SecurityEventLog events() {
        return events;
    }

    public CredentialValidator credentialValidator() {
        return credentialValidator;
    }

    public RateLimiter rateLimiter() {
        return rateLimiter;
    }

    public IpReputationTracker ipReputationTracker() {
        return ipReputationTracker;
    }

    public SessionTokenIssuer sessionTokenIssuer() {
        return sessionTokenIssuer;
    }
}
