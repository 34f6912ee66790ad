package com.heystive.guard.service.security;

import com.heystive.guard.domain.AuthenticatedPrincipal;
import com.heystive.guard.domain.CredentialCheck;
import com.heystive.guard.domain.RateLimitDecision;
import com.heystive.guard.domain.SecurityEventType;
import com.heystive.guard.domain.SessionClaims;
import com.heystive.guard.exception.AuthenticationException;
import com.heystive.guard.exception.ExpiredSignatureException;
import com.heystive.guard.exception.InvalidSignatureException;
import com.heystive.guard.exception.IpBlockedException;
import com.heystive.guard.exception.PermissionDeniedException;
import com.heystive.guard.exception.RateLimitExceededException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Runs the per-request admission checks in a fixed order:
 *
 * <ol>
 *   <li>reject callers whose address is currently blocked</li>
 *   <li>validate the presented credential (API key or session token), counting
 *       failures against the caller's address</li>
 *   <li>apply the tier's sliding-window rate limit</li>
 * </ol>
 *
 * <p>Each step fails fast with a {@link com.heystive.guard.exception.HeystiveException};
 * nothing is retried here.
 */
@Component
public class AuthenticationChain {

    private static final Logger LOG = LogManager.getLogger(AuthenticationChain.class);

    public static final String AUTH_MISSING = "AUTH_MISSING";
    public static final String AUTH_INVALID = "AUTH_INVALID";

    private final SecurityContext context;

    public AuthenticationChain(SecurityContext context) {
        this.context = Objects.requireNonNull(context, "context");
    }

    /**
     * Authenticates a presented credential from a client address.
     *
     * @param presented API key or session token, may be null
     * @param clientIp caller address
     * @return principal with the rate-limit decision attached
     * @throws IpBlockedException if the address is blocked
     * @throws AuthenticationException if the credential is missing or invalid
     * @throws InvalidSignatureException if a session token fails verification
     * @throws ExpiredSignatureException if a session token has expired
     * @throws RateLimitExceededException if the tier budget is used up
     */
    public AuthenticatedPrincipal authenticate(String presented, String clientIp) {
        IpReputationTracker ipTracker = context.ipReputationTracker();
        if (ipTracker.isBlocked(clientIp)) {
            context.events().record(SecurityEventType.BLOCKED_IP_REJECTED, clientIp, Map.of());
            throw new IpBlockedException(clientIp);
        }

        if (presented == null || presented.isBlank()) {
            context.events().record(SecurityEventType.MISSING_CREDENTIAL, clientIp, Map.of("key_length", "0"));
            throw new AuthenticationException(AUTH_MISSING, "API key required");
        }

        String name;
        String tier;
        Set<String> permissions;
        if (SessionTokenIssuer.looksLikeToken(presented)) {
            SessionClaims claims;
            try {
                claims = context.sessionTokenIssuer().validate(presented);
            } catch (InvalidSignatureException e) {
                ipTracker.trackFailure(clientIp);
                throw e;
            }
            name = claims.subject();
            tier = claims.tier();
            permissions = new HashSet<>(claims.permissions());
        } else {
            CredentialCheck check = context.credentialValidator().validate(presented);
            if (!check.valid()) {
                ipTracker.trackFailure(clientIp);
                throw new AuthenticationException(AUTH_INVALID, "Invalid API key");
            }
            name = check.credentialName();
            tier = check.tier();
            permissions = check.permissions();
        }

        RateLimitDecision decision = context.rateLimiter().check(name, tier);
        if (!decision.allowed()) {
            throw new RateLimitExceededException(decision);
        }

        LOG.debug("Authenticated {} (tier={}, remaining={})", name, tier, decision.remaining());
        return new AuthenticatedPrincipal(name, tier, permissions, decision);
    }

    /**
     * Requires an endpoint permission of an authenticated principal.
     *
     * @throws PermissionDeniedException if the principal lacks the permission
     */
    public void requirePermission(AuthenticatedPrincipal principal, String permission) {
        Objects.requireNonNull(principal, "principal");
        if (!principal.hasPermission(permission)) {
            context.events().record(SecurityEventType.PERMISSION_DENIED, Map.of(
                    "key_name", principal.name(),
                    "required", permission));
            throw new PermissionDeniedException(permission);
        }
    }

    /**
     * Issues a session token carrying the principal's identity.
     */
    public String issueToken(AuthenticatedPrincipal principal) {
        return context.sessionTokenIssuer().issue(principal.name(), principal.tier(), principal.permissions());
    }
}
