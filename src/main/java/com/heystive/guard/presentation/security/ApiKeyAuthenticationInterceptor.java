package com.heystive.guard.presentation.security;

import com.heystive.guard.config.logging.MdcFilter;
import com.heystive.guard.domain.AuthenticatedPrincipal;
import com.heystive.guard.domain.RateLimitDecision;
import com.heystive.guard.service.security.AuthenticationChain;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Authenticates every {@code /api/**} request before it reaches a controller.
 *
 * <p>The credential is taken from, in order: the {@code X-API-Key} header, an
 * {@code Authorization: Bearer} header (API key or session token), the {@code api_key}
 * query parameter. Failures are thrown and rendered by the global exception handler.
 * On success the principal is stored as a request attribute and the rate-limit headers
 * are set.
 */
@Component
public class ApiKeyAuthenticationInterceptor implements HandlerInterceptor {

    /** Request attribute holding the {@link AuthenticatedPrincipal}. */
    public static final String PRINCIPAL_ATTRIBUTE = "heystive.principal";

    static final String API_KEY_HEADER = "X-API-Key";
    static final String API_KEY_PARAM = "api_key";
    private static final String BEARER_PREFIX = "Bearer ";

    private final AuthenticationChain authenticationChain;

    public ApiKeyAuthenticationInterceptor(AuthenticationChain authenticationChain) {
        this.authenticationChain = authenticationChain;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String presented = extractCredential(request);
        AuthenticatedPrincipal principal = authenticationChain.authenticate(presented, MdcFilter.clientIp(request));
        request.setAttribute(PRINCIPAL_ATTRIBUTE, principal);
        RateLimitHeaders.apply(response, principal.rateLimit());
        return true;
    }

    static String extractCredential(HttpServletRequest request) {
        String header = request.getHeader(API_KEY_HEADER);
        if (header != null && !header.isBlank()) {
            return header.strip();
        }
        String authorization = request.getHeader("Authorization");
        if (authorization != null && authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            String bearer = authorization.substring(BEARER_PREFIX.length()).strip();
            if (!bearer.isEmpty()) {
                return bearer;
            }
        }
        String param = request.getParameter(API_KEY_PARAM);
        return (param == null || param.isBlank()) ? null : param.strip();
    }

    /**
     * Writes {@code X-RateLimit-*} headers from a rate-limit decision.
     */
    public static final class RateLimitHeaders {

        public static final String LIMIT = "X-RateLimit-Limit";
        public static final String REMAINING = "X-RateLimit-Remaining";
        public static final String RESET = "X-RateLimit-Reset";

        private RateLimitHeaders() {
        }

        public static void apply(HttpServletResponse response, RateLimitDecision decision) {
            if (decision == null) {
                return;
            }
            response.setHeader(LIMIT, String.valueOf(decision.limit()));
            response.setHeader(REMAINING, String.valueOf(decision.remaining()));
            response.setHeader(RESET, String.valueOf(decision.resetTime().getEpochSecond()));
        }
    }
}
