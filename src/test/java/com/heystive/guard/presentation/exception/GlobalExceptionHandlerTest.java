package com.heystive.guard.presentation.exception;

import com.heystive.guard.domain.RateLimitDecision;
import com.heystive.guard.exception.AuthenticationException;
import com.heystive.guard.exception.ExpiredSignatureException;
import com.heystive.guard.exception.InvalidSignatureException;
import com.heystive.guard.exception.IpBlockedException;
import com.heystive.guard.exception.PermissionDeniedException;
import com.heystive.guard.exception.RateLimitExceededException;
import com.heystive.guard.exception.SandboxExecutionExceptionBuilder;
import com.heystive.guard.exception.SandboxTimeoutException;
import com.heystive.guard.exception.SecurityViolationException;
import com.heystive.guard.exception.SkillNotFoundException;
import com.heystive.guard.presentation.exception.GlobalExceptionHandler.ApiError;
import com.heystive.guard.service.security.AuthenticationChain;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void missingCredentialIs401() {
        ResponseEntity<ApiError> response = handler.handleAuthentication(
                new AuthenticationException(AuthenticationChain.AUTH_MISSING, "API key required"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(response.getBody().errorCode()).isEqualTo("AUTH_MISSING");
    }

    @Test
    void invalidCredentialIs403() {
        ResponseEntity<ApiError> response = handler.handleAuthentication(
                new AuthenticationException(AuthenticationChain.AUTH_INVALID, "Invalid API key"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(response.getBody().message()).isEqualTo("Invalid API key");
    }

    @Test
    void tokenFailuresAreDistinguished() {
        assertThat(handler.handleExpiredToken(new ExpiredSignatureException(Instant.EPOCH)).getStatusCode())
                .isEqualTo(HttpStatus.UNAUTHORIZED);
        ResponseEntity<ApiError> invalid = handler.handleInvalidToken(new InvalidSignatureException("bad"));
        assertThat(invalid.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(invalid.getBody().errorCode()).isEqualTo("TOKEN_INVALID");
    }

    @Test
    void rateLimitIs429WithRetryAfterAndLimitHeaders() {
        RateLimitDecision decision = new RateLimitDecision(false, 50, 50, 3600,
                Instant.parse("2025-01-01T01:00:00Z"), 17, 0);

        ResponseEntity<ApiError> response = handler.handleRateLimit(new RateLimitExceededException(decision));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
        assertThat(response.getHeaders().getFirst("Retry-After")).isEqualTo("17");
        assertThat(response.getHeaders().getFirst("X-RateLimit-Limit")).isEqualTo("50");
        assertThat(response.getHeaders().getFirst("X-RateLimit-Remaining")).isEqualTo("0");
        assertThat(response.getHeaders().getFirst("X-RateLimit-Reset"))
                .isEqualTo(String.valueOf(Instant.parse("2025-01-01T01:00:00Z").getEpochSecond()));
    }

    @Test
    void blockedAddressIs429() {
        assertThat(handler.handleIpBlocked(new IpBlockedException("10.0.0.1")).getStatusCode())
                .isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
    }

    @Test
    void permissionAndCommandRejectionsAre403() {
        ResponseEntity<ApiError> denied = handler.handlePermissionDenied(new PermissionDeniedException("admin"));
        assertThat(denied.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(denied.getBody().details()).contains("admin");

        assertThat(handler.handleSecurityViolation(
                new SecurityViolationException("Command not allowed: rm", List.of("rm"))).getStatusCode())
                .isEqualTo(HttpStatus.FORBIDDEN);
    }

    @Test
    void skillErrorsMapToGatewayStatuses() {
        assertThat(handler.handleSkillNotFound(new SkillNotFoundException("ghost")).getStatusCode())
                .isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(handler.handleSandboxTimeout(
                new SandboxTimeoutException("speak", Duration.ofSeconds(3))).getStatusCode())
                .isEqualTo(HttpStatus.GATEWAY_TIMEOUT);

        ResponseEntity<ApiError> failed = handler.handleSandboxFailure(
                SandboxExecutionExceptionBuilder.create("Non-zero exit: 1")
                        .skill("speak").exitCode(1).errorOutput("secret stack trace").build());
        assertThat(failed.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(failed.getBody().details()).doesNotContain("secret stack trace");
    }

    @Test
    void invalidInputIs400() {
        ResponseEntity<ApiError> response = handler.handleBadRequest(new ArithmeticException("division by zero"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().details()).isEqualTo("division by zero");
    }

    @Test
    void unexpectedErrorsHideInternals() {
        Instant before = Instant.now().minusSeconds(1);

        ResponseEntity<ApiError> response = handler.handleUnexpected(new IllegalStateException("db password=x"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().toString()).doesNotContain("password");
        assertThat(response.getBody().timestamp()).isAfter(before);
    }
}
