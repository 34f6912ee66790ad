package com.heystive.guard.presentation.exception;

import com.heystive.guard.exception.AuthenticationException;
import com.heystive.guard.exception.ExpiredSignatureException;
import com.heystive.guard.exception.InvalidSignatureException;
import com.heystive.guard.exception.IpBlockedException;
import com.heystive.guard.exception.PermissionDeniedException;
import com.heystive.guard.exception.RateLimitExceededException;
import com.heystive.guard.exception.SandboxExecutionException;
import com.heystive.guard.exception.SandboxTimeoutException;
import com.heystive.guard.exception.SecurityViolationException;
import com.heystive.guard.exception.SkillNotFoundException;
import com.heystive.guard.presentation.security.ApiKeyAuthenticationInterceptor.RateLimitHeaders;
import com.heystive.guard.service.security.AuthenticationChain;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Converts domain exceptions to HTTP responses at the REST boundary.
 *
 * <pre>
 * 401  missing credential, expired session token
 * 403  invalid credential, invalid token signature, permission denied, rejected command
 * 429  rate limit exceeded (with Retry-After), address blocked
 * 404  unknown skill
 * 504  skill timeout
 * 502  skill failed
 * 400  malformed request or skill input
 * 500  anything else
 * </pre>
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(AuthenticationException.class)
    ResponseEntity<ApiError> handleAuthentication(AuthenticationException ex) {
        HttpStatus status = AuthenticationChain.AUTH_MISSING.equals(ex.getCode())
                ? HttpStatus.UNAUTHORIZED
                : HttpStatus.FORBIDDEN;
        LOG.debug("Authentication rejected: {}", ex.getCode());
        return error(status, ex.getCode(), ex.getMessage(), "Provide a valid API key or session token");
    }

    @ExceptionHandler(ExpiredSignatureException.class)
    ResponseEntity<ApiError> handleExpiredToken(ExpiredSignatureException ex) {
        return error(HttpStatus.UNAUTHORIZED, "TOKEN_EXPIRED", "Session token expired",
                "Request a new token");
    }

    @ExceptionHandler(InvalidSignatureException.class)
    ResponseEntity<ApiError> handleInvalidToken(InvalidSignatureException ex) {
        return error(HttpStatus.FORBIDDEN, "TOKEN_INVALID", "Invalid session token", ex.getMessage());
    }

    @ExceptionHandler(PermissionDeniedException.class)
    ResponseEntity<ApiError> handlePermissionDenied(PermissionDeniedException ex) {
        return error(HttpStatus.FORBIDDEN, "PERMISSION_DENIED", ex.getMessage(),
                "Required permission: " + ex.getPermission());
    }

    @ExceptionHandler(SecurityViolationException.class)
    ResponseEntity<ApiError> handleSecurityViolation(SecurityViolationException ex) {
        LOG.warn("Command rejected: {}", ex.getMessage());
        return error(HttpStatus.FORBIDDEN, "SECURITY_VIOLATION", "Command rejected", ex.getMessage());
    }

    @ExceptionHandler(RateLimitExceededException.class)
    ResponseEntity<ApiError> handleRateLimit(RateLimitExceededException ex) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()));
        headers.set(RateLimitHeaders.LIMIT, String.valueOf(ex.getDecision().limit()));
        headers.set(RateLimitHeaders.REMAINING, "0");
        headers.set(RateLimitHeaders.RESET, String.valueOf(ex.getDecision().resetTime().getEpochSecond()));
        return ResponseEntity
            .status(HttpStatus.TOO_MANY_REQUESTS)
            .headers(headers)
            .body(new ApiError("RATE_LIMIT_EXCEEDED", "Rate limit exceeded",
                "Retry after " + ex.getRetryAfterSeconds() + "s", Instant.now()));
    }

    @ExceptionHandler(IpBlockedException.class)
    ResponseEntity<ApiError> handleIpBlocked(IpBlockedException ex) {
        return error(HttpStatus.TOO_MANY_REQUESTS, "IP_BLOCKED", "IP temporarily blocked",
                "Too many failed authentication attempts");
    }

    @ExceptionHandler(SkillNotFoundException.class)
    ResponseEntity<ApiError> handleSkillNotFound(SkillNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, "SKILL_NOT_FOUND", ex.getMessage(), ex.getSkillName());
    }

    /**
     * Skill exceeded its time budget (HTTP 504).
     */
    @ExceptionHandler(SandboxTimeoutException.class)
    ResponseEntity<ApiError> handleSandboxTimeout(SandboxTimeoutException ex) {
        LOG.warn("Skill timed out: skill={}, timeout={}ms", ex.getSkillName(), ex.getTimeout().toMillis());
        return error(HttpStatus.GATEWAY_TIMEOUT, "SKILL_TIMEOUT", "Skill timed out", ex.getSkillName());
    }

    /**
     * Skill ran but failed (HTTP 502). Error output stays in the log.
     */
    @ExceptionHandler(SandboxExecutionException.class)
    ResponseEntity<ApiError> handleSandboxFailure(SandboxExecutionException ex) {
        LOG.error("Skill failed: skill={}, exitCode={}", ex.getSkillName(), ex.getExitCode(), ex);
        return error(HttpStatus.BAD_GATEWAY, "SKILL_FAILED", "Skill execution failed",
                "Skill " + ex.getSkillName() + " exited with code " + ex.getExitCode());
    }

    /**
     * Client error - invalid input (HTTP 400).
     */
    @ExceptionHandler({IllegalArgumentException.class, ArithmeticException.class,
            HttpMessageNotReadableException.class, MethodArgumentNotValidException.class})
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        LOG.debug("Bad request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", "Invalid request", ex.getMessage());
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "InternalServerError",
                "An unexpected error occurred", "Please contact support with request ID");
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String code, String message, String details) {
        return ResponseEntity
            .status(status)
            .body(new ApiError(code, message, details, Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
