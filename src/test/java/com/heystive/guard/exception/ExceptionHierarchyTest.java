package com.heystive.guard.exception;

import com.heystive.guard.domain.RateLimitDecision;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExceptionHierarchyTest {

    @Test
    void heystiveExceptionShouldIncludeMessageAndCause() {
        IOException cause = new IOException("disk");
        HeystiveException ex = new HeystiveException("wrapper", cause);

        assertThat(ex).isInstanceOf(RuntimeException.class);
        assertThat(ex.getMessage()).isEqualTo("wrapper");
        assertThat(ex.getCause()).isSameAs(cause);
    }

    @Test
    void authenticationExceptionShouldCarryCode() {
        AuthenticationException ex = new AuthenticationException("AUTH_INVALID", "Invalid API key");

        assertThat(ex).isInstanceOf(HeystiveException.class);
        assertThat(ex.getCode()).isEqualTo("AUTH_INVALID");
        assertThat(ex.getMessage()).isEqualTo("Invalid API key");
    }

    @Test
    void rateLimitExceptionShouldExposeRetryAfter() {
        RateLimitDecision decision = new RateLimitDecision(false, 50, 50, 3600,
                Instant.parse("2025-01-01T01:00:00Z"), 42, 0);

        RateLimitExceededException ex = new RateLimitExceededException(decision);

        assertThat(ex.getRetryAfterSeconds()).isEqualTo(42);
        assertThat(ex.getDecision()).isSameAs(decision);
        assertThat(ex.getMessage()).contains("50/50");
    }

    @Test
    void sessionTokenExceptionsShareParent() {
        assertThat(new ExpiredSignatureException(Instant.EPOCH)).isInstanceOf(SessionTokenException.class);
        assertThat(new InvalidSignatureException("bad")).isInstanceOf(SessionTokenException.class);
        assertThat(new ExpiredSignatureException(Instant.EPOCH).getExpiredAt()).isEqualTo(Instant.EPOCH);
    }

    @Test
    void timeoutExceptionShouldUseConventionalExitCode() {
        SandboxTimeoutException ex = new SandboxTimeoutException("speak", Duration.ofSeconds(3));

        assertThat(ex).isInstanceOf(SandboxException.class);
        assertThat(ex.getExitCode()).isEqualTo(124);
        assertThat(ex.getSkillName()).isEqualTo("speak");
        assertThat(ex.getMessage()).isEqualTo("Timeout after 3000ms (skill: speak)");
    }

    @Test
    void builderShouldAssembleDetailedMessage() {
        SandboxExecutionException ex = SandboxExecutionExceptionBuilder.create("Non-zero exit: 2")
                .skill("speak")
                .exitCode(2)
                .durationMs(140)
                .metadata("executable", "espeak")
                .errorOutput("voice not found")
                .build();

        assertThat(ex.getMessage()).isEqualTo(
                "Non-zero exit: 2 (exitCode=2, durationMs=140, executable=espeak, stderr=voice not found)"
                        + " (skill: speak)");
        assertThat(ex.getExitCode()).isEqualTo(2);
        assertThat(ex.getErrorOutput()).isEqualTo("voice not found");
    }

    @Test
    void builderShouldDefaultSkillAndExitCode() {
        SandboxExecutionException ex = SandboxExecutionExceptionBuilder.create("I/O failure").build();

        assertThat(ex.getSkillName()).isEqualTo("unknown");
        assertThat(ex.getExitCode()).isEqualTo(-1);
        assertThat(ex.getErrorOutput()).isEmpty();
        assertThatThrownBy(() -> SandboxExecutionExceptionBuilder.create(""))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void securityViolationShouldCopyCommand() {
        SecurityViolationException ex = new SecurityViolationException("Command not allowed: rm", List.of("rm", "-rf"));

        assertThat(ex.getCommand()).containsExactly("rm", "-rf");
        assertThat(new SecurityViolationException("Empty command", null).getCommand()).isEmpty();
    }

    @Test
    void lookupExceptionsShouldExposeSubjects() {
        assertThat(new SkillNotFoundException("ghost").getSkillName()).isEqualTo("ghost");
        assertThat(new IpBlockedException("10.0.0.1").getIpAddress()).isEqualTo("10.0.0.1");
        assertThat(new PermissionDeniedException("admin").getMessage()).isEqualTo("Permission 'admin' required");
    }
}
