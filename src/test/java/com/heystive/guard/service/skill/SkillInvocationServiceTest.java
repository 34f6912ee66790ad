package com.heystive.guard.service.skill;

import com.heystive.guard.domain.AuthenticatedPrincipal;
import com.heystive.guard.domain.RequestStage;
import com.heystive.guard.domain.RouteResult;
import com.heystive.guard.domain.SecurityEventType;
import com.heystive.guard.exception.PermissionDeniedException;
import com.heystive.guard.exception.SandboxTimeoutException;
import com.heystive.guard.exception.SkillNotFoundException;
import com.heystive.guard.service.permission.PermissionStore;
import com.heystive.guard.service.security.AuthenticationChain;
import com.heystive.guard.service.security.SecurityContext;
import com.heystive.guard.testutil.EventCapturingPublisher;
import com.heystive.guard.testutil.MutableClock;
import com.heystive.guard.testutil.SecurityFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SkillInvocationServiceTest {

    private static final AuthenticatedPrincipal WRITER =
            new AuthenticatedPrincipal("heystive_user", "user", Set.of("read", "write"), null);
    private static final AuthenticatedPrincipal READER =
            new AuthenticatedPrincipal("heystive_demo", "demo", Set.of("read"), null);

    @TempDir
    Path dir;

    private EventCapturingPublisher publisher;
    private PermissionStore permissions;
    private StubSkill echo;
    private SkillInvocationService service;

    @BeforeEach
    void setUp() {
        publisher = new EventCapturingPublisher();
        SecurityContext context = SecurityFixtures.context(
                MutableClock.startingAt("2025-01-01T00:00:00Z"), publisher);
        permissions = new PermissionStore(dir.resolve("permissions.json"), context.events());
        echo = StubSkill.claiming("echo", "");
        SkillRegistry registry = new SkillRegistry(List.of(
                echo,
                StubSkill.requiring("camera", "camera"),
                StubSkill.failing("slow", new SandboxTimeoutException("slow", Duration.ofSeconds(3))),
                StubSkill.failing("crash", new IllegalStateException("crashed"))),
                List::of);
        service = new SkillInvocationService(registry, new AuthenticationChain(context), permissions,
                context.events());
    }

    @Test
    void completedInvocationWalksAllStages() {
        RequestLifecycle lifecycle = new RequestLifecycle();

        RouteResult result = service.invoke(WRITER, "echo", Map.of("text", "hi"), lifecycle);

        assertThat(result.skill()).isEqualTo("echo");
        assertThat(result.result()).containsEntry("text", "hi");
        assertThat(lifecycle.history()).containsExactly(
                RequestStage.UNVALIDATED, RequestStage.RATE_CHECKED, RequestStage.PERMISSION_CHECKED,
                RequestStage.EXECUTING, RequestStage.COMPLETED);
    }

    @Test
    void callerWithoutWritePermissionIsRejected() {
        RequestLifecycle lifecycle = new RequestLifecycle();

        assertThatThrownBy(() -> service.invoke(READER, "echo", Map.of(), lifecycle))
                .isInstanceOf(PermissionDeniedException.class);

        assertThat(lifecycle.current()).isEqualTo(RequestStage.FAILED);
        assertThat(echo.handled).isEmpty();
    }

    @Test
    void unknownSkillFailsTheRequest() {
        RequestLifecycle lifecycle = new RequestLifecycle();

        assertThatThrownBy(() -> service.invoke(WRITER, "ghost", Map.of(), lifecycle))
                .isInstanceOfSatisfying(SkillNotFoundException.class,
                        e -> assertThat(e.getSkillName()).isEqualTo("ghost"));

        assertThat(lifecycle.current()).isEqualTo(RequestStage.FAILED);
        assertThat(publisher.securityEvents(SecurityEventType.SKILL_NOT_FOUND)).hasSize(1);
    }

    @Test
    void skillPermissionMustBeGranted() {
        assertThatThrownBy(() -> service.invoke(WRITER, "camera", Map.of()))
                .isInstanceOfSatisfying(PermissionDeniedException.class,
                        e -> assertThat(e.getPermission()).isEqualTo("camera"));

        permissions.grant("camera");

        assertThat(service.invoke(WRITER, "camera", Map.of()).skill()).isEqualTo("camera");
    }

    @Test
    void sandboxTimeoutEndsInTimeoutStage() {
        RequestLifecycle lifecycle = new RequestLifecycle();

        assertThatThrownBy(() -> service.invoke(WRITER, "slow", Map.of(), lifecycle))
                .isInstanceOf(SandboxTimeoutException.class);

        assertThat(lifecycle.current()).isEqualTo(RequestStage.TIMEOUT);
    }

    @Test
    void skillFailureEndsInFailedStage() {
        RequestLifecycle lifecycle = new RequestLifecycle();

        assertThatThrownBy(() -> service.invoke(WRITER, "crash", null, lifecycle))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("crashed");

        assertThat(lifecycle.history()).endsWith(RequestStage.EXECUTING, RequestStage.FAILED);
    }
}
