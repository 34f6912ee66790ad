package com.heystive.guard.service.skill;

import com.heystive.guard.domain.SecurityEventType;
import com.heystive.guard.domain.SkillInvocationResult;
import com.heystive.guard.domain.SkillManifest;
import com.heystive.guard.exception.PermissionDeniedException;
import com.heystive.guard.service.permission.PermissionStore;
import com.heystive.guard.service.sandbox.SkillSandboxExecutor;
import com.heystive.guard.service.security.SecurityEventLog;
import com.heystive.guard.testutil.EventCapturingPublisher;
import com.heystive.guard.testutil.MutableClock;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ManifestSkillTest {

    private static final List<String> COMMAND = List.of("espeak-ng", "-v", "fa");

    @TempDir
    Path dir;

    private SkillSandboxExecutor executor;
    private PermissionStore permissions;
    private EventCapturingPublisher publisher;
    private ManifestSkill skill;

    @BeforeEach
    void setUp() {
        executor = mock(SkillSandboxExecutor.class);
        publisher = new EventCapturingPublisher();
        SecurityEventLog events = new SecurityEventLog(100, MutableClock.startingAt("2025-01-01T00:00:00Z"), publisher);
        permissions = new PermissionStore(dir.resolve("permissions.json"), events);
        SkillManifest manifest = new SkillManifest("speak", COMMAND, "tts", "Speaks text",
                Duration.ofSeconds(5), List.of("say ", "speak "), dir);
        skill = new ManifestSkill(manifest, executor, permissions, events);
    }

    @Test
    void claimsTextStartingWithTrigger() {
        assertThat(skill.canHandle("Say hello")).isTrue();
        assertThat(skill.canHandle("  speak slowly")).isTrue();
        assertThat(skill.canHandle("sayonara")).isFalse();
        assertThat(skill.requiredPermission()).isEqualTo("tts");
        assertThat(skill.description()).isEqualTo("Speaks text");
    }

    @Test
    void refusesToRunWithoutGrantedPermission() {
        assertThatThrownBy(() -> skill.handle("say hi", Map.of()))
                .isInstanceOfSatisfying(PermissionDeniedException.class,
                        e -> assertThat(e.getPermission()).isEqualTo("tts"));

        verify(executor, never()).execute(any(), anyMap(), any(), anyString());
        assertThat(publisher.securityEvents(SecurityEventType.PERMISSION_DENIED)).hasSize(1);
    }

    @Test
    @SuppressWarnings("unchecked")
    void runsThroughSandboxOnceGranted() {
        permissions.grant("tts");
        when(executor.execute(eq(COMMAND), anyMap(), eq(Duration.ofSeconds(5)), eq("speak")))
                .thenReturn(new SkillInvocationResult("speak", COMMAND, 0, "{\"spoken\": true, \"chars\": 2}", 12));

        Map<String, Object> result = skill.handle("say hi", Map.of("rate", 120));

        assertThat(result).containsEntry("spoken", true).containsEntry("chars", 2);
        ArgumentCaptor<Map<String, Object>> payload = ArgumentCaptor.forClass(Map.class);
        verify(executor).execute(eq(COMMAND), payload.capture(), eq(Duration.ofSeconds(5)), eq("speak"));
        assertThat(payload.getValue()).containsEntry("skill", "speak").containsEntry("text", "say hi");
        assertThat(((JSONObject) payload.getValue().get("args")).getInt("rate")).isEqualTo(120);
    }

    @Test
    void nonJsonOutputIsWrapped() {
        assertThat(ManifestSkill.parseOutput("  done\n")).containsExactly(Map.entry("output", "done"));
        assertThat(ManifestSkill.parseOutput("{broken")).containsEntry("output", "{broken");
        assertThat(ManifestSkill.parseOutput(null)).containsEntry("output", "");
        assertThat(ManifestSkill.parseOutput("{\"a\": 1}")).containsEntry("a", 1);
    }
}
