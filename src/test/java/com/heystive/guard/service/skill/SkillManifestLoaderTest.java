package com.heystive.guard.service.skill;

import com.heystive.guard.domain.SkillManifest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SkillManifestLoaderTest {

    @TempDir
    Path skillsDir;

    private void manifest(String name, String json) throws IOException {
        Path dir = Files.createDirectories(skillsDir.resolve(name));
        Files.writeString(dir.resolve(SkillManifestLoader.MANIFEST_FILE), json);
    }

    @Test
    void loadsValidManifestsSortedByName() throws Exception {
        manifest("speak", """
                {"command": ["espeak-ng", "-v", "fa"], "permission": "tts",
                 "description": "Speaks text", "timeout-seconds": 5, "triggers": ["Say ", "speak "]}
                """);
        manifest("gpu", """
                {"command": ["nvidia-smi"]}
                """);

        List<SkillManifest> manifests = SkillManifestLoader.loadAll(skillsDir);

        assertThat(manifests).extracting(SkillManifest::name).containsExactly("gpu", "speak");
        SkillManifest speak = manifests.get(1);
        assertThat(speak.command()).containsExactly("espeak-ng", "-v", "fa");
        assertThat(speak.permission()).isEqualTo("tts");
        assertThat(speak.timeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(speak.triggers()).containsExactly("say ", "speak ");
        assertThat(speak.directory()).isEqualTo(skillsDir.resolve("speak"));

        SkillManifest gpu = manifests.get(0);
        assertThat(gpu.permission()).isNull();
        assertThat(gpu.timeout()).isNull();
        assertThat(gpu.triggers()).isEmpty();
        assertThat(gpu.description()).isEmpty();
    }

    @Test
    void invalidManifestsAreSkipped() throws Exception {
        manifest("empty-command", "{\"command\": []}");
        manifest("no-command", "{\"permission\": \"x\"}");
        manifest("bad-json", "{command: [");
        manifest("zero-timeout", "{\"command\": [\"ping\"], \"timeout-seconds\": 0}");
        manifest("ok", "{\"command\": [\"ping\"], \"permission\": \"  \"}");
        Files.createDirectories(skillsDir.resolve("no-manifest"));
        Files.writeString(skillsDir.resolve("stray.json"), "{}");

        List<SkillManifest> manifests = SkillManifestLoader.loadAll(skillsDir);

        assertThat(manifests).singleElement().satisfies(m -> {
            assertThat(m.name()).isEqualTo("ok");
            assertThat(m.permission()).isNull();
        });
    }

    @Test
    void missingDirectoryYieldsNothing() {
        assertThat(SkillManifestLoader.loadAll(skillsDir.resolve("absent"))).isEmpty();
        assertThat(SkillManifestLoader.loadAll(null)).isEmpty();
    }
}
