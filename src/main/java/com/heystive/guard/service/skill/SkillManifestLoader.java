package com.heystive.guard.service.skill;

import com.heystive.guard.domain.SkillManifest;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Reads skill manifests from {@code <skills-dir>/<name>/skill.json}.
 *
 * <pre>
 * {
 *   "command": ["espeak-ng", "-v", "fa"],
 *   "permission": "tts",
 *   "description": "Speaks text aloud",
 *   "timeout-seconds": 5,
 *   "triggers": ["say ", "speak "]
 * }
 * </pre>
 *
 * <p>Malformed manifests are skipped with a warning; they never prevent startup.
 */
public final class SkillManifestLoader {

    private static final Logger LOG = LogManager.getLogger(SkillManifestLoader.class);

    static final String MANIFEST_FILE = "skill.json";

    private SkillManifestLoader() {
    }

    /**
     * Loads every valid manifest under a skills root, ordered by skill name.
     * A missing root yields an empty list.
     */
    public static List<SkillManifest> loadAll(Path skillsDir) {
        List<SkillManifest> manifests = new ArrayList<>();
        if (skillsDir == null || !Files.isDirectory(skillsDir)) {
            LOG.debug("Skills directory {} not found; no manifest skills loaded", skillsDir);
            return manifests;
        }
        try (Stream<Path> dirs = Files.list(skillsDir)) {
            dirs.filter(Files::isDirectory)
                    .sorted()
                    .forEach(dir -> {
                        Path file = dir.resolve(MANIFEST_FILE);
                        if (Files.isRegularFile(file)) {
                            SkillManifest manifest = load(dir.getFileName().toString(), file);
                            if (manifest != null) {
                                manifests.add(manifest);
                            }
                        }
                    });
        } catch (IOException e) {
            LOG.warn("Cannot list skills directory {}: {}", skillsDir, e.toString());
        }
        LOG.info("Loaded {} manifest skill(s) from {}", manifests.size(), skillsDir.toAbsolutePath());
        return manifests;
    }

    /**
     * Parses one manifest.
     *
     * @return the manifest, or null if the file is unreadable or invalid
     */
    static SkillManifest load(String name, Path file) {
        try {
            JSONObject json = new JSONObject(Files.readString(file, StandardCharsets.UTF_8));
            JSONArray commandArray = json.getJSONArray("command");
            List<String> command = new ArrayList<>();
            for (int i = 0; i < commandArray.length(); i++) {
                command.add(commandArray.getString(i));
            }
            if (command.isEmpty() || command.get(0).isBlank()) {
                LOG.warn("Skipping skill {}: empty command in {}", name, file);
                return null;
            }

            Duration timeout = null;
            if (json.has("timeout-seconds")) {
                long seconds = json.getLong("timeout-seconds");
                if (seconds <= 0) {
                    LOG.warn("Skipping skill {}: timeout-seconds must be positive", name);
                    return null;
                }
                timeout = Duration.ofSeconds(seconds);
            }

            List<String> triggers = new ArrayList<>();
            JSONArray triggerArray = json.optJSONArray("triggers");
            if (triggerArray != null) {
                for (int i = 0; i < triggerArray.length(); i++) {
                    String trigger = triggerArray.getString(i).toLowerCase(Locale.ROOT);
                    if (!trigger.isBlank()) {
                        triggers.add(trigger);
                    }
                }
            }

            String permission = json.optString("permission", "").strip();
            return new SkillManifest(name, command,
                    permission.isEmpty() ? null : permission,
                    json.optString("description", ""),
                    timeout, triggers, file.getParent());
        } catch (IOException | JSONException e) {
            LOG.warn("Skipping skill {}: invalid manifest {}: {}", name, file, e.getMessage());
            return null;
        }
    }
}
