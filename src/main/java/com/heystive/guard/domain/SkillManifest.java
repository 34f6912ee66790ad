package com.heystive.guard.domain;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Descriptor of an out-of-process skill, read from {@code <skills-dir>/<name>/skill.json}.
 *
 * @param name skill name (the directory name)
 * @param command invocation template; the payload file path is appended at run time
 * @param permission permission that must be granted before the skill runs
 * @param description human readable summary
 * @param timeout per-skill timeout, or null to use the sandbox default
 * @param triggers lower-case text prefixes routed to this skill
 * @param directory the skill's own directory, used as working directory
 */
public record SkillManifest(
        String name,
        List<String> command,
        String permission,
        String description,
        Duration timeout,
        List<String> triggers,
        Path directory
) {
    public SkillManifest {
        Objects.requireNonNull(name, "name");
        command = command == null ? List.of() : List.copyOf(command);
        triggers = triggers == null ? List.of() : List.copyOf(triggers);
        description = description == null ? "" : description;
    }
}
