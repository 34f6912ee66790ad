package com.heystive.guard.service.skill;

import com.heystive.guard.domain.SecurityEventType;
import com.heystive.guard.domain.SkillInvocationResult;
import com.heystive.guard.domain.SkillManifest;
import com.heystive.guard.exception.PermissionDeniedException;
import com.heystive.guard.service.permission.PermissionStore;
import com.heystive.guard.service.sandbox.SkillSandboxExecutor;
import com.heystive.guard.service.security.SecurityEventLog;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Skill backed by an external executable described by a manifest. Runs only through
 * {@link SkillSandboxExecutor}, and only once its permission has been granted.
 *
 * <p>The child receives {@code {"text": ..., "args": {...}}} as its payload file. Stdout
 * holding a JSON object becomes the result; any other output is returned under
 * {@code output}.
 */
final class ManifestSkill implements Skill {

    private static final Logger LOG = LogManager.getLogger(ManifestSkill.class);

    private final SkillManifest manifest;
    private final SkillSandboxExecutor executor;
    private final PermissionStore permissions;
    private final SecurityEventLog events;

    ManifestSkill(SkillManifest manifest,
                  SkillSandboxExecutor executor,
                  PermissionStore permissions,
                  SecurityEventLog events) {
        this.manifest = manifest;
        this.executor = executor;
        this.permissions = permissions;
        this.events = events;
    }

    @Override
    public String name() {
        return manifest.name();
    }

    @Override
    public String description() {
        return manifest.description();
    }

    @Override
    public String requiredPermission() {
        return manifest.permission();
    }

    @Override
    public boolean canHandle(String text) {
        String t = text.strip().toLowerCase(Locale.ROOT);
        return manifest.triggers().stream().anyMatch(t::startsWith);
    }

    @Override
    public Map<String, Object> handle(String text, Map<String, Object> args) {
        String permission = manifest.permission();
        if (permission != null && !permissions.isGranted(permission)) {
            events.record(SecurityEventType.PERMISSION_DENIED, Map.of(
                    "skill", manifest.name(),
                    "required", permission));
            throw new PermissionDeniedException(permission,
                    "Permission '" + permission + "' not granted for skill " + manifest.name());
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("skill", manifest.name());
        payload.put("text", text);
        payload.put("args", new JSONObject(args));
        SkillInvocationResult invocation = executor.execute(manifest.command(), payload,
                manifest.timeout(), manifest.name());
        return parseOutput(invocation.output());
    }

    SkillManifest manifest() {
        return manifest;
    }

    static Map<String, Object> parseOutput(String stdout) {
        String trimmed = stdout == null ? "" : stdout.strip();
        if (trimmed.startsWith("{")) {
            try {
                return new JSONObject(trimmed).toMap();
            } catch (JSONException e) {
                LOG.debug("Skill output is not a JSON object, returning it as text: {}", e.getMessage());
            }
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("output", trimmed);
        return result;
    }
}
