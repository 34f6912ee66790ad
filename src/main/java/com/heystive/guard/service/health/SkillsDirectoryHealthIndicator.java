package com.heystive.guard.service.health;

import com.heystive.guard.config.sandbox.SandboxProperties;
import com.heystive.guard.service.skill.SkillRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reports the skills directory and the number of registered skills. A missing directory
 * is not an outage (built-in skills still work), so it is reported as UNKNOWN.
 */
@Component
public class SkillsDirectoryHealthIndicator implements HealthIndicator {

    private final SandboxProperties properties;
    private final SkillRegistry registry;

    public SkillsDirectoryHealthIndicator(SandboxProperties properties, SkillRegistry registry) {
        this.properties = properties;
        this.registry = registry;
    }

    @Override
    public Health health() {
        Path dir = Path.of(properties.getSkillsDir()).toAbsolutePath();
        Health.Builder builder;
        if (!Files.exists(dir)) {
            builder = Health.unknown().withDetail("status", "Skills directory missing");
        } else if (Files.isDirectory(dir) && Files.isReadable(dir)) {
            builder = Health.up();
        } else {
            builder = Health.down().withDetail("status", "Skills directory not readable");
        }
        return builder
                .withDetail("path", dir.toString())
                .withDetail("skills", registry.skills().size())
                .build();
    }
}
