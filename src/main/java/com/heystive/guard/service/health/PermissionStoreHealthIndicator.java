package com.heystive.guard.service.health;

import com.heystive.guard.service.permission.PermissionStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reports whether the permission store can be persisted: the store file must be writable
 * if it exists, otherwise its nearest existing parent directory must be.
 *
 * <p>Exposed via /actuator/health.
 */
@Component
public class PermissionStoreHealthIndicator implements HealthIndicator {

    private final PermissionStore store;

    public PermissionStoreHealthIndicator(PermissionStore store) {
        this.store = store;
    }

    @Override
    public Health health() {
        Path path = store.storePath();
        boolean exists = Files.isRegularFile(path);
        Path target = exists ? path : nearestExistingAncestor(path.getParent());
        boolean writable = target != null && Files.isWritable(target);

        Health.Builder builder = writable ? Health.up() : Health.down();
        builder.withDetail("path", path.toString())
                .withDetail("exists", exists)
                .withDetail("writable", writable);
        if (writable) {
            builder.withDetail("grants", store.snapshot().size());
        }
        return builder.build();
    }

    private static Path nearestExistingAncestor(Path dir) {
        Path current = dir;
        while (current != null && !Files.exists(current)) {
            current = current.getParent();
        }
        return current;
    }
}
