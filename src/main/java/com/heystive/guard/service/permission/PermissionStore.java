package com.heystive.guard.service.permission;

import com.heystive.guard.config.permission.PermissionProperties;
import com.heystive.guard.domain.PermissionStatus;
import com.heystive.guard.domain.SecurityEventType;
import com.heystive.guard.service.security.SecurityContext;
import com.heystive.guard.service.security.SecurityEventLog;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Persisted table of skill permission grants, stored as a flat JSON object
 * {@code {"permission": true|false}}.
 *
 * <p>Reads are uncached and lock-free: every check reads the file, so external edits take
 * effect immediately. Writes are serialized by a lock and replace the file with an atomic
 * rename, so a reader never sees a partial table. A missing or unreadable table grants
 * nothing.
 */
@Component
public class PermissionStore {

    private static final Logger LOG = LogManager.getLogger(PermissionStore.class);

    private final Path storePath;
    private final SecurityEventLog events;
    private final Lock writeLock = new ReentrantLock();

    @Autowired
    public PermissionStore(PermissionProperties properties, SecurityContext securityContext) {
        this(Path.of(properties.getStorePath()), securityContext.events());
    }

    public PermissionStore(Path storePath, SecurityEventLog events) {
        this.storePath = Objects.requireNonNull(storePath, "storePath").toAbsolutePath();
        this.events = Objects.requireNonNull(events, "events");
    }

    /**
     * Returns whether a permission is currently granted. Unknown permissions are not.
     */
    public boolean isGranted(String permission) {
        if (permission == null || permission.isBlank()) {
            return false;
        }
        return Boolean.TRUE.equals(readTable().get(permission));
    }

    /**
     * Returns the current status of a permission without changing it.
     */
    public PermissionStatus requestPermission(String permission) {
        return new PermissionStatus(permission, isGranted(permission));
    }

    /**
     * Grants a permission and persists the table.
     */
    public PermissionStatus grant(String permission) {
        write(permission, true);
        events.record(SecurityEventType.PERMISSION_GRANTED, Map.of("permission", permission));
        LOG.info("Permission granted: {}", permission);
        return new PermissionStatus(permission, true);
    }

    /**
     * Revokes a permission and persists the table.
     */
    public PermissionStatus revoke(String permission) {
        write(permission, false);
        events.record(SecurityEventType.PERMISSION_REVOKED, Map.of("permission", permission));
        LOG.info("Permission revoked: {}", permission);
        return new PermissionStatus(permission, false);
    }

    /**
     * Returns every recorded permission with its grant flag, sorted by name.
     */
    public Map<String, Boolean> snapshot() {
        return readTable();
    }

    public Path storePath() {
        return storePath;
    }

    private void write(String permission, boolean granted) {
        if (permission == null || permission.isBlank()) {
            throw new IllegalArgumentException("permission must not be blank");
        }
        writeLock.lock();
        try {
            Map<String, Boolean> table = readTable();
            table.put(permission, granted);
            persist(table);
        } finally {
            writeLock.unlock();
        }
    }

    private Map<String, Boolean> readTable() {
        Map<String, Boolean> table = new TreeMap<>();
        if (!Files.exists(storePath)) {
            return table;
        }
        try {
            String content = Files.readString(storePath, StandardCharsets.UTF_8);
            if (content.isBlank()) {
                return table;
            }
            JSONObject json = new JSONObject(content);
            for (String key : json.keySet()) {
                table.put(key, json.optBoolean(key, false));
            }
        } catch (IOException e) {
            LOG.warn("Cannot read permission store {}: {}", storePath, e.toString());
        } catch (JSONException e) {
            LOG.warn("Permission store {} is not valid JSON; treating as empty: {}", storePath, e.getMessage());
        }
        return table;
    }

    private void persist(Map<String, Boolean> table) {
        try {
            Path dir = storePath.getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            Path tmp = Files.createTempFile(dir, storePath.getFileName().toString(), ".tmp");
            try {
                Files.writeString(tmp, new JSONObject(table).toString(2), StandardCharsets.UTF_8);
                moveIntoPlace(tmp);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to persist permission store " + storePath, e);
        }
    }

    private void moveIntoPlace(Path tmp) throws IOException {
        try {
            Files.move(tmp, storePath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.debug("Atomic move unsupported for {}, falling back to replace", storePath);
            Files.move(tmp, storePath, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
