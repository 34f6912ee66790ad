package com.heystive.guard.config.permission;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the persisted permission grant table.
 *
 * <pre>
 * permissions.store-path=data/permissions.json
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "permissions")
public class PermissionProperties {

    static final String DEFAULT_STORE_PATH = "data/permissions.json";

    /** JSON file holding {@code {"permission": true|false}} entries. */
    @NotBlank(message = "Permission store path must not be blank")
    private final String storePath;

    @ConstructorBinding
    public PermissionProperties(String storePath) {
        this.storePath = (storePath == null || storePath.isBlank()) ? DEFAULT_STORE_PATH : storePath;
    }

    public String getStorePath() {
        return storePath;
    }
}
