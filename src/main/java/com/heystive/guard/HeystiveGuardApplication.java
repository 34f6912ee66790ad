package com.heystive.guard;

import com.heystive.guard.config.permission.PermissionProperties;
import com.heystive.guard.config.sandbox.SandboxProperties;
import com.heystive.guard.config.security.SecurityProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({SecurityProperties.class, SandboxProperties.class, PermissionProperties.class})
public class HeystiveGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(HeystiveGuardApplication.class, args);
    }
}
