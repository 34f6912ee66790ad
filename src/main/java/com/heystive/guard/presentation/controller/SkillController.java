package com.heystive.guard.presentation.controller;

import com.heystive.guard.domain.AuthenticatedPrincipal;
import com.heystive.guard.domain.RouteResult;
import com.heystive.guard.presentation.security.ApiKeyAuthenticationInterceptor;
import com.heystive.guard.service.permission.PermissionStore;
import com.heystive.guard.service.security.AuthenticationChain;
import com.heystive.guard.service.skill.Skill;
import com.heystive.guard.service.skill.SkillInvocationService;
import com.heystive.guard.service.skill.SkillRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Skill listing and direct invocation.
 */
@RestController
@RequestMapping("/api/skills")
class SkillController {

    private final SkillRegistry registry;
    private final SkillInvocationService invocationService;
    private final PermissionStore permissionStore;
    private final AuthenticationChain authenticationChain;

    SkillController(SkillRegistry registry,
                    SkillInvocationService invocationService,
                    PermissionStore permissionStore,
                    AuthenticationChain authenticationChain) {
        this.registry = registry;
        this.invocationService = invocationService;
        this.permissionStore = permissionStore;
        this.authenticationChain = authenticationChain;
    }

    @GetMapping
    ResponseEntity<List<Map<String, Object>>> list(
            @RequestAttribute(ApiKeyAuthenticationInterceptor.PRINCIPAL_ATTRIBUTE) AuthenticatedPrincipal principal) {
        authenticationChain.requirePermission(principal, "read");
        List<Map<String, Object>> skills = new ArrayList<>();
        for (Skill skill : registry.skills()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", skill.name());
            entry.put("description", skill.description());
            String permission = skill.requiredPermission();
            entry.put("permission", permission);
            entry.put("granted", permission == null || permissionStore.isGranted(permission));
            skills.add(entry);
        }
        return ResponseEntity.ok(skills);
    }

    @PostMapping("/{name}/execute")
    ResponseEntity<RouteResult> execute(
            @RequestAttribute(ApiKeyAuthenticationInterceptor.PRINCIPAL_ATTRIBUTE) AuthenticatedPrincipal principal,
            @PathVariable("name") String name,
            @RequestBody(required = false) Map<String, Object> args) {
        return ResponseEntity.ok(invocationService.invoke(principal, name, args));
    }

    /**
     * Rescans the skills directory (admin only).
     */
    @PostMapping("/reload")
    ResponseEntity<Map<String, Object>> reload(
            @RequestAttribute(ApiKeyAuthenticationInterceptor.PRINCIPAL_ATTRIBUTE) AuthenticatedPrincipal principal) {
        authenticationChain.requirePermission(principal, "admin");
        return ResponseEntity.ok(Map.of("skills", registry.reload()));
    }
}
