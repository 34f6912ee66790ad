package com.heystive.guard.presentation.controller;

import com.heystive.guard.domain.AuthenticatedPrincipal;
import com.heystive.guard.domain.PermissionStatus;
import com.heystive.guard.presentation.security.ApiKeyAuthenticationInterceptor;
import com.heystive.guard.service.permission.PermissionStore;
import com.heystive.guard.service.security.AuthenticationChain;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Query and manage skill permission grants. Changing a grant needs the {@code admin}
 * endpoint permission.
 */
@RestController
@RequestMapping("/api/permissions")
class PermissionController {

    static final String ADMIN_PERMISSION = "admin";

    private final PermissionStore store;
    private final AuthenticationChain authenticationChain;

    PermissionController(PermissionStore store, AuthenticationChain authenticationChain) {
        this.store = store;
        this.authenticationChain = authenticationChain;
    }

    @GetMapping
    ResponseEntity<Map<String, Boolean>> all(
            @RequestAttribute(ApiKeyAuthenticationInterceptor.PRINCIPAL_ATTRIBUTE) AuthenticatedPrincipal principal) {
        authenticationChain.requirePermission(principal, ADMIN_PERMISSION);
        return ResponseEntity.ok(store.snapshot());
    }

    @GetMapping("/{name}")
    ResponseEntity<PermissionStatus> status(
            @RequestAttribute(ApiKeyAuthenticationInterceptor.PRINCIPAL_ATTRIBUTE) AuthenticatedPrincipal principal,
            @PathVariable("name") String name) {
        authenticationChain.requirePermission(principal, "read");
        return ResponseEntity.ok(store.requestPermission(name));
    }

    @PostMapping("/{name}")
    ResponseEntity<PermissionStatus> grant(
            @RequestAttribute(ApiKeyAuthenticationInterceptor.PRINCIPAL_ATTRIBUTE) AuthenticatedPrincipal principal,
            @PathVariable("name") String name) {
        authenticationChain.requirePermission(principal, ADMIN_PERMISSION);
        return ResponseEntity.ok(store.grant(name));
    }

    @DeleteMapping("/{name}")
    ResponseEntity<PermissionStatus> revoke(
            @RequestAttribute(ApiKeyAuthenticationInterceptor.PRINCIPAL_ATTRIBUTE) AuthenticatedPrincipal principal,
            @PathVariable("name") String name) {
        authenticationChain.requirePermission(principal, ADMIN_PERMISSION);
        return ResponseEntity.ok(store.revoke(name));
    }
}
