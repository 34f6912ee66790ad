package com.heystive.guard.presentation.controller;

import com.heystive.guard.domain.AuthenticatedPrincipal;
import com.heystive.guard.domain.SecurityEvent;
import com.heystive.guard.domain.SecurityStats;
import com.heystive.guard.presentation.security.ApiKeyAuthenticationInterceptor;
import com.heystive.guard.service.security.AuthenticationChain;
import com.heystive.guard.service.security.SecurityAuditService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Admin-only audit views over the security event log.
 */
@RestController
@RequestMapping("/api/security")
class SecurityAuditController {

    private final SecurityAuditService auditService;
    private final AuthenticationChain authenticationChain;

    SecurityAuditController(SecurityAuditService auditService, AuthenticationChain authenticationChain) {
        this.auditService = auditService;
        this.authenticationChain = authenticationChain;
    }

    @GetMapping("/stats")
    ResponseEntity<SecurityStats> stats(
            @RequestAttribute(ApiKeyAuthenticationInterceptor.PRINCIPAL_ATTRIBUTE) AuthenticatedPrincipal principal) {
        authenticationChain.requirePermission(principal, "admin");
        return ResponseEntity.ok(auditService.stats());
    }

    @GetMapping("/events")
    ResponseEntity<List<SecurityEvent>> events(
            @RequestAttribute(ApiKeyAuthenticationInterceptor.PRINCIPAL_ATTRIBUTE) AuthenticatedPrincipal principal,
            @RequestParam(name = "limit", defaultValue = "50") int limit) {
        authenticationChain.requirePermission(principal, "admin");
        return ResponseEntity.ok(auditService.recentEvents(limit));
    }
}
