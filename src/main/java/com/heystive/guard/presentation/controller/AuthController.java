package com.heystive.guard.presentation.controller;

import com.heystive.guard.domain.AuthenticatedPrincipal;
import com.heystive.guard.presentation.security.ApiKeyAuthenticationInterceptor;
import com.heystive.guard.service.security.AuthenticationChain;
import com.heystive.guard.service.security.SecurityContext;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exchanges an API key for a signed session token.
 */
@RestController
@RequestMapping("/api/auth")
class AuthController {

    private final AuthenticationChain authenticationChain;
    private final SecurityContext securityContext;

    AuthController(AuthenticationChain authenticationChain, SecurityContext securityContext) {
        this.authenticationChain = authenticationChain;
        this.securityContext = securityContext;
    }

    @PostMapping("/token")
    ResponseEntity<Map<String, Object>> issueToken(
            @RequestAttribute(ApiKeyAuthenticationInterceptor.PRINCIPAL_ATTRIBUTE) AuthenticatedPrincipal principal) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("token", authenticationChain.issueToken(principal));
        body.put("token_type", "Bearer");
        body.put("expires_in", securityContext.sessionTokenIssuer().expiry().toSeconds());
        body.put("subject", principal.name());
        return ResponseEntity.ok(body);
    }
}
