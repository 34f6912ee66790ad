package com.heystive.guard.presentation.controller;

import com.heystive.guard.domain.AuthenticatedPrincipal;
import com.heystive.guard.domain.PlanStep;
import com.heystive.guard.domain.RouteResult;
import com.heystive.guard.domain.StepResult;
import com.heystive.guard.presentation.security.ApiKeyAuthenticationInterceptor;
import com.heystive.guard.service.security.AuthenticationChain;
import com.heystive.guard.service.skill.IntentRouter;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Free-text routing and multi-step plan execution.
 */
@RestController
@RequestMapping("/api/intent")
class IntentController {

    static final String ROUTE_PERMISSION = "read";
    static final String PLAN_PERMISSION = "write";

    private final IntentRouter router;
    private final AuthenticationChain authenticationChain;

    IntentController(IntentRouter router, AuthenticationChain authenticationChain) {
        this.router = router;
        this.authenticationChain = authenticationChain;
    }

    record RouteRequest(@NotBlank String text) {}

    @PostMapping("/route")
    ResponseEntity<RouteResult> route(
            @RequestAttribute(ApiKeyAuthenticationInterceptor.PRINCIPAL_ATTRIBUTE) AuthenticatedPrincipal principal,
            @Valid @RequestBody RouteRequest request) {
        authenticationChain.requirePermission(principal, ROUTE_PERMISSION);
        return ResponseEntity.ok(router.route(request.text()));
    }

    /**
     * Runs every step; the response has one entry per step, in order.
     */
    @PostMapping("/plan")
    ResponseEntity<List<StepResult>> plan(
            @RequestAttribute(ApiKeyAuthenticationInterceptor.PRINCIPAL_ATTRIBUTE) AuthenticatedPrincipal principal,
            @RequestBody List<PlanStep> steps) {
        authenticationChain.requirePermission(principal, PLAN_PERMISSION);
        return ResponseEntity.ok(router.executePlan(steps));
    }
}
