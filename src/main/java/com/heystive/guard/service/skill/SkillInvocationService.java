package com.heystive.guard.service.skill;

import com.heystive.guard.domain.AuthenticatedPrincipal;
import com.heystive.guard.domain.RequestStage;
import com.heystive.guard.domain.RouteResult;
import com.heystive.guard.domain.SecurityEventType;
import com.heystive.guard.exception.PermissionDeniedException;
import com.heystive.guard.exception.SandboxTimeoutException;
import com.heystive.guard.exception.SkillNotFoundException;
import com.heystive.guard.service.permission.PermissionStore;
import com.heystive.guard.service.security.AuthenticationChain;
import com.heystive.guard.service.security.SecurityContext;
import com.heystive.guard.service.security.SecurityEventLog;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Objects;

/**
 * Invokes a single skill by name on behalf of an authenticated caller, walking the
 * request through its lifecycle stages.
 *
 * <p>The caller has already passed authentication and the rate limit when it reaches
 * this service, so every request starts by moving to {@link RequestStage#RATE_CHECKED}.
 */
@Service
public class SkillInvocationService {

    private static final Logger LOG = LogManager.getLogger(SkillInvocationService.class);

    /** Endpoint permission required to invoke skills directly. */
    public static final String EXECUTE_PERMISSION = "write";

    private final SkillRegistry registry;
    private final AuthenticationChain authenticationChain;
    private final PermissionStore permissionStore;
    private final SecurityEventLog events;

    @Autowired
    public SkillInvocationService(SkillRegistry registry,
                                  AuthenticationChain authenticationChain,
                                  PermissionStore permissionStore,
                                  SecurityContext securityContext) {
        this(registry, authenticationChain, permissionStore, securityContext.events());
    }

    SkillInvocationService(SkillRegistry registry,
                           AuthenticationChain authenticationChain,
                           PermissionStore permissionStore,
                           SecurityEventLog events) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.authenticationChain = Objects.requireNonNull(authenticationChain, "authenticationChain");
        this.permissionStore = Objects.requireNonNull(permissionStore, "permissionStore");
        this.events = Objects.requireNonNull(events, "events");
    }

    /**
     * Runs a skill and returns its result.
     *
     * @param principal authenticated, rate-checked caller
     * @param skillName skill to run
     * @param args skill arguments; {@code text} is passed as the utterance
     * @param lifecycle stage tracker, advanced as the request progresses
     * @throws SkillNotFoundException if no such skill is registered
     * @throws PermissionDeniedException if the caller or the skill lacks a permission
     */
    public RouteResult invoke(AuthenticatedPrincipal principal,
                              String skillName,
                              Map<String, Object> args,
                              RequestLifecycle lifecycle) {
        Map<String, Object> safeArgs = args == null ? Map.of() : args;
        lifecycle.advance(RequestStage.RATE_CHECKED);
        try {
            authenticationChain.requirePermission(principal, EXECUTE_PERMISSION);
            Skill skill = registry.find(skillName).orElseThrow(() -> {
                events.record(SecurityEventType.SKILL_NOT_FOUND, Map.of("skill", String.valueOf(skillName)));
                return new SkillNotFoundException(skillName);
            });
            String permission = skill.requiredPermission();
            if (permission != null && !permissionStore.isGranted(permission)) {
                events.record(SecurityEventType.PERMISSION_DENIED, Map.of(
                        "skill", skillName,
                        "required", permission));
                throw new PermissionDeniedException(permission,
                        "Permission '" + permission + "' not granted for skill " + skillName);
            }
            lifecycle.advance(RequestStage.PERMISSION_CHECKED);

            lifecycle.advance(RequestStage.EXECUTING);
            Object text = safeArgs.get(IntentRouter.TEXT_ARG);
            Map<String, Object> result = skill.handle(text == null ? "" : text.toString(), safeArgs);
            lifecycle.advance(RequestStage.COMPLETED);
            LOG.debug("Skill {} completed for {} ({})", skillName, principal.name(), lifecycle.history());
            return new RouteResult(skillName, result);
        } catch (SandboxTimeoutException e) {
            lifecycle.advance(RequestStage.TIMEOUT);
            throw e;
        } catch (RuntimeException e) {
            lifecycle.fail();
            throw e;
        }
    }

    /**
     * Convenience overload with a fresh lifecycle.
     */
    public RouteResult invoke(AuthenticatedPrincipal principal, String skillName, Map<String, Object> args) {
        return invoke(principal, skillName, args, new RequestLifecycle());
    }
}
