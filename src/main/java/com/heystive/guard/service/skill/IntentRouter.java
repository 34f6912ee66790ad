package com.heystive.guard.service.skill;

import com.heystive.guard.domain.PlanStep;
import com.heystive.guard.domain.RouteResult;
import com.heystive.guard.domain.SecurityEventType;
import com.heystive.guard.domain.StepResult;
import com.heystive.guard.exception.SkillNotFoundException;
import com.heystive.guard.service.security.SecurityContext;
import com.heystive.guard.service.security.SecurityEventLog;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Maps free text to a skill and runs multi-step plans.
 */
@Service
public class IntentRouter {

    private static final Logger LOG = LogManager.getLogger(IntentRouter.class);

    /** Plan argument carrying the utterance passed to {@link Skill#handle}. */
    static final String TEXT_ARG = "text";

    private final SkillRegistry registry;
    private final SecurityEventLog events;

    @Autowired
    public IntentRouter(SkillRegistry registry, SecurityContext securityContext) {
        this(registry, securityContext.events());
    }

    IntentRouter(SkillRegistry registry, SecurityEventLog events) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.events = Objects.requireNonNull(events, "events");
    }

    /**
     * Hands the text to the first skill, in priority order, that claims it.
     *
     * @return the handling skill and its result, or the fallback result when none matches
     */
    public RouteResult route(String text) {
        String utterance = text == null ? "" : text.strip();
        for (Skill skill : registry.skills()) {
            if (skill.canHandle(utterance)) {
                LOG.debug("Routed utterance to skill {}", skill.name());
                return new RouteResult(skill.name(), skill.handle(utterance, Map.of()));
            }
        }
        return RouteResult.fallback();
    }

    /**
     * Runs each step in order. A failing step is recorded as an error and the remaining
     * steps still run; the result list always has one entry per step.
     */
    public List<StepResult> executePlan(List<PlanStep> steps) {
        if (steps == null) {
            return List.of();
        }
        List<StepResult> results = new ArrayList<>(steps.size());
        for (PlanStep step : steps) {
            results.add(runStep(step));
        }
        long failed = results.stream().filter(r -> !r.isSuccess()).count();
        LOG.info("Executed plan of {} step(s), {} failed", results.size(), failed);
        return results;
    }

    private StepResult runStep(PlanStep step) {
        if (step == null) {
            LOG.warn("Plan step is null");
            return StepResult.failure(null, new IllegalArgumentException("Plan step must not be null"));
        }
        try {
            Skill skill = registry.find(step.skill())
                    .orElseThrow(() -> new SkillNotFoundException(step.skill()));
            Object text = step.args().get(TEXT_ARG);
            return StepResult.success(step, skill.handle(text == null ? "" : text.toString(), step.args()));
        } catch (SkillNotFoundException e) {
            events.record(SecurityEventType.SKILL_NOT_FOUND, Map.of("skill", String.valueOf(step.skill())));
            return StepResult.failure(step, e);
        } catch (RuntimeException e) {
            LOG.warn("Plan step {} failed: {}", step.skill(), e.getMessage());
            return StepResult.failure(step, e);
        }
    }
}
