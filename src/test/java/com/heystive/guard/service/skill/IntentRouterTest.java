package com.heystive.guard.service.skill;

import com.heystive.guard.domain.PlanStep;
import com.heystive.guard.domain.RouteResult;
import com.heystive.guard.domain.SecurityEventType;
import com.heystive.guard.domain.StepResult;
import com.heystive.guard.service.security.SecurityEventLog;
import com.heystive.guard.service.skill.builtin.CalcSkill;
import com.heystive.guard.testutil.EventCapturingPublisher;
import com.heystive.guard.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class IntentRouterTest {

    private EventCapturingPublisher publisher;
    private StubSkill greet;
    private StubSkill greedy;
    private IntentRouter router;

    @BeforeEach
    void setUp() {
        publisher = new EventCapturingPublisher();
        greet = StubSkill.claiming("greet", "hello");
        greedy = StubSkill.claiming("greedy", "");
        SkillRegistry registry = new SkillRegistry(
                List.of(greet, greedy, StubSkill.failing("broken", new IllegalStateException("boom"))),
                List::of);
        router = new IntentRouter(registry,
                new SecurityEventLog(100, MutableClock.startingAt("2025-01-01T00:00:00Z"), publisher));
    }

    @Test
    void firstClaimingSkillWins() {
        RouteResult result = router.route("  hello there ");

        assertThat(result.skill()).isEqualTo("greet");
        assertThat(result.result()).containsEntry("text", "hello there");
        assertThat(greedy.handled).isEmpty();
    }

    @Test
    void laterSkillHandlesWhatEarlierOnesDecline() {
        assertThat(router.route("weather tomorrow").skill()).isEqualTo("greedy");
    }

    @Test
    void noClaimYieldsFallback() {
        IntentRouter empty = new IntentRouter(new SkillRegistry(List.of(), List::of),
                new SecurityEventLog(10, MutableClock.startingAt("2025-01-01T00:00:00Z"), null));

        RouteResult result = empty.route("anything");

        assertThat(result.isFallback()).isTrue();
        assertThat(result.skill()).isEqualTo(RouteResult.FALLBACK);
    }

    @Test
    void planRunsEveryStepEvenAfterFailure() {
        List<StepResult> results = router.executePlan(List.of(
                new PlanStep("greet", Map.of("text", "hello one")),
                new PlanStep("broken", Map.of()),
                new PlanStep("greedy", Map.of("text", "three", "extra", 1))));

        assertThat(results).hasSize(3);
        assertThat(results.get(0).isSuccess()).isTrue();
        assertThat(results.get(0).result()).containsEntry("text", "hello one");
        assertThat(results.get(1).status()).isEqualTo(StepResult.Status.ERROR);
        assertThat(results.get(1).error()).isEqualTo("boom");
        assertThat(results.get(1).errorType()).isEqualTo("IllegalStateException");
        assertThat(results.get(1).result()).isNull();
        assertThat(results.get(2).isSuccess()).isTrue();
        assertThat(results.get(2).result()).containsEntry("argCount", 2);
    }

    @Test
    void unknownSkillInPlanIsRecorded() {
        List<StepResult> results = router.executePlan(List.of(new PlanStep("ghost", null)));

        assertThat(results).singleElement().satisfies(r -> {
            assertThat(r.isSuccess()).isFalse();
            assertThat(r.errorType()).isEqualTo("SkillNotFoundException");
            assertThat(r.args()).isEmpty();
        });
        assertThat(publisher.securityEvents(SecurityEventType.SKILL_NOT_FOUND))
                .singleElement()
                .satisfies(e -> assertThat(e.details()).containsEntry("skill", "ghost"));
    }

    @Test
    void emptyPlanYieldsNoResults() {
        assertThat(router.executePlan(List.of())).isEmpty();
    }

    @Test
    void nullStepBecomesErrorEntryAndPlanContinues() {
        List<StepResult> results = router.executePlan(Arrays.asList(
                new PlanStep("greet", Map.of("text", "hello")),
                null,
                new PlanStep("greedy", Map.of())));

        assertThat(results).hasSize(3);
        assertThat(results.get(1).status()).isEqualTo(StepResult.Status.ERROR);
        assertThat(results.get(1).skill()).isNull();
        assertThat(results.get(1).args()).isEmpty();
        assertThat(results.get(1).errorType()).isEqualTo("IllegalArgumentException");
        assertThat(results.get(2).isSuccess()).isTrue();
    }

    @Test
    void pathologicalCalcStepFailsAloneWithoutLosingThePlan() {
        IntentRouter calcRouter = new IntentRouter(new SkillRegistry(List.of(new CalcSkill()), List::of),
                new SecurityEventLog(10, MutableClock.startingAt("2025-01-01T00:00:00Z"), publisher));
        String deep = "(".repeat(50_000) + "1+1" + ")".repeat(50_000);
        String nested = "(".repeat(500) + "1+1" + ")".repeat(500);

        List<StepResult> results = calcRouter.executePlan(List.of(
                new PlanStep("calc", Map.of("expression", "1+1")),
                new PlanStep("calc", Map.of("expression", deep)),
                new PlanStep("calc", Map.of("expression", nested)),
                new PlanStep("calc", Map.of("expression", "6*7"))));

        assertThat(results).hasSize(4);
        assertThat(results.get(0).result()).containsEntry("result", 2L);
        assertThat(results.get(1).errorType()).isEqualTo("IllegalArgumentException");
        assertThat(results.get(2).errorType()).isEqualTo("IllegalArgumentException");
        assertThat(results.get(3).result()).containsEntry("result", 42L);
    }

    @Test
    void missingPlanYieldsNoResults() {
        assertThat(router.executePlan(null)).isEmpty();
    }
}
