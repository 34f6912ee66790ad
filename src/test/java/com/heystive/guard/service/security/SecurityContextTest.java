package com.heystive.guard.service.security;

import com.heystive.guard.config.security.SecurityProperties;
import com.heystive.guard.domain.SecurityEvent;
import com.heystive.guard.domain.SecurityEventType;
import com.heystive.guard.testutil.EventCapturingPublisher;
import com.heystive.guard.testutil.MutableClock;
import org.junit.jupiter.api.Test;

import java.security.SecureRandom;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SecurityContextTest {

    @Test
    void generatedKeysAreWellFormedAndPassValidation() {
        ApiKeyGenerator generator = new ApiKeyGenerator(new SecureRandom());

        String key = generator.generate("admin");

        assertThat(key).matches("sk_live_[0-9a-f]{32}");
        assertThat(generator.generate("admin")).isNotEqualTo(key);
    }

    @Test
    void credentialsWithoutKeysStillGetUsableKeys() {
        MutableClock clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
        EventCapturingPublisher publisher = new EventCapturingPublisher();
        SecurityProperties props = new SecurityProperties();

        SecurityContext context = SecurityContext.create(props, clock, publisher);

        assertThat(context.credentialValidator().size()).isEqualTo(4);
        assertThat(context.credentialValidator().validate("sk_demo_safe123heystive456demo").tier())
                .isEqualTo("demo");
    }

    @Test
    void unknownTierFallsBackToDefaultProfile() {
        SecurityProperties props = new SecurityProperties();
        props.getAuth().setCredentials(List.of(
                new SecurityProperties.CredentialEntry("robot", "sk_live_abcdefabcdefabcdef", "robot")));

        SecurityContext context = SecurityContext.create(props,
                MutableClock.startingAt("2025-01-01T00:00:00Z"), null);

        assertThat(context.rateLimiter().profileFor("robot").limit()).isEqualTo(100);
        assertThat(context.credentialValidator().validate("sk_live_abcdefabcdefabcdef").permissions())
                .containsExactly("read");
    }

    @Test
    void blankTokenSecretStillSignsTokens() {
        MutableClock clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
        EventCapturingPublisher publisher = new EventCapturingPublisher();
        SecurityContext context = SecurityContext.create(new SecurityProperties(), clock, publisher);

        String token = context.sessionTokenIssuer().issue("x", "user", List.of("read"));

        assertThat(context.sessionTokenIssuer().validate(token).subject()).isEqualTo("x");
        List<SecurityEvent> issued = publisher.securityEvents(SecurityEventType.TOKEN_ISSUED);
        assertThat(issued).hasSize(1);
    }
}
