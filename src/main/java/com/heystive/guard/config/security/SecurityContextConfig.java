package com.heystive.guard.config.security;

import com.heystive.guard.service.security.SecurityContext;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the process-wide {@link SecurityContext}.
 *
 * <p>The {@link Clock} bean is overridable so tests can drive window and expiry logic
 * with a controllable time source.
 */
@Configuration
public class SecurityContextConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SecurityContext securityContext(SecurityProperties properties,
                                           Clock clock,
                                           ApplicationEventPublisher publisher) {
        return SecurityContext.create(properties, clock, publisher);
    }
}
