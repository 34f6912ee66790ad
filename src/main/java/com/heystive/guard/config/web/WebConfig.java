package com.heystive.guard.config.web;

import com.heystive.guard.presentation.security.ApiKeyAuthenticationInterceptor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Puts every {@code /api/**} endpoint behind the authentication chain. {@code /ping} and
 * the actuator endpoints stay public.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final ApiKeyAuthenticationInterceptor authenticationInterceptor;

    public WebConfig(ApiKeyAuthenticationInterceptor authenticationInterceptor) {
        this.authenticationInterceptor = authenticationInterceptor;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(authenticationInterceptor).addPathPatterns("/api/**");
    }
}
