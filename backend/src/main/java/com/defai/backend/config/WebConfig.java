package com.defai.backend.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.web.servlet.config.annotation.CorsRegistration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

@Configuration
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer {

    private final OracleProperties properties;
    private final RateLimitInterceptor rateLimitInterceptor;
    private final Environment environment;

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(rateLimitInterceptor)
                .addPathPatterns("/api/**")
                .excludePathPatterns("/api/v1/rate-limit/stats");
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        CorsRegistration cors = registry.addMapping("/api/**")
                .allowedMethods(properties.getCors().getAllowedMethods().toArray(new String[0]))
                .allowedHeaders("*")
                .exposedHeaders(RateLimitInterceptor.LIMIT_HEADER, RateLimitInterceptor.REMAINING_HEADER,
                        RateLimitInterceptor.RESET_HEADER, "Retry-After")
                .maxAge(3600);

        if (isProd()) {
            List<String> origins = properties.getCors().getAllowedOrigins();
            cors.allowedOrigins(origins.toArray(new String[0]));
        } else {
            cors.allowedOriginPatterns("*");
        }
    }

    private boolean isProd() {
        for (String profile : environment.getActiveProfiles()) {
            if ("prod".equalsIgnoreCase(profile) || "production".equalsIgnoreCase(profile)) {
                return true;
            }
        }
        return false;
    }
}
