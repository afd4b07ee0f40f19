package com.handelsregister.scraper.web;

import com.handelsregister.scraper.service.api.CallerRateLimiter;
import com.handelsregister.scraper.service.api.ServiceTokenService;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Registers the token and rate-limit guard on the search endpoint.
 */
@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

    private final ServiceTokenService tokens;

    private final CallerRateLimiter limiter;

    @Override
    public void addInterceptors(final InterceptorRegistry registry) {
        registry.addInterceptor(new ServiceTokenInterceptor(tokens, limiter))
                .addPathPatterns("/api/search", "/api/search/**");
    }
}
