package com.feed.shield.gateway.web;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer {

    private final UsageTrackingInterceptor usageTracking;
    private final RateLimitInterceptor rateLimit;

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        // tracking first so that its afterCompletion also runs for rate-limited requests
        registry.addInterceptor(usageTracking).addPathPatterns("/api/**").excludePathPatterns("/api/admin/**");
        registry.addInterceptor(rateLimit).addPathPatterns("/api/**").excludePathPatterns("/api/admin/**");
    }
}
