package com.collabnote.backend.global.config;

import java.time.Clock;

import com.collabnote.backend.global.ratelimit.FixedWindowRateLimiter;
import com.collabnote.backend.global.ratelimit.RateLimitInterceptor;
import com.collabnote.backend.global.ratelimit.RateLimitProperties;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

    private final RateLimitProperties rateLimitProperties;
    private final Clock clock;

    public WebMvcConfig(RateLimitProperties rateLimitProperties, Clock clock) {
        this.rateLimitProperties = rateLimitProperties;
        this.clock = clock;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        RateLimitInterceptor interceptor = new RateLimitInterceptor(
                new FixedWindowRateLimiter(clock, rateLimitProperties.window()),
                new FixedWindowRateLimiter(clock, rateLimitProperties.window()),
                rateLimitProperties
        );
        registry.addInterceptor(interceptor)
                .addPathPatterns("/annotations", "/annotations/**", "/replies/**", "/mentions");
    }
}
