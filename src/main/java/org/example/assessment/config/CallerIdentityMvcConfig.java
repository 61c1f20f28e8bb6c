package org.example.assessment.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class CallerIdentityMvcConfig implements WebMvcConfigurer {

    private final CallerIdentityInterceptor callerIdentityInterceptor;

    public CallerIdentityMvcConfig(CallerIdentityInterceptor callerIdentityInterceptor) {
        this.callerIdentityInterceptor = callerIdentityInterceptor;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(callerIdentityInterceptor)
                .addPathPatterns("/api/**");
    }
}
