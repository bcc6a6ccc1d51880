package com.prudhvi.vlm_relay.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Lets browser dashboards served from another origin read the status endpoints.
 *
 * Defaults to any origin. Set CORS_ALLOWED_ORIGIN to lock it down to the
 * dashboard's URL in production.
 */
@Configuration
public class CorsConfig implements WebMvcConfigurer {

    @Value("${cors.allowed-origin:*}")
    private String allowedOrigin;

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
                .allowedOriginPatterns(allowedOrigin)
                .allowedMethods("GET", "OPTIONS");
    }
}
