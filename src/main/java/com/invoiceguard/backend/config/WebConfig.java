package com.invoiceguard.backend.config;

import java.nio.file.Path;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import lombok.extern.slf4j.Slf4j;

@Configuration
@Slf4j
public class WebConfig {

    @Bean
    public WebMvcConfigurer invoiceGuardWebConfigurer(ForensicsProperties properties) {
        return new WebMvcConfigurer() {
            @Override
            public void addCorsMappings(CorsRegistry registry) {
                registry.addMapping("/api/**")
                        .allowedOrigins("*")
                        .allowedMethods("GET", "POST", "OPTIONS");
            }

            @Override
            public void addResourceHandlers(ResourceHandlerRegistry registry) {
                String prefix = properties.getEla().getPublicResultsPrefix();
                if (prefix == null || prefix.isBlank()) {
                    return;
                }

                String pattern = stripTrailingSlash(prefix.trim()) + "/**";
                String location = Path.of(properties.getEla().getResultsDirectory())
                        .toAbsolutePath()
                        .toUri()
                        .toString();
                if (!location.endsWith("/")) {
                    location = location + "/";
                }
                log.info("[Web] Serving ELA visualizations: pattern='{}' location='{}'", pattern, location);
                registry.addResourceHandler(pattern).addResourceLocations(location);
            }
        };
    }

    private static String stripTrailingSlash(String value) {
        String result = value;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
