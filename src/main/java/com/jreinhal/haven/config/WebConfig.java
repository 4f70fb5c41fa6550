package com.jreinhal.haven.config;

import com.jreinhal.haven.security.PermissionInterceptor;
import com.jreinhal.haven.storage.FileStorageService;
import jakarta.annotation.PostConstruct;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * CORS, the permission interceptor and the upload resource handler.
 *
 * Configuration:
 * - app.cors.allowed-origins: comma-separated list of allowed origins
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private static final Logger log = LoggerFactory.getLogger(WebConfig.class);

    private final PermissionInterceptor permissionInterceptor;
    private final FileStorageService fileStorageService;

    @Value("${app.cors.allowed-origins:http://localhost:3000}")
    private String[] allowedOrigins;

    public WebConfig(PermissionInterceptor permissionInterceptor, FileStorageService fileStorageService) {
        this.permissionInterceptor = permissionInterceptor;
        this.fileStorageService = fileStorageService;
    }

    @PostConstruct
    public void validateCorsConfiguration() {
        if (Arrays.asList(allowedOrigins).contains("*")) {
            log.error("=================================================================");
            log.error("  SECURITY WARNING: CORS wildcard (*) configured!");
            log.error("  Set app.cors.allowed-origins to explicit domains.");
            log.error("=================================================================");
        }
        log.info("CORS allowed origins: {}", Arrays.toString(allowedOrigins));
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(permissionInterceptor).addPathPatterns("/api/**");
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOrigins(allowedOrigins)
                .allowedMethods("GET", "POST", "PATCH", "DELETE", "OPTIONS")
                .allowedHeaders("Authorization", "Content-Type", "Accept", "Origin", "X-Requested-With", "X-Correlation-Id")
                .exposedHeaders("X-Correlation-Id")
                .allowCredentials(false)
                .maxAge(3600);
    }

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        String location = fileStorageService.getRoot().toUri().toString();
        registry.addResourceHandler("/uploads/**").addResourceLocations(location.endsWith("/") ? location : location + "/");
    }
}
