package com.mdtodo.config;

import com.mdtodo.web.StrictUuidConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer {

    private static final String[] ALLOWED_METHODS = {"GET", "POST", "PUT", "PATCH", "DELETE", "OPTIONS"};

    private final TodoProperties properties;

    @Override
    public void addFormatters(FormatterRegistry registry) {
        registry.addConverter(new StrictUuidConverter());
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        String[] origins = properties.getCors().getAllowedOrigins().toArray(String[]::new);
        log.info("CORS allowed origins: {}", String.join(",", origins));

        for (String path : new String[] {"/api/**", "/health"}) {
            registry.addMapping(path)
                    .allowedOriginPatterns(origins)
                    .allowedMethods(ALLOWED_METHODS)
                    .allowedHeaders("*");
        }
    }
}
