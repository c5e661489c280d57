package com.adlanda.perema.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Path;

/**
 * Serves uploaded photos from the photo directory.
 *
 * Registers {@link PhotoProperties} itself so that web slice tests, which skip
 * component scanning, still get the handler.
 */
@Configuration
@EnableConfigurationProperties(PhotoProperties.class)
public class WebConfig implements WebMvcConfigurer {

    private final PhotoProperties photoProperties;

    public WebConfig(PhotoProperties photoProperties) {
        this.photoProperties = photoProperties;
    }

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        String location = Path.of(photoProperties.getDirectory()).toAbsolutePath().normalize().toUri().toString();
        registry.addResourceHandler(photoProperties.getUrlPrefix() + "/**")
                .addResourceLocations(location.endsWith("/") ? location : location + "/");
    }
}
