package com.delta.autoapply.run.api;

import com.delta.autoapply.config.AutoApplyProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Paths;

/**
 * Serves run screenshots under {@code /files/**}.
 */
@Configuration
public class FilesResourceConfig implements WebMvcConfigurer {
    private final AutoApplyProperties properties;

    public FilesResourceConfig(AutoApplyProperties properties) {
        this.properties = properties;
    }

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        String location = Paths.get(properties.getFilesDir()).toAbsolutePath().normalize().toUri().toString();
        registry.addResourceHandler("/files/**")
            .addResourceLocations(location.endsWith("/") ? location : location + "/");
    }
}
