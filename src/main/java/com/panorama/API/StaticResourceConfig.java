package com.panorama.API;

import com.panorama.config.StitchingProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Paths;

@Configuration
public class StaticResourceConfig implements WebMvcConfigurer {
    private final StitchingProperties properties;

    public StaticResourceConfig(StitchingProperties properties) {
        this.properties = properties;
    }

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        // Stitched panoramas at /stitch/** from the output directory
        String location = Paths.get(properties.getStorage().getOutputDir()).toAbsolutePath().toUri().toString();
        registry.addResourceHandler("/stitch/**")
                .addResourceLocations(location.endsWith("/") ? location : location + "/");
    }
}
