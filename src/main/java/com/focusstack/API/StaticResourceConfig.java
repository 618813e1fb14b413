package com.focusstack.API;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Paths;

@Configuration
public class StaticResourceConfig implements WebMvcConfigurer {

    @Value("${focusstack.output-dir:src/main/resources/stack}")
    private String outputDir;

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        // Serve ảnh kết quả tại /stack/** → từ thư mục output
        String location = "file:" + Paths.get(outputDir).toAbsolutePath() + "/";
        registry.addResourceHandler("/stack/**")
                .addResourceLocations(location);
    }
}
