package com.focusstack;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FocusStackApplication {

    public static void main(String[] args) {
        SpringApplication.run(FocusStackApplication.class, args);
    }
}
