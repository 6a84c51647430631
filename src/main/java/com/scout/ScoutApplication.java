package com.scout;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ScoutApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScoutApplication.class, args);
    }
}
