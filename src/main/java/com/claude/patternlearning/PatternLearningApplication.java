package com.claude.patternlearning;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PatternLearningApplication {

    public static void main(String[] args) {
        SpringApplication.run(PatternLearningApplication.class, args);
    }
}
