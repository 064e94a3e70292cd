package com.sharedsolve;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SharedSolveApplication {

    public static void main(String[] args) {
        SpringApplication.run(SharedSolveApplication.class, args);
    }
}
