package com.engagewatch.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * EngageWatch application entry point.
 */
@SpringBootApplication
@ComponentScan(basePackages = "com.engagewatch")
public class EngageWatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(EngageWatchApplication.class, args);
    }
}
