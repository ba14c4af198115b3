package com.automation.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * Main application entry point for the event automation service.
 */
@SpringBootApplication
@ComponentScan(basePackages = {
    "com.automation.api",
    "com.automation.engine"
})
public class AutomationApplication {

    public static void main(String[] args) {
        SpringApplication.run(AutomationApplication.class, args);
    }
}
