package com.herzen.unlock;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class UnlockGraphApplication {
    public static void main(String[] args) {
        SpringApplication.run(UnlockGraphApplication.class, args);
    }
}
