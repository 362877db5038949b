package com.lastchair;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LastChairApplication {
    public static void main(String[] args) {
        SpringApplication.run(LastChairApplication.class, args);
    }
}
