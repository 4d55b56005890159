package com.agriguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan(basePackages = "com.agriguard.config")
public class AgriGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgriGuardApplication.class, args);
    }
}
