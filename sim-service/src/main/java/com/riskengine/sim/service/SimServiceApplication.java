package com.riskengine.sim.service;

import com.riskengine.sim.config.SimProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication(scanBasePackages = "com.riskengine.sim")
@EnableConfigurationProperties(SimProperties.class)
public class SimServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(SimServiceApplication.class, args);
    }
}
