package com.evobus;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class EvolutionBusApplication {

    public static void main(String[] args) {
        SpringApplication.run(EvolutionBusApplication.class, args);
    }
}
