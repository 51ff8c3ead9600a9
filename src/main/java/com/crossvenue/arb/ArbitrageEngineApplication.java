package com.crossvenue.arb;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class ArbitrageEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(ArbitrageEngineApplication.class, args);
    }
}
