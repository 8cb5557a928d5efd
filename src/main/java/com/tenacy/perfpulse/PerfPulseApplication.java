package com.tenacy.perfpulse;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PerfPulseApplication {

    public static void main(String[] args) {
        SpringApplication.run(PerfPulseApplication.class, args);
    }
}
