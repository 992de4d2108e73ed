package com.prospectpulse.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ProspectPulseApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProspectPulseApplication.class, args);
    }
}
