package com.safeher.sosdispatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main Spring Boot Application Class
 * SOS Alert Dispatch & Volunteer Matching Engine
 */
@SpringBootApplication
public class SosDispatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(SosDispatchApplication.class, args);
    }

}
