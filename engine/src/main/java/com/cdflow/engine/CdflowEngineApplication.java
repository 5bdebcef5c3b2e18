package com.cdflow.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CdflowEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(CdflowEngineApplication.class, args);
    }
}
