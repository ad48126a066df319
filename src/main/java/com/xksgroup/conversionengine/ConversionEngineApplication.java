package com.xksgroup.conversionengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ConversionEngineApplication {
    public static void main(String[] args) {
        SpringApplication.run(ConversionEngineApplication.class, args);
    }
}
