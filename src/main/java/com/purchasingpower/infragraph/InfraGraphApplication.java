package com.purchasingpower.infragraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class InfraGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(InfraGraphApplication.class, args);
    }
}
