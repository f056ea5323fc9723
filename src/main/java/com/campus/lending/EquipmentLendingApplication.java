package com.campus.lending;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class EquipmentLendingApplication {

    public static void main(String[] args) {
        SpringApplication.run(EquipmentLendingApplication.class, args);
    }
}
