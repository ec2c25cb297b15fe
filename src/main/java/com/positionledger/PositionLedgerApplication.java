package com.positionledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PositionLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PositionLedgerApplication.class, args);
    }
}
