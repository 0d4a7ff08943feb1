package com.compliancescan;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ComplianceScanApplication {

    public static void main(String[] args) {
        SpringApplication.run(ComplianceScanApplication.class, args);
    }
}
