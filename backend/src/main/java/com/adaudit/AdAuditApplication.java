package com.adaudit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AdAuditApplication {

    public static void main(String[] args) {
        SpringApplication.run(AdAuditApplication.class, args);
    }
}
