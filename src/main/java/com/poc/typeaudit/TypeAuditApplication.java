package com.poc.typeaudit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TypeAuditApplication {

    public static void main(String[] args) {
        SpringApplication.run(TypeAuditApplication.class, args);
    }
}
