package com.ivamare.auditstore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.SpringBootConfiguration;
import org.springframework.boot.autoconfigure.EnableAutoConfiguration;

/**
 * Standalone audit store service. All beans come from the auto-configurations.
 */
@SpringBootConfiguration
@EnableAutoConfiguration
public class AuditStoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(AuditStoreApplication.class, args);
    }
}
