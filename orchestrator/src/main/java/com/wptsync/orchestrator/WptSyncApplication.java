package com.wptsync.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class WptSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(WptSyncApplication.class, args);
    }
}
