package com.mobilebackup.importer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BackupImporterApplication {

    public static void main(String[] args) {
        SpringApplication.run(BackupImporterApplication.class, args);
    }
}
