package com.skyreader.sync.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.skyreader.sync")
public class SkyreaderSyncApplication {
    public static void main(String[] args) {
        SpringApplication.run(SkyreaderSyncApplication.class, args);
    }
}
