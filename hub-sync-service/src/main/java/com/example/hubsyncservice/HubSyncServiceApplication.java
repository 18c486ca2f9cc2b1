package com.example.hubsyncservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class HubSyncServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(HubSyncServiceApplication.class, args);
    }
}
