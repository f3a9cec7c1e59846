package com.collab.sync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CollabSyncApplication {
    public static void main(String[] args) {
        SpringApplication.run(CollabSyncApplication.class, args);
    }
}
