package com.convsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ConvSyncApplication {
    public static void main(String[] args) {
        SpringApplication.run(ConvSyncApplication.class, args);
    }
}
