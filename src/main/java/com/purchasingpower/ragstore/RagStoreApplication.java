package com.purchasingpower.ragstore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RagStoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(RagStoreApplication.class, args);
    }
}
