package com.example.clipscore_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ClipscoreBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClipscoreBackendApplication.class, args);
    }
}
