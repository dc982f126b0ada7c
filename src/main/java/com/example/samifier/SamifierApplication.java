package com.example.samifier;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SamifierApplication {

    public static void main(String[] args) {
        SpringApplication.run(SamifierApplication.class, args);
    }
}
