package com.example.livesession;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LiveSessionApplication {

    public static void main(String[] args) {
        SpringApplication.run(LiveSessionApplication.class, args);
    }
}
