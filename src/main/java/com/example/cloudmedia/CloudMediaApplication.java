package com.example.cloudmedia;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CloudMediaApplication {

    public static void main(String[] args) {
        SpringApplication.run(CloudMediaApplication.class, args);
    }
}
