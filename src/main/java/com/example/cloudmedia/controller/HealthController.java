package com.example.cloudmedia.controller;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class HealthController {

    static final String SERVICE_NAME = "Cloud Media Platform API";
    static final String VERSION = "1.0.0";

    @GetMapping("/health")
    public HealthResponse health() {
        return new HealthResponse("healthy", SERVICE_NAME, VERSION);
    }

    public record HealthResponse(String status, String service, String version) {
    }
}
