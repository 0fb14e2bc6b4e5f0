package com.example.cloudmedia.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "app.api")
public class ApiProperties {

    private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:4200"));

    private boolean exposeErrorDetails = false;

    public List<String> getAllowedOrigins() {
        return allowedOrigins;
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
        this.allowedOrigins = allowedOrigins;
    }

    public boolean isExposeErrorDetails() {
        return exposeErrorDetails;
    }

    public void setExposeErrorDetails(boolean exposeErrorDetails) {
        this.exposeErrorDetails = exposeErrorDetails;
    }
}
