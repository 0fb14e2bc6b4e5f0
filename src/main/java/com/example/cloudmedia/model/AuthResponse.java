package com.example.cloudmedia.model;

public record AuthResponse(String token, UserView user) {
}
