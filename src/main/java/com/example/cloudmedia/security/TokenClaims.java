package com.example.cloudmedia.security;

public record TokenClaims(String subjectId, String email) {
}
