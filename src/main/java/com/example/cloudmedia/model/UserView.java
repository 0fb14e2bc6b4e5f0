package com.example.cloudmedia.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class UserView {

    String id;
    String username;
    String email;
    Instant createdAt;
}
