package com.example.cloudmedia.persistence;

import java.util.Optional;

public record CreateResult<T>(Status status, T value) {

    public enum Status {
        CREATED,
        ALREADY_EXISTS
    }

    public static <T> CreateResult<T> created(T value) {
        return new CreateResult<>(Status.CREATED, value);
    }

    public static <T> CreateResult<T> alreadyExists() {
        return new CreateResult<>(Status.ALREADY_EXISTS, null);
    }

    public boolean isCreated() {
        return status == Status.CREATED;
    }

    public Optional<T> createdValue() {
        return isCreated() ? Optional.of(value) : Optional.empty();
    }
}
