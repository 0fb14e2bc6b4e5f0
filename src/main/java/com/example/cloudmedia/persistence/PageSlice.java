package com.example.cloudmedia.persistence;

import java.util.List;

public record PageSlice<T>(List<T> items, long total) {
}
