package com.mockbuster.server.domain.film;

public record Category(int categoryId, String name) {}
