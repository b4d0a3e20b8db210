package com.mockbuster.server.web.film.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mockbuster.server.domain.film.Category;

public record CategoryResponse(
        @JsonProperty("category_id") int categoryId,
        String name
) {
    public static CategoryResponse from(Category category) {
        return new CategoryResponse(category.categoryId(), category.name());
    }
}
