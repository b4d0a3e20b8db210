package com.mockbuster.server.web.film.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.mockbuster.server.domain.film.Film;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

public record FilmResponse(
        @JsonProperty("film_id") int filmId,
        String title,
        @JsonInclude(JsonInclude.Include.NON_NULL) String description,
        @JsonProperty("release_year") @JsonInclude(JsonInclude.Include.NON_NULL) Integer releaseYear,
        @JsonProperty("language_id") int languageId,
        @JsonProperty("rental_duration") int rentalDuration,
        @JsonProperty("rental_rate") BigDecimal rentalRate,
        @JsonInclude(JsonInclude.Include.NON_NULL) Integer length,
        @JsonProperty("replacement_cost") BigDecimal replacementCost,
        String rating,
        @JsonProperty("last_update") LocalDateTime lastUpdate,
        @JsonProperty("special_features") @JsonInclude(JsonInclude.Include.NON_EMPTY) List<String> specialFeatures,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) List<String> categories,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) List<String> actors
) {
    public static FilmResponse from(Film film) {
        return new FilmResponse(
                film.filmId(),
                film.title(),
                film.description(),
                film.releaseYear(),
                film.languageId(),
                film.rentalDuration(),
                film.rentalRate(),
                film.length(),
                film.replacementCost(),
                film.rating(),
                film.lastUpdate(),
                film.specialFeatures(),
                film.categories(),
                film.actors()
        );
    }
}
