package com.mockbuster.server.domain.film;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 대여 카탈로그의 영화 한 편.
 * <p>
 * 카탈로그 데이터는 외부 시드/마이그레이션으로만 관리되며 이 API 에서는 읽기 전용이다.
 * categories, actors 는 조인 테이블에서 유도되는 값이다.
 */
public record Film(
        int filmId,
        String title,
        String description,
        Integer releaseYear,
        int languageId,
        int rentalDuration,
        BigDecimal rentalRate,
        Integer length,
        BigDecimal replacementCost,
        String rating,
        LocalDateTime lastUpdate,
        List<String> specialFeatures,
        List<String> categories,
        List<String> actors
) {
    public Film {
        if (title == null || title.isEmpty()) {
            throw new IllegalArgumentException("film title is required");
        }
        specialFeatures = specialFeatures == null ? List.of() : List.copyOf(specialFeatures);
        categories = categories == null ? List.of() : List.copyOf(categories);
        actors = actors == null ? List.of() : List.copyOf(actors);
    }

    public Film withCategoriesAndActors(List<String> categories, List<String> actors) {
        return new Film(filmId, title, description, releaseYear, languageId, rentalDuration,
                rentalRate, length, replacementCost, rating, lastUpdate, specialFeatures,
                categories, actors);
    }
}
