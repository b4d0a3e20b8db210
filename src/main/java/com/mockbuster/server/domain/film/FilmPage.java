package com.mockbuster.server.domain.film;

import java.util.List;

/**
 * 필터에 맞는 영화 한 페이지와 전체 건수(페이지와 무관)
 */
public record FilmPage(
        List<Film> films,
        int total,
        int page,
        int limit
) {
    public FilmPage {
        films = films == null ? List.of() : List.copyOf(films);
    }
}
