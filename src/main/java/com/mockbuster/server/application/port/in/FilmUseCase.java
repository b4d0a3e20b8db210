package com.mockbuster.server.application.port.in;

import com.mockbuster.server.domain.film.Category;
import com.mockbuster.server.domain.film.Film;
import com.mockbuster.server.domain.film.FilmFilters;
import com.mockbuster.server.domain.film.FilmPage;

import java.util.List;

/**
 * 영화 카탈로그 조회 Use Case
 */
public interface FilmUseCase {

    /**
     * 필터/페이지 조건으로 영화 목록 조회.
     * page 는 1 이상, limit 은 1~100, rating 은 G/PG/PG-13/R/NC-17 중 하나여야 한다.
     */
    FilmPage getFilms(FilmFilters filters);

    /**
     * 영화 상세 조회. 없으면 {@link com.mockbuster.server.domain.film.FilmNotFoundException}
     */
    Film getFilmById(int filmId);

    List<Category> getCategories();
}
