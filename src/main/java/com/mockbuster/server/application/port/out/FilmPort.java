package com.mockbuster.server.application.port.out;

import com.mockbuster.server.domain.film.Category;
import com.mockbuster.server.domain.film.Film;
import com.mockbuster.server.domain.film.FilmFilters;
import com.mockbuster.server.domain.film.FilmPage;

import java.util.List;

public interface FilmPort {

    FilmPage getFilms(FilmFilters filters);

    /**
     * @throws com.mockbuster.server.domain.film.FilmNotFoundException 해당 id 의 영화가 없을 때
     */
    Film getFilmById(int filmId);

    List<Category> getCategories();
}
