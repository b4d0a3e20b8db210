package com.mockbuster.server.infrastructure.persistence.film;

import com.mockbuster.server.application.port.out.FilmPort;
import com.mockbuster.server.domain.common.exception.DatabaseException;
import com.mockbuster.server.domain.film.Category;
import com.mockbuster.server.domain.film.Film;
import com.mockbuster.server.domain.film.FilmFilters;
import com.mockbuster.server.domain.film.FilmNotFoundException;
import com.mockbuster.server.domain.film.FilmPage;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.function.Supplier;

/**
 * dvdrental 스키마(film, category, actor 및 조인 테이블) 조회 어댑터.
 * 동적 WHERE 절이 필요해 JPA 대신 NamedParameterJdbcTemplate 을 사용한다.
 */
@Repository
@RequiredArgsConstructor
public class FilmJdbcAdapter implements FilmPort {

    private static final String FILM_BY_ID_SQL = "SELECT " + FilmSearchQuery.FILM_COLUMNS
            + " FROM film f WHERE f.film_id = :filmId";

    private static final String FILM_CATEGORIES_SQL = """
            SELECT c.name
            FROM category c
            JOIN film_category fc ON c.category_id = fc.category_id
            WHERE fc.film_id = :filmId
            ORDER BY c.name
            """;

    private static final String FILM_ACTORS_SQL = """
            SELECT a.first_name || ' ' || a.last_name AS actor_name
            FROM actor a
            JOIN film_actor fa ON a.actor_id = fa.actor_id
            WHERE fa.film_id = :filmId
            ORDER BY a.last_name, a.first_name
            """;

    private static final String CATEGORIES_SQL = "SELECT category_id, name FROM category ORDER BY name";

    private static final FilmRowMapper FILM_ROW_MAPPER = new FilmRowMapper();

    private final NamedParameterJdbcTemplate jdbc;

    @Override
    public FilmPage getFilms(FilmFilters filters) {
        FilmFilters normalized = filters.withDefaultPagination();
        FilmSearchQuery query = FilmSearchQuery.of(normalized);

        List<Film> films = execute("error querying films",
                () -> jdbc.query(query.selectSql(), query.selectParams(), FILM_ROW_MAPPER))
                .stream()
                .map(this::withCategoriesAndActors)
                .toList();

        Long total = execute("error counting films",
                () -> jdbc.queryForObject(query.countSql(), query.countParams(), Long.class));

        return new FilmPage(films, total == null ? 0 : total.intValue(), normalized.page(), normalized.limit());
    }

    @Override
    public Film getFilmById(int filmId) {
        List<Film> found = execute("error querying film",
                () -> jdbc.query(FILM_BY_ID_SQL, filmIdParam(filmId), FILM_ROW_MAPPER));

        if (found.isEmpty()) {
            throw new FilmNotFoundException(filmId);
        }
        return withCategoriesAndActors(found.get(0));
    }

    @Override
    public List<Category> getCategories() {
        return execute("error querying categories",
                () -> jdbc.query(CATEGORIES_SQL,
                        (rs, rowNum) -> new Category(rs.getInt("category_id"), rs.getString("name"))));
    }

    private Film withCategoriesAndActors(Film film) {
        List<String> categories = execute("error querying film categories",
                () -> jdbc.queryForList(FILM_CATEGORIES_SQL, filmIdParam(film.filmId()), String.class));
        List<String> actors = execute("error querying film actors",
                () -> jdbc.queryForList(FILM_ACTORS_SQL, filmIdParam(film.filmId()), String.class));
        return film.withCategoriesAndActors(categories, actors);
    }

    private static MapSqlParameterSource filmIdParam(int filmId) {
        return new MapSqlParameterSource("filmId", filmId);
    }

    private static <T> T execute(String context, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new DatabaseException(context, e);
        }
    }
}
