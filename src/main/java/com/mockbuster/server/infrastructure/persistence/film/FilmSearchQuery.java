package com.mockbuster.server.infrastructure.persistence.film;

import com.mockbuster.server.domain.film.FilmFilters;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

/**
 * 영화 목록/건수 조회 SQL 을 필터 조건에 따라 조립한다.
 * <p>
 * 목록 쿼리와 건수 쿼리는 같은 WHERE 절을 공유하며, 건수 쿼리에는 LIMIT/OFFSET 이 붙지 않는다.
 * 값은 모두 named parameter 로 바인딩한다.
 */
final class FilmSearchQuery {

    static final String FILM_COLUMNS = """
            f.film_id, f.title, f.description, f.release_year,
            f.language_id, f.rental_duration, f.rental_rate, f.length,
            f.replacement_cost, CAST(f.rating AS text) AS rating, f.last_update,
            CAST(f.special_features AS text) AS special_features
            """;

    private static final String FROM_CLAUSE = """
            FROM film f
            LEFT JOIN film_category fc ON f.film_id = fc.film_id
            LEFT JOIN category c ON fc.category_id = c.category_id
            WHERE 1=1
            """;

    private final String whereClause;
    private final MapSqlParameterSource filterParams;
    private final int limit;
    private final long offset;

    private FilmSearchQuery(String whereClause, MapSqlParameterSource filterParams, int limit, long offset) {
        this.whereClause = whereClause;
        this.filterParams = filterParams;
        this.limit = limit;
        this.offset = offset;
    }

    /**
     * @param filters 페이지 값이 정규화된 조건 (page >= 1, limit >= 1)
     */
    static FilmSearchQuery of(FilmFilters filters) {
        StringBuilder where = new StringBuilder();
        MapSqlParameterSource params = new MapSqlParameterSource();

        if (filters.hasTitle()) {
            where.append(" AND f.title ILIKE :title");
            params.addValue("title", "%" + filters.title() + "%");
        }
        if (filters.hasRating()) {
            // mpaa_rating enum 컬럼과 varchar 파라미터 비교를 위해 text 로 캐스팅
            where.append(" AND CAST(f.rating AS text) = :rating");
            params.addValue("rating", filters.rating());
        }
        if (filters.hasCategory()) {
            where.append(" AND c.name ILIKE :category");
            params.addValue("category", "%" + filters.category() + "%");
        }

        return new FilmSearchQuery(where.toString(), params, filters.limit(), filters.offset());
    }

    String selectSql() {
        return "SELECT DISTINCT " + FILM_COLUMNS + FROM_CLAUSE + whereClause
                + " ORDER BY f.title LIMIT :limit OFFSET :offset";
    }

    MapSqlParameterSource selectParams() {
        MapSqlParameterSource params = new MapSqlParameterSource(filterParams.getValues());
        params.addValue("limit", limit);
        params.addValue("offset", offset);
        return params;
    }

    String countSql() {
        return "SELECT COUNT(DISTINCT f.film_id) " + FROM_CLAUSE + whereClause;
    }

    MapSqlParameterSource countParams() {
        return new MapSqlParameterSource(filterParams.getValues());
    }
}
