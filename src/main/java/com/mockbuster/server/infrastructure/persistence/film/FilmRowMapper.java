package com.mockbuster.server.infrastructure.persistence.film;

import com.mockbuster.server.domain.film.Film;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

/**
 * film 행 → {@link Film}. categories/actors 는 비워두고 어댑터에서 채운다.
 */
class FilmRowMapper implements RowMapper<Film> {

    @Override
    public Film mapRow(ResultSet rs, int rowNum) throws SQLException {
        int filmId = rs.getInt("film_id");
        String title = rs.getString("title");
        // 저장된 데이터 결함이므로 요청 오류가 아닌 조회 실패로 올린다
        if (title == null || title.isEmpty()) {
            throw new DataRetrievalFailureException("film " + filmId + " has no title");
        }

        return new Film(
                filmId,
                title,
                rs.getString("description"),
                rs.getObject("release_year", Integer.class),
                rs.getInt("language_id"),
                rs.getInt("rental_duration"),
                rs.getBigDecimal("rental_rate"),
                rs.getObject("length", Integer.class),
                rs.getBigDecimal("replacement_cost"),
                rs.getString("rating"),
                rs.getObject("last_update", LocalDateTime.class),
                parseSpecialFeatures(rs.getString("special_features")),
                List.of(),
                List.of()
        );
    }

    /**
     * "{Trailers,Commentaries}" 형태의 배열 문자열을 목록으로 변환.
     * 빈 배열/null 은 빈 목록이고, 공백이 있는 원소에 붙는 따옴표는 제거한다.
     */
    static List<String> parseSpecialFeatures(String raw) {
        if (raw == null) {
            return List.of();
        }
        String features = trim(raw, '{', '}');
        if (features.isEmpty()) {
            return List.of();
        }
        return Arrays.stream(features.split(","))
                .map(feature -> trim(feature, '"', '"'))
                .toList();
    }

    private static String trim(String value, char leading, char trailing) {
        int start = 0;
        int end = value.length();
        while (start < end && (value.charAt(start) == leading || value.charAt(start) == trailing)) {
            start++;
        }
        while (end > start && (value.charAt(end - 1) == leading || value.charAt(end - 1) == trailing)) {
            end--;
        }
        return value.substring(start, end);
    }
}
