package com.mockbuster.server.domain.film;

import java.util.Arrays;

/**
 * MPAA 등급. dvdrental 스키마의 mpaa_rating 값과 동일한 문자열을 사용한다.
 */
public enum FilmRating {
    G("G"),
    PG("PG"),
    PG_13("PG-13"),
    R("R"),
    NC_17("NC-17");

    private final String code;

    FilmRating(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static boolean isValid(String code) {
        return Arrays.stream(values()).anyMatch(r -> r.code.equals(code));
    }
}
