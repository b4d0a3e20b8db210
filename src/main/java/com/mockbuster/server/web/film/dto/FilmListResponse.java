package com.mockbuster.server.web.film.dto;

import com.mockbuster.server.domain.film.FilmPage;

import java.util.List;

public record FilmListResponse(
        List<FilmResponse> films,
        int total,
        int page,
        int limit
) {
    public static FilmListResponse from(FilmPage page) {
        return new FilmListResponse(
                page.films().stream().map(FilmResponse::from).toList(),
                page.total(),
                page.page(),
                page.limit()
        );
    }
}
