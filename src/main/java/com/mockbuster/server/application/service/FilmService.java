package com.mockbuster.server.application.service;

import com.mockbuster.server.application.port.in.FilmUseCase;
import com.mockbuster.server.application.port.out.FilmPort;
import com.mockbuster.server.domain.film.Category;
import com.mockbuster.server.domain.film.Film;
import com.mockbuster.server.domain.film.FilmFilters;
import com.mockbuster.server.domain.film.FilmNotFoundException;
import com.mockbuster.server.domain.film.FilmPage;
import com.mockbuster.server.domain.film.FilmRating;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class FilmService implements FilmUseCase {

    private final FilmPort filmPort;

    /**
     * 영화 목록 조회
     * - 전달받은 조건 그대로 검증한 뒤(page=0 도 거부) 기본 페이지 값을 적용한다
     */
    @Override
    public FilmPage getFilms(FilmFilters filters) {
        try {
            validateFilters(filters);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid filters provided: filters={}, reason={}", filters, e.getMessage());
            throw e;
        }

        FilmFilters normalized = filters.withDefaultPagination();

        FilmPage page;
        try {
            page = filmPort.getFilms(normalized);
        } catch (RuntimeException e) {
            log.error("Failed to retrieve films: filters={}", normalized, e);
            throw e;
        }

        log.info("Successfully retrieved films: count={}, total={}", page.films().size(), page.total());
        return page;
    }

    /**
     * 영화 상세 조회
     */
    @Override
    public Film getFilmById(int filmId) {
        if (filmId <= 0) {
            log.warn("Invalid film ID provided: filmId={}", filmId);
            throw new IllegalArgumentException("invalid film ID");
        }

        Film film;
        try {
            film = filmPort.getFilmById(filmId);
        } catch (FilmNotFoundException e) {
            log.warn("Film not found: filmId={}", filmId);
            throw e;
        } catch (RuntimeException e) {
            log.error("Failed to retrieve film: filmId={}", filmId, e);
            throw e;
        }

        log.info("Successfully retrieved film: filmId={}, title={}", filmId, film.title());
        return film;
    }

    /**
     * 전체 카테고리 조회 (이름순)
     */
    @Override
    public List<Category> getCategories() {
        List<Category> categories;
        try {
            categories = filmPort.getCategories();
        } catch (RuntimeException e) {
            log.error("Failed to retrieve categories", e);
            throw e;
        }

        log.info("Successfully retrieved categories: count={}", categories.size());
        return categories;
    }

    private void validateFilters(FilmFilters filters) {
        if (filters.page() < 1) {
            throw new IllegalArgumentException("page must be greater than 0");
        }
        if (filters.limit() < 1 || filters.limit() > FilmFilters.MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and 100");
        }
        if (filters.hasRating() && !FilmRating.isValid(filters.rating())) {
            throw new IllegalArgumentException("invalid rating provided");
        }
    }
}
