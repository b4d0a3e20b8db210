package com.mockbuster.server.web.film;

import com.mockbuster.server.application.port.in.FilmUseCase;
import com.mockbuster.server.domain.film.FilmFilters;
import com.mockbuster.server.web.common.ErrorSummary;
import com.mockbuster.server.web.film.dto.CategoryResponse;
import com.mockbuster.server.web.film.dto.FilmListResponse;
import com.mockbuster.server.web.film.dto.FilmResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class FilmController {

    private final FilmUseCase filmUseCase;

    /**
     * page/limit 이 없거나 숫자가 아니거나 0 이하이면 1/10 으로 대체한다
     */
    @GetMapping("/films")
    @ErrorSummary("Failed to retrieve films")
    public ResponseEntity<FilmListResponse> getFilms(
            @RequestParam(required = false) String title,
            @RequestParam(required = false) String rating,
            @RequestParam(required = false) String category,
            @RequestParam(required = false) String page,
            @RequestParam(required = false) String limit) {
        FilmFilters filters = new FilmFilters(
                title,
                rating,
                category,
                positiveOrDefault(page, FilmFilters.DEFAULT_PAGE),
                positiveOrDefault(limit, FilmFilters.DEFAULT_LIMIT)
        );
        return ResponseEntity.ok(FilmListResponse.from(filmUseCase.getFilms(filters)));
    }

    @GetMapping("/films/{id}")
    @ErrorSummary("Failed to retrieve film")
    public ResponseEntity<FilmResponse> getFilmById(@PathVariable("id") int filmId) {
        return ResponseEntity.ok(FilmResponse.from(filmUseCase.getFilmById(filmId)));
    }

    @GetMapping("/categories")
    @ErrorSummary("Failed to retrieve categories")
    public ResponseEntity<List<CategoryResponse>> getCategories() {
        List<CategoryResponse> categories = filmUseCase.getCategories().stream()
                .map(CategoryResponse::from)
                .toList();
        return ResponseEntity.ok(categories);
    }

    private static int positiveOrDefault(String raw, int defaultValue) {
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            return value > 0 ? value : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }
}
