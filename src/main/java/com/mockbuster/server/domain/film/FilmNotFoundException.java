package com.mockbuster.server.domain.film;

/**
 * 참조한 영화가 존재하지 않을 때 발생하는 예외.
 * - 저장소/서비스 계층 어디서 감싸더라도 타입으로 판별한다 (메시지 비교 금지)
 * - 웹 계층에서 404 로 변환된다
 */
public class FilmNotFoundException extends RuntimeException {

    public static final String MESSAGE = "film not found";

    private final int filmId;

    public FilmNotFoundException(int filmId) {
        super(MESSAGE);
        this.filmId = filmId;
    }

    public int getFilmId() {
        return filmId;
    }
}
