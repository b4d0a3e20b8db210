package com.mockbuster.server.application.service;

import com.mockbuster.server.application.port.in.CommentUseCase;
import com.mockbuster.server.application.port.out.CommentPort;
import com.mockbuster.server.application.port.out.FilmPort;
import com.mockbuster.server.domain.comment.Comment;
import com.mockbuster.server.domain.film.FilmNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class CommentService implements CommentUseCase {

    static final int MAX_CUSTOMER_NAME_LENGTH = 100;
    static final int MAX_COMMENT_LENGTH = 1000;

    private final CommentPort commentPort;
    private final FilmPort filmPort;

    /**
     * 코멘트 등록
     * 1. filmId 검증
     * 2. 요청 검증 (이름 누락 → 이름 길이 → 본문 누락 → 본문 길이 순)
     * 3. 영화 존재 확인 후 저장
     */
    @Override
    @Transactional
    public Comment addComment(int filmId, AddCommentCommand command) {
        if (filmId <= 0) {
            log.warn("Invalid film ID provided: filmId={}", filmId);
            throw new IllegalArgumentException("invalid film ID");
        }

        try {
            validateComment(command);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid comment provided: filmId={}, reason={}", filmId, e.getMessage());
            throw e;
        }

        requireFilm(filmId, "Cannot add comment to non-existent film");

        Comment comment;
        try {
            comment = commentPort.addComment(filmId, command.customerName(), command.comment());
        } catch (RuntimeException e) {
            log.error("Failed to add comment: filmId={}", filmId, e);
            throw e;
        }

        log.info("Successfully added comment: filmId={}, commentId={}", filmId, comment.id());
        return comment;
    }

    @Override
    public List<Comment> getCommentsByFilmId(int filmId) {
        if (filmId <= 0) {
            log.warn("Invalid film ID provided: filmId={}", filmId);
            throw new IllegalArgumentException("invalid film ID");
        }

        requireFilm(filmId, "Cannot get comments for non-existent film");

        List<Comment> comments;
        try {
            comments = commentPort.getCommentsByFilmId(filmId);
        } catch (RuntimeException e) {
            log.error("Failed to retrieve comments: filmId={}", filmId, e);
            throw e;
        }

        log.info("Successfully retrieved comments: filmId={}, count={}", filmId, comments.size());
        return comments;
    }

    private void requireFilm(int filmId, String notFoundMessage) {
        try {
            filmPort.getFilmById(filmId);
        } catch (FilmNotFoundException e) {
            log.warn("{}: filmId={}", notFoundMessage, filmId);
            throw e;
        } catch (RuntimeException e) {
            log.error("Failed to verify film exists: filmId={}", filmId, e);
            throw e;
        }
    }

    private void validateComment(AddCommentCommand command) {
        String customerName = command == null ? null : command.customerName();
        String text = command == null ? null : command.comment();

        if (customerName == null || customerName.isEmpty()) {
            throw new IllegalArgumentException("customer name is required");
        }
        if (lengthOf(customerName) > MAX_CUSTOMER_NAME_LENGTH) {
            throw new IllegalArgumentException("customer name too long (max 100 characters)");
        }
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("comment text is required");
        }
        if (lengthOf(text) > MAX_COMMENT_LENGTH) {
            throw new IllegalArgumentException("comment text too long (max 1000 characters)");
        }
    }

    // 서로게이트 쌍을 한 글자로 센다
    private static int lengthOf(String value) {
        return value.codePointCount(0, value.length());
    }
}
