package com.mockbuster.server.infrastructure.persistence.comment;

import com.mockbuster.server.application.port.out.CommentPort;
import com.mockbuster.server.domain.comment.Comment;
import com.mockbuster.server.domain.common.exception.DatabaseException;
import com.mockbuster.server.domain.film.FilmNotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
@RequiredArgsConstructor
public class CommentJpaAdapter implements CommentPort {

    private static final String FILM_EXISTS_SQL = "SELECT EXISTS(SELECT 1 FROM film WHERE film_id = ?)";

    private final FilmCommentJpaRepository repository;
    private final JdbcTemplate jdbcTemplate;

    @Override
    public Comment addComment(int filmId, String customerName, String comment) {
        // FK 위반에 기대지 않고 insert 전에 확인
        requireFilm(filmId);

        FilmCommentJpaEntity saved;
        try {
            saved = repository.save(new FilmCommentJpaEntity(filmId, customerName, comment));
        } catch (DataAccessException e) {
            throw new DatabaseException("error inserting comment", e);
        }
        return toDomain(saved);
    }

    @Override
    public List<Comment> getCommentsByFilmId(int filmId) {
        requireFilm(filmId);

        try {
            return repository.findByFilmIdOrderByCreatedAtDesc(filmId).stream()
                    .map(this::toDomain)
                    .toList();
        } catch (DataAccessException e) {
            throw new DatabaseException("error querying comments", e);
        }
    }

    private void requireFilm(int filmId) {
        Boolean exists;
        try {
            exists = jdbcTemplate.queryForObject(FILM_EXISTS_SQL, Boolean.class, filmId);
        } catch (DataAccessException e) {
            throw new DatabaseException("error checking film existence", e);
        }
        if (!Boolean.TRUE.equals(exists)) {
            throw new FilmNotFoundException(filmId);
        }
    }

    private Comment toDomain(FilmCommentJpaEntity e) {
        return new Comment(
                e.getId(),
                e.getFilmId(),
                e.getCustomerName(),
                e.getComment(),
                e.getCreatedAt()
        );
    }
}
