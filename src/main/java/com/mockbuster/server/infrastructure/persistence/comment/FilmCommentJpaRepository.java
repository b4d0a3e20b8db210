package com.mockbuster.server.infrastructure.persistence.comment;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface FilmCommentJpaRepository extends JpaRepository<FilmCommentJpaEntity, Integer> {
    List<FilmCommentJpaEntity> findByFilmIdOrderByCreatedAtDesc(Integer filmId);
}
