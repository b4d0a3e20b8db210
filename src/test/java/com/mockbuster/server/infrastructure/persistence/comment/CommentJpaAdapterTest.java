package com.mockbuster.server.infrastructure.persistence.comment;

import com.mockbuster.server.domain.comment.Comment;
import com.mockbuster.server.domain.common.exception.DatabaseException;
import com.mockbuster.server.domain.film.FilmNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CommentJpaAdapterTest {

    @Mock
    private FilmCommentJpaRepository repository;

    @Mock
    private JdbcTemplate jdbcTemplate;

    private CommentJpaAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new CommentJpaAdapter(repository, jdbcTemplate);
    }

    @Test
    void 코멘트를_저장하고_생성된_ID와_시각을_반환한다() {
        // given
        givenFilmExists(1, true);
        when(repository.save(any(FilmCommentJpaEntity.class))).thenAnswer(invocation -> {
            FilmCommentJpaEntity entity = invocation.getArgument(0);
            ReflectionTestUtils.setField(entity, "id", 7);
            return entity;
        });

        // when
        Comment result = adapter.addComment(1, "John Doe", "Great movie!");

        // then
        assertThat(result.id()).isEqualTo(7);
        assertThat(result.filmId()).isEqualTo(1);
        assertThat(result.customerName()).isEqualTo("John Doe");
        assertThat(result.comment()).isEqualTo("Great movie!");
        assertThat(result.createdAt()).isNotNull();
    }

    @Test
    void 영화가_없으면_저장하지_않는다() {
        // given
        givenFilmExists(999, false);

        // when & then
        assertThatThrownBy(() -> adapter.addComment(999, "John Doe", "Great movie!"))
                .isInstanceOf(FilmNotFoundException.class);
        verify(repository, never()).save(any());
    }

    @Test
    void 저장_실패는_DatabaseException으로_감싼다() {
        // given
        givenFilmExists(1, true);
        when(repository.save(any(FilmCommentJpaEntity.class)))
                .thenThrow(new DataAccessResourceFailureException("disk full"));

        // when & then
        assertThatThrownBy(() -> adapter.addComment(1, "John Doe", "Great movie!"))
                .isInstanceOf(DatabaseException.class)
                .hasMessage("error inserting comment: disk full");
    }

    @Test
    void 존재_확인_실패는_별도_문맥으로_감싼다() {
        // given
        when(jdbcTemplate.queryForObject(anyString(), eq(Boolean.class), eq(1)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        // when & then
        assertThatThrownBy(() -> adapter.getCommentsByFilmId(1))
                .isInstanceOf(DatabaseException.class)
                .hasMessage("error checking film existence: connection refused");
        verifyNoInteractions(repository);
    }

    @Test
    void 코멘트_목록을_도메인으로_변환한다() {
        // given
        givenFilmExists(1, true);
        FilmCommentJpaEntity newer = new FilmCommentJpaEntity(1, "Jane", "Second");
        FilmCommentJpaEntity older = new FilmCommentJpaEntity(1, "John Doe", "First");
        ReflectionTestUtils.setField(newer, "id", 2);
        ReflectionTestUtils.setField(older, "id", 1);
        when(repository.findByFilmIdOrderByCreatedAtDesc(1)).thenReturn(List.of(newer, older));

        // when
        List<Comment> result = adapter.getCommentsByFilmId(1);

        // then
        assertThat(result).extracting(Comment::id).containsExactly(2, 1);
        assertThat(result).extracting(Comment::customerName).containsExactly("Jane", "John Doe");
    }

    @Test
    void 코멘트가_없으면_빈_목록이다() {
        // given
        givenFilmExists(5, true);
        when(repository.findByFilmIdOrderByCreatedAtDesc(5)).thenReturn(List.of());

        // when & then
        assertThat(adapter.getCommentsByFilmId(5)).isEmpty();
    }

    private void givenFilmExists(int filmId, boolean exists) {
        when(jdbcTemplate.queryForObject(anyString(), eq(Boolean.class), eq(filmId))).thenReturn(exists);
    }
}
