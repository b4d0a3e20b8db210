package com.mockbuster.server.application.service;

import com.mockbuster.server.application.port.in.CommentUseCase.AddCommentCommand;
import com.mockbuster.server.application.port.out.CommentPort;
import com.mockbuster.server.application.port.out.FilmPort;
import com.mockbuster.server.domain.comment.Comment;
import com.mockbuster.server.domain.film.FilmNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CommentServiceTest {

    @Mock
    private CommentPort commentPort;

    @Mock
    private FilmPort filmPort;

    private CommentService commentService;

    @BeforeEach
    void setUp() {
        commentService = new CommentService(commentPort, filmPort);
    }

    @Nested
    @DisplayName("코멘트 등록")
    class AddComment {

        @Test
        void 존재하는_영화에_코멘트를_등록한다() {
            // given
            LocalDateTime now = LocalDateTime.now();
            when(filmPort.getFilmById(1)).thenReturn(FilmServiceTest.film(1, "Academy Dinosaur", "PG"));
            when(commentPort.addComment(1, "John Doe", "Great movie!"))
                    .thenReturn(new Comment(1, 1, "John Doe", "Great movie!", now));

            // when
            Comment result = commentService.addComment(1, new AddCommentCommand("John Doe", "Great movie!"));

            // then
            assertThat(result.id()).isPositive();
            assertThat(result.filmId()).isEqualTo(1);
            assertThat(result.customerName()).isEqualTo("John Doe");
            assertThat(result.comment()).isEqualTo("Great movie!");
            assertThat(result.createdAt()).isEqualTo(now);
        }

        @Test
        void 존재하지_않는_영화면_저장하지_않는다() {
            // given
            when(filmPort.getFilmById(999)).thenThrow(new FilmNotFoundException(999));

            // when & then
            assertThatThrownBy(() -> commentService.addComment(999, new AddCommentCommand("John Doe", "Great movie!")))
                    .isInstanceOf(FilmNotFoundException.class);
            verifyNoInteractions(commentPort);
        }

        @Test
        void 영화_ID가_양수가_아니면_거부한다() {
            // when & then
            assertThatThrownBy(() -> commentService.addComment(0, new AddCommentCommand("John Doe", "Great movie!")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("invalid film ID");
            verifyNoInteractions(filmPort, commentPort);
        }

        @Test
        void 고객_이름이_비어있으면_거부한다() {
            assertRejected(new AddCommentCommand("", "Great movie!"), "customer name is required");
        }

        @Test
        void 이름과_본문이_모두_비어있으면_이름_오류가_먼저다() {
            assertRejected(new AddCommentCommand(null, null), "customer name is required");
        }

        @Test
        void 고객_이름이_100자를_넘으면_거부한다() {
            assertRejected(new AddCommentCommand("a".repeat(101), "Great movie!"),
                    "customer name too long (max 100 characters)");
        }

        @Test
        void 이름_길이_오류가_본문_누락보다_먼저다() {
            assertRejected(new AddCommentCommand("a".repeat(101), ""),
                    "customer name too long (max 100 characters)");
        }

        @Test
        void 본문이_비어있으면_거부한다() {
            assertRejected(new AddCommentCommand("John Doe", ""), "comment text is required");
        }

        @Test
        void 본문이_1000자를_넘으면_거부한다() {
            assertRejected(new AddCommentCommand("John Doe", "x".repeat(1001)),
                    "comment text too long (max 1000 characters)");
        }

        @Test
        void 경계값_길이는_허용한다() {
            // given: 이모지는 UTF-16 두 글자지만 한 글자로 센다
            String name = "🎬".repeat(100);
            String text = "x".repeat(1000);
            when(filmPort.getFilmById(1)).thenReturn(FilmServiceTest.film(1, "Academy Dinosaur", "PG"));
            when(commentPort.addComment(1, name, text))
                    .thenReturn(new Comment(3, 1, name, text, LocalDateTime.now()));

            // when
            Comment result = commentService.addComment(1, new AddCommentCommand(name, text));

            // then
            assertThat(result.id()).isEqualTo(3);
        }

        private void assertRejected(AddCommentCommand command, String message) {
            assertThatThrownBy(() -> commentService.addComment(1, command))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage(message);
            verifyNoInteractions(filmPort, commentPort);
        }
    }

    @Nested
    @DisplayName("코멘트 조회")
    class GetComments {

        @Test
        void 영화의_코멘트를_최신순으로_반환한다() {
            // given
            LocalDateTime now = LocalDateTime.now();
            List<Comment> comments = List.of(
                    new Comment(2, 1, "Jane", "Even better the second time", now),
                    new Comment(1, 1, "John Doe", "Great movie!", now.minusDays(1))
            );
            when(filmPort.getFilmById(1)).thenReturn(FilmServiceTest.film(1, "Academy Dinosaur", "PG"));
            when(commentPort.getCommentsByFilmId(1)).thenReturn(comments);

            // when
            List<Comment> result = commentService.getCommentsByFilmId(1);

            // then
            assertThat(result).extracting(Comment::id).containsExactly(2, 1);
        }

        @Test
        void 존재하지_않는_영화면_FilmNotFoundException() {
            // given
            when(filmPort.getFilmById(404)).thenThrow(new FilmNotFoundException(404));

            // when & then
            assertThatThrownBy(() -> commentService.getCommentsByFilmId(404))
                    .isInstanceOf(FilmNotFoundException.class);
            verifyNoInteractions(commentPort);
        }

        @Test
        void 영화_ID가_양수가_아니면_거부한다() {
            assertThatThrownBy(() -> commentService.getCommentsByFilmId(-1))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("invalid film ID");
        }
    }
}
