package com.mockbuster.server.application.port.in;

import com.mockbuster.server.domain.comment.Comment;

import java.util.List;

/**
 * 영화 코멘트 Use Case
 */
public interface CommentUseCase {

    record AddCommentCommand(
            String customerName,
            String comment
    ) {}

    Comment addComment(int filmId, AddCommentCommand command);

    /**
     * 최신순(created_at 내림차순) 코멘트 목록
     */
    List<Comment> getCommentsByFilmId(int filmId);
}
