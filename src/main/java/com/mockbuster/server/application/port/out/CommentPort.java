package com.mockbuster.server.application.port.out;

import com.mockbuster.server.domain.comment.Comment;

import java.util.List;

public interface CommentPort {

    /**
     * 영화 존재 여부를 먼저 확인한 뒤 저장한다. 없으면 FilmNotFoundException (insert 하지 않음)
     */
    Comment addComment(int filmId, String customerName, String comment);

    List<Comment> getCommentsByFilmId(int filmId);
}
