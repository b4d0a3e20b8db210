package com.mockbuster.server.web.comment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mockbuster.server.domain.comment.Comment;

import java.time.LocalDateTime;

public record CommentResponse(
        int id,
        @JsonProperty("film_id") int filmId,
        @JsonProperty("customer_name") String customerName,
        String comment,
        @JsonProperty("created_at") LocalDateTime createdAt
) {
    public static CommentResponse from(Comment c) {
        return new CommentResponse(c.id(), c.filmId(), c.customerName(), c.comment(), c.createdAt());
    }
}
