package com.mockbuster.server.domain.comment;

import java.time.LocalDateTime;

/**
 * 고객이 영화에 남긴 코멘트. 생성 후 수정/삭제되지 않는다.
 */
public record Comment(
        int id,
        int filmId,
        String customerName,
        String comment,
        LocalDateTime createdAt
) {}
