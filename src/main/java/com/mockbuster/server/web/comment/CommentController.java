package com.mockbuster.server.web.comment;

import com.mockbuster.server.application.port.in.CommentUseCase;
import com.mockbuster.server.web.comment.dto.AddCommentRequest;
import com.mockbuster.server.web.comment.dto.CommentResponse;
import com.mockbuster.server.web.common.ErrorSummary;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/films/{id}/comments")
@RequiredArgsConstructor
public class CommentController {

    private final CommentUseCase commentUseCase;

    @PostMapping
    @ErrorSummary("Failed to add comment")
    public ResponseEntity<CommentResponse> addComment(
            @PathVariable("id") int filmId,
            @Valid @RequestBody AddCommentRequest request) {
        CommentResponse response = CommentResponse.from(commentUseCase.addComment(filmId, request.toCommand()));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    @ErrorSummary("Failed to retrieve comments")
    public ResponseEntity<List<CommentResponse>> getComments(@PathVariable("id") int filmId) {
        List<CommentResponse> comments = commentUseCase.getCommentsByFilmId(filmId).stream()
                .map(CommentResponse::from)
                .toList();
        return ResponseEntity.ok(comments);
    }
}
