package com.mockbuster.server.web.comment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mockbuster.server.application.port.in.CommentUseCase.AddCommentCommand;
import jakarta.validation.constraints.NotEmpty;

public record AddCommentRequest(
        @JsonProperty("customer_name")
        @NotEmpty(message = "customer name is required")
        String customerName,

        @NotEmpty(message = "comment text is required")
        String comment
) {
    public AddCommentCommand toCommand() {
        return new AddCommentCommand(customerName, comment);
    }
}
