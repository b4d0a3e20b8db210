package com.mockbuster.server.web.common;

public record ErrorResponse(String error, String details) {}
