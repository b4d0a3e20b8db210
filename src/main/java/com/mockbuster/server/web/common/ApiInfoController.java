package com.mockbuster.server.web.common;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
public class ApiInfoController {

    static final String WELCOME_MESSAGE = "Welcome to Mockbuster Movie API!";

    static final List<String> ENDPOINTS = List.of(
            "GET /api/v1/films - List films with filtering and pagination",
            "GET /api/v1/films/{id} - Get detailed film information",
            "GET /api/v1/categories - List all available categories",
            "POST /api/v1/films/{id}/comments - Add a comment to a film",
            "GET /api/v1/films/{id}/comments - Get comments for a film"
    );

    public record WelcomeResponse(String message) {}

    public record ApiInfoResponse(
            String name,
            String version,
            String description,
            List<String> endpoints,
            String documentation
    ) {}

    private final String documentationUrl;

    public ApiInfoController(
            @Value("${mockbuster.api.documentation-url:http://localhost:8080/swagger-ui/index.html}")
            String documentationUrl) {
        this.documentationUrl = documentationUrl;
    }

    @GetMapping("/")
    public ResponseEntity<WelcomeResponse> welcome() {
        return ResponseEntity.ok(new WelcomeResponse(WELCOME_MESSAGE));
    }

    @GetMapping("/api/v1")
    public ResponseEntity<ApiInfoResponse> apiInfo() {
        return ResponseEntity.ok(new ApiInfoResponse(
                "Mockbuster Movie API",
                "1.0",
                "A RESTful API for the Mockbuster DVD rental business",
                ENDPOINTS,
                documentationUrl
        ));
    }
}
