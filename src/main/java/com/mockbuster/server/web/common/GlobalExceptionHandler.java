package com.mockbuster.server.web.common;

import com.mockbuster.server.domain.film.FilmNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.HandlerMapping;

import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String DEFAULT_SUMMARY = "Internal server error";

    // ========== 영화 관련 예외 ==========
    @ExceptionHandler(FilmNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    ErrorResponse handleFilmNotFound(FilmNotFoundException e) {
        return new ErrorResponse("Film not found", e.getMessage());
    }

    // ========== 요청 파싱/검증 예외 ==========
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    ErrorResponse handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        String summary = "id".equals(e.getName()) ? "Invalid film ID" : "Invalid parameter: " + e.getName();
        return new ErrorResponse(summary, e.getMostSpecificCause().getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    ErrorResponse handleUnreadableBody(HttpMessageNotReadableException e) {
        return new ErrorResponse("Invalid request body", e.getMostSpecificCause().getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    ErrorResponse handleInvalidBody(MethodArgumentNotValidException e) {
        String details = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        return new ErrorResponse("Validation failed", details);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    ErrorResponse handleIllegalArgument(IllegalArgumentException e) {
        return new ErrorResponse("Validation failed", e.getMessage());
    }

    // ========== 일반 예외 ==========
    @ExceptionHandler(Exception.class)
    ResponseEntity<ErrorResponse> handleUnexpected(Exception e, HttpServletRequest request) {
        // 404(없는 경로), 405 등 Spring MVC 자체 예외는 원래 상태 코드를 유지
        if (e instanceof org.springframework.web.ErrorResponse mvcError) {
            HttpStatusCode status = mvcError.getStatusCode();
            HttpStatus resolved = HttpStatus.resolve(status.value());
            String reason = resolved != null ? resolved.getReasonPhrase() : DEFAULT_SUMMARY;
            return ResponseEntity.status(status).body(new ErrorResponse(reason, e.getMessage()));
        }

        log.error("Unhandled exception: method={}, uri={}", request.getMethod(), request.getRequestURI(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse(summaryOf(request), e.getMessage()));
    }

    private String summaryOf(HttpServletRequest request) {
        Object handler = request.getAttribute(HandlerMapping.BEST_MATCHING_HANDLER_ATTRIBUTE);
        if (handler instanceof HandlerMethod handlerMethod) {
            ErrorSummary summary = handlerMethod.getMethodAnnotation(ErrorSummary.class);
            if (summary != null) {
                return summary.value();
            }
        }
        return DEFAULT_SUMMARY;
    }
}
