package com.mdtodo.web;

import com.mdtodo.todo.TodoNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String INTERNAL_ERROR = "Internal server error";

    // TodoValidationException lands here as well
    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ApiResponse<Void> handleBadRequest(IllegalArgumentException e) {
        log.warn("rejected request: {}", e.getMessage());
        return ApiResponse.error(e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ApiResponse<Void> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("unreadable request body: {}", e.getMostSpecificCause().getMessage());
        return ApiResponse.error("Malformed request body");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ApiResponse<Void> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("bad path/query value {}={}", e.getName(), e.getValue());
        return ApiResponse.error("Invalid todo id: " + e.getValue());
    }

    @ExceptionHandler(TodoNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public ApiResponse<Void> handleNotFound(TodoNotFoundException e) {
        log.warn("todo not found: {}", e.getId());
        return ApiResponse.error(e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleUnexpected(Exception e) {
        // framework errors (405, 415, unknown route ...) keep their own status
        if (e instanceof ErrorResponse er) {
            log.warn("request failed with {}: {}", er.getStatusCode(), e.getMessage());
            String reason = er.getBody().getDetail() != null ? er.getBody().getDetail() : e.getMessage();
            return ResponseEntity.status(er.getStatusCode()).body(ApiResponse.error(reason));
        }
        log.error("unexpected failure", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiResponse.error(INTERNAL_ERROR));
    }
}
