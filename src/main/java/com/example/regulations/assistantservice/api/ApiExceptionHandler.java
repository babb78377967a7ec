package com.example.regulations.assistantservice.api;

import com.example.regulations.assistantservice.dto.ErrorResponse;
import com.example.regulations.assistantservice.error.LlmException;
import com.example.regulations.assistantservice.error.RetrievalException;
import com.example.regulations.assistantservice.error.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;

/**
 * Turns failures into the {@code {status, code, message}} body chat clients expect.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(RetrievalException.class)
    ResponseEntity<ErrorResponse> retrieval(RetrievalException e) {
        log.warn("Retrieval failed: {}", e.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "RETRIEVAL_FAILED",
                "Document search is unavailable right now. Please try again shortly.");
    }

    @ExceptionHandler(LlmException.class)
    ResponseEntity<ErrorResponse> llm(LlmException e) {
        log.warn("Language model failed: {}", e.getMessage());
        if (e.isTimeout()) {
            return respond(HttpStatus.GATEWAY_TIMEOUT, "LLM_TIMEOUT",
                    "The assistant took too long to answer. Please try again.");
        }
        return respond(HttpStatus.BAD_GATEWAY, "LLM_FAILED",
                "The assistant could not produce an answer. Please try again or rephrase your question.");
    }

    @ExceptionHandler(StorageException.class)
    ResponseEntity<ErrorResponse> storage(StorageException e) {
        log.error("Storage failure: {}", e.getMessage(), e);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "STORAGE_FAILED", "The document store is unavailable.");
    }

    @ExceptionHandler({
            MethodArgumentNotValidException.class,
            HandlerMethodValidationException.class,
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            IllegalArgumentException.class
    })
    ResponseEntity<ErrorResponse> badRequest(Exception e) {
        return respond(HttpStatus.BAD_REQUEST, "BAD_REQUEST", e instanceof MethodArgumentNotValidException
                ? "Request body is invalid"
                : e.getMessage());
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(ErrorResponse.of(code, message));
    }
}
