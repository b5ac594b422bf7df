package app.lexora.cards.web;

import app.lexora.cards.generation.controller.dto.GenerationSessionResponse;
import app.lexora.cards.generation.port.AudioSynthesisException;
import app.lexora.cards.generation.service.DeckNotFoundException;
import app.lexora.cards.generation.service.GenerationCancelledException;
import app.lexora.cards.generation.service.GenerationFailureException;
import app.lexora.cards.generation.service.GenerationServiceFailureException;
import app.lexora.cards.generation.service.PersistenceFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Maps exceptions to HTTP responses. Failed generation runs answer with the finalized session so
 * the client still sees every outcome.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(DeckNotFoundException.class)
    ResponseEntity<ApiError> handleDeckNotFound(DeckNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, "DeckNotFound", ex.getMessage(), null);
    }

    @ExceptionHandler(GenerationFailureException.class)
    ResponseEntity<GenerationSessionResponse> handleGenerationFailure(GenerationFailureException ex) {
        HttpStatus status = statusOf(ex);
        log.warn("Generation request failed sessionId={} status={} errorType={}",
                ex.getSession().getSessionId(), status.value(), ex.getClass().getSimpleName());
        return ResponseEntity.status(status).body(GenerationSessionResponse.from(ex.getSession()));
    }

    @ExceptionHandler(AudioSynthesisException.class)
    ResponseEntity<ApiError> handleAudioFailure(AudioSynthesisException ex) {
        log.warn("Audio synthesis failed message={}", ex.getMessage());
        return error(HttpStatus.BAD_GATEWAY, "AudioSynthesisFailed", "Pronunciation could not be synthesized",
                ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(GlobalExceptionHandler::describe)
                .collect(Collectors.joining("; "));
        return error(HttpStatus.BAD_REQUEST, "ValidationFailed", "Request is invalid", details);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return error(HttpStatus.BAD_REQUEST, "InvalidRequest",
                "Invalid value for parameter '" + ex.getName() + "'", String.valueOf(ex.getValue()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException ex) {
        return error(HttpStatus.BAD_REQUEST, "InvalidRequest", ex.getMessage(), null);
    }

    @ExceptionHandler(ResponseStatusException.class)
    ResponseEntity<ApiError> handleResponseStatus(ResponseStatusException ex) {
        return error(ex.getStatusCode(), errorCode(ex.getStatusCode()), ex.getReason(), null);
    }

    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            HttpStatusCode status = errorResponse.getStatusCode();
            return error(status, errorCode(status), errorResponse.getBody().getDetail(), null);
        }
        log.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "InternalServerError", "An unexpected error occurred", null);
    }

    private HttpStatus statusOf(GenerationFailureException ex) {
        if (ex instanceof GenerationServiceFailureException) {
            return HttpStatus.BAD_GATEWAY;
        }
        if (ex instanceof PersistenceFailureException) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        if (ex instanceof GenerationCancelledException) {
            return HttpStatus.CONFLICT;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private static String describe(FieldError error) {
        return error.getField() + " " + error.getDefaultMessage();
    }

    private static String errorCode(HttpStatusCode status) {
        HttpStatus resolved = HttpStatus.resolve(status.value());
        return resolved == null ? "Error" + status.value() : resolved.name();
    }

    private static ResponseEntity<ApiError> error(HttpStatusCode status, String code, String message, String details) {
        return ResponseEntity.status(status).body(new ApiError(code, message, details, Instant.now()));
    }

    public record ApiError(
            String errorCode,
            String message,
            String details,
            Instant timestamp
    ) {
    }
}
