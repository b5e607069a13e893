package com.scholar.api;

import com.scholar.api.dto.ErrorResponse;
import com.scholar.classify.InsufficientTrainingDataException;
import com.scholar.classify.InvalidClassificationRequestException;
import com.scholar.classify.ModelNotTrainedException;
import com.scholar.classify.UnknownAlgorithmException;
import com.scholar.classify.UnknownCategoryException;
import com.scholar.corpus.CorpusLoadException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({HttpMessageNotReadableException.class, HttpMediaTypeNotSupportedException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "bad_request", "Invalid request body", request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "bad_request", "invalid value for " + ex.getName(), request);
    }

    @ExceptionHandler(InvalidClassificationRequestException.class)
    public ResponseEntity<ErrorResponse> handleInvalidClassification(RuntimeException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage(), request);
    }

    @ExceptionHandler(UnknownAlgorithmException.class)
    public ResponseEntity<ErrorResponse> handleUnknownAlgorithm(RuntimeException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "unknown_algorithm", ex.getMessage(), request);
    }

    @ExceptionHandler(ModelNotTrainedException.class)
    public ResponseEntity<ErrorResponse> handleNotTrained(RuntimeException ex, HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, "model_not_trained", ex.getMessage(), request);
    }

    @ExceptionHandler(InsufficientTrainingDataException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientData(RuntimeException ex, HttpServletRequest request) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "insufficient_training_data", ex.getMessage(), request);
    }

    @ExceptionHandler(UnknownCategoryException.class)
    public ResponseEntity<ErrorResponse> handleUnknownCategory(RuntimeException ex, HttpServletRequest request) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "unknown_category", ex.getMessage(), request);
    }

    @ExceptionHandler(CorpusLoadException.class)
    public ResponseEntity<ErrorResponse> handleCorpusLoad(CorpusLoadException ex, HttpServletRequest request) {
        log.warn("corpus reload failed: {}", ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "corpus_unavailable", ex.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("unhandled error on {} {}", request.getMethod(), request.getRequestURI(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Unexpected error", request);
    }

    private ResponseEntity<ErrorResponse> respond(
        HttpStatus status,
        String code,
        String message,
        HttpServletRequest request
    ) {
        return ResponseEntity.status(status).body(ErrorResponse.of(code, message, RequestIds.from(request)));
    }
}
