package com.example.roster.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new LinkedHashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String field = error instanceof FieldError fe ? fe.getField() : error.getObjectName();
            errors.put(field, error.getDefaultMessage());
        });
        logger.warn("入力チェックエラー: {}", errors);
        return ResponseEntity.badRequest()
                .body(new ErrorResponse("バリデーションエラー", "入力データに問題があります", errors, LocalDateTime.now()));
    }

    @ExceptionHandler(DataUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleDataUnavailable(DataUnavailableException ex) {
        logger.warn("作成対象データなし [{}]: {}", ex.getErrorCode(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new ErrorResponse(ex.getErrorCode(), ex.getMessage(), null, LocalDateTime.now()));
    }

    @ExceptionHandler(RosterNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(RosterNotFoundException ex) {
        logger.info("ロスター未検出: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse(ex.getErrorCode(), ex.getMessage(), null, LocalDateTime.now()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException ex) {
        logger.warn("引数エラーが発生しました: {}", ex.getMessage());
        return ResponseEntity.badRequest()
                .body(new ErrorResponse("引数エラー", ex.getMessage(), null, LocalDateTime.now()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        logger.error("予期しないエラーが発生しました", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("内部サーバーエラー", "予期しないエラーが発生しました", null, LocalDateTime.now()));
    }

    public record ErrorResponse(String error, String message, Map<String, String> details, LocalDateTime timestamp) {
    }
}
