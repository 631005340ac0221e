package com.studentnotes.notes_api.exception;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.studentnotes.notes_api.dto.ErrorResponse;
import com.studentnotes.notes_api.dto.NoteRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.Comparator;
import java.util.List;

/**
 * 모든 실패 응답을 {"error": "..."} 형태로 변환한다.
 *
 * - 400: 요청 본문 검증 실패, 잘못된 노트 id
 * - 404: 없는 노트, 없는 경로 (지원하지 않는 메서드 포함)
 * - 500: 그 외 예외. production 환경에서는 메시지를 감춘다.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String INVALID_ID_MESSAGE = "Invalid note ID";
    static final String ROUTE_NOT_FOUND_MESSAGE = "Route not found";
    static final String INTERNAL_ERROR_MESSAGE = "Internal server error";
    static final String MALFORMED_BODY_MESSAGE = "Request body must be a valid JSON object";

    // 여러 필드가 동시에 틀리면 title -> content -> tags 순으로 하나만 알려준다
    private static final List<String> FIELD_ORDER = List.of("title", "content", "tags");

    private final boolean production;

    public GlobalExceptionHandler(@Value("${notes.environment:development}") String environment) {
        this.production = "production".equalsIgnoreCase(environment);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .min(Comparator.comparingInt(error -> fieldRank(error.getField())))
                .map(FieldError::getDefaultMessage)
                .orElse(MALFORMED_BODY_MESSAGE);

        return badRequest(message);
    }

    // 문자열이 아닌 title/content, 배열이 아닌 tags 등 JSON 타입 오류
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        if (ex.getCause() instanceof JsonMappingException) {
            return badRequest(messageFor(((JsonMappingException) ex.getCause()).getPath()));
        }
        return badRequest(MALFORMED_BODY_MESSAGE);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return badRequest(INVALID_ID_MESSAGE);
    }

    @ExceptionHandler(NoteNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoteNotFound(NoteNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ErrorResponse.of(ex.getMessage()));
    }

    @ExceptionHandler({
            NoHandlerFoundException.class,
            NoResourceFoundException.class,
            HttpRequestMethodNotSupportedException.class
    })
    public ResponseEntity<ErrorResponse> handleRouteNotFound(Exception ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ErrorResponse.of(ROUTE_NOT_FOUND_MESSAGE));
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMediaType(HttpMediaTypeNotSupportedException ex) {
        return ResponseEntity.status(HttpStatus.UNSUPPORTED_MEDIA_TYPE)
                .body(ErrorResponse.of("Content-Type must be application/json"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        log.error("처리되지 않은 예외", ex);

        String message = production || ex.getMessage() == null ? INTERNAL_ERROR_MESSAGE : ex.getMessage();
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of(message));
    }

    private ResponseEntity<ErrorResponse> badRequest(String message) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of(message));
    }

    private static String messageFor(List<JsonMappingException.Reference> path) {
        if (path.isEmpty()) {
            return MALFORMED_BODY_MESSAGE;
        }

        String field = path.get(0).getFieldName();
        if ("title".equals(field)) {
            return NoteRequest.TITLE_MESSAGE;
        }
        if ("content".equals(field)) {
            return NoteRequest.CONTENT_MESSAGE;
        }
        if ("tags".equals(field)) {
            // tags[n] 에서 실패했으면 배열은 맞고 원소가 문자열이 아님
            return path.size() > 1 ? NoteRequest.TAG_ELEMENT_MESSAGE : NoteRequest.TAGS_MESSAGE;
        }
        return MALFORMED_BODY_MESSAGE;
    }

    private static int fieldRank(String field) {
        for (int i = 0; i < FIELD_ORDER.size(); i++) {
            if (field.startsWith(FIELD_ORDER.get(i))) {
                return i;
            }
        }
        return FIELD_ORDER.size();
    }
}
