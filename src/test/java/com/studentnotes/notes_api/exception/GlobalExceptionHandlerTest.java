package com.studentnotes.notes_api.exception;

import com.studentnotes.notes_api.dto.ErrorResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    @Test
    @DisplayName("production 환경 - 500 응답 메시지를 감춤")
    void unexpected_production() {
        GlobalExceptionHandler handler = new GlobalExceptionHandler("production");

        ResponseEntity<ErrorResponse> response = handler.handleUnexpected(new IllegalStateException("db password=1234"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().getError()).isEqualTo("Internal server error");
    }

    @Test
    @DisplayName("development 환경 - 500 응답에 원래 예외 메시지")
    void unexpected_development() {
        GlobalExceptionHandler handler = new GlobalExceptionHandler("development");

        ResponseEntity<ErrorResponse> response = handler.handleUnexpected(new IllegalStateException("boom"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().getError()).isEqualTo("boom");
    }

    @Test
    @DisplayName("없는 노트 - 404 Note not found")
    void noteNotFound() {
        GlobalExceptionHandler handler = new GlobalExceptionHandler("development");

        ResponseEntity<ErrorResponse> response = handler.handleNoteNotFound(new NoteNotFoundException(3L));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody().getError()).isEqualTo("Note not found");
    }
}
