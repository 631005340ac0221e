package com.studentnotes.notes_api.controller;

import com.studentnotes.notes_api.domain.note.Note;
import com.studentnotes.notes_api.dto.NoteRequest;
import com.studentnotes.notes_api.dto.NoteResponse;
import com.studentnotes.notes_api.service.NoteService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 노트 CRUD 컨트롤러 (REST API)
 *
 * - 요청 본문 검증은 @Valid 로 처리하고, 실패 응답은 GlobalExceptionHandler 가 만든다.
 * - 모든 변경 요청은 응답 전에 파일 저장까지 끝난 상태다.
 */
@RestController
@RequestMapping("/notes")
@RequiredArgsConstructor
public class NoteController {

    private final NoteService noteService;

    // 1. 노트 생성
    @PostMapping
    public ResponseEntity<NoteResponse> createNote(@Valid @RequestBody NoteRequest request) {
        Note note = noteService.createNote(request.getTitle(), request.getContent(), request.getTags());
        return ResponseEntity.status(HttpStatus.CREATED).body(NoteResponse.from(note));
    }

    // 2. 노트 목록 조회 (tag, q 필터는 모두 선택)
    @GetMapping
    public ResponseEntity<List<NoteResponse>> getNotes(
            @RequestParam(required = false) String tag,
            @RequestParam(required = false) String q
    ) {
        List<NoteResponse> body = noteService.getNotes(tag, q).stream()
                .map(NoteResponse::from)
                .toList();
        return ResponseEntity.ok(body);
    }

    // 3. 노트 단건 조회
    @GetMapping("/{noteId}")
    public ResponseEntity<NoteResponse> getNote(@PathVariable Long noteId) {
        return ResponseEntity.ok(NoteResponse.from(noteService.getNote(noteId)));
    }

    // 4. 노트 수정 (title, content, tags 전체 교체)
    // 본문 검증이 id 변환보다 먼저 실패해야 하므로 본문 파라미터가 앞에 온다
    @PutMapping("/{noteId}")
    public ResponseEntity<NoteResponse> updateNote(
            @Valid @RequestBody NoteRequest request,
            @PathVariable Long noteId
    ) {
        Note note = noteService.updateNote(noteId, request.getTitle(), request.getContent(), request.getTags());
        return ResponseEntity.ok(NoteResponse.from(note));
    }

    // 5. 노트 삭제
    @DeleteMapping("/{noteId}")
    public ResponseEntity<Void> deleteNote(@PathVariable Long noteId) {
        noteService.deleteNote(noteId);
        return ResponseEntity.noContent().build();
    }

}
