package com.studentnotes.notes_api.service;

import com.studentnotes.notes_api.domain.note.Note;
import com.studentnotes.notes_api.exception.NoteNotFoundException;
import com.studentnotes.notes_api.exception.NotePersistenceException;
import com.studentnotes.notes_api.repository.NoteRepository;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * 메모리 상의 노트 컬렉션과 id 카운터를 소유하는 노트 저장소
 *
 * 동작 방식:
 * 1. 기동 시 저장소 파일에서 컬렉션을 읽고 다음 id 를 (최대 id 또는 0) + 1 로 정한다.
 * 2. 이후 id 는 메모리에서만 증가한다. 삭제가 있어도 다시 계산하지 않는다.
 * 3. 생성/수정/삭제가 성공하면 곧바로 컬렉션 전체를 파일에 쓴다.
 * 4. 파일 쓰기가 실패해도 메모리 변경은 그대로 유지되고 요청은 성공으로 처리된다.
 *
 * 요청은 여러 스레드에서 들어오므로 컬렉션 변경과 파일 쓰기를 하나의 락 안에서 수행한다.
 * 호출자에게는 락 안에서 만든 복사본만 돌려주고, 내부 리스트의 Note 는 밖으로 나가지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NoteServiceImpl implements NoteService {

    private final NoteRepository noteRepository;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final List<Note> notes = new ArrayList<>();
    private long nextId = 1;

    @PostConstruct
    public void loadNotes() {
        lock.lock();
        try {
            List<Note> loaded = noteRepository.loadAll();
            notes.clear();
            notes.addAll(loaded);
            nextId = loaded.stream()
                    .map(Note::getId)
                    .filter(Objects::nonNull)
                    .mapToLong(Long::longValue)
                    .max()
                    .orElse(0L) + 1;

            log.info("노트 {}개를 불러왔습니다 - 다음 id: {}", notes.size(), nextId);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Note createNote(String title, String content, List<String> tags) {
        lock.lock();
        try {
            Note note = Note.makeNote(nextId++, title, content, tags, now());
            notes.add(note);
            persist();

            log.debug("노트 생성 완료 - id: {}", note.getId());
            return note.snapshot();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Note> getNotes(String tag, String q) {
        lock.lock();
        try {
            Stream<Note> filtered = notes.stream();

            if (tag != null && !tag.isEmpty()) {
                filtered = filtered.filter(note -> note.hasTagContaining(tag));
            }
            if (q != null && !q.isEmpty()) {
                filtered = filtered.filter(note -> note.mentions(q));
            }

            return new ArrayList<>(filtered.map(Note::snapshot).toList());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Note getNote(Long noteId) {
        lock.lock();
        try {
            return findById(noteId).snapshot();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Note updateNote(Long noteId, String title, String content, List<String> tags) {
        lock.lock();
        try {
            Note note = findById(noteId);
            note.updateNote(title, content, tags, now());
            persist();

            log.debug("노트 수정 완료 - id: {}", noteId);
            return note.snapshot();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void deleteNote(Long noteId) {
        lock.lock();
        try {
            Note note = findById(noteId);
            notes.remove(note);
            persist();

            log.debug("노트 삭제 완료 - id: {}", noteId);
        } finally {
            lock.unlock();
        }
    }

    private Note findById(Long noteId) {
        return notes.stream()
                .filter(note -> note.getId() != null && note.getId().equals(noteId))
                .findFirst()
                .orElseThrow(() -> new NoteNotFoundException(noteId));
    }

    // 저장 실패는 요청 실패로 이어지지 않는다. 메모리 상태가 기준이다
    private void persist() {
        try {
            noteRepository.saveAll(new ArrayList<>(notes));
        } catch (NotePersistenceException e) {
            log.error("노트 파일 저장 실패 - 파일: {}", e.getStorageFile(), e);
        }
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

}
