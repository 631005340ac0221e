package com.studentnotes.notes_api.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.studentnotes.notes_api.domain.note.Note;
import com.studentnotes.notes_api.exception.NotePersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON 파일 하나에 노트 컬렉션 전체를 저장하는 저장소
 *
 * 저장 방식:
 * - 매 저장마다 파일 전체를 pretty-print 된 JSON 배열로 덮어쓴다.
 * - atomicWrites 가 켜져 있으면 "{파일명}.tmp" 에 먼저 쓰고 원자적으로 교체한다.
 *   꺼져 있으면 대상 파일에 바로 쓰므로 쓰는 도중 프로세스가 죽으면 파일이 깨질 수 있다.
 *
 * 읽기 실패(파일 없음, 손상된 JSON)는 빈 컬렉션으로 취급하고 예외를 던지지 않는다.
 */
@Slf4j
@Repository
public class JsonFileNoteRepository implements NoteRepository {

    private static final TypeReference<List<Note>> NOTE_LIST = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final Path storageFile;
    private final boolean atomicWrites;

    public JsonFileNoteRepository(ObjectMapper objectMapper,
                                  @Value("${notes.storage.file:notes.json}") String storageFile,
                                  @Value("${notes.storage.atomic-writes:false}") boolean atomicWrites) {
        this.objectMapper = objectMapper;
        this.storageFile = Path.of(storageFile);
        this.atomicWrites = atomicWrites;
    }

    @Override
    public List<Note> loadAll() {
        if (!Files.exists(storageFile)) {
            log.info("노트 파일이 없습니다. 빈 컬렉션으로 시작합니다 - 파일: {}", storageFile);
            return new ArrayList<>();
        }

        try {
            String json = Files.readString(storageFile, StandardCharsets.UTF_8);
            List<Note> notes = objectMapper.readValue(json, NOTE_LIST);
            log.info("노트 파일을 읽었습니다 - 파일: {}", storageFile);
            return notes == null ? new ArrayList<>() : new ArrayList<>(notes);
        } catch (IOException e) {
            log.warn("노트 파일을 읽을 수 없습니다. 빈 컬렉션으로 시작합니다 - 파일: {}, 원인: {}",
                    storageFile, e.getMessage());
            return new ArrayList<>();
        }
    }

    @Override
    public void saveAll(List<Note> notes) {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(notes);

            Path parent = storageFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }

            if (atomicWrites) {
                Path tmp = storageFile.resolveSibling(storageFile.getFileName() + ".tmp");
                Files.writeString(tmp, json, StandardCharsets.UTF_8);
                Files.move(tmp, storageFile,
                        StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.ATOMIC_MOVE);
            } else {
                Files.writeString(storageFile, json, StandardCharsets.UTF_8);
            }
        } catch (IOException e) {
            throw new NotePersistenceException("노트 저장에 실패했습니다: " + e.getMessage(), storageFile, e);
        }
    }
}
