package com.studentnotes.notes_api.repository;

import com.studentnotes.notes_api.domain.note.Note;

import java.util.List;

/**
 * 노트 컬렉션 전체를 저장소에 보관하는 영속성 어댑터.
 * 부분 갱신 없이 항상 전체 컬렉션 단위로 읽고 쓴다.
 */
public interface NoteRepository {

    // 저장된 컬렉션을 읽는다. 파일이 없거나 읽을 수 없으면 빈 리스트
    List<Note> loadAll();

    // 컬렉션 전체를 덮어쓴다. 실패 시 NotePersistenceException
    void saveAll(List<Note> notes);

}
