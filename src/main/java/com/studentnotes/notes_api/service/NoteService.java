package com.studentnotes.notes_api.service;

import com.studentnotes.notes_api.domain.note.Note;

import java.util.List;

public interface NoteService {

    Note createNote(String title, String content, List<String> tags);

    List<Note> getNotes(String tag, String q);

    Note getNote(Long noteId);

    Note updateNote(Long noteId, String title, String content, List<String> tags);

    void deleteNote(Long noteId);

}
