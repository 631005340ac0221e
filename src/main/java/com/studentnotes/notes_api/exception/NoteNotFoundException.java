package com.studentnotes.notes_api.exception;

import lombok.Getter;

@Getter
public class NoteNotFoundException extends RuntimeException {

    private final Long noteId;

    public NoteNotFoundException(Long noteId) {
        super("Note not found");
        this.noteId = noteId;
    }
}
