package com.studentnotes.notes_api.exception;

import lombok.Getter;

import java.nio.file.Path;

@Getter
public class NotePersistenceException extends RuntimeException {

    private final Path storageFile;

    public NotePersistenceException(String message, Path storageFile, Throwable cause) {
        super(message, cause);
        this.storageFile = storageFile;
    }
}
