package com.adlanda.perema.model;

import com.adlanda.perema.entity.Note;

import java.time.Instant;
import java.time.LocalDate;

public record NoteResponse(
        Long id,
        String content,
        LocalDate date,
        Long contactId,
        Instant createdAt
) {
    public static NoteResponse from(Note note) {
        return new NoteResponse(note.getId(), note.getContent(), note.getDate(),
                note.getContact().getId(), note.getCreatedAt());
    }
}
