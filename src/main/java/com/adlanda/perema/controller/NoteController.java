package com.adlanda.perema.controller;

import com.adlanda.perema.model.NoteRequest;
import com.adlanda.perema.model.OnCreate;
import com.adlanda.perema.service.NoteService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api")
public class NoteController {

    private final NoteService noteService;

    public NoteController(NoteService noteService) {
        this.noteService = noteService;
    }

    @PostMapping("/contacts/{contactId}/notes")
    public ResponseEntity<Map<String, Object>> create(
            @PathVariable long contactId,
            @Validated(OnCreate.class) @RequestBody NoteRequest request) {
        return ResponseEntity.ok(Map.of(
                "message", "Note created successfully",
                "note", noteService.create(contactId, request)
        ));
    }

    @GetMapping("/contacts/{contactId}/notes")
    public ResponseEntity<Map<String, Object>> list(@PathVariable long contactId) {
        return ResponseEntity.ok(Map.of("notes", noteService.listForContact(contactId)));
    }

    @PutMapping("/notes/{id}")
    public ResponseEntity<Map<String, Object>> update(@PathVariable long id,
                                                      @Valid @RequestBody NoteRequest request) {
        return ResponseEntity.ok(Map.of(
                "message", "Note updated successfully",
                "note", noteService.update(id, request)
        ));
    }

    @DeleteMapping("/notes/{id}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable long id) {
        noteService.delete(id);
        return ResponseEntity.ok(Map.of("message", "Note deleted"));
    }
}
