package com.adlanda.perema.service;

import com.adlanda.perema.entity.Contact;
import com.adlanda.perema.entity.Note;
import com.adlanda.perema.exception.ResourceNotFoundException;
import com.adlanda.perema.model.NoteRequest;
import com.adlanda.perema.model.NoteResponse;
import com.adlanda.perema.repository.ContactRepository;
import com.adlanda.perema.repository.NoteRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

@Service
public class NoteService {

    private static final Logger log = LoggerFactory.getLogger(NoteService.class);

    private final NoteRepository noteRepository;
    private final ContactRepository contactRepository;
    private final Clock clock;

    public NoteService(NoteRepository noteRepository, ContactRepository contactRepository, Clock clock) {
        this.noteRepository = noteRepository;
        this.contactRepository = contactRepository;
        this.clock = clock;
    }

    @Transactional
    public NoteResponse create(long contactId, NoteRequest request) {
        Contact contact = contactRepository.findById(contactId)
                .orElseThrow(ResourceNotFoundException::contact);

        Note note = new Note(request.content().trim(),
                request.date() != null ? request.date() : LocalDate.now(clock));
        contact.addNote(note);

        Note saved = noteRepository.save(note);
        log.info("Created note {} for contact {}", saved.getId(), contactId);
        return NoteResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public List<NoteResponse> listForContact(long contactId) {
        if (!contactRepository.existsById(contactId)) {
            throw ResourceNotFoundException.contact();
        }
        return noteRepository.findByContact_IdOrderByDateDescIdDesc(contactId).stream()
                .map(NoteResponse::from)
                .toList();
    }

    @Transactional
    public NoteResponse update(long id, NoteRequest request) {
        Note note = findNote(id);
        if (request.content() != null) note.setContent(request.content().trim());
        if (request.date() != null) note.setDate(request.date());
        return NoteResponse.from(noteRepository.save(note));
    }

    @Transactional
    public void delete(long id) {
        Note note = findNote(id);
        note.getContact().getNotes().remove(note);
        noteRepository.delete(note);
        log.info("Deleted note {}", id);
    }

    private Note findNote(long id) {
        return noteRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Note not found"));
    }
}
