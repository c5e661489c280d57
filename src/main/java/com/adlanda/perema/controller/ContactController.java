package com.adlanda.perema.controller;

import com.adlanda.perema.model.ContactListQuery;
import com.adlanda.perema.model.ContactPage;
import com.adlanda.perema.model.ContactRequest;
import com.adlanda.perema.model.ContactResponse;
import com.adlanda.perema.model.OnCreate;
import com.adlanda.perema.service.ContactListingService;
import com.adlanda.perema.service.ContactService;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.Map;

/**
 * REST controller for contacts and the contact listing.
 */
@RestController
@RequestMapping("/api/contacts")
public class ContactController {

    private final ContactService contactService;
    private final ContactListingService listingService;

    public ContactController(ContactService contactService, ContactListingService listingService) {
        this.contactService = contactService;
        this.listingService = listingService;
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> create(
            @Validated(OnCreate.class) @RequestBody ContactRequest request) {
        ContactResponse contact = contactService.create(request);
        return ResponseEntity.ok(Map.of(
                "message", "Contact created successfully",
                "contact", contact
        ));
    }

    /**
     * Paged, filtered listing. Parameters are taken as raw strings so that
     * malformed values fall back to defaults instead of failing the request.
     */
    @GetMapping
    public ResponseEntity<ContactPage> list(
            @RequestParam(required = false) String page,
            @RequestParam(required = false) String limit,
            @RequestParam(required = false) String fields,
            @RequestParam(required = false) String includes,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) String circle) {
        ContactListQuery query = ContactListQuery.of(page, limit, fields, includes, search, circle);
        return ResponseEntity.ok(listingService.list(query));
    }

    @GetMapping("/circles")
    public ResponseEntity<List<String>> circles() {
        return ResponseEntity.ok(contactService.circles());
    }

    @GetMapping("/{id}")
    public ResponseEntity<ContactResponse> get(@PathVariable long id) {
        return ResponseEntity.ok(contactService.get(id));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ContactResponse> update(@PathVariable long id,
                                                  @Valid @RequestBody ContactRequest request) {
        return ResponseEntity.ok(contactService.update(id, request));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable long id) {
        contactService.delete(id);
        return ResponseEntity.ok(Map.of("message", "Contact deleted"));
    }

    @PostMapping(path = "/{id}/photo", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ContactResponse> uploadPhoto(@PathVariable long id,
                                                       @RequestParam("photo") MultipartFile photo) {
        return ResponseEntity.ok(contactService.attachPhoto(id, photo));
    }
}
