package com.adlanda.perema.controller;

import com.adlanda.perema.model.OnCreate;
import com.adlanda.perema.model.RelationshipRequest;
import com.adlanda.perema.model.RelationshipResponse;
import com.adlanda.perema.service.RelationshipService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api")
public class RelationshipController {

    private final RelationshipService relationshipService;

    public RelationshipController(RelationshipService relationshipService) {
        this.relationshipService = relationshipService;
    }

    @PostMapping("/contacts/{contactId}/relationships")
    public ResponseEntity<Map<String, Object>> create(
            @PathVariable long contactId,
            @Validated(OnCreate.class) @RequestBody RelationshipRequest request) {
        return ResponseEntity.ok(Map.of(
                "message", "Relationship created successfully",
                "relationship", relationshipService.create(contactId, request)
        ));
    }

    @GetMapping("/contacts/{contactId}/relationships")
    public ResponseEntity<Map<String, Object>> list(@PathVariable long contactId) {
        return ResponseEntity.ok(Map.of("relationships", relationshipService.listForContact(contactId)));
    }

    @PutMapping("/relationships/{id}")
    public ResponseEntity<Map<String, Object>> update(@PathVariable long id,
                                                      @Valid @RequestBody RelationshipRequest request) {
        RelationshipResponse relationship = relationshipService.update(id, request);
        return ResponseEntity.ok(Map.of(
                "message", "Relationship updated successfully",
                "relationship", relationship
        ));
    }

    @DeleteMapping("/relationships/{id}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable long id) {
        relationshipService.delete(id);
        return ResponseEntity.ok(Map.of("message", "Relationship deleted"));
    }
}
