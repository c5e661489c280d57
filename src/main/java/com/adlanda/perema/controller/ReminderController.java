package com.adlanda.perema.controller;

import com.adlanda.perema.model.OnCreate;
import com.adlanda.perema.model.ReminderRequest;
import com.adlanda.perema.model.ReminderResponse;
import com.adlanda.perema.service.ReminderService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST controller for reminders.
 */
@RestController
@RequestMapping("/api")
public class ReminderController {

    private final ReminderService reminderService;

    public ReminderController(ReminderService reminderService) {
        this.reminderService = reminderService;
    }

    @PostMapping("/contacts/{contactId}/reminders")
    public ResponseEntity<Map<String, Object>> create(
            @PathVariable long contactId,
            @Validated(OnCreate.class) @RequestBody ReminderRequest request) {
        return ResponseEntity.ok(Map.of(
                "message", "Reminder created successfully",
                "reminder", reminderService.create(contactId, request)
        ));
    }

    @GetMapping("/contacts/{contactId}/reminders")
    public ResponseEntity<Map<String, Object>> listForContact(@PathVariable long contactId) {
        return ResponseEntity.ok(Map.of("reminders", reminderService.listForContact(contactId)));
    }

    /**
     * Open reminders due within the next {@code days} days, overdue ones included.
     */
    @GetMapping("/reminders/upcoming")
    public ResponseEntity<Map<String, Object>> upcoming(@RequestParam(defaultValue = "7") int days) {
        return ResponseEntity.ok(Map.of("reminders", reminderService.upcoming(days)));
    }

    @GetMapping("/reminders/{id}")
    public ResponseEntity<ReminderResponse> get(@PathVariable long id) {
        return ResponseEntity.ok(reminderService.get(id));
    }

    @PutMapping("/reminders/{id}")
    public ResponseEntity<Map<String, Object>> update(@PathVariable long id,
                                                      @Valid @RequestBody ReminderRequest request) {
        return ResponseEntity.ok(Map.of(
                "message", "Reminder updated successfully",
                "reminder", reminderService.update(id, request)
        ));
    }

    @DeleteMapping("/reminders/{id}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable long id) {
        reminderService.delete(id);
        return ResponseEntity.ok(Map.of("message", "Reminder deleted"));
    }

    @PostMapping("/reminders/{id}/complete")
    public ResponseEntity<Map<String, Object>> complete(@PathVariable long id) {
        return ResponseEntity.ok(Map.of(
                "message", "Reminder completed",
                "reminder", reminderService.complete(id)
        ));
    }
}
