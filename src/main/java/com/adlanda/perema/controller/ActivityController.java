package com.adlanda.perema.controller;

import com.adlanda.perema.model.ActivityRequest;
import com.adlanda.perema.model.OnCreate;
import com.adlanda.perema.service.ActivityService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api")
public class ActivityController {

    private final ActivityService activityService;

    public ActivityController(ActivityService activityService) {
        this.activityService = activityService;
    }

    @PostMapping("/contacts/{contactId}/activities")
    public ResponseEntity<Map<String, Object>> create(
            @PathVariable long contactId,
            @Validated(OnCreate.class) @RequestBody ActivityRequest request) {
        return ResponseEntity.ok(Map.of(
                "message", "Activity created successfully",
                "activity", activityService.create(contactId, request)
        ));
    }

    @GetMapping("/contacts/{contactId}/activities")
    public ResponseEntity<Map<String, Object>> list(@PathVariable long contactId) {
        return ResponseEntity.ok(Map.of("activities", activityService.listForContact(contactId)));
    }

    @PutMapping("/activities/{id}")
    public ResponseEntity<Map<String, Object>> update(@PathVariable long id,
                                                      @Valid @RequestBody ActivityRequest request) {
        return ResponseEntity.ok(Map.of(
                "message", "Activity updated successfully",
                "activity", activityService.update(id, request)
        ));
    }

    @DeleteMapping("/activities/{id}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable long id) {
        activityService.delete(id);
        return ResponseEntity.ok(Map.of("message", "Activity deleted"));
    }
}
