package com.adlanda.perema.controller;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root API controller providing endpoint discovery.
 *
 * Health checks are handled by Spring Actuator at /actuator/health.
 */
@RestController
@RequestMapping("/api")
public class ApiController {

    @Value("${info.app.version:0.0.1-SNAPSHOT}")
    private String appVersion;

    @GetMapping
    public ResponseEntity<Map<String, Object>> root() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("contacts", "GET|POST /api/contacts - List (page, limit, fields, includes, search, circle) or create contacts");
        endpoints.put("contact", "GET|PUT|DELETE /api/contacts/{id} - Read, update or delete a contact");
        endpoints.put("circles", "GET /api/contacts/circles - Distinct circle names");
        endpoints.put("photo", "POST /api/contacts/{id}/photo - Upload a contact photo");
        endpoints.put("relationships", "GET|POST /api/contacts/{id}/relationships, PUT|DELETE /api/relationships/{id}");
        endpoints.put("notes", "GET|POST /api/contacts/{id}/notes, PUT|DELETE /api/notes/{id}");
        endpoints.put("activities", "GET|POST /api/contacts/{id}/activities, PUT|DELETE /api/activities/{id}");
        endpoints.put("reminders", "GET|POST /api/contacts/{id}/reminders, GET|PUT|DELETE /api/reminders/{id}");
        endpoints.put("completeReminder", "POST /api/reminders/{id}/complete - Complete or advance a reminder");
        endpoints.put("upcomingReminders", "GET /api/reminders/upcoming?days=N - Open reminders due within N days");
        endpoints.put("health", "GET /actuator/health - Health check");
        endpoints.put("info", "GET /actuator/info - Application info");

        return ResponseEntity.ok(Map.of(
                "service", "Perema",
                "version", appVersion,
                "endpoints", endpoints
        ));
    }
}
