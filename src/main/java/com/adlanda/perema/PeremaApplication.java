package com.adlanda.perema;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Perema - Personal Relationship Manager
 *
 * Keeps track of the people you care about: contacts, how they relate to each
 * other, notes, shared activities and reminders. A daily job sends birthday
 * and reminder emails through SendGrid dynamic templates.
 *
 * This application uses:
 * - Spring Boot 3.3 (web, data-jpa, validation, actuator)
 * - PostgreSQL for persistence
 * - SendGrid v3 mail API for templated notifications
 */
@SpringBootApplication
public class PeremaApplication {

    public static void main(String[] args) {
        SpringApplication.run(PeremaApplication.class, args);
    }
}
