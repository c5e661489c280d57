package com.adlanda.perema.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;

/**
 * Request body for relationships.
 *
 * @param relatedContactId Optional id of an existing contact this relationship points at
 */
public record RelationshipRequest(
        @NotBlank(groups = OnCreate.class, message = "Name is required")
        @Pattern(regexp = "(?s).*\\S.*", message = "Name must not be blank")
        @Size(max = 255)
        String name,

        @Size(max = 64) String type,
        @Size(max = 64) String gender,
        LocalDate birthday,
        Long relatedContactId
) {}
