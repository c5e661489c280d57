package com.adlanda.perema.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;

/**
 * Request body for notes. A missing date means today.
 */
public record NoteRequest(
        @NotBlank(groups = OnCreate.class, message = "Content is required")
        @Pattern(regexp = "(?s).*\\S.*", message = "Content must not be blank")
        @Size(max = 10000)
        String content,

        LocalDate date
) {}
