package com.adlanda.perema.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;

/**
 * Request body for activities. A missing date means today.
 */
public record ActivityRequest(
        @NotBlank(groups = OnCreate.class, message = "Name is required")
        @Pattern(regexp = "(?s).*\\S.*", message = "Name must not be blank")
        @Size(max = 255)
        String name,

        @Size(max = 10000) String description,
        LocalDate date,
        @Size(max = 255) String location
) {}
