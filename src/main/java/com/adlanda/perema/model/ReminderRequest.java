package com.adlanda.perema.model;

import com.adlanda.perema.entity.Recurrence;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;

/**
 * Request body for reminders.
 */
public record ReminderRequest(
        @NotBlank(groups = OnCreate.class, message = "Message is required")
        @Pattern(regexp = "(?s).*\\S.*", message = "Message must not be blank")
        @Size(max = 2000)
        String message,

        @NotNull(groups = OnCreate.class, message = "Remind date is required")
        LocalDate remindAt,

        Boolean byMail,
        Recurrence recurrence,
        Boolean reoccurFromCompletion
) {}
