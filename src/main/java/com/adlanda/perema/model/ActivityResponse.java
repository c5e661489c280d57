package com.adlanda.perema.model;

import com.adlanda.perema.entity.Activity;

import java.time.Instant;
import java.time.LocalDate;

public record ActivityResponse(
        Long id,
        String name,
        String description,
        LocalDate date,
        String location,
        Long contactId,
        Instant createdAt
) {
    public static ActivityResponse from(Activity activity) {
        return new ActivityResponse(activity.getId(), activity.getName(), activity.getDescription(),
                activity.getDate(), activity.getLocation(), activity.getContact().getId(),
                activity.getCreatedAt());
    }
}
