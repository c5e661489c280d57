package com.adlanda.perema.model;

import com.adlanda.perema.entity.Contact;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * A contact with all of its related records.
 */
public record ContactResponse(
        Long id,
        String firstname,
        String lastname,
        String nickname,
        String gender,
        String email,
        String phone,
        LocalDate birthday,
        String address,
        String howWeMet,
        String foodPreference,
        String workInformation,
        String contactInformation,
        List<String> circles,
        String photo,
        Instant createdAt,
        Instant updatedAt,
        List<NoteResponse> notes,
        List<ActivityResponse> activities,
        List<RelationshipResponse> relationships,
        List<ReminderResponse> reminders
) {
    public static ContactResponse from(Contact contact) {
        return new ContactResponse(
                contact.getId(),
                contact.getFirstname(),
                contact.getLastname(),
                contact.getNickname(),
                contact.getGender(),
                contact.getEmail(),
                contact.getPhone(),
                contact.getBirthday(),
                contact.getAddress(),
                contact.getHowWeMet(),
                contact.getFoodPreference(),
                contact.getWorkInformation(),
                contact.getContactInformation(),
                List.copyOf(contact.getCircles()),
                contact.getPhoto(),
                contact.getCreatedAt(),
                contact.getUpdatedAt(),
                contact.getNotes().stream().map(NoteResponse::from).toList(),
                contact.getActivities().stream().map(ActivityResponse::from).toList(),
                contact.getRelationships().stream().map(RelationshipResponse::from).toList(),
                contact.getReminders().stream().map(ReminderResponse::from).toList()
        );
    }
}
