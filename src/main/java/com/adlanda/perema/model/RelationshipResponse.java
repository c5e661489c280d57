package com.adlanda.perema.model;

import com.adlanda.perema.entity.Contact;
import com.adlanda.perema.entity.Relationship;

import java.time.LocalDate;

public record RelationshipResponse(
        Long id,
        String name,
        String type,
        String gender,
        LocalDate birthday,
        Long contactId,
        Long relatedContactId,
        String relatedContactName
) {
    public static RelationshipResponse from(Relationship relationship) {
        Contact related = relationship.getRelatedContact();
        return new RelationshipResponse(
                relationship.getId(),
                relationship.getName(),
                relationship.getType(),
                relationship.getGender(),
                relationship.getBirthday(),
                relationship.getContact().getId(),
                related != null ? related.getId() : null,
                related != null ? related.getFullName() : null
        );
    }
}
