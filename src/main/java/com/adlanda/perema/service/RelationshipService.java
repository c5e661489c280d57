package com.adlanda.perema.service;

import com.adlanda.perema.entity.Contact;
import com.adlanda.perema.entity.Relationship;
import com.adlanda.perema.exception.InvalidRequestException;
import com.adlanda.perema.exception.ResourceNotFoundException;
import com.adlanda.perema.model.RelationshipRequest;
import com.adlanda.perema.model.RelationshipResponse;
import com.adlanda.perema.repository.ContactRepository;
import com.adlanda.perema.repository.RelationshipRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
public class RelationshipService {

    private static final Logger log = LoggerFactory.getLogger(RelationshipService.class);

    private final RelationshipRepository relationshipRepository;
    private final ContactRepository contactRepository;

    public RelationshipService(RelationshipRepository relationshipRepository,
                               ContactRepository contactRepository) {
        this.relationshipRepository = relationshipRepository;
        this.contactRepository = contactRepository;
    }

    /**
     * Adds a relationship to a contact. If a related contact id is given, it
     * must name an existing contact other than the owner.
     */
    @Transactional
    public RelationshipResponse create(long contactId, RelationshipRequest request) {
        Contact contact = contactRepository.findById(contactId)
                .orElseThrow(ResourceNotFoundException::contact);

        Relationship relationship = new Relationship();
        apply(relationship, contact, request);
        contact.addRelationship(relationship);

        Relationship saved = relationshipRepository.save(relationship);
        log.info("Created relationship {} for contact {}", saved.getId(), contactId);
        return RelationshipResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public List<RelationshipResponse> listForContact(long contactId) {
        if (!contactRepository.existsById(contactId)) {
            throw ResourceNotFoundException.contact();
        }
        return relationshipRepository.findByContact_IdOrderByIdAsc(contactId).stream()
                .map(RelationshipResponse::from)
                .toList();
    }

    @Transactional
    public RelationshipResponse update(long id, RelationshipRequest request) {
        Relationship relationship = findRelationship(id);
        apply(relationship, relationship.getContact(), request);
        return RelationshipResponse.from(relationshipRepository.save(relationship));
    }

    @Transactional
    public void delete(long id) {
        Relationship relationship = findRelationship(id);
        relationship.getContact().getRelationships().remove(relationship);
        relationshipRepository.delete(relationship);
        log.info("Deleted relationship {}", id);
    }

    private void apply(Relationship relationship, Contact owner, RelationshipRequest request) {
        if (request.name() != null) relationship.setName(request.name().trim());
        if (request.type() != null) relationship.setType(request.type());
        if (request.gender() != null) relationship.setGender(request.gender());
        if (request.birthday() != null) relationship.setBirthday(request.birthday());

        if (request.relatedContactId() != null) {
            if (request.relatedContactId().equals(owner.getId())) {
                throw new InvalidRequestException("A contact cannot be related to itself");
            }
            Contact related = contactRepository.findById(request.relatedContactId())
                    .orElseThrow(() -> new InvalidRequestException("Related contact not found"));
            relationship.setRelatedContact(related);
        }
    }

    private Relationship findRelationship(long id) {
        return relationshipRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Relationship not found"));
    }
}
