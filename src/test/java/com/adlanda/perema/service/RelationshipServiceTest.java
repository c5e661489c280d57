package com.adlanda.perema.service;

import com.adlanda.perema.entity.Contact;
import com.adlanda.perema.entity.Relationship;
import com.adlanda.perema.exception.InvalidRequestException;
import com.adlanda.perema.exception.ResourceNotFoundException;
import com.adlanda.perema.model.RelationshipRequest;
import com.adlanda.perema.model.RelationshipResponse;
import com.adlanda.perema.repository.ContactRepository;
import com.adlanda.perema.repository.RelationshipRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RelationshipServiceTest {

    @Mock
    private RelationshipRepository relationshipRepository;

    @Mock
    private ContactRepository contactRepository;

    private RelationshipService relationshipService;

    private Contact ada;

    @BeforeEach
    void setUp() {
        relationshipService = new RelationshipService(relationshipRepository, contactRepository);
        ada = new Contact("Ada", "Lovelace");
        ada.setId(1L);
    }

    @Test
    void create_withRelatedContact_linksIt() {
        Contact byron = new Contact("Lord", "Byron");
        byron.setId(2L);
        when(contactRepository.findById(1L)).thenReturn(Optional.of(ada));
        when(contactRepository.findById(2L)).thenReturn(Optional.of(byron));
        when(relationshipRepository.save(any(Relationship.class))).thenAnswer(invocation -> invocation.getArgument(0));

        RelationshipResponse response = relationshipService.create(1L,
                new RelationshipRequest("Father", "father", "male", null, 2L));

        assertThat(response.relatedContactId()).isEqualTo(2L);
        assertThat(response.relatedContactName()).isEqualTo("Lord Byron");
        assertThat(response.contactId()).isEqualTo(1L);
        assertThat(ada.getRelationships()).hasSize(1);
    }

    @Test
    void create_withoutRelatedContact_isFreeStanding() {
        when(contactRepository.findById(1L)).thenReturn(Optional.of(ada));
        when(relationshipRepository.save(any(Relationship.class))).thenAnswer(invocation -> invocation.getArgument(0));

        RelationshipResponse response = relationshipService.create(1L,
                new RelationshipRequest("Annabella", "mother", null, null, null));

        assertThat(response.relatedContactId()).isNull();
        assertThat(response.relatedContactName()).isNull();
    }

    @Test
    void create_selfReference_isRejected() {
        when(contactRepository.findById(1L)).thenReturn(Optional.of(ada));

        assertThatThrownBy(() -> relationshipService.create(1L,
                new RelationshipRequest("Me", null, null, null, 1L)))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessage("A contact cannot be related to itself");
        verify(relationshipRepository, never()).save(any());
    }

    @Test
    void create_unknownRelatedContact_isRejected() {
        when(contactRepository.findById(1L)).thenReturn(Optional.of(ada));
        when(contactRepository.findById(404L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> relationshipService.create(1L,
                new RelationshipRequest("Ghost", null, null, null, 404L)))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessage("Related contact not found");
    }

    private Relationship linkedToByron(long id) {
        Contact byron = new Contact("Lord", "Byron");
        byron.setId(2L);
        Relationship relationship = new Relationship("Father", "father");
        relationship.setId(id);
        relationship.setRelatedContact(byron);
        ada.addRelationship(relationship);
        return relationship;
    }

    @Test
    void update_withoutRelatedContactId_keepsExistingLink() {
        Relationship relationship = linkedToByron(10L);
        when(relationshipRepository.findById(10L)).thenReturn(Optional.of(relationship));
        when(relationshipRepository.save(relationship)).thenReturn(relationship);

        RelationshipResponse response = relationshipService.update(10L,
                new RelationshipRequest("Lord Byron", null, "male", null, null));

        assertThat(response.name()).isEqualTo("Lord Byron");
        assertThat(response.type()).isEqualTo("father");
        assertThat(response.gender()).isEqualTo("male");
        assertThat(response.relatedContactId()).isEqualTo(2L);
        assertThat(response.relatedContactName()).isEqualTo("Lord Byron");
        verify(contactRepository, never()).findById(any());
    }

    @Test
    void update_newRelatedContactId_relinks() {
        Relationship relationship = linkedToByron(10L);
        Contact babbage = new Contact("Charles", "Babbage");
        babbage.setId(3L);
        when(relationshipRepository.findById(10L)).thenReturn(Optional.of(relationship));
        when(contactRepository.findById(3L)).thenReturn(Optional.of(babbage));
        when(relationshipRepository.save(relationship)).thenReturn(relationship);

        RelationshipResponse response = relationshipService.update(10L,
                new RelationshipRequest(null, "colleague", null, null, 3L));

        assertThat(response.relatedContactId()).isEqualTo(3L);
        assertThat(response.type()).isEqualTo("colleague");
        assertThat(response.name()).isEqualTo("Father");
    }

    @Test
    void update_pointingAtOwner_isRejected() {
        Relationship relationship = linkedToByron(10L);
        when(relationshipRepository.findById(10L)).thenReturn(Optional.of(relationship));

        assertThatThrownBy(() -> relationshipService.update(10L,
                new RelationshipRequest(null, null, null, null, 1L)))
                .isInstanceOf(InvalidRequestException.class);
        assertThat(relationship.getRelatedContact().getId()).isEqualTo(2L);
        verify(relationshipRepository, never()).save(any());
    }

    @Test
    void update_missingRelationship_isNotFound() {
        when(relationshipRepository.findById(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> relationshipService.update(99L,
                new RelationshipRequest("X", null, null, null, null)))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Relationship not found");
    }

    @Test
    void delete_removesFromOwner() {
        Relationship relationship = linkedToByron(10L);
        when(relationshipRepository.findById(10L)).thenReturn(Optional.of(relationship));

        relationshipService.delete(10L);

        assertThat(ada.getRelationships()).isEmpty();
        verify(relationshipRepository).delete(relationship);
    }

    @Test
    void delete_missingRelationship_isNotFound() {
        when(relationshipRepository.findById(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> relationshipService.delete(99L))
                .isInstanceOf(ResourceNotFoundException.class);
        verify(relationshipRepository, never()).delete(any());
    }
}
