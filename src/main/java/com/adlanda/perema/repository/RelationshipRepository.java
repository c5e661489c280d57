package com.adlanda.perema.repository;

import com.adlanda.perema.entity.Relationship;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface RelationshipRepository extends JpaRepository<Relationship, Long> {

    List<Relationship> findByContact_IdOrderByIdAsc(Long contactId);

    /**
     * Detach relationships of other contacts that point at a contact about to be deleted.
     *
     * @param contactId The contact being deleted
     * @return Number of relationships updated
     */
    @Modifying
    @Query("UPDATE Relationship r SET r.relatedContact = null WHERE r.relatedContact.id = :contactId")
    int clearRelatedContact(Long contactId);
}
