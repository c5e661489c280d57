package com.adlanda.perema.entity;

import jakarta.persistence.*;

import java.time.LocalDate;

/**
 * Directed association from the owning contact to a person, e.g. "sibling of".
 *
 * The person may exist only as this record (name, gender, birthday) or may be
 * another contact, referenced through {@code relatedContact}.
 */
@Entity
@Table(name = "relationships",
       indexes = {
           @Index(name = "idx_relationships_contact", columnList = "contact_id"),
           @Index(name = "idx_relationships_related", columnList = "related_contact_id")
       })
public class Relationship {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(name = "relationship_type")
    private String type;

    private String gender;

    private LocalDate birthday;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "contact_id", nullable = false)
    private Contact contact;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "related_contact_id")
    private Contact relatedContact;

    public Relationship() {
    }

    public Relationship(String name, String type) {
        this.name = name;
        this.type = type;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getGender() {
        return gender;
    }

    public void setGender(String gender) {
        this.gender = gender;
    }

    public LocalDate getBirthday() {
        return birthday;
    }

    public void setBirthday(LocalDate birthday) {
        this.birthday = birthday;
    }

    public Contact getContact() {
        return contact;
    }

    public void setContact(Contact contact) {
        this.contact = contact;
    }

    public Contact getRelatedContact() {
        return relatedContact;
    }

    public void setRelatedContact(Contact relatedContact) {
        this.relatedContact = relatedContact;
    }
}
