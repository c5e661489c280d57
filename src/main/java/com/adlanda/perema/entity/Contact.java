package com.adlanda.perema.entity;

import jakarta.persistence.*;
import org.hibernate.annotations.BatchSize;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * JPA entity for a person in the address book.
 *
 * A contact owns its notes, activities, reminders and relationships; removing
 * the contact removes them too. Circles are stored as a JSON array in a single
 * column, see {@link CirclesConverter}.
 */
@Entity
@Table(name = "contacts",
       indexes = {
           @Index(name = "idx_contacts_name", columnList = "lastname, firstname"),
           @Index(name = "idx_contacts_birthday", columnList = "birthday_month, birthday_day")
       })
public class Contact {

    /**
     * Birth year used when only day and month of the birthday are known.
     */
    public static final int UNKNOWN_BIRTH_YEAR = 1;

    public static final int MAX_CIRCLES = 30;

    public static final int MAX_CIRCLE_LENGTH = 100;

    // Worst case JSON for MAX_CIRCLES names of MAX_CIRCLE_LENGTH chars, every char escaped to six
    static final int CIRCLES_COLUMN_LENGTH = MAX_CIRCLES * (MAX_CIRCLE_LENGTH * 6 + 3) + 2;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String firstname;

    private String lastname;

    private String nickname;

    private String gender;

    private String email;

    private String phone;

    private LocalDate birthday;

    // Derived from birthday so the daily job can match on day and month portably
    @Column(name = "birthday_month")
    private Integer birthdayMonth;

    @Column(name = "birthday_day")
    private Integer birthdayDay;

    @Column(length = 1000)
    private String address;

    @Column(name = "how_we_met", length = 4000)
    private String howWeMet;

    @Column(name = "food_preference", length = 4000)
    private String foodPreference;

    @Column(name = "work_information", length = 4000)
    private String workInformation;

    @Column(name = "contact_information", length = 4000)
    private String contactInformation;

    @Convert(converter = CirclesConverter.class)
    @Column(name = "circles", length = CIRCLES_COLUMN_LENGTH)
    private List<String> circles = new ArrayList<>();

    // Raw JSON of the circles column, read-only, for LIKE filtering
    @Column(name = "circles", length = CIRCLES_COLUMN_LENGTH, insertable = false, updatable = false)
    private String circlesJson;

    private String photo;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @OneToMany(mappedBy = "contact", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("date DESC, id DESC")
    @BatchSize(size = 50)
    private List<Note> notes = new ArrayList<>();

    @OneToMany(mappedBy = "contact", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("date DESC, id DESC")
    @BatchSize(size = 50)
    private List<Activity> activities = new ArrayList<>();

    @OneToMany(mappedBy = "contact", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    @BatchSize(size = 50)
    private List<Relationship> relationships = new ArrayList<>();

    @OneToMany(mappedBy = "contact", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("remindAt ASC, id ASC")
    @BatchSize(size = 50)
    private List<Reminder> reminders = new ArrayList<>();

    // Default constructor for JPA
    public Contact() {
    }

    public Contact(String firstname, String lastname) {
        this.firstname = firstname;
        this.lastname = lastname;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
        syncBirthdayParts();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
        syncBirthdayParts();
    }

    private void syncBirthdayParts() {
        birthdayMonth = birthday != null ? birthday.getMonthValue() : null;
        birthdayDay = birthday != null ? birthday.getDayOfMonth() : null;
    }

    /**
     * Returns true when the birthday is known including its year.
     */
    public boolean hasBirthYear() {
        return birthday != null && birthday.getYear() != UNKNOWN_BIRTH_YEAR;
    }

    public String getFullName() {
        return (firstname + " " + (lastname != null ? lastname : "")).trim();
    }

    public void addNote(Note note) {
        note.setContact(this);
        notes.add(note);
    }

    public void addActivity(Activity activity) {
        activity.setContact(this);
        activities.add(activity);
    }

    public void addRelationship(Relationship relationship) {
        relationship.setContact(this);
        relationships.add(relationship);
    }

    public void addReminder(Reminder reminder) {
        reminder.setContact(this);
        reminders.add(reminder);
    }

    // Getters and Setters
    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getFirstname() {
        return firstname;
    }

    public void setFirstname(String firstname) {
        this.firstname = firstname;
    }

    public String getLastname() {
        return lastname;
    }

    public void setLastname(String lastname) {
        this.lastname = lastname;
    }

    public String getNickname() {
        return nickname;
    }

    public void setNickname(String nickname) {
        this.nickname = nickname;
    }

    public String getGender() {
        return gender;
    }

    public void setGender(String gender) {
        this.gender = gender;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getPhone() {
        return phone;
    }

    public void setPhone(String phone) {
        this.phone = phone;
    }

    public LocalDate getBirthday() {
        return birthday;
    }

    public void setBirthday(LocalDate birthday) {
        this.birthday = birthday;
        syncBirthdayParts();
    }

    public Integer getBirthdayMonth() {
        return birthdayMonth;
    }

    public Integer getBirthdayDay() {
        return birthdayDay;
    }

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }

    public String getHowWeMet() {
        return howWeMet;
    }

    public void setHowWeMet(String howWeMet) {
        this.howWeMet = howWeMet;
    }

    public String getFoodPreference() {
        return foodPreference;
    }

    public void setFoodPreference(String foodPreference) {
        this.foodPreference = foodPreference;
    }

    public String getWorkInformation() {
        return workInformation;
    }

    public void setWorkInformation(String workInformation) {
        this.workInformation = workInformation;
    }

    public String getContactInformation() {
        return contactInformation;
    }

    public void setContactInformation(String contactInformation) {
        this.contactInformation = contactInformation;
    }

    public List<String> getCircles() {
        return circles;
    }

    public void setCircles(List<String> circles) {
        this.circles = circles != null ? new ArrayList<>(circles) : new ArrayList<>();
    }

    public String getPhoto() {
        return photo;
    }

    public void setPhoto(String photo) {
        this.photo = photo;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public List<Note> getNotes() {
        return notes;
    }

    public List<Activity> getActivities() {
        return activities;
    }

    public List<Relationship> getRelationships() {
        return relationships;
    }

    public List<Reminder> getReminders() {
        return reminders;
    }

    @Override
    public String toString() {
        return "Contact{" +
                "id=" + id +
                ", firstname='" + firstname + '\'' +
                ", lastname='" + lastname + '\'' +
                ", birthday=" + birthday +
                ", circles=" + circles +
                '}';
    }
}
