package com.adlanda.perema.entity;

import jakarta.persistence.*;

import java.time.Instant;
import java.time.LocalDate;

/**
 * A scheduled notification about a contact.
 *
 * Recurring reminders are never marked completed; completing one moves
 * {@code remindAt} to the next occurrence instead. With
 * {@code reoccurFromCompletion} the next occurrence is counted from the day of
 * completion, otherwise from the original schedule.
 */
@Entity
@Table(name = "reminders",
       indexes = {
           @Index(name = "idx_reminders_contact", columnList = "contact_id"),
           @Index(name = "idx_reminders_due", columnList = "completed, remind_at")
       })
public class Reminder {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 2000)
    private String message;

    @Column(name = "remind_at", nullable = false)
    private LocalDate remindAt;

    @Column(name = "by_mail", nullable = false)
    private boolean byMail;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Recurrence recurrence = Recurrence.NONE;

    @Column(name = "reoccur_from_completion", nullable = false)
    private boolean reoccurFromCompletion;

    @Column(nullable = false)
    private boolean completed;

    @Column(name = "last_completed_on")
    private LocalDate lastCompletedOn;

    /**
     * Day the due mail went out for the current {@code remindAt}, null if not yet sent.
     */
    @Column(name = "notified_on")
    private LocalDate notifiedOn;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "contact_id", nullable = false)
    private Contact contact;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public Reminder() {
    }

    public Reminder(String message, LocalDate remindAt, Recurrence recurrence) {
        this.message = message;
        this.remindAt = remindAt;
        this.recurrence = recurrence;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        if (recurrence == null) {
            recurrence = Recurrence.NONE;
        }
    }

    /**
     * Marks this reminder done on {@code today}.
     *
     * @throws IllegalStateException if a one-off reminder is already completed
     */
    public void completeOn(LocalDate today) {
        if (!recurrence.isRecurring()) {
            if (completed) {
                throw new IllegalStateException("Reminder already completed");
            }
            completed = true;
            lastCompletedOn = today;
            return;
        }

        LocalDate next;
        if (reoccurFromCompletion) {
            next = recurrence.next(today);
        } else {
            next = recurrence.next(remindAt);
            while (!next.isAfter(today)) {
                next = recurrence.next(next);
            }
        }
        remindAt = next;
        completed = false;
        lastCompletedOn = today;
        notifiedOn = null;
    }

    /**
     * Returns true if a due mail should go out for this reminder on {@code today}.
     */
    public boolean isMailDue(LocalDate today) {
        return byMail
                && !completed
                && !remindAt.isAfter(today)
                && (notifiedOn == null || notifiedOn.isBefore(remindAt));
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public LocalDate getRemindAt() {
        return remindAt;
    }

    public void setRemindAt(LocalDate remindAt) {
        this.remindAt = remindAt;
    }

    public boolean isByMail() {
        return byMail;
    }

    public void setByMail(boolean byMail) {
        this.byMail = byMail;
    }

    public Recurrence getRecurrence() {
        return recurrence;
    }

    public void setRecurrence(Recurrence recurrence) {
        this.recurrence = recurrence != null ? recurrence : Recurrence.NONE;
    }

    public boolean isReoccurFromCompletion() {
        return reoccurFromCompletion;
    }

    public void setReoccurFromCompletion(boolean reoccurFromCompletion) {
        this.reoccurFromCompletion = reoccurFromCompletion;
    }

    public boolean isCompleted() {
        return completed;
    }

    public void setCompleted(boolean completed) {
        this.completed = completed;
    }

    public LocalDate getLastCompletedOn() {
        return lastCompletedOn;
    }

    public LocalDate getNotifiedOn() {
        return notifiedOn;
    }

    public void setNotifiedOn(LocalDate notifiedOn) {
        this.notifiedOn = notifiedOn;
    }

    public Contact getContact() {
        return contact;
    }

    public void setContact(Contact contact) {
        this.contact = contact;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
