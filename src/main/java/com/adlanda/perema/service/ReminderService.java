package com.adlanda.perema.service;

import com.adlanda.perema.entity.Contact;
import com.adlanda.perema.entity.Reminder;
import com.adlanda.perema.exception.ConflictException;
import com.adlanda.perema.exception.InvalidRequestException;
import com.adlanda.perema.exception.ResourceNotFoundException;
import com.adlanda.perema.model.ReminderRequest;
import com.adlanda.perema.model.ReminderResponse;
import com.adlanda.perema.repository.ContactRepository;
import com.adlanda.perema.repository.ReminderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Reminders of a contact, including completion and rescheduling of recurring ones.
 */
@Service
public class ReminderService {

    private static final Logger log = LoggerFactory.getLogger(ReminderService.class);

    static final int MAX_UPCOMING_DAYS = 365;

    private final ReminderRepository reminderRepository;
    private final ContactRepository contactRepository;
    private final Clock clock;

    public ReminderService(ReminderRepository reminderRepository, ContactRepository contactRepository, Clock clock) {
        this.reminderRepository = reminderRepository;
        this.contactRepository = contactRepository;
        this.clock = clock;
    }

    @Transactional
    public ReminderResponse create(long contactId, ReminderRequest request) {
        Contact contact = contactRepository.findById(contactId)
                .orElseThrow(ResourceNotFoundException::contact);

        Reminder reminder = new Reminder();
        apply(reminder, request);
        contact.addReminder(reminder);

        Reminder saved = reminderRepository.save(reminder);
        log.info("Created reminder {} for contact {} due {}", saved.getId(), contactId, saved.getRemindAt());
        return ReminderResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public ReminderResponse get(long id) {
        return ReminderResponse.from(findReminder(id));
    }

    @Transactional(readOnly = true)
    public List<ReminderResponse> listForContact(long contactId) {
        if (!contactRepository.existsById(contactId)) {
            throw ResourceNotFoundException.contact();
        }
        return reminderRepository.findByContact_IdOrderByRemindAtAscIdAsc(contactId).stream()
                .map(ReminderResponse::from)
                .toList();
    }

    /**
     * Open reminders due within the next {@code days} days, overdue ones included.
     */
    @Transactional(readOnly = true)
    public List<ReminderResponse> upcoming(int days) {
        if (days < 0 || days > MAX_UPCOMING_DAYS) {
            throw new InvalidRequestException("days must be between 0 and " + MAX_UPCOMING_DAYS);
        }
        LocalDate until = LocalDate.now(clock).plusDays(days);
        return reminderRepository.findOpenDueBy(until).stream()
                .map(ReminderResponse::from)
                .toList();
    }

    @Transactional
    public ReminderResponse update(long id, ReminderRequest request) {
        Reminder reminder = findReminder(id);
        LocalDate previousDate = reminder.getRemindAt();
        apply(reminder, request);
        if (!reminder.getRemindAt().equals(previousDate)) {
            // A moved reminder is due again, even if the old date was already mailed
            reminder.setNotifiedOn(null);
        }
        return ReminderResponse.from(reminderRepository.save(reminder));
    }

    @Transactional
    public void delete(long id) {
        Reminder reminder = findReminder(id);
        reminder.getContact().getReminders().remove(reminder);
        reminderRepository.delete(reminder);
        log.info("Deleted reminder {}", id);
    }

    /**
     * Completes the reminder today. One-off reminders become completed,
     * recurring ones move to their next occurrence.
     *
     * @throws ConflictException if a one-off reminder is already completed
     */
    @Transactional
    public ReminderResponse complete(long id) {
        Reminder reminder = findReminder(id);
        LocalDate today = LocalDate.now(clock);
        try {
            reminder.completeOn(today);
        } catch (IllegalStateException e) {
            throw new ConflictException(e.getMessage());
        }
        log.info("Completed reminder {} ({}), next date {}", id, reminder.getRecurrence(),
                reminder.isCompleted() ? "none" : reminder.getRemindAt());
        return ReminderResponse.from(reminderRepository.save(reminder));
    }

    private void apply(Reminder reminder, ReminderRequest request) {
        if (request.message() != null) reminder.setMessage(request.message().trim());
        if (request.remindAt() != null) reminder.setRemindAt(request.remindAt());
        if (request.byMail() != null) reminder.setByMail(request.byMail());
        if (request.recurrence() != null) reminder.setRecurrence(request.recurrence());
        if (request.reoccurFromCompletion() != null) reminder.setReoccurFromCompletion(request.reoccurFromCompletion());
    }

    private Reminder findReminder(long id) {
        return reminderRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Reminder not found"));
    }
}
