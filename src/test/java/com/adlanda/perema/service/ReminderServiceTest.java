package com.adlanda.perema.service;

import com.adlanda.perema.entity.Contact;
import com.adlanda.perema.entity.Recurrence;
import com.adlanda.perema.entity.Reminder;
import com.adlanda.perema.exception.ConflictException;
import com.adlanda.perema.exception.InvalidRequestException;
import com.adlanda.perema.exception.ResourceNotFoundException;
import com.adlanda.perema.model.ReminderRequest;
import com.adlanda.perema.model.ReminderResponse;
import com.adlanda.perema.repository.ContactRepository;
import com.adlanda.perema.repository.ReminderRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReminderServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 5, 20);

    @Mock
    private ReminderRepository reminderRepository;

    @Mock
    private ContactRepository contactRepository;

    private ReminderService reminderService;

    private Contact contact;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-05-20T10:15:30Z"), ZoneOffset.UTC);
        reminderService = new ReminderService(reminderRepository, contactRepository, clock);
        contact = new Contact("Ada", "Lovelace");
        contact.setId(1L);
    }

    private Reminder reminder(Recurrence recurrence, LocalDate remindAt) {
        Reminder reminder = new Reminder("Call", remindAt, recurrence);
        reminder.setId(5L);
        contact.addReminder(reminder);
        return reminder;
    }

    @Test
    void create_attachesReminderToContact() {
        when(contactRepository.findById(1L)).thenReturn(Optional.of(contact));
        when(reminderRepository.save(any(Reminder.class))).thenAnswer(invocation -> invocation.getArgument(0));

        ReminderResponse response = reminderService.create(1L,
                new ReminderRequest("  Call about the trip ", TODAY, true, null, null));

        assertThat(response.message()).isEqualTo("Call about the trip");
        assertThat(response.recurrence()).isEqualTo(Recurrence.NONE);
        assertThat(response.byMail()).isTrue();
        assertThat(response.contactId()).isEqualTo(1L);
        assertThat(contact.getReminders()).hasSize(1);
    }

    @Test
    void create_missingContact_throwsNotFound() {
        when(contactRepository.findById(9L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> reminderService.create(9L, new ReminderRequest("Call", TODAY, null, null, null)))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Contact not found");
        verify(reminderRepository, never()).save(any());
    }

    @Test
    void complete_oneOff_marksCompleted() {
        Reminder reminder = reminder(Recurrence.NONE, TODAY.minusDays(1));
        when(reminderRepository.findById(5L)).thenReturn(Optional.of(reminder));
        when(reminderRepository.save(reminder)).thenReturn(reminder);

        ReminderResponse response = reminderService.complete(5L);

        assertThat(response.completed()).isTrue();
        assertThat(response.lastCompletedOn()).isEqualTo(TODAY);
    }

    @Test
    void complete_alreadyCompleted_throwsConflict() {
        Reminder reminder = reminder(Recurrence.NONE, TODAY);
        reminder.setCompleted(true);
        when(reminderRepository.findById(5L)).thenReturn(Optional.of(reminder));

        assertThatThrownBy(() -> reminderService.complete(5L))
                .isInstanceOf(ConflictException.class)
                .hasMessage("Reminder already completed");
    }

    @Test
    void complete_yearly_movesToNextYear() {
        Reminder reminder = reminder(Recurrence.YEARLY, LocalDate.of(2024, 5, 1));
        when(reminderRepository.findById(5L)).thenReturn(Optional.of(reminder));
        when(reminderRepository.save(reminder)).thenReturn(reminder);

        ReminderResponse response = reminderService.complete(5L);

        assertThat(response.completed()).isFalse();
        assertThat(response.remindAt()).isEqualTo(LocalDate.of(2025, 5, 1));
    }

    @Test
    void update_movedDate_clearsNotification() {
        Reminder reminder = reminder(Recurrence.NONE, TODAY);
        reminder.setNotifiedOn(TODAY);
        when(reminderRepository.findById(5L)).thenReturn(Optional.of(reminder));
        when(reminderRepository.save(reminder)).thenReturn(reminder);

        reminderService.update(5L, new ReminderRequest(null, TODAY.plusDays(3), null, null, null));

        assertThat(reminder.getRemindAt()).isEqualTo(TODAY.plusDays(3));
        assertThat(reminder.getNotifiedOn()).isNull();
        assertThat(reminder.getMessage()).isEqualTo("Call");
    }

    @Test
    void update_sameDate_keepsNotification() {
        Reminder reminder = reminder(Recurrence.NONE, TODAY);
        reminder.setNotifiedOn(TODAY);
        when(reminderRepository.findById(5L)).thenReturn(Optional.of(reminder));
        when(reminderRepository.save(reminder)).thenReturn(reminder);

        reminderService.update(5L, new ReminderRequest("Call back", null, null, null, null));

        assertThat(reminder.getNotifiedOn()).isEqualTo(TODAY);
        assertThat(reminder.getMessage()).isEqualTo("Call back");
    }

    @Test
    void upcoming_queriesUntilTodayPlusDays() {
        when(reminderRepository.findOpenDueBy(TODAY.plusDays(7)))
                .thenReturn(List.of(reminder(Recurrence.NONE, TODAY.plusDays(2))));

        List<ReminderResponse> upcoming = reminderService.upcoming(7);

        assertThat(upcoming).hasSize(1);
    }

    @Test
    void upcoming_outOfRange_throwsInvalidRequest() {
        assertThatThrownBy(() -> reminderService.upcoming(-1)).isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> reminderService.upcoming(366)).isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void delete_removesFromContact() {
        Reminder reminder = reminder(Recurrence.NONE, TODAY);
        when(reminderRepository.findById(5L)).thenReturn(Optional.of(reminder));

        reminderService.delete(5L);

        assertThat(contact.getReminders()).isEmpty();
        verify(reminderRepository).delete(reminder);
    }

    @Test
    void listForContact_missingContact_throwsNotFound() {
        when(contactRepository.existsById(3L)).thenReturn(false);

        assertThatThrownBy(() -> reminderService.listForContact(3L))
                .isInstanceOf(ResourceNotFoundException.class);
    }
}
