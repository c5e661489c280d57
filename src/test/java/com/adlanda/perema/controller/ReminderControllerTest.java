package com.adlanda.perema.controller;

import com.adlanda.perema.entity.Recurrence;
import com.adlanda.perema.exception.ConflictException;
import com.adlanda.perema.exception.InvalidRequestException;
import com.adlanda.perema.exception.ResourceNotFoundException;
import com.adlanda.perema.model.ReminderRequest;
import com.adlanda.perema.model.ReminderResponse;
import com.adlanda.perema.service.ReminderService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ReminderController.class)
class ReminderControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ReminderService reminderService;

    private static ReminderResponse reminder(Recurrence recurrence, LocalDate remindAt, boolean completed) {
        return new ReminderResponse(5L, "Call about the trip", remindAt, true, recurrence,
                false, completed, null, null, 1L);
    }

    @Test
    void create_validRequest_returnsReminder() throws Exception {
        when(reminderService.create(eq(1L), any()))
                .thenReturn(reminder(Recurrence.WEEKLY, LocalDate.of(2024, 6, 1), false));

        mockMvc.perform(post("/api/contacts/1/reminders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                            {"message": "Call about the trip", "remind_at": "2024-06-01",
                             "by_mail": true, "recurrence": "weekly"}
                            """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Reminder created successfully"))
                .andExpect(jsonPath("$.reminder.remind_at").value("2024-06-01"))
                .andExpect(jsonPath("$.reminder.by_mail").value(true))
                .andExpect(jsonPath("$.reminder.recurrence").value("WEEKLY"))
                .andExpect(jsonPath("$.reminder.contact_id").value(1));

        ArgumentCaptor<ReminderRequest> captor = ArgumentCaptor.forClass(ReminderRequest.class);
        verify(reminderService).create(eq(1L), captor.capture());
        assertThat(captor.getValue().recurrence()).isEqualTo(Recurrence.WEEKLY);
        assertThat(captor.getValue().remindAt()).isEqualTo(LocalDate.of(2024, 6, 1));
    }

    @Test
    void create_missingDate_returnsValidationError() throws Exception {
        mockMvc.perform(post("/api/contacts/1/reminders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                            {"message": "Call"}
                            """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.remindAt").value("Remind date is required"));
    }

    @Test
    void create_unknownRecurrence_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/contacts/1/reminders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                            {"message": "Call", "remind_at": "2024-06-01", "recurrence": "hourly"}
                            """))
                .andExpect(status().isBadRequest());
    }

    @Test
    void create_missingContact_returnsNotFound() throws Exception {
        when(reminderService.create(eq(9L), any())).thenThrow(ResourceNotFoundException.contact());

        mockMvc.perform(post("/api/contacts/9/reminders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                            {"message": "Call", "remind_at": "2024-06-01"}
                            """))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Contact not found"));
    }

    @Test
    void listForContact_wrapsReminders() throws Exception {
        when(reminderService.listForContact(1L))
                .thenReturn(List.of(reminder(Recurrence.NONE, LocalDate.of(2024, 6, 1), false)));

        mockMvc.perform(get("/api/contacts/1/reminders"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.reminders[0].id").value(5));
    }

    @Test
    void upcoming_defaultsToSevenDays() throws Exception {
        when(reminderService.upcoming(7)).thenReturn(List.of());

        mockMvc.perform(get("/api/reminders/upcoming"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.reminders").isArray());

        verify(reminderService).upcoming(7);
    }

    @Test
    void upcoming_outOfRange_returnsBadRequest() throws Exception {
        when(reminderService.upcoming(400)).thenThrow(new InvalidRequestException("days must be between 0 and 365"));

        mockMvc.perform(get("/api/reminders/upcoming").param("days", "400"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("days must be between 0 and 365"));
    }

    @Test
    void get_missingReminder_returnsNotFound() throws Exception {
        when(reminderService.get(anyLong())).thenThrow(new ResourceNotFoundException("Reminder not found"));

        mockMvc.perform(get("/api/reminders/77"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Reminder not found"));
    }

    @Test
    void update_returnsUpdatedReminder() throws Exception {
        when(reminderService.update(eq(5L), any()))
                .thenReturn(reminder(Recurrence.NONE, LocalDate.of(2024, 7, 1), false));

        mockMvc.perform(put("/api/reminders/5")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                            {"remind_at": "2024-07-01"}
                            """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Reminder updated successfully"))
                .andExpect(jsonPath("$.reminder.remind_at").value("2024-07-01"));
    }

    @Test
    void delete_returnsMessage() throws Exception {
        mockMvc.perform(delete("/api/reminders/5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Reminder deleted"));

        verify(reminderService).delete(5L);
    }

    @Test
    void complete_returnsCompletedReminder() throws Exception {
        when(reminderService.complete(5L))
                .thenReturn(reminder(Recurrence.NONE, LocalDate.of(2024, 6, 1), true));

        mockMvc.perform(post("/api/reminders/5/complete"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Reminder completed"))
                .andExpect(jsonPath("$.reminder.completed").value(true));
    }

    @Test
    void complete_alreadyCompleted_returnsConflict() throws Exception {
        when(reminderService.complete(5L)).thenThrow(new ConflictException("Reminder already completed"));

        mockMvc.perform(post("/api/reminders/5/complete"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Reminder already completed"));
    }
}
