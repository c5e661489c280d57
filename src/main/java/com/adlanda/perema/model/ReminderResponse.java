package com.adlanda.perema.model;

import com.adlanda.perema.entity.Recurrence;
import com.adlanda.perema.entity.Reminder;

import java.time.LocalDate;

public record ReminderResponse(
        Long id,
        String message,
        LocalDate remindAt,
        boolean byMail,
        Recurrence recurrence,
        boolean reoccurFromCompletion,
        boolean completed,
        LocalDate lastCompletedOn,
        LocalDate notifiedOn,
        Long contactId
) {
    public static ReminderResponse from(Reminder reminder) {
        return new ReminderResponse(
                reminder.getId(),
                reminder.getMessage(),
                reminder.getRemindAt(),
                reminder.isByMail(),
                reminder.getRecurrence(),
                reminder.isReoccurFromCompletion(),
                reminder.isCompleted(),
                reminder.getLastCompletedOn(),
                reminder.getNotifiedOn(),
                reminder.getContact().getId()
        );
    }
}
