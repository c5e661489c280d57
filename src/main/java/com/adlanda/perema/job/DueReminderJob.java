package com.adlanda.perema.job;

import com.adlanda.perema.config.MailProperties;
import com.adlanda.perema.entity.Reminder;
import com.adlanda.perema.mail.MailDeliveryException;
import com.adlanda.perema.mail.TemplatedMail;
import com.adlanda.perema.mail.TemplatedMailSender;
import com.adlanda.perema.repository.ReminderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Mails every open mail reminder that is due, once per due date.
 *
 * A reminder that was mailed is marked with the day it went out, so a failed
 * send is retried on the next run while a successful one is not repeated.
 * The mark is committed per reminder; no transaction spans the mail calls.
 */
@Service
public class DueReminderJob {

    private static final Logger log = LoggerFactory.getLogger(DueReminderJob.class);

    public static final String NAME = "reminders";

    private final ReminderRepository reminderRepository;
    private final TemplatedMailSender mailSender;
    private final MailProperties mailProperties;
    private final Clock clock;

    public DueReminderJob(ReminderRepository reminderRepository,
                          TemplatedMailSender mailSender,
                          MailProperties mailProperties,
                          Clock clock) {
        this.reminderRepository = reminderRepository;
        this.mailSender = mailSender;
        this.mailProperties = mailProperties;
        this.clock = clock;
    }

    public JobRunSummary run() {
        LocalDate today = LocalDate.now(clock);
        List<Reminder> due = reminderRepository.findMailDue(today);

        if (due.isEmpty()) {
            log.debug("No reminders due on {}", today);
            return JobRunSummary.empty(NAME);
        }
        if (mailProperties.getToEmail() == null || mailProperties.getToEmail().isBlank()) {
            log.warn("{} reminders due but no recipient configured (perema.mail.sendgrid.to-email)", due.size());
            return new JobRunSummary(NAME, 0, due.size());
        }

        int sent = 0;
        int failed = 0;
        for (Reminder reminder : due) {
            try {
                mailSender.send(toMail(reminder));
            } catch (MailDeliveryException e) {
                failed++;
                log.warn("Failed to send reminder {}: {}", reminder.getId(), e.getMessage());
                continue;
            } catch (RuntimeException e) {
                failed++;
                log.error("Unexpected error mailing reminder {}", reminder.getId(), e);
                continue;
            }
            reminderRepository.markNotified(reminder.getId(), today);
            reminder.setNotifiedOn(today);
            sent++;
        }

        log.info("Reminder job for {}: {} sent, {} failed", today, sent, failed);
        return new JobRunSummary(NAME, sent, failed);
    }

    TemplatedMail toMail(Reminder reminder) {
        return new TemplatedMail(
                mailProperties.getToEmail(),
                mailProperties.getReminderTemplateId(),
                Map.of(
                        "reminder_message", reminder.getMessage(),
                        "contact_name", reminder.getContact().getFullName(),
                        "remind_at", reminder.getRemindAt().toString()
                ));
    }
}
