package com.adlanda.perema.job;

import com.adlanda.perema.config.MailProperties;
import com.adlanda.perema.entity.Contact;
import com.adlanda.perema.mail.MailDeliveryException;
import com.adlanda.perema.mail.TemplatedMail;
import com.adlanda.perema.mail.TemplatedMailSender;
import com.adlanda.perema.repository.ContactRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.Month;
import java.util.List;
import java.util.Map;

/**
 * Mails a birthday notice for every contact whose birthday is today.
 *
 * People born on 29 February are celebrated on 28 February in non-leap years.
 */
@Service
public class BirthdayReminderJob {

    private static final Logger log = LoggerFactory.getLogger(BirthdayReminderJob.class);

    public static final String NAME = "birthdays";

    private final ContactRepository contactRepository;
    private final TemplatedMailSender mailSender;
    private final MailProperties mailProperties;
    private final Clock clock;

    public BirthdayReminderJob(ContactRepository contactRepository,
                               TemplatedMailSender mailSender,
                               MailProperties mailProperties,
                               Clock clock) {
        this.contactRepository = contactRepository;
        this.mailSender = mailSender;
        this.mailProperties = mailProperties;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public JobRunSummary run() {
        LocalDate today = LocalDate.now(clock);
        List<Contact> birthdayPeople = contactRepository.findByBirthdayMonthAndBirthdayDayIn(
                today.getMonthValue(), birthdayDaysFor(today));

        if (birthdayPeople.isEmpty()) {
            log.debug("No birthdays on {}", today);
            return JobRunSummary.empty(NAME);
        }
        if (mailProperties.getToEmail() == null || mailProperties.getToEmail().isBlank()) {
            log.warn("{} birthdays today but no recipient configured (perema.mail.sendgrid.to-email)",
                    birthdayPeople.size());
            return new JobRunSummary(NAME, 0, birthdayPeople.size());
        }

        int sent = 0;
        int failed = 0;
        for (Contact contact : birthdayPeople) {
            try {
                mailSender.send(toMail(contact, today));
                sent++;
                log.debug("Sent birthday mail for contact {}", contact.getId());
            } catch (MailDeliveryException e) {
                failed++;
                log.warn("Failed to send birthday mail for contact {}: {}", contact.getId(), e.getMessage());
            }
        }

        log.info("Birthday job for {}: {} sent, {} failed", today, sent, failed);
        return new JobRunSummary(NAME, sent, failed);
    }

    TemplatedMail toMail(Contact contact, LocalDate today) {
        return new TemplatedMail(
                mailProperties.getToEmail(),
                mailProperties.getBirthdayTemplateId(),
                Map.of(
                        "birthday_person_nick", nickOrFirstname(contact),
                        "birthday_person", contact.getFullName(),
                        "birthday_age", describeAge(contact, today)
                ));
    }

    /**
     * Days of the current month whose birthdays fall on {@code today}.
     */
    static List<Integer> birthdayDaysFor(LocalDate today) {
        if (today.getMonth() == Month.FEBRUARY && today.getDayOfMonth() == 28 && !today.isLeapYear()) {
            return List.of(28, 29);
        }
        return List.of(today.getDayOfMonth());
    }

    static String describeAge(Contact contact, LocalDate today) {
        if (!contact.hasBirthYear()) {
            return "unknown age";
        }
        return (today.getYear() - contact.getBirthday().getYear()) + " years old";
    }

    static String nickOrFirstname(Contact contact) {
        String nickname = contact.getNickname();
        return nickname == null || nickname.isBlank() ? contact.getFirstname() : nickname;
    }
}
