package com.adlanda.perema.repository;

import com.adlanda.perema.entity.Reminder;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;

/**
 * Repository for reminders.
 *
 * Key queries:
 * - Reminders of one contact (for the contact page)
 * - Open reminders up to a date (upcoming list)
 * - Reminders whose mail is due (for the daily job)
 */
@Repository
public interface ReminderRepository extends JpaRepository<Reminder, Long> {

    List<Reminder> findByContact_IdOrderByRemindAtAscIdAsc(Long contactId);

    /**
     * Open reminders due on or before the given day, soonest first.
     */
    @Query("SELECT r FROM Reminder r JOIN FETCH r.contact " +
           "WHERE r.completed = false AND r.remindAt <= :until ORDER BY r.remindAt ASC, r.id ASC")
    List<Reminder> findOpenDueBy(LocalDate until);

    /**
     * Mail reminders that are due and have not been mailed for their current date yet.
     */
    @Query("SELECT r FROM Reminder r JOIN FETCH r.contact " +
           "WHERE r.byMail = true AND r.completed = false AND r.remindAt <= :today " +
           "AND (r.notifiedOn IS NULL OR r.notifiedOn < r.remindAt) " +
           "ORDER BY r.remindAt ASC, r.id ASC")
    List<Reminder> findMailDue(LocalDate today);

    /**
     * Records that the mail for a reminder went out, in its own transaction.
     *
     * @return Number of reminders updated
     */
    @Transactional
    @Modifying
    @Query("UPDATE Reminder r SET r.notifiedOn = :day WHERE r.id = :id")
    int markNotified(Long id, LocalDate day);
}
