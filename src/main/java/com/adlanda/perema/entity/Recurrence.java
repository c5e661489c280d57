package com.adlanda.perema.entity;

import java.time.LocalDate;
import java.util.function.UnaryOperator;

/**
 * How a reminder repeats once it has been completed.
 *
 * Month and year steps follow {@link LocalDate#plusMonths(long)} and
 * {@link LocalDate#plusYears(long)}: the 31st becomes the last day of a
 * shorter month, 29 February becomes 28 February.
 */
public enum Recurrence {

    /**
     * One-off reminder
     */
    NONE(null),

    DAILY(date -> date.plusDays(1)),

    WEEKLY(date -> date.plusWeeks(1)),

    MONTHLY(date -> date.plusMonths(1)),

    YEARLY(date -> date.plusYears(1));

    private final UnaryOperator<LocalDate> step;

    Recurrence(UnaryOperator<LocalDate> step) {
        this.step = step;
    }

    public boolean isRecurring() {
        return step != null;
    }

    /**
     * Returns the occurrence one period after {@code date}.
     *
     * @throws IllegalStateException for {@link #NONE}
     */
    public LocalDate next(LocalDate date) {
        if (step == null) {
            throw new IllegalStateException("Reminder does not recur");
        }
        return step.apply(date);
    }
}
