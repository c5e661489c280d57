package com.adlanda.perema.job;

/**
 * Outcome of one run of a notification job.
 *
 * @param job    Job name, e.g. "birthdays"
 * @param sent   Mails handed over to the provider
 * @param failed Mails that could not be sent
 */
public record JobRunSummary(
        String job,
        int sent,
        int failed
) {
    public static JobRunSummary empty(String job) {
        return new JobRunSummary(job, 0, 0);
    }
}
