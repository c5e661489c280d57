package com.adlanda.perema.mail;

/**
 * Sends templated notification mails.
 */
public interface TemplatedMailSender {

    /**
     * Sends one mail.
     *
     * @throws MailDeliveryException if the provider rejects or cannot be reached
     */
    void send(TemplatedMail mail);
}
