package com.adlanda.perema.mail;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs mails instead of sending them. Used when no SendGrid API key is configured.
 */
public class DryRunMailSender implements TemplatedMailSender {

    private static final Logger log = LoggerFactory.getLogger(DryRunMailSender.class);

    @Override
    public void send(TemplatedMail mail) {
        log.info("[dry-run] Would send template {} to {} with data {}",
                mail.templateId(), mail.to(), mail.templateData());
    }
}
