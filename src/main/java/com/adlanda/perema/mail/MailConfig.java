package com.adlanda.perema.mail;

import com.adlanda.perema.config.MailProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * Chooses the mail sender: SendGrid when an API key is configured, dry-run otherwise.
 */
@Configuration
public class MailConfig {

    private static final Logger log = LoggerFactory.getLogger(MailConfig.class);

    @Bean
    public TemplatedMailSender templatedMailSender(MailProperties properties,
                                                   RestClient.Builder restClientBuilder) {
        if (!properties.hasApiKey()) {
            log.warn("No SendGrid API key configured (perema.mail.sendgrid.api-key); mails will only be logged");
            return new DryRunMailSender();
        }
        log.info("Sending mails through SendGrid at {}", properties.getBaseUrl());
        return new SendGridMailSender(restClientBuilder, properties);
    }
}
