package com.adlanda.perema;

import com.adlanda.perema.config.JobProperties;
import com.adlanda.perema.config.MailProperties;
import com.adlanda.perema.repository.ContactRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

@Component
public class StartupInfoLogger implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StartupInfoLogger.class);

    private final ContactRepository contactRepository;
    private final MailProperties mailProperties;
    private final JobProperties jobProperties;

    @Value("${server.port:8080}")
    private int port;

    @Value("${info.app.version:0.0.1-SNAPSHOT}")
    private String version;

    public StartupInfoLogger(ContactRepository contactRepository,
                             MailProperties mailProperties,
                             JobProperties jobProperties) {
        this.contactRepository = contactRepository;
        this.mailProperties = mailProperties;
        this.jobProperties = jobProperties;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("""

            Perema v{}
            Contacts: {}
            Mail: {}
            Daily jobs: {} ({} {})

            Frontend:
              http://localhost:{}/

            API Endpoints:
              GET  http://localhost:{}/api
              GET  http://localhost:{}/api/contacts
              GET  http://localhost:{}/api/reminders/upcoming

            Health:
              GET  http://localhost:{}/actuator/health
            """,
            version, contactRepository.count(),
            mailProperties.hasApiKey() ? "SendGrid" : "dry run (no API key)",
            jobProperties.isEnabled() ? "enabled" : "disabled", jobProperties.getCron(), jobProperties.getZone(),
            port, port, port, port, port
        );
    }
}
