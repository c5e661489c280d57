package com.adlanda.perema.mail;

import com.adlanda.perema.config.MailProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.Map;

/**
 * Sends mails through the SendGrid v3 mail API using dynamic templates.
 *
 * The free tier allows 100 mails per day, which is plenty for one user's
 * birthdays and reminders.
 */
public class SendGridMailSender implements TemplatedMailSender {

    private static final Logger log = LoggerFactory.getLogger(SendGridMailSender.class);

    static final String SEND_PATH = "/v3/mail/send";

    private final RestClient restClient;
    private final String fromEmail;

    public SendGridMailSender(RestClient.Builder restClientBuilder, MailProperties properties) {
        this.restClient = restClientBuilder
                .baseUrl(properties.getBaseUrl())
                .defaultHeaders(headers -> headers.setBearerAuth(properties.getApiKey()))
                .build();
        this.fromEmail = properties.getFromEmail();
    }

    @Override
    public void send(TemplatedMail mail) {
        Map<String, Object> body = Map.of(
                "from", Map.of("email", fromEmail),
                "template_id", mail.templateId(),
                "personalizations", List.of(Map.of(
                        "to", List.of(Map.of("email", mail.to())),
                        "dynamic_template_data", mail.templateData()
                ))
        );

        ResponseEntity<Void> response;
        try {
            response = restClient.post()
                    .uri(SEND_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (request, errorResponse) -> {
                        throw new MailDeliveryException(
                                "SendGrid rejected mail with status " + errorResponse.getStatusCode().value(),
                                errorResponse.getStatusCode().value());
                    })
                    .toBodilessEntity();
        } catch (RestClientException e) {
            throw new MailDeliveryException("SendGrid request failed: " + e.getMessage(), e);
        }

        log.debug("SendGrid accepted mail for template {} with status {}",
                mail.templateId(), response.getStatusCode().value());
    }
}
