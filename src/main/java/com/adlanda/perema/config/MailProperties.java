package com.adlanda.perema.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * SendGrid settings, prefixed with 'perema.mail.sendgrid'.
 *
 * Leaving the API key empty switches the application to the dry-run sender,
 * which only logs what would have been sent.
 */
@Component
@ConfigurationProperties(prefix = "perema.mail.sendgrid")
public class MailProperties {

    private String apiKey = "";

    private String baseUrl = "https://api.sendgrid.com";

    private String fromEmail = "perema@localhost";

    /**
     * Recipient of all notifications. Perema is a single-user application.
     */
    private String toEmail = "";

    private String birthdayTemplateId = "";

    private String reminderTemplateId = "";

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getFromEmail() {
        return fromEmail;
    }

    public void setFromEmail(String fromEmail) {
        this.fromEmail = fromEmail;
    }

    public String getToEmail() {
        return toEmail;
    }

    public void setToEmail(String toEmail) {
        this.toEmail = toEmail;
    }

    public String getBirthdayTemplateId() {
        return birthdayTemplateId;
    }

    public void setBirthdayTemplateId(String birthdayTemplateId) {
        this.birthdayTemplateId = birthdayTemplateId;
    }

    public String getReminderTemplateId() {
        return reminderTemplateId;
    }

    public void setReminderTemplateId(String reminderTemplateId) {
        this.reminderTemplateId = reminderTemplateId;
    }
}
